/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.vahak.appender.connection;

import static org.assertj.core.api.Assertions.assertThatCode;

import org.junit.jupiter.api.Test;

class LoggingConnectionListenerTest {

    private final LoggingConnectionListener subject = new LoggingConnectionListener("listener-test");

    @Test
    void acceptsEveryEventType() {
        assertThatCode(() -> {
            subject.onEvent(ConnectionEvent.connected(false, "tcp://localhost:1883"));
            subject.onEvent(ConnectionEvent.connected(true, "tcp://localhost:1883"));
            subject.onEvent(ConnectionEvent.incoming("cmd/ping"));
            subject.onEvent(ConnectionEvent.outgoing(7));
            subject.onEvent(ConnectionEvent.transportError(new IllegalStateException("reset")));
            subject.onEvent(ConnectionEvent.transportError(null));
            subject.onEvent(ConnectionEvent.disconnected("tcp://localhost:1883"));
        }).doesNotThrowAnyException();
    }
}
