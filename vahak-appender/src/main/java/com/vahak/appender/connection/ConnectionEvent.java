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

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One notification from a broker session's lifecycle.
 */
@Getter
@ToString
public final class ConnectionEvent {
    
    public enum Type {
        /** Broker acknowledged a connect or reconnect. */
        CONNECTED,
        /** A packet arrived from the broker. */
        INCOMING,
        /** An outgoing publish completed. */
        OUTGOING,
        /** The connection was lost or a connect attempt failed. */
        TRANSPORT_ERROR,
        /** The session was closed locally; always the last event of a session. */
        DISCONNECTED
    }
    
    private final Type type;
    private final Instant timestamp;
    /** Server URI, topic or message id, depending on type */
    private final String detail;
    private final boolean reconnect;
    private final Throwable cause;
    
    private ConnectionEvent(Type type, String detail, boolean reconnect, Throwable cause) {
        this.type = type;
        this.timestamp = Instant.now();
        this.detail = detail;
        this.reconnect = reconnect;
        this.cause = cause;
    }
    
    public static ConnectionEvent connected(boolean reconnect, String serverUri) {
        return new ConnectionEvent(Type.CONNECTED, serverUri, reconnect, null);
    }
    
    public static ConnectionEvent incoming(String topic) {
        return new ConnectionEvent(Type.INCOMING, topic, false, null);
    }
    
    public static ConnectionEvent outgoing(int messageId) {
        return new ConnectionEvent(Type.OUTGOING, String.valueOf(messageId), false, null);
    }
    
    public static ConnectionEvent transportError(Throwable cause) {
        return new ConnectionEvent(Type.TRANSPORT_ERROR, cause != null ? cause.getMessage() : null, false, cause);
    }
    
    public static ConnectionEvent disconnected(String serverUri) {
        return new ConnectionEvent(Type.DISCONNECTED, serverUri, false, null);
    }
}
