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

import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link ConnectionListener}: writes lifecycle notifications to the
 * application log. Transport errors are logged and otherwise absorbed; the
 * client's own reconnect logic restores the session.
 * 
 * If the root logger feeds an MQTT appender, turn additivity off for
 * {@code com.vahak.appender.connection} so that connection trouble is not
 * itself published over the failing connection.
 */
@Slf4j
public class LoggingConnectionListener implements ConnectionListener {
    
    private final String name;
    
    public LoggingConnectionListener(String name) {
        this.name = name;
    }
    
    @Override
    public void onEvent(ConnectionEvent event) {
        switch (event.getType()) {
            case CONNECTED:
                if (event.isReconnect()) {
                    log.info("[{}] Reconnected to MQTT broker {}", name, event.getDetail());
                } else {
                    log.info("[{}] Connected to MQTT broker {}", name, event.getDetail());
                }
                break;
            case INCOMING:
                log.debug("[{}] Incoming packet on '{}'", name, event.getDetail());
                break;
            case OUTGOING:
                log.trace("[{}] Outgoing publish #{} complete", name, event.getDetail());
                break;
            case TRANSPORT_ERROR:
                log.warn("[{}] MQTT transport error, client will retry: {}", name, event.getDetail());
                break;
            case DISCONNECTED:
                log.info("[{}] Disconnected from MQTT broker {}", name, event.getDetail());
                break;
            default:
                break;
        }
    }
}
