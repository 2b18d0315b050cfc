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

import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * Creates {@link MqttSession}s. The default creates Paho-backed sessions;
 * alternative transports and test doubles plug in here.
 */
@FunctionalInterface
public interface MqttSessionFactory {
    
    /**
     * @param settings connection settings
     * @param callback receiver for lifecycle notifications
     * @return a new, not yet connected, session
     * @throws MqttException if the client cannot be created
     */
    MqttSession create(ConnectionSettings settings, MqttCallbackExtended callback) throws MqttException;
}
