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

import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * A single MQTT client session with a blocking publish.
 * 
 * Lifecycle notifications are delivered through the callback handed to the
 * {@link MqttSessionFactory} that created the session.
 */
public interface MqttSession {
    
    /**
     * Perform a blocking connect. Only used for the first connection; the
     * session reconnects by itself afterwards.
     */
    void connect() throws MqttException;
    
    boolean isConnected();
    
    /**
     * Publish and wait for the client to accept the message.
     */
    void publish(String topic, byte[] payload, int qos, boolean retained) throws MqttException;
    
    /**
     * Disconnect if connected and release client resources. Called once, from
     * the lifecycle thread, never while {@link #connect()} is running.
     */
    void close();
    
    String getServerUri();
}
