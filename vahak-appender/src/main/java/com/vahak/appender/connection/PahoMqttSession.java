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
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MqttSession} over the Eclipse Paho {@link MqttAsyncClient}.
 * 
 * <p>Connect waits for the broker's acknowledgement, bounded only by the
 * connection timeout. A positive publish timeout bounds each publish on its
 * own delivery token.</p>
 * 
 * In-flight state is kept in memory only; nothing is persisted across restarts.
 */
@Slf4j
public class PahoMqttSession implements MqttSession {
    
    private static final long DISCONNECT_QUIESCE_MS = 1000;
    
    private final MqttAsyncClient client;
    private final MqttConnectOptions options;
    private final long publishTimeoutMillis;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    public PahoMqttSession(ConnectionSettings settings, MqttCallbackExtended callback) throws MqttException {
        this.client = new MqttAsyncClient(settings.getServerUri(), settings.getClientId(), new MemoryPersistence());
        this.options = settings.toConnectOptions();
        this.publishTimeoutMillis = settings.getPublishTimeoutMillis();
        this.client.setCallback(callback);
    }
    
    @Override
    public void connect() throws MqttException {
        client.connect(options).waitForCompletion();
    }
    
    @Override
    public boolean isConnected() {
        return client.isConnected();
    }
    
    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retained) throws MqttException {
        IMqttDeliveryToken token = client.publish(topic, payload, qos, retained);
        if (publishTimeoutMillis > 0) {
            token.waitForCompletion(publishTimeoutMillis);
        } else {
            token.waitForCompletion();
        }
    }
    
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect(DISCONNECT_QUIESCE_MS).waitForCompletion(2 * DISCONNECT_QUIESCE_MS);
            }
        } catch (MqttException e) {
            log.debug("MQTT disconnect from {} failed: {}", client.getServerURI(), e.getMessage());
        }
        try {
            client.close();
        } catch (MqttException e) {
            log.warn("Failed to close MQTT client for {}: {}", client.getServerURI(), e.getMessage());
        }
    }
    
    @Override
    public String getServerUri() {
        return client.getServerURI();
    }
}
