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

import com.vahak.core.constants.VahakConstants;
import com.vahak.core.exception.AppenderBuildException;
import com.vahak.core.exception.PublishException;
import com.vahak.core.model.DeliveryLevel;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one MQTT session and the background thread that keeps it alive.
 * 
 * <p>The session is shared by every thread that logs through the appender.
 * {@link #publish} serializes access with a lock held only for the duration
 * of the session's publish call, so at most one publish is in flight at any
 * time. The lifecycle thread works on the notification queue and never takes
 * that lock.</p>
 * 
 * <p>{@link #close()} ends the notification stream and waits for the
 * lifecycle thread, which disconnects and closes the session once any connect
 * attempt it is running has returned.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
public class BrokerConnection implements PublishCapability, AutoCloseable {
    
    private final String name;
    private final ConnectionSettings settings;
    private final MqttSession session;
    private final ReentrantLock publishLock = new ReentrantLock();
    private final BlockingQueue<ConnectionEvent> notifications = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ConnectionLifecycleDriver driver;
    private final Thread lifecycleThread;
    
    // Statistics
    private final AtomicLong messagesPublished = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    
    private BrokerConnection(String name, ConnectionSettings settings, MqttSessionFactory sessionFactory,
                             ConnectionListener listener) {
        this.name = name;
        this.settings = settings;
        try {
            this.session = sessionFactory.create(settings, new NotificationCallback());
        } catch (MqttException | IllegalArgumentException e) {
            throw AppenderBuildException.clientCreation(settings.getServerUri(), e);
        }
        this.driver = new ConnectionLifecycleDriver(name, session, notifications, listener, closed);
        this.lifecycleThread = new Thread(driver, VahakConstants.LIFECYCLE_THREAD_PREFIX + name);
        this.lifecycleThread.setDaemon(true);
    }
    
    /**
     * Create the session and start its lifecycle thread. The first connect
     * happens on that thread, so this returns without waiting for the broker.
     * 
     * @throws AppenderBuildException if the client cannot be created
     */
    public static BrokerConnection open(String name, ConnectionSettings settings,
                                        MqttSessionFactory sessionFactory, ConnectionListener listener) {
        BrokerConnection connection = new BrokerConnection(name, settings, sessionFactory, listener);
        connection.lifecycleThread.start();
        log.info("[{}] Opened MQTT session to {} as client '{}'{}", name, settings.getAddress(),
                settings.getClientId(), settings.hasCredentials() ? " with credentials" : "");
        return connection;
    }
    
    @Override
    public void publish(String topic, DeliveryLevel level, boolean retain, byte[] payload) throws PublishException {
        if (closed.get()) {
            throw PublishException.closed(topic);
        }
        
        acquire(topic);
        try {
            session.publish(topic, payload, level.getCode(), retain);
            messagesPublished.incrementAndGet();
        } catch (MqttException | IllegalArgumentException e) {
            errors.incrementAndGet();
            throw PublishException.failed(topic, e);
        } finally {
            publishLock.unlock();
        }
    }
    
    private void acquire(String topic) {
        long timeoutMs = settings.getPublishTimeoutMillis();
        if (timeoutMs <= 0) {
            publishLock.lock();
            return;
        }
        
        try {
            if (publishLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.incrementAndGet();
            throw PublishException.interrupted(topic, e);
        }
        
        if (settings.getBackpressurePolicy() == BackpressurePolicy.DROP) {
            dropped.incrementAndGet();
            throw PublishException.timedOut(topic, timeoutMs);
        }
        publishLock.lock();
    }
    
    public boolean isConnected() {
        return !closed.get() && session.isConnected();
    }
    
    public boolean isClosed() {
        return closed.get();
    }
    
    public String getName() {
        return name;
    }
    
    public ConnectionSettings getSettings() {
        return settings;
    }
    
    public long getMessagesPublished() {
        return messagesPublished.get();
    }
    
    public long getErrors() {
        return errors.get();
    }
    
    public long getDropped() {
        return dropped.get();
    }
    
    public long getConnectAttempts() {
        return driver.getConnectAttempts();
    }
    
    public Map<ConnectionEvent.Type, Long> getEventCounts() {
        return driver.getEventCounts();
    }
    
    boolean isLifecycleRunning() {
        return lifecycleThread.isAlive();
    }
    
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[{}] Closing MQTT session to {}", name, settings.getAddress());
        
        notifications.offer(ConnectionEvent.disconnected(settings.getServerUri()));
        
        try {
            lifecycleThread.join(VahakConstants.LIFECYCLE_JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for the lifecycle thread to stop", name);
        }
        if (lifecycleThread.isAlive()) {
            log.warn("[{}] Lifecycle thread did not stop within {} ms, session will close when its connect attempt returns",
                    name, VahakConstants.LIFECYCLE_JOIN_TIMEOUT_MS);
        }
    }
    
    /**
     * Turns Paho callbacks into queued notifications. Runs on Paho's threads
     * and never blocks.
     */
    private class NotificationCallback implements MqttCallbackExtended {
        
        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            notifications.offer(ConnectionEvent.connected(reconnect, serverURI));
        }
        
        @Override
        public void connectionLost(Throwable cause) {
            notifications.offer(ConnectionEvent.transportError(cause));
        }
        
        @Override
        public void messageArrived(String topic, MqttMessage message) {
            notifications.offer(ConnectionEvent.incoming(topic));
        }
        
        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            notifications.offer(ConnectionEvent.outgoing(token.getMessageId()));
        }
    }
}
