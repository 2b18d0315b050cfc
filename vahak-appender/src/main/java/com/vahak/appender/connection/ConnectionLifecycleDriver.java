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
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.MqttException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop that keeps a broker session progressing.
 * 
 * <p>Paho only reconnects automatically once a first connection has been
 * established, so the loop retries the first connect with exponential backoff.
 * After that it blocks on the notification queue and hands every event to the
 * {@link ConnectionListener}. Errors never leave the loop; it ends when the
 * {@link ConnectionEvent.Type#DISCONNECTED} event is taken from the queue or
 * the thread is interrupted.</p>
 * 
 * <p>The loop owns the session's teardown: it closes the session on its way
 * out, after any connect attempt in progress has returned.</p>
 */
@Slf4j
class ConnectionLifecycleDriver implements Runnable {
    
    private final String name;
    private final MqttSession session;
    private final BlockingQueue<ConnectionEvent> notifications;
    private final ConnectionListener listener;
    private final AtomicBoolean closed;
    
    private final Map<ConnectionEvent.Type, AtomicLong> eventCounts = new EnumMap<>(ConnectionEvent.Type.class);
    private final AtomicLong connectAttempts = new AtomicLong(0);
    
    ConnectionLifecycleDriver(String name, MqttSession session, BlockingQueue<ConnectionEvent> notifications,
                              ConnectionListener listener, AtomicBoolean closed) {
        this.name = name;
        this.session = session;
        this.notifications = notifications;
        this.listener = listener;
        this.closed = closed;
        for (ConnectionEvent.Type type : ConnectionEvent.Type.values()) {
            eventCounts.put(type, new AtomicLong(0));
        }
    }
    
    @Override
    public void run() {
        log.debug("[{}] Lifecycle loop started for {}", name, session.getServerUri());
        
        boolean established = false;
        long retryDelayMs = VahakConstants.INITIAL_RECONNECT_DELAY_MS;
        long nextAttemptAt = 0;
        
        try {
            while (true) {
                if (!established && !closed.get() && System.currentTimeMillis() >= nextAttemptAt) {
                    established = connect();
                    if (!established) {
                        nextAttemptAt = System.currentTimeMillis() + retryDelayMs;
                        retryDelayMs = Math.min(retryDelayMs * 2, VahakConstants.MAX_RECONNECT_DELAY_MS);
                    }
                }
                
                ConnectionEvent event;
                if (established || closed.get()) {
                    event = notifications.take();
                } else {
                    long waitMs = Math.max(1, nextAttemptAt - System.currentTimeMillis());
                    event = notifications.poll(waitMs, TimeUnit.MILLISECONDS);
                }
                
                if (event == null) {
                    continue;
                }
                if (event.getType() == ConnectionEvent.Type.CONNECTED) {
                    established = true;
                }
                if (event.getType() == ConnectionEvent.Type.DISCONNECTED) {
                    session.close();
                    dispatch(event);
                    return;
                }
                dispatch(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Lifecycle loop interrupted", name);
            session.close();
        } finally {
            log.debug("[{}] Lifecycle loop finished", name);
        }
    }
    
    private boolean connect() {
        long attempt = connectAttempts.incrementAndGet();
        try {
            session.connect();
            log.debug("[{}] Connect attempt {} to {} succeeded", name, attempt, session.getServerUri());
            return true;
        } catch (MqttException e) {
            if (isAlreadyConnecting(e) || session.isConnected()) {
                log.debug("[{}] Connect attempt {} to {} left the session connecting: {}",
                        name, attempt, session.getServerUri(), e.getMessage());
                return true;
            }
            log.debug("[{}] Connect attempt {} to {} failed: {}", name, attempt, session.getServerUri(), e.getMessage());
            dispatch(ConnectionEvent.transportError(e));
            return false;
        } catch (RuntimeException e) {
            log.debug("[{}] Connect attempt {} to {} failed: {}", name, attempt, session.getServerUri(), e.getMessage());
            dispatch(ConnectionEvent.transportError(e));
            return false;
        }
    }
    
    private static boolean isAlreadyConnecting(MqttException e) {
        int reason = e.getReasonCode();
        return reason == MqttException.REASON_CODE_CLIENT_CONNECTED
                || reason == MqttException.REASON_CODE_CONNECT_IN_PROGRESS;
    }
    
    private void dispatch(ConnectionEvent event) {
        eventCounts.get(event.getType()).incrementAndGet();
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("[{}] Connection listener failed on {} event: {}", name, event.getType(), e.getMessage(), e);
        }
    }
    
    Map<ConnectionEvent.Type, Long> getEventCounts() {
        Map<ConnectionEvent.Type, Long> counts = new EnumMap<>(ConnectionEvent.Type.class);
        for (Map.Entry<ConnectionEvent.Type, AtomicLong> entry : eventCounts.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().get());
        }
        return Collections.unmodifiableMap(counts);
    }
    
    long getConnectAttempts() {
        return connectAttempts.get();
    }
}
