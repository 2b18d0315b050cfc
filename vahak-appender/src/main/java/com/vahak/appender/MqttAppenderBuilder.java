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
package com.vahak.appender;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.encoder.Encoder;
import com.vahak.appender.connection.BackpressurePolicy;
import com.vahak.appender.connection.ConnectionListener;
import com.vahak.appender.connection.MqttSessionFactory;
import com.vahak.appender.connection.PahoMqttSession;
import com.vahak.core.constants.VahakConstants;
import com.vahak.core.exception.AppenderBuildException;
import com.vahak.core.model.DeliveryLevel;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Fluent configuration for {@link MqttAppender}.
 * 
 * <p>Defaults: broker {@code mqtt://localhost:1883}, client id
 * {@code log4rs_client}, topic {@code logs}, QoS 0, no credentials, pattern
 * encoder. {@link #build()} opens the broker session and starts the appender;
 * every call opens a new session with its own lifecycle thread.</p>
 * 
 * <pre>{@code
 * MqttAppender appender = MqttAppender.builder()
 *         .broker("mqtt://broker.local:1883")
 *         .clientId("billing")
 *         .topic("logs/{level}")
 *         .qos(1)
 *         .build();
 * }</pre>
 */
public class MqttAppenderBuilder {
    
    public static final String DEFAULT_NAME = "MQTT";
    
    private String name = DEFAULT_NAME;
    private Context context;
    private String broker = VahakConstants.DEFAULT_BROKER;
    private String clientId = VahakConstants.DEFAULT_CLIENT_ID;
    private String topic = VahakConstants.DEFAULT_TOPIC;
    private DeliveryLevel deliveryLevel = DeliveryLevel.AT_MOST_ONCE;
    private String username;
    private String password;
    private Encoder<ILoggingEvent> encoder;
    private long publishTimeoutMillis = VahakConstants.DEFAULT_PUBLISH_TIMEOUT_MS;
    private BackpressurePolicy backpressurePolicy = BackpressurePolicy.BLOCK;
    private MqttSessionFactory sessionFactory = PahoMqttSession::new;
    private ConnectionListener connectionListener;
    
    MqttAppenderBuilder() {
    }
    
    /**
     * Appender name, also used in log output and the lifecycle thread name.
     */
    public MqttAppenderBuilder name(String name) {
        this.name = name;
        return this;
    }
    
    /**
     * Logback context; defaults to the context bound to SLF4J.
     */
    public MqttAppenderBuilder context(Context context) {
        this.context = context;
        return this;
    }
    
    /**
     * Broker URL, e.g. {@code mqtt://host:1883}, {@code mqtts://host:8883}, {@code tcp://host} or {@code host:port}.
     */
    public MqttAppenderBuilder broker(String broker) {
        this.broker = broker;
        return this;
    }
    
    public MqttAppenderBuilder clientId(String clientId) {
        this.clientId = clientId;
        return this;
    }
    
    /**
     * Topic template; a {@code {level}} placeholder is replaced by the
     * lower-case level of each event.
     */
    public MqttAppenderBuilder topic(String topic) {
        this.topic = topic;
        return this;
    }
    
    /**
     * QoS 0, 1 or 2. Any other value falls back to at most once.
     */
    public MqttAppenderBuilder qos(int qos) {
        this.deliveryLevel = DeliveryLevel.fromCode(qos);
        return this;
    }
    
    public MqttAppenderBuilder deliveryLevel(DeliveryLevel deliveryLevel) {
        this.deliveryLevel = deliveryLevel;
        return this;
    }
    
    /**
     * User name; only applied when a password is set as well.
     */
    public MqttAppenderBuilder username(String username) {
        this.username = username;
        return this;
    }
    
    /**
     * Password; only applied when a user name is set as well.
     */
    public MqttAppenderBuilder password(String password) {
        this.password = password;
        return this;
    }
    
    public MqttAppenderBuilder encoder(Encoder<ILoggingEvent> encoder) {
        this.encoder = encoder;
        return this;
    }
    
    /**
     * Bound on how long a publish may wait; 0 waits indefinitely.
     */
    public MqttAppenderBuilder publishTimeoutMillis(long publishTimeoutMillis) {
        this.publishTimeoutMillis = publishTimeoutMillis;
        return this;
    }
    
    public MqttAppenderBuilder backpressurePolicy(BackpressurePolicy backpressurePolicy) {
        this.backpressurePolicy = backpressurePolicy;
        return this;
    }
    
    public MqttAppenderBuilder sessionFactory(MqttSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
        return this;
    }
    
    public MqttAppenderBuilder connectionListener(ConnectionListener connectionListener) {
        this.connectionListener = connectionListener;
        return this;
    }
    
    /**
     * Validate the settings, open the broker session and return the started appender.
     * 
     * @throws com.vahak.core.exception.AddressParseException if the broker address is malformed
     * @throws AppenderBuildException if a setting is invalid or the client cannot be created
     */
    public MqttAppender build() {
        requireText(name, "name");
        requireSet(clientId, "client_id");
        requireSet(topic, "topic");
        if (deliveryLevel == null) {
            throw AppenderBuildException.invalidConfig("qos must be set");
        }
        if (sessionFactory == null) {
            throw AppenderBuildException.invalidConfig("session factory must be set");
        }
        if (publishTimeoutMillis < 0) {
            throw AppenderBuildException.invalidConfig("publish_timeout_ms must not be negative: " + publishTimeoutMillis);
        }
        
        Context appenderContext = context != null ? context : defaultContext();
        
        MqttAppender appender = new MqttAppender();
        appender.setContext(appenderContext);
        appender.setName(name);
        appender.setBroker(broker);
        appender.setClientId(clientId);
        appender.setTopic(topic);
        appender.setDeliveryLevel(deliveryLevel);
        appender.setUsername(username);
        appender.setPassword(password);
        appender.setEncoder(encoder);
        appender.setPublishTimeoutMillis(publishTimeoutMillis);
        appender.setBackpressurePolicy(backpressurePolicy);
        appender.setSessionFactory(sessionFactory);
        appender.setConnectionListener(connectionListener);
        
        appender.openConnection();
        appender.start();
        return appender;
    }
    
    /**
     * Only null is rejected. An empty client id is legal with a clean session,
     * and topic syntax is left to the transport.
     */
    static void requireSet(String value, String key) {
        if (value == null) {
            throw AppenderBuildException.invalidConfig("'" + key + "' must be set");
        }
    }
    
    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw AppenderBuildException.invalidConfig("'" + key + "' must be set");
        }
    }
    
    private static Context defaultContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            return (LoggerContext) factory;
        }
        return new LoggerContext();
    }
}
