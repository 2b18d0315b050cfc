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

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import ch.qos.logback.core.encoder.Encoder;
import com.vahak.appender.connection.BackpressurePolicy;
import com.vahak.appender.connection.BrokerConnection;
import com.vahak.appender.connection.ConnectionListener;
import com.vahak.appender.connection.ConnectionSettings;
import com.vahak.appender.connection.LoggingConnectionListener;
import com.vahak.appender.connection.MqttSessionFactory;
import com.vahak.appender.connection.PahoMqttSession;
import com.vahak.appender.encoder.EncoderRegistry;
import com.vahak.appender.encoder.StyleStrippingBuffer;
import com.vahak.core.constants.VahakConstants;
import com.vahak.core.exception.AppenderBuildException;
import com.vahak.core.exception.PublishException;
import com.vahak.core.exception.VahakException;
import com.vahak.core.model.BrokerAddress;
import com.vahak.core.model.DeliveryLevel;
import com.vahak.core.topic.TopicResolver;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logback appender that publishes every log event to an MQTT broker.
 * 
 * <p>Each event is rendered by the configured encoder (a pattern encoder by
 * default), its topic is resolved from the topic template and the event's
 * level, and the payload is published with the configured QoS and the retain
 * flag off. Publishing threads share one broker session; publishes are
 * serialized at the connection, encoding is not.</p>
 * 
 * <p>Configure it programmatically with {@link #builder()} or in
 * {@code logback.xml}:</p>
 * <pre>{@code
 * <appender name="MQTT" class="com.vahak.appender.MqttAppender">
 *   <broker>mqtt://localhost:1883</broker>
 *   <clientId>orders-service</clientId>
 *   <topic>logs/{level}</topic>
 *   <qos>1</qos>
 *   <encoder>
 *     <pattern>%d %level %logger - %msg%n</pattern>
 *   </encoder>
 * </appender>
 * }</pre>
 * 
 * <p>A failed publish is reported to the logback status manager and the
 * appender keeps accepting events.</p>
 * 
 * @version 1.0.0
 */
@Getter
@Setter
public class MqttAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {
    
    private static final int ALLOWED_REPEATS = 3;
    
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
    
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private volatile BrokerConnection connection;
    
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final AtomicLong encodingErrors = new AtomicLong(0);
    
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    
    public static MqttAppenderBuilder builder() {
        return new MqttAppenderBuilder();
    }
    
    /**
     * QoS as configured: 0, 1 or 2. Any other value means at most once.
     */
    public void setQos(int qos) {
        this.deliveryLevel = DeliveryLevel.fromCode(qos);
    }
    
    public int getQos() {
        return deliveryLevel.getCode();
    }
    
    @Override
    public void start() {
        if (isStarted()) {
            return;
        }
        if (encoder == null) {
            addInfo("No encoder set for appender [" + name + "], using pattern " + VahakConstants.DEFAULT_PATTERN);
            encoder = EncoderRegistry.defaultEncoder(getContext());
        } else if (!encoder.isStarted()) {
            encoder.setContext(getContext());
            encoder.start();
        }
        if (connection == null || connection.isClosed()) {
            try {
                openConnection();
            } catch (VahakException e) {
                addError("Appender [" + name + "] not started: " + e.getCodedMessage(), e);
                return;
            }
        }
        super.start();
    }
    
    /**
     * Parse the broker address and open the broker session.
     * 
     * @throws com.vahak.core.exception.AddressParseException if the broker address is malformed
     * @throws AppenderBuildException if the settings are invalid or the client cannot be created
     */
    void openConnection() {
        if (connection != null && !connection.isClosed()) {
            return;
        }
        MqttAppenderBuilder.requireSet(clientId, "client_id");
        MqttAppenderBuilder.requireSet(topic, "topic");
        if (publishTimeoutMillis < 0) {
            throw AppenderBuildException.invalidConfig("publish_timeout_ms must not be negative: " + publishTimeoutMillis);
        }
        
        BrokerAddress address = BrokerAddress.parse(broker);
        ConnectionSettings settings = ConnectionSettings.builder()
                .address(address)
                .clientId(clientId)
                .username(username)
                .password(password)
                .publishTimeoutMillis(publishTimeoutMillis)
                .backpressurePolicy(backpressurePolicy != null ? backpressurePolicy : BackpressurePolicy.BLOCK)
                .build();
        ConnectionListener listener = connectionListener != null
                ? connectionListener
                : new LoggingConnectionListener(name);
        
        connection = BrokerConnection.open(name, settings, sessionFactory, listener);
    }
    
    @Override
    public void stop() {
        if (!isStarted()) {
            return;
        }
        super.stop();
        if (connection != null) {
            connection.close();
        }
    }
    
    @Override
    protected void append(ILoggingEvent event) {
        try {
            publish(event);
            consecutiveFailures.set(0);
        } catch (PublishException e) {
            if (consecutiveFailures.incrementAndGet() <= ALLOWED_REPEATS) {
                addError("Appender [" + name + "] failed to publish event: " + e.getCodedMessage(), e);
            }
        }
    }
    
    /**
     * Encode, resolve the topic and publish one event.
     * 
     * @throws PublishException if the event cannot be encoded or the transport fails the publish
     */
    public void publish(ILoggingEvent event) throws PublishException {
        byte[] payload = encode(event);
        String resolvedTopic = TopicResolver.resolve(topic, event.getLevel().toString());
        
        BrokerConnection current = connection;
        if (current == null) {
            throw PublishException.closed(resolvedTopic);
        }
        current.publish(resolvedTopic, deliveryLevel, VahakConstants.RETAIN, payload);
    }
    
    private byte[] encode(ILoggingEvent event) {
        try {
            byte[] encoded = encoder.encode(event);
            StyleStrippingBuffer buffer = new StyleStrippingBuffer(encoded.length);
            buffer.write(encoded, 0, encoded.length);
            return buffer.toByteArray();
        } catch (RuntimeException e) {
            encodingErrors.incrementAndGet();
            throw PublishException.encoding(e);
        }
    }
    
    /**
     * No-op: the MQTT client owns its outbound buffering.
     */
    public void flush() {
    }
    
    public boolean isConnected() {
        return connection != null && connection.isConnected();
    }
    
    public AppenderStats getStats() {
        BrokerConnection current = connection;
        if (current == null) {
            return new AppenderStats(name, broker, false, 0, 0, 0, encodingErrors.get(), 0, Collections.emptyMap());
        }
        return new AppenderStats(
                name,
                broker,
                current.isConnected(),
                current.getMessagesPublished(),
                current.getErrors(),
                current.getDropped(),
                encodingErrors.get(),
                current.getConnectAttempts(),
                current.getEventCounts()
        );
    }
}
