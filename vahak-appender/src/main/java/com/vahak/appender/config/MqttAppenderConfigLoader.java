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
package com.vahak.appender.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.encoder.Encoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vahak.appender.MqttAppender;
import com.vahak.appender.MqttAppenderBuilder;
import com.vahak.appender.connection.BackpressurePolicy;
import com.vahak.appender.encoder.EncoderRegistry;
import com.vahak.core.exception.AppenderBuildException;
import com.vahak.core.exception.VahakException;
import com.vahak.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds {@link MqttAppender}s from JSON or YAML configuration documents.
 * 
 * <p>Files ending in {@code .yml} or {@code .yaml} are read as YAML, anything
 * else as JSON. {@code broker}, {@code client_id} and {@code topic} are
 * required; unknown keys fail the load. The {@code encoder} section is
 * resolved through the {@link EncoderRegistry}.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
public class MqttAppenderConfigLoader {
    
    private final EncoderRegistry encoderRegistry;
    
    public MqttAppenderConfigLoader() {
        this(EncoderRegistry.withDefaults());
    }
    
    public MqttAppenderConfigLoader(EncoderRegistry encoderRegistry) {
        this.encoderRegistry = encoderRegistry;
    }
    
    /**
     * Read a configuration file.
     */
    public MqttAppenderConfig read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw AppenderBuildException.invalidConfig("MQTT appender config file not found: " + path.toAbsolutePath());
        }
        log.info("Loading MQTT appender config from '{}'", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return read(JsonUtils.mapperFor(path), in);
        } catch (IOException e) {
            throw AppenderBuildException.invalidConfig(
                    "Failed to read MQTT appender config file '" + path.toAbsolutePath() + "': " + e.getMessage(), e);
        }
    }
    
    public MqttAppenderConfig readYaml(String document) {
        return bind(JsonUtils.getYamlMapper(), document);
    }
    
    public MqttAppenderConfig readJson(String document) {
        return bind(JsonUtils.getObjectMapper(), document);
    }
    
    private MqttAppenderConfig read(ObjectMapper mapper, InputStream in) {
        try {
            return JsonUtils.read(mapper, in, MqttAppenderConfig.class);
        } catch (VahakException e) {
            throw AppenderBuildException.invalidConfig(e.getMessage(), e.getCause());
        }
    }
    
    private MqttAppenderConfig bind(ObjectMapper mapper, String document) {
        try {
            return JsonUtils.read(mapper, document, MqttAppenderConfig.class);
        } catch (VahakException e) {
            throw AppenderBuildException.invalidConfig(e.getMessage(), e.getCause());
        }
    }
    
    /**
     * Turn a configuration document into a builder, without opening anything.
     * 
     * @throws AppenderBuildException if a required key is missing or the encoder section is invalid
     */
    public MqttAppenderBuilder toBuilder(MqttAppenderConfig config, Context context) {
        MqttAppenderBuilder builder = MqttAppender.builder()
                .context(context)
                .broker(required(config.getBroker(), "broker"))
                .clientId(required(config.getClientId(), "client_id"))
                .topic(required(config.getTopic(), "topic"))
                .username(config.getUsername())
                .password(config.getPassword());
        
        if (config.getQos() != null) {
            builder.qos(config.getQos());
        }
        if (config.getPublishTimeoutMs() != null) {
            builder.publishTimeoutMillis(config.getPublishTimeoutMs());
        }
        if (config.getBackpressure() != null) {
            try {
                builder.backpressurePolicy(BackpressurePolicy.fromName(config.getBackpressure()));
            } catch (IllegalArgumentException e) {
                throw AppenderBuildException.invalidConfig(
                        "Unknown backpressure policy '" + config.getBackpressure() + "', expected block or drop", e);
            }
        }
        if (config.getEncoder() != null) {
            EncoderConfig encoderConfig = config.getEncoder();
            Encoder<ILoggingEvent> encoder = encoderRegistry.create(
                    encoderConfig.getKind(), encoderConfig.getProperties(), context);
            builder.encoder(encoder);
        }
        return builder;
    }
    
    /**
     * Read a configuration file and build the appender it describes.
     */
    public MqttAppender load(Path path, Context context) {
        MqttAppender appender = toBuilder(read(path), context).build();
        log.info("MQTT appender '{}' publishing to {} on topic '{}'",
                appender.getName(), appender.getBroker(), appender.getTopic());
        return appender;
    }
    
    private static String required(String value, String key) {
        if (value == null) {
            throw AppenderBuildException.invalidConfig("Missing required key '" + key + "' in MQTT appender config");
        }
        return value;
    }
}
