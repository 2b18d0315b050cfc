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
package com.vahak.appender.encoder;

import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.encoder.Encoder;
import com.vahak.core.constants.VahakConstants;
import com.vahak.core.exception.AppenderBuildException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of encoder kinds available to configuration documents.
 * 
 * <p>Built-in kinds:</p>
 * <ul>
 *   <li>{@code pattern} - logback {@link PatternLayoutEncoder}; optional {@code pattern} property</li>
 *   <li>{@code json} - logback {@link JsonEncoder}; no properties</li>
 * </ul>
 * 
 * Further kinds are added with {@link #register(String, EncoderFactory)}.
 */
@Slf4j
public class EncoderRegistry {
    
    private static final String PATTERN_PROPERTY = "pattern";
    
    private final Map<String, EncoderFactory> factoriesByKind = new ConcurrentHashMap<>();
    
    /**
     * Registry holding the built-in kinds.
     */
    public static EncoderRegistry withDefaults() {
        EncoderRegistry registry = new EncoderRegistry();
        registry.register(VahakConstants.ENCODER_KIND_PATTERN, EncoderRegistry::patternEncoder);
        registry.register(VahakConstants.ENCODER_KIND_JSON, EncoderRegistry::jsonEncoder);
        return registry;
    }
    
    public void register(String kind, EncoderFactory factory) {
        EncoderFactory previous = factoriesByKind.put(kind, factory);
        if (previous != null) {
            log.debug("Encoder kind '{}' re-registered", kind);
        }
    }
    
    public boolean isRegistered(String kind) {
        return factoriesByKind.containsKey(kind);
    }
    
    public Set<String> getRegisteredKinds() {
        return Collections.unmodifiableSet(new HashSet<>(factoriesByKind.keySet()));
    }
    
    /**
     * Create a started encoder.
     * 
     * @throws AppenderBuildException if the kind is unknown or its properties are invalid
     */
    public Encoder<ILoggingEvent> create(String kind, Map<String, Object> properties, Context context) {
        if (kind == null) {
            kind = VahakConstants.ENCODER_KIND_PATTERN;
        }
        EncoderFactory factory = factoriesByKind.get(kind);
        if (factory == null) {
            throw AppenderBuildException.invalidConfig(
                    "Unknown encoder kind '" + kind + "', registered kinds: " + getRegisteredKinds());
        }
        return factory.create(properties != null ? properties : Collections.emptyMap(), context);
    }
    
    /**
     * The encoder used when none is configured: a pattern encoder with the default pattern.
     */
    public static Encoder<ILoggingEvent> defaultEncoder(Context context) {
        return patternEncoder(VahakConstants.DEFAULT_PATTERN, context);
    }
    
    static Encoder<ILoggingEvent> patternEncoder(Map<String, Object> properties, Context context) {
        rejectUnknown(VahakConstants.ENCODER_KIND_PATTERN, properties, Set.of(PATTERN_PROPERTY));
        Object pattern = properties.get(PATTERN_PROPERTY);
        if (pattern != null && !(pattern instanceof String)) {
            throw AppenderBuildException.invalidConfig("Encoder property 'pattern' must be a string");
        }
        return patternEncoder(pattern != null ? (String) pattern : VahakConstants.DEFAULT_PATTERN, context);
    }
    
    private static Encoder<ILoggingEvent> patternEncoder(String pattern, Context context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();
        if (!encoder.isStarted()) {
            throw AppenderBuildException.invalidConfig("Invalid encoder pattern: " + pattern);
        }
        return encoder;
    }
    
    static Encoder<ILoggingEvent> jsonEncoder(Map<String, Object> properties, Context context) {
        rejectUnknown(VahakConstants.ENCODER_KIND_JSON, properties, Set.of());
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }
    
    private static void rejectUnknown(String kind, Map<String, Object> properties, Set<String> allowed) {
        for (String key : properties.keySet()) {
            if (!allowed.contains(key)) {
                throw AppenderBuildException.invalidConfig(
                        "Unknown property '" + key + "' for encoder kind '" + kind + "'");
            }
        }
    }
}
