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
package com.vahak.core.constants;

/**
 * Constants used throughout the Vahak system.
 */
public final class VahakConstants {
    
    private VahakConstants() {
        // Prevent instantiation
    }
    
    // Broker defaults
    public static final String DEFAULT_BROKER = "mqtt://localhost:1883";
    public static final int DEFAULT_MQTT_PORT = 1883;
    public static final String DEFAULT_CLIENT_ID = "log4rs_client";
    public static final String DEFAULT_TOPIC = "logs";
    public static final int DEFAULT_KEEP_ALIVE_SECONDS = 30;
    public static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 30;
    
    // Publish defaults
    public static final long DEFAULT_PUBLISH_TIMEOUT_MS = 0; // Wait indefinitely
    public static final boolean RETAIN = false;
    
    // Initial connect backoff
    public static final long INITIAL_RECONNECT_DELAY_MS = 1000;
    public static final long MAX_RECONNECT_DELAY_MS = 120_000;
    public static final long LIFECYCLE_JOIN_TIMEOUT_MS = 5000;
    
    // Broker URL schemes
    public static final String SCHEME_MQTT = "mqtt://";
    public static final String SCHEME_MQTTS = "mqtts://";
    public static final String SCHEME_TCP = "tcp://";
    
    // Paho server URI schemes
    public static final String PAHO_TCP = "tcp://";
    public static final String PAHO_SSL = "ssl://";
    
    // Topic template placeholder
    public static final String LEVEL_PLACEHOLDER = "{level}";
    
    // Encoding
    public static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd'T'HH:mm:ss.SSSXXX} %level %logger - %msg%n";
    public static final String ENCODER_KIND_PATTERN = "pattern";
    public static final String ENCODER_KIND_JSON = "json";
    
    // Thread names
    public static final String LIFECYCLE_THREAD_PREFIX = "vahak-mqtt-lifecycle-";
}
