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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Configuration document for one MQTT appender.
 * 
 * <pre>{@code
 * broker: mqtt://localhost:1883
 * client_id: log4rs_client
 * topic: logs/{level}
 * qos: 1                  # optional, defaults to 0
 * username: user          # optional
 * password: pass          # optional
 * publish_timeout_ms: 0   # optional, 0 waits indefinitely
 * backpressure: block     # optional, block or drop
 * encoder:                # optional
 *   pattern: "%d %level %logger - %msg%n"
 * }</pre>
 * 
 * Unknown keys are rejected.
 * 
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@ToString(exclude = "password")
@JsonIgnoreProperties(ignoreUnknown = false)
public class MqttAppenderConfig {
    
    /**
     * Broker URL. Required.
     */
    private String broker;
    
    /**
     * Session identifier presented to the broker. Required.
     */
    @JsonProperty("client_id")
    private String clientId;
    
    /**
     * Topic template, may contain {level}. Required.
     */
    private String topic;
    
    /**
     * Delivery level 0, 1 or 2; absent means 0.
     */
    private Integer qos;
    
    private String username;
    
    private String password;
    
    private EncoderConfig encoder;
    
    @JsonProperty("publish_timeout_ms")
    private Long publishTimeoutMs;
    
    /**
     * block or drop
     */
    private String backpressure;
}
