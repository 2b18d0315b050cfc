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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.vahak.core.constants.VahakConstants;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nested encoder section of an appender document.
 * 
 * <pre>{@code
 * encoder:
 *   kind: pattern        # optional, defaults to pattern
 *   pattern: "%d %level - %msg%n"
 * }</pre>
 * 
 * Every key other than {@code kind} is passed to the encoder factory, which
 * rejects keys it does not know.
 */
@NoArgsConstructor
@ToString
public class EncoderConfig {
    
    @Getter
    @Setter
    private String kind = VahakConstants.ENCODER_KIND_PATTERN;
    
    private final Map<String, Object> properties = new LinkedHashMap<>();
    
    @JsonAnySetter
    public void setProperty(String key, Object value) {
        properties.put(key, value);
    }
    
    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }
}
