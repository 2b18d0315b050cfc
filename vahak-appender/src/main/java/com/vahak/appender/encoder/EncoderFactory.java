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

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.encoder.Encoder;

import java.util.Map;

/**
 * Creates a started encoder of one kind from its configuration properties.
 */
@FunctionalInterface
public interface EncoderFactory {
    
    /**
     * @param properties kind-specific settings, never null; unknown keys must be rejected
     * @param context    logback context the encoder is attached to
     * @return a started encoder
     */
    Encoder<ILoggingEvent> create(Map<String, Object> properties, Context context);
}
