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

import com.vahak.appender.connection.ConnectionEvent;

import java.util.Map;

/**
 * Point-in-time statistics of an {@link MqttAppender}, for monitoring.
 *
 * @param name              appender name
 * @param broker            broker address as configured
 * @param connected         whether the session is currently connected
 * @param messagesPublished publishes accepted by the session
 * @param publishErrors     publishes the session rejected or failed
 * @param dropped           records discarded by the DROP backpressure policy
 * @param encodingErrors    records the encoder could not render
 * @param connectAttempts   initial connect attempts made by the lifecycle loop
 * @param lifecycleEvents   lifecycle notifications seen, by type
 */
public record AppenderStats(
    String name,
    String broker,
    boolean connected,
    long messagesPublished,
    long publishErrors,
    long dropped,
    long encodingErrors,
    long connectAttempts,
    Map<ConnectionEvent.Type, Long> lifecycleEvents
) {}
