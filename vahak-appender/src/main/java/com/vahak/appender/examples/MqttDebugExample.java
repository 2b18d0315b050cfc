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
package com.vahak.appender.examples;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.vahak.appender.MqttAppender;
import com.vahak.appender.config.MqttAppenderConfig;
import com.vahak.appender.config.MqttAppenderConfigLoader;
import com.vahak.core.util.JsonUtils;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Connects an MQTT appender to a local broker and logs a few messages.
 * 
 * <p>Usage: {@code java com.vahak.appender.examples.MqttDebugExample [config.yml]}.
 * Without an argument the bundled {@code examples/mqtt-debug.yml} is used.
 * Subscribe with {@code mosquitto_sub -t 'test/logs/#' -v} to watch the output.</p>
 */
public class MqttDebugExample {
    
    private static final String BUNDLED_CONFIG = "/examples/mqtt-debug.yml";
    
    public static void main(String[] args) throws Exception {
        System.out.println("Starting MQTT debug example...");
        
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        MqttAppenderConfigLoader loader = new MqttAppenderConfigLoader();
        
        MqttAppenderConfig config = args.length > 0
                ? loader.read(Path.of(args[0]))
                : loader.readYaml(readBundledConfig());
        
        MqttAppender appender = loader.toBuilder(config, context).name("mqtt").build();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        
        System.out.println("Waiting 2 seconds for the MQTT connection...");
        Thread.sleep(2000);
        
        org.slf4j.Logger log = LoggerFactory.getLogger(MqttDebugExample.class);
        log.info("Test info message");
        log.warn("Test warning message");
        log.error("Test error message");
        
        System.out.println("Waiting 3 seconds for messages to be sent...");
        Thread.sleep(3000);
        
        System.out.println("Appender stats: " + JsonUtils.toJson(appender.getStats()));
        root.detachAppender(appender);
        appender.stop();
        
        System.out.println("Debug example completed.");
    }
    
    private static String readBundledConfig() throws IOException {
        try (InputStream in = MqttDebugExample.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (in == null) {
                throw new IOException("Bundled config not found: " + BUNDLED_CONFIG);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
