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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import com.vahak.appender.MqttAppender;
import com.vahak.appender.connection.BackpressurePolicy;
import com.vahak.appender.connection.FakeMqttSessionFactory;
import com.vahak.appender.encoder.EncoderRegistry;
import com.vahak.core.exception.AppenderBuildException;
import com.vahak.core.exception.VahakException.ErrorCode;
import com.vahak.core.model.DeliveryLevel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MqttAppenderConfigLoaderTest {

    private static final String YAML = String.join("\n",
            "broker: mqtt://broker.test:1884",
            "client_id: orders",
            "topic: logs/{level}",
            "qos: 1",
            "username: svc",
            "password: pw",
            "publish_timeout_ms: 500",
            "backpressure: drop",
            "encoder:",
            "  kind: pattern",
            "  pattern: \"%level %msg%n\"",
            "");

    private final LoggerContext context = new LoggerContext();
    private final FakeMqttSessionFactory factory = new FakeMqttSessionFactory();
    private final MqttAppenderConfigLoader subject = new MqttAppenderConfigLoader();
    private MqttAppender appender;

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        if (appender != null) {
            appender.stop();
        }
        context.stop();
    }

    @Test
    void readsEveryYamlKey() {
        final var config = subject.readYaml(YAML);

        assertThat(config.getBroker()).isEqualTo("mqtt://broker.test:1884");
        assertThat(config.getClientId()).isEqualTo("orders");
        assertThat(config.getTopic()).isEqualTo("logs/{level}");
        assertThat(config.getQos()).isEqualTo(1);
        assertThat(config.getUsername()).isEqualTo("svc");
        assertThat(config.getPublishTimeoutMs()).isEqualTo(500L);
        assertThat(config.getBackpressure()).isEqualTo("drop");
        assertThat(config.getEncoder().getKind()).isEqualTo("pattern");
        assertThat(config.getEncoder().getProperties()).containsExactly(Map.entry("pattern", "%level %msg%n"));
        assertThat(config.toString()).doesNotContain("pw");
    }

    @Test
    void buildsAppenderFromDocument() {
        appender = subject.toBuilder(subject.readYaml(YAML), context).sessionFactory(factory).build();

        assertThat(appender.isStarted()).isTrue();
        assertThat(appender.getDeliveryLevel()).isEqualTo(DeliveryLevel.AT_LEAST_ONCE);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).isEqualTo("%level %msg%n");
        final var settings = factory.last().getSettings();
        assertThat(settings.getServerUri()).isEqualTo("tcp://broker.test:1884");
        assertThat(settings.hasCredentials()).isTrue();
        assertThat(settings.getPublishTimeoutMillis()).isEqualTo(500);
        assertThat(settings.getBackpressurePolicy()).isEqualTo(BackpressurePolicy.DROP);
    }

    @Test
    void readsJsonWithJsonEncoder() {
        final var config = subject.readJson(
                "{\"broker\":\"localhost\",\"client_id\":\"c\",\"topic\":\"t\",\"encoder\":{\"kind\":\"json\"}}");

        appender = subject.toBuilder(config, context).sessionFactory(factory).build();

        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(appender.getDeliveryLevel()).isEqualTo(DeliveryLevel.AT_MOST_ONCE);
    }

    @Test
    void rejectsUnknownKeys() {
        assertThatThrownBy(() -> subject.readYaml(YAML + "retain: true\n"))
                .isInstanceOf(AppenderBuildException.class)
                .hasMessageContaining("retain")
                .satisfies(e -> assertThat(((AppenderBuildException) e).getErrorCode()).isEqualTo(ErrorCode.CONFIG_ERROR));
    }

    @Test
    void requiresBrokerClientIdAndTopic() {
        final var config = subject.readYaml("client_id: c\ntopic: t\n");

        assertThatThrownBy(() -> subject.toBuilder(config, context))
                .isInstanceOf(AppenderBuildException.class)
                .hasMessageContaining("broker");
    }

    @Test
    void rejectsUnknownBackpressureAndEncoderKind() {
        final var badPolicy = subject.readYaml("broker: h\nclient_id: c\ntopic: t\nbackpressure: spill\n");
        final var badKind = subject.readYaml("broker: h\nclient_id: c\ntopic: t\nencoder:\n  kind: xml\n");

        assertThatThrownBy(() -> subject.toBuilder(badPolicy, context))
                .isInstanceOf(AppenderBuildException.class)
                .hasMessageContaining("spill");
        assertThatThrownBy(() -> subject.toBuilder(badKind, context))
                .isInstanceOf(AppenderBuildException.class)
                .hasMessageContaining("xml");
    }

    @Test
    void usesCustomEncoderKinds() {
        final var registry = EncoderRegistry.withDefaults();
        registry.register("message-only", (properties, ctx) -> registry.create("pattern", Map.of("pattern", "%msg"), ctx));
        final var loader = new MqttAppenderConfigLoader(registry);

        final var builder = loader.toBuilder(
                loader.readYaml("broker: h\nclient_id: c\ntopic: t\nencoder:\n  kind: message-only\n"), context);
        appender = builder.sessionFactory(factory).build();

        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).isEqualTo("%msg");
    }

    @Test
    void readsFilesByExtension() throws Exception {
        final Path yaml = Files.writeString(tempDir.resolve("mqtt.yaml"), YAML);
        final Path json = Files.writeString(tempDir.resolve("mqtt.json"),
                "{\"broker\":\"h:1\",\"client_id\":\"c\",\"topic\":\"t\"}");

        assertThat(subject.read(yaml).getClientId()).isEqualTo("orders");
        assertThat(subject.read(json).getBroker()).isEqualTo("h:1");
    }

    @Test
    void missingFileIsConfigError() {
        assertThatThrownBy(() -> subject.read(tempDir.resolve("absent.yml")))
                .isInstanceOf(AppenderBuildException.class)
                .hasMessageContaining("absent.yml");
    }

    @Test
    void bundledExampleConfigIsValid() throws Exception {
        try (var in = getClass().getResourceAsStream("/examples/mqtt-debug.yml")) {
            assertThat(in).isNotNull();
            final var config = subject.readYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8));

            assertThat(config.getTopic()).isEqualTo("test/logs/{level}");
            appender = subject.toBuilder(config, context).sessionFactory(factory).build();
        }
        assertThat(appender.isStarted()).isTrue();
    }
}
