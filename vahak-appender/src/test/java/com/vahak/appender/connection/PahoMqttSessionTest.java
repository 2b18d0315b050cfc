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
package com.vahak.appender.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import com.vahak.core.exception.PublishException;
import com.vahak.core.exception.VahakException.ErrorCode;
import com.vahak.core.model.BrokerAddress;
import com.vahak.core.model.DeliveryLevel;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PahoMqttSessionTest {

    private static final byte[] PAYLOAD = "line".getBytes(StandardCharsets.UTF_8);

    @Mock
    private MqttCallbackExtended callback;

    @Mock
    private ConnectionListener listener;

    private final List<PahoMqttSession> sessions = new CopyOnWriteArrayList<>();
    private final MqttSessionFactory factory = (settings, cb) -> {
        final var session = new PahoMqttSession(settings, cb);
        sessions.add(session);
        return session;
    };

    private LocalMqttBroker broker;
    private BrokerConnection connection;

    @AfterEach
    void tearDown() throws Exception {
        if (connection != null) {
            connection.close();
        }
        sessions.forEach(PahoMqttSession::close);
        if (broker != null) {
            broker.close();
        }
    }

    private static ConnectionSettings settings(String url, long publishTimeoutMillis) {
        return ConnectionSettings.builder()
                .address(BrokerAddress.parse(url))
                .clientId("paho-session-test")
                .publishTimeoutMillis(publishTimeoutMillis)
                .build();
    }

    @Test
    void connectsAndPublishes() throws Exception {
        broker = new LocalMqttBroker(0);
        final var session = (PahoMqttSession) factory.create(settings(broker.getBrokerUrl(), 0), callback);

        session.connect();
        session.publish("logs/info", PAYLOAD, 0, false);

        assertThat(session.isConnected()).isTrue();
        assertThat(session.getServerUri()).isEqualTo(broker.getServerUri());
        verify(callback, timeout(2000)).connectComplete(eq(false), eq(broker.getServerUri()));
        assertThat(broker.awaitPublished(1, 2000)).isTrue();
        assertThat(broker.getPublishedTopics()).containsExactly("logs/info");
    }

    @Test
    void publishTimeoutDoesNotBoundConnect() throws Exception {
        broker = new LocalMqttBroker(300);
        final var session = (PahoMqttSession) factory.create(settings(broker.getBrokerUrl(), 100), callback);

        session.connect();

        assertThat(session.isConnected()).isTrue();
    }

    @Test
    void slowAcknowledgementNeedsOneConnectAttempt() throws Exception {
        broker = new LocalMqttBroker(300);
        connection = BrokerConnection.open("slow", settings(broker.getBrokerUrl(), 100), factory, listener);

        verify(listener, timeout(3000)).onEvent(argThat(e -> e.getType() == ConnectionEvent.Type.CONNECTED));
        verify(listener, after(1500).never())
                .onEvent(argThat(e -> e.getType() == ConnectionEvent.Type.TRANSPORT_ERROR));
        assertThat(connection.getConnectAttempts()).isEqualTo(1);
        assertThat(broker.getConnects()).isEqualTo(1);

        connection.publish("logs/warn", DeliveryLevel.AT_LEAST_ONCE, false, PAYLOAD);
        assertThat(broker.getPublishedTopics()).containsExactly("logs/warn");
    }

    @Test
    void unacknowledgedPublishTimesOut() throws Exception {
        broker = new LocalMqttBroker(0);
        broker.setAcknowledgeQos1(false);
        final var session = (PahoMqttSession) factory.create(settings(broker.getBrokerUrl(), 200), callback);
        session.connect();

        assertThatThrownBy(() -> session.publish("logs/error", PAYLOAD, 1, false))
                .isInstanceOf(MqttException.class)
                .satisfies(e -> assertThat(((MqttException) e).getReasonCode())
                        .isEqualTo((int) MqttException.REASON_CODE_CLIENT_TIMEOUT));
    }

    @Test
    void publishWhileDisconnectedIsPublishError() throws Exception {
        connection = BrokerConnection.open("offline",
                settings("mqtt://127.0.0.1:" + LocalMqttBroker.unusedPort(), 0), factory, listener);

        assertThatThrownBy(() -> connection.publish("logs/info", DeliveryLevel.AT_MOST_ONCE, false, PAYLOAD))
                .isInstanceOf(PublishException.class)
                .satisfies(e -> assertThat(((PublishException) e).getErrorCode()).isEqualTo(ErrorCode.PUBLISH_ERROR))
                .hasCauseInstanceOf(MqttException.class);
        assertThat(connection.getErrors()).isEqualTo(1);
    }

    @Test
    void closeDuringConnectLeavesNoLiveClient() throws Exception {
        broker = new LocalMqttBroker(800);
        connection = BrokerConnection.open("closing", settings(broker.getBrokerUrl(), 0), factory, listener);
        assertThat(broker.awaitConnect(2000)).isTrue();

        connection.close();

        assertThat(connection.isLifecycleRunning()).isFalse();
        assertThat(sessions).hasSize(1);
        assertThat(sessions.get(0).isConnected()).isFalse();
        assertThat(broker.awaitDisconnect(2000)).isTrue();
        Thread.sleep(1000);
        assertThat(broker.getConnects()).isEqualTo(1);
    }
}
