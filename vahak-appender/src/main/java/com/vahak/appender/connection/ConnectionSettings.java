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

import com.vahak.core.constants.VahakConstants;
import com.vahak.core.model.BrokerAddress;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;

/**
 * Immutable settings for one broker session.
 */
@Getter
@Builder
@ToString(exclude = "password")
public class ConnectionSettings {
    
    private final BrokerAddress address;
    
    private final String clientId;
    
    private final String username;
    
    private final String password;
    
    @Builder.Default
    private final int keepAliveSeconds = VahakConstants.DEFAULT_KEEP_ALIVE_SECONDS;
    
    @Builder.Default
    private final int connectionTimeoutSeconds = VahakConstants.DEFAULT_CONNECTION_TIMEOUT_SECONDS;
    
    /**
     * Bound on waiting for the publish lock and for the client to complete a publish.
     * 0 waits indefinitely.
     */
    @Builder.Default
    private final long publishTimeoutMillis = VahakConstants.DEFAULT_PUBLISH_TIMEOUT_MS;
    
    @Builder.Default
    private final BackpressurePolicy backpressurePolicy = BackpressurePolicy.BLOCK;
    
    /**
     * Credentials are only applied when both user name and password are set.
     */
    public boolean hasCredentials() {
        return username != null && password != null;
    }
    
    public String getServerUri() {
        return address.toServerUri();
    }
    
    /**
     * Build the Paho connect options: clean session, automatic reconnect,
     * keep-alive and, where present, credentials.
     */
    public MqttConnectOptions toConnectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setKeepAliveInterval(keepAliveSeconds);
        options.setConnectionTimeout(connectionTimeoutSeconds);
        options.setMaxReconnectDelay((int) VahakConstants.MAX_RECONNECT_DELAY_MS);
        if (hasCredentials()) {
            options.setUserName(username);
            options.setPassword(password.toCharArray());
        }
        return options;
    }
}
