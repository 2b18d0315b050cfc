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

import com.vahak.core.exception.PublishException;
import com.vahak.core.model.DeliveryLevel;

/**
 * The narrow publish surface of a broker connection.
 * 
 * Appenders see only this interface, never the underlying session, so every
 * publish goes through the connection's serialization guard.
 */
public interface PublishCapability {
    
    /**
     * Publish one payload.
     * Blocks until the publish call on the session has returned.
     * 
     * @param topic   destination topic
     * @param level   delivery guarantee
     * @param retain  broker retain flag
     * @param payload encoded message
     * @throws PublishException if the transport rejects or fails the publish
     */
    void publish(String topic, DeliveryLevel level, boolean retain, byte[] payload) throws PublishException;
}
