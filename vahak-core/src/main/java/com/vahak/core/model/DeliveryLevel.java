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
package com.vahak.core.model;

/**
 * MQTT delivery guarantee (QoS) applied to every published log record.
 */
public enum DeliveryLevel {
    AT_MOST_ONCE(0),
    AT_LEAST_ONCE(1),
    EXACTLY_ONCE(2);
    
    private final int code;
    
    DeliveryLevel(int code) {
        this.code = code;
    }
    
    /**
     * Protocol QoS value (0, 1 or 2)
     */
    public int getCode() {
        return code;
    }
    
    /**
     * Map a configured QoS integer to a delivery level.
     * Values other than 0, 1 and 2 fall back to {@link #AT_MOST_ONCE}.
     */
    public static DeliveryLevel fromCode(int code) {
        switch (code) {
            case 1:
                return AT_LEAST_ONCE;
            case 2:
                return EXACTLY_ONCE;
            case 0:
            default:
                return AT_MOST_ONCE;
        }
    }
}
