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

import java.util.Locale;

/**
 * What a publisher does when it cannot get hold of the connection within the
 * configured publish timeout.
 */
public enum BackpressurePolicy {
    /** Keep waiting without a bound. */
    BLOCK,
    /** Discard the record and report a timeout. */
    DROP;
    
    /**
     * Lenient lookup used for configuration documents; null or blank means {@link #BLOCK}.
     */
    public static BackpressurePolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return BLOCK;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
