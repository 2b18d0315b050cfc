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

/**
 * Observer for broker session notifications.
 * Called on the connection's lifecycle thread, one event at a time.
 */
@FunctionalInterface
public interface ConnectionListener {
    
    void onEvent(ConnectionEvent event);
}
