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
package com.vahak.core.exception;

/**
 * Exception thrown when an appender cannot be assembled, either because the
 * configuration is invalid or because the broker client could not be created.
 */
public class AppenderBuildException extends VahakException {
    
    private static final long serialVersionUID = 1L;
    
    public AppenderBuildException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public AppenderBuildException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public static AppenderBuildException clientCreation(String serverUri, Throwable cause) {
        return new AppenderBuildException(ErrorCode.CONNECTION_ERROR,
                "Failed to create MQTT client for " + serverUri + ": " + cause.getMessage(), cause);
    }
    
    public static AppenderBuildException invalidConfig(String message) {
        return new AppenderBuildException(ErrorCode.CONFIG_ERROR, message);
    }
    
    public static AppenderBuildException invalidConfig(String message, Throwable cause) {
        return new AppenderBuildException(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
