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
 * Exception thrown when a single log record could not be published.
 * The appender that raised it remains usable.
 */
public class PublishException extends VahakException {
    
    private static final long serialVersionUID = 1L;
    
    public PublishException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public PublishException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public static PublishException failed(String topic, Throwable cause) {
        return new PublishException(ErrorCode.PUBLISH_ERROR,
                "Failed to publish to topic '" + topic + "': " + cause.getMessage(), cause);
    }
    
    public static PublishException timedOut(String topic, long timeoutMillis) {
        return new PublishException(ErrorCode.PUBLISH_TIMEOUT,
                "Publish to topic '" + topic + "' dropped after waiting " + timeoutMillis + " ms for the connection");
    }
    
    public static PublishException closed(String topic) {
        return new PublishException(ErrorCode.CONNECTION_CLOSED,
                "Cannot publish to topic '" + topic + "': connection is closed");
    }
    
    public static PublishException interrupted(String topic, InterruptedException cause) {
        return new PublishException(ErrorCode.PUBLISH_ERROR,
                "Interrupted while waiting to publish to topic '" + topic + "'", cause);
    }
    
    public static PublishException encoding(Throwable cause) {
        return new PublishException(ErrorCode.ENCODING_ERROR,
                "Failed to encode log event: " + cause.getMessage(), cause);
    }
}
