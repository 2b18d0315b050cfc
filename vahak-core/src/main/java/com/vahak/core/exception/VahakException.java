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
 * Base exception for all Vahak errors.
 */
public class VahakException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final ErrorCode errorCode;
    
    public VahakException(String message) {
        super(message);
        this.errorCode = ErrorCode.GENERAL_ERROR;
    }
    
    public VahakException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = ErrorCode.GENERAL_ERROR;
    }
    
    public VahakException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public VahakException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    /**
     * Error codes for Vahak operations
     */
    public enum ErrorCode {
        GENERAL_ERROR("ERR"),
        INVALID_ADDRESS("BADADDR"),
        INVALID_PORT("BADPORT"),
        CONFIG_ERROR("CONFIGERR"),
        CONNECTION_ERROR("CONNERR"),
        CONNECTION_CLOSED("CLOSED"),
        ENCODING_ERROR("ENCODEERR"),
        PUBLISH_ERROR("PUBERR"),
        PUBLISH_TIMEOUT("TIMEOUT");
        
        private final String prefix;
        
        ErrorCode(String prefix) {
            this.prefix = prefix;
        }
        
        public String getPrefix() {
            return prefix;
        }
    }
    
    /**
     * Get the message prefixed with the short error code, as reported in status output
     */
    public String getCodedMessage() {
        return errorCode.getPrefix() + " " + getMessage();
    }
}
