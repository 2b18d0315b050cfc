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
 * Exception thrown when a broker address cannot be parsed.
 */
public class AddressParseException extends VahakException {
    
    private static final long serialVersionUID = 1L;
    
    public AddressParseException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public AddressParseException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public static AddressParseException invalidPort(String address, String port, Throwable cause) {
        return new AddressParseException(ErrorCode.INVALID_PORT,
                "Invalid port number '" + port + "' in broker address: " + address, cause);
    }
    
    public static AddressParseException missingHost(String address) {
        return new AddressParseException(ErrorCode.INVALID_ADDRESS,
                "No host in broker address: " + address);
    }
    
    public static AddressParseException missingAddress() {
        return new AddressParseException(ErrorCode.INVALID_ADDRESS, "Broker address is not set");
    }
}
