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

import com.vahak.core.constants.VahakConstants;
import com.vahak.core.exception.AddressParseException;

import java.util.regex.Pattern;

/**
 * Host and port of an MQTT broker, derived from a URL-like string.
 * 
 * <p>Recognised scheme prefixes are {@code mqtt://}, {@code mqtts://} and
 * {@code tcp://}; a bare {@code host:port} is accepted too. The last colon
 * separates host from port. When no port is given the standard MQTT port
 * 1883 is used, whatever the scheme.</p>
 * 
 * @param host   host name or address, scheme stripped
 * @param port   TCP port, 0 to 65535
 * @param secure true when the address was given with the {@code mqtts://} scheme
 */
public record BrokerAddress(String host, int port, boolean secure) {
    
    private static final Pattern PORT_PATTERN = Pattern.compile("\\+?\\d{1,5}");
    private static final int MAX_PORT = 0xFFFF;
    
    /**
     * Parse a broker URL.
     * 
     * @param url broker URL, e.g. {@code mqtt://broker.local:1883}
     * @return parsed address
     * @throws AddressParseException if the port is not an unsigned 16-bit integer or the host is empty
     */
    public static BrokerAddress parse(String url) {
        if (url == null) {
            throw AddressParseException.missingAddress();
        }
        
        boolean secure = false;
        String remainder = url;
        if (remainder.startsWith(VahakConstants.SCHEME_MQTT)) {
            remainder = remainder.substring(VahakConstants.SCHEME_MQTT.length());
        } else if (remainder.startsWith(VahakConstants.SCHEME_MQTTS)) {
            remainder = remainder.substring(VahakConstants.SCHEME_MQTTS.length());
            secure = true;
        } else if (remainder.startsWith(VahakConstants.SCHEME_TCP)) {
            remainder = remainder.substring(VahakConstants.SCHEME_TCP.length());
        }
        
        int colon = remainder.lastIndexOf(':');
        if (colon < 0) {
            if (remainder.isEmpty()) {
                throw AddressParseException.missingHost(url);
            }
            return new BrokerAddress(remainder, VahakConstants.DEFAULT_MQTT_PORT, secure);
        }
        
        String host = remainder.substring(0, colon);
        String portText = remainder.substring(colon + 1);
        int port = parsePort(url, portText);
        if (host.isEmpty()) {
            throw AddressParseException.missingHost(url);
        }
        return new BrokerAddress(host, port, secure);
    }
    
    private static int parsePort(String url, String portText) {
        if (!PORT_PATTERN.matcher(portText).matches()) {
            throw AddressParseException.invalidPort(url, portText, null);
        }
        try {
            int port = Integer.parseInt(portText);
            if (port > MAX_PORT) {
                throw AddressParseException.invalidPort(url, portText, null);
            }
            return port;
        } catch (NumberFormatException e) {
            throw AddressParseException.invalidPort(url, portText, e);
        }
    }
    
    /**
     * Server URI in the form the Paho client expects ({@code tcp://} or {@code ssl://}).
     */
    public String toServerUri() {
        String scheme = secure ? VahakConstants.PAHO_SSL : VahakConstants.PAHO_TCP;
        return scheme + host + ":" + port;
    }
    
    @Override
    public String toString() {
        return host + ":" + port + (secure ? " [TLS]" : "");
    }
}
