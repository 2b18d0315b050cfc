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
package com.vahak.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vahak.core.exception.VahakException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility class for reading JSON and YAML configuration documents.
 * Both mappers reject unknown properties.
 */
public final class JsonUtils {
    
    private static final ObjectMapper jsonMapper;
    private static final ObjectMapper yamlMapper;
    
    static {
        jsonMapper = configure(new ObjectMapper());
        yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }
    
    private JsonUtils() {
        // Prevent instantiation
    }
    
    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
    
    /**
     * Get the shared JSON ObjectMapper instance
     */
    public static ObjectMapper getObjectMapper() {
        return jsonMapper;
    }
    
    /**
     * Get the shared YAML ObjectMapper instance
     */
    public static ObjectMapper getYamlMapper() {
        return yamlMapper;
    }
    
    /**
     * Pick the mapper for a file by extension: .yml and .yaml are YAML, everything else JSON
     */
    public static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml") ? yamlMapper : jsonMapper;
    }
    
    /**
     * Bind a document to the given type
     */
    public static <T> T read(ObjectMapper mapper, InputStream in, Class<T> type) {
        try {
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new VahakException(VahakException.ErrorCode.CONFIG_ERROR,
                    "Failed to read " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Bind a document string to the given type
     */
    public static <T> T read(ObjectMapper mapper, String document, Class<T> type) {
        try {
            return mapper.readValue(document, type);
        } catch (IOException e) {
            throw new VahakException(VahakException.ErrorCode.CONFIG_ERROR,
                    "Failed to read " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Convert object to JSON string
     */
    public static String toJson(Object obj) {
        try {
            return jsonMapper.writeValueAsString(obj);
        } catch (IOException e) {
            throw new VahakException(VahakException.ErrorCode.CONFIG_ERROR,
                    "Failed to serialize to JSON: " + e.getMessage(), e);
        }
    }
}
