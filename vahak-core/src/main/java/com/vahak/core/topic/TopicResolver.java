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
package com.vahak.core.topic;

import com.vahak.core.constants.VahakConstants;

import java.util.Locale;

/**
 * Resolves a topic template against the severity of a log record.
 * 
 * <p>The first {@code {level}} in the template is replaced by the severity
 * name in lower case, so {@code logs/{level}} becomes {@code logs/warn}.
 * A template without the placeholder is a constant topic. The resulting
 * topic is not validated; topic syntax is the transport's concern.</p>
 */
public final class TopicResolver {
    
    private TopicResolver() {
        // Prevent instantiation
    }
    
    public static String resolve(String template, String levelName) {
        int index = template.indexOf(VahakConstants.LEVEL_PLACEHOLDER);
        if (index < 0) {
            return template;
        }
        String level = levelName.toLowerCase(Locale.ROOT);
        return template.substring(0, index)
                + level
                + template.substring(index + VahakConstants.LEVEL_PLACEHOLDER.length());
    }
    
    public static boolean hasLevelPlaceholder(String template) {
        return template != null && template.contains(VahakConstants.LEVEL_PLACEHOLDER);
    }
}
