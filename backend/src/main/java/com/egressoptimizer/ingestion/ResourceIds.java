package com.egressoptimizer.ingestion;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers over ARM resource ids of the form
 * {@code /subscriptions/{sub}/resourceGroups/{rg}/providers/{ns}/{type}/{name}}.
 */
public final class ResourceIds {

    public static final String UNKNOWN = "unknown";

    private static final Pattern RESOURCE_GROUP = Pattern.compile("/resourceGroups/([^/]+)/", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBSCRIPTION = Pattern.compile("/subscriptions/([^/]+)/", Pattern.CASE_INSENSITIVE);

    private ResourceIds() {
        // Utility class
    }

    /**
     * Last path segment of the id.
     */
    public static String name(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            return UNKNOWN;
        }
        return resourceId.substring(resourceId.lastIndexOf('/') + 1);
    }

    public static String resourceGroup(String resourceId) {
        return firstGroup(RESOURCE_GROUP, resourceId);
    }

    public static String subscription(String resourceId) {
        return firstGroup(SUBSCRIPTION, resourceId);
    }

    private static String firstGroup(Pattern pattern, String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            return UNKNOWN;
        }
        Matcher matcher = pattern.matcher(resourceId);
        return matcher.find() ? matcher.group(1) : UNKNOWN;
    }
}
