package com.sandcastle.sandbox;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label keys stamped on every sandbox container.
 */
public final class ContainerLabels {

    private ContainerLabels() {}

    public static final String MANAGED = "sandcastle.managed";
    public static final String SANDBOX_ID = "sandcastle.sandbox.id";
    public static final String SANDBOX_NAME = "sandcastle.sandbox.name";
    public static final String SANDBOX_SLUG = "sandcastle.sandbox.slug";
    public static final String SANDBOX_USER = "sandcastle.sandbox.user";
    public static final String SANDBOX_REPO = "sandcastle.sandbox.repo";
    public static final String SANDBOX_GITHUB = "sandcastle.sandbox.github";
    public static final String URL_PREFIX = "sandcastle.url.";

    public static String url(String service) {
        return URL_PREFIX + service;
    }

    /**
     * Extracts the published URLs from a container's labels, keyed by service name.
     */
    public static Map<String, String> urls(Map<String, String> labels) {
        var urls = new LinkedHashMap<String, String>();
        if (labels == null) {
            return urls;
        }
        labels.forEach((key, value) -> {
            if (key.startsWith(URL_PREFIX) && value != null) {
                urls.put(key.substring(URL_PREFIX.length()), value);
            }
        });
        return urls;
    }
}
