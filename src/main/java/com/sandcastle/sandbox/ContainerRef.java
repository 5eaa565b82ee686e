package com.sandcastle.sandbox;

import java.util.Map;

/**
 * A created container.
 *
 * @param urls published URLs keyed by service name ({@code opencode}, {@code code-server}, {@code vnc})
 */
public record ContainerRef(String containerId, String containerName, Map<String, String> urls) {

    public ContainerRef {
        urls = urls == null ? Map.of() : Map.copyOf(urls);
    }

    public String url(String service) {
        return urls.get(service);
    }
}
