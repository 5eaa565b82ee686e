package com.sandcastle.core.model;

import java.util.List;

/**
 * Pre-built container image with a language toolchain.
 *
 * @param imageName image repository name without registry or tag, e.g. {@code codeopen-js}
 */
public record ContainerFlavor(
    String id,
    String name,
    String description,
    List<String> languages,
    String imageName,
    boolean isDefault,
    int sortOrder
) {

    public ContainerFlavor {
        languages = languages == null ? List.of() : List.copyOf(languages);
    }
}
