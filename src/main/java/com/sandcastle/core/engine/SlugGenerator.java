package com.sandcastle.core.engine;

import com.sandcastle.core.error.ConflictException;
import com.sandcastle.core.persistence.SandboxRepository;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a URL-safe slug from a sandbox name that is unused within its owner's sandboxes.
 * Probes {@code base}, {@code base-1}, {@code base-2}, ... and returns the first free one.
 */
public class SlugGenerator {

    static final String FALLBACK = "sandbox";
    private static final int MAX_ATTEMPTS = 10_000;
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private final SandboxRepository repository;

    public SlugGenerator(SandboxRepository repository) {
        this.repository = repository;
    }

    public String generate(String userId, String name) {
        String base = slugify(name);
        if (!repository.slugExists(userId, base)) {
            return base;
        }
        for (int suffix = 1; suffix < MAX_ATTEMPTS; suffix++) {
            String candidate = base + "-" + suffix;
            if (!repository.slugExists(userId, candidate)) {
                return candidate;
            }
        }
        throw new ConflictException("No free slug for '%s' after %d attempts".formatted(base, MAX_ATTEMPTS));
    }

    /**
     * Lower-cases, collapses runs of characters outside {@code [a-z0-9]} to a
     * single dash and trims dashes at either end. Empty results become {@value #FALLBACK}.
     */
    public static String slugify(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String slug = NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') start++;
        while (end > start && slug.charAt(end - 1) == '-') end--;
        slug = slug.substring(start, end);
        return slug.isEmpty() ? FALLBACK : slug;
    }
}
