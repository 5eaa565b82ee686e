package com.sandcastle.core.engine;

import java.security.SecureRandom;

/**
 * Generates sandbox ids: 12 random lower-case alphanumeric characters.
 */
public final class SandboxIds {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int LENGTH = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private SandboxIds() {}

    public static String newId() {
        var sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static boolean isValid(String id) {
        return id != null && id.matches("[a-z0-9]{12}");
    }
}
