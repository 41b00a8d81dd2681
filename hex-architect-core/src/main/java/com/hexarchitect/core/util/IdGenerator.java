package com.hexarchitect.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic identifiers from strings using SHA-256.
 *
 * <p>Identifiers are the first 16 hexadecimal characters of the hash, which is stable
 * across runs and JVMs and contains only characters that every diagram syntax accepts as a
 * node identifier.
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a short identifier from a single string.
     *
     * @param input value to hash
     * @return 16-character hexadecimal identifier
     * @throws IllegalArgumentException if the input is null or blank
     */
    public static String generateFromString(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, SHORT_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
