package dev.jobtracker.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Content-addressed job identity.
 * <p>
 * The id is the first 16 hex characters (64 bits) of SHA-256 over
 * {@code lower(url + ":" + title + ":" + company)}. The truncation keeps keys short;
 * the birthday bound stays negligible for a personal feed of thousands of records.
 */
public final class JobIdGenerator {

    public static final int ID_LENGTH = 16;

    private JobIdGenerator() {
    }

    public static String generateId(String url, String title, String company) {
        String composite = (nullToEmpty(url) + ":" + nullToEmpty(title) + ":" + nullToEmpty(company))
                .toLowerCase(Locale.ROOT);
        return sha256Hex(composite).substring(0, ID_LENGTH);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
