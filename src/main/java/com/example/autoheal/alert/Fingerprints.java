package com.example.autoheal.alert;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable issue identities. Null parts hash as empty strings.
 */
public final class Fingerprints {

    private Fingerprints() {
    }

    public static String of(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) joined.append('|');
            joined.append(parts[i] != null ? parts[i] : "");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(joined.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Identity of a locally detected issue */
    public static String local(String source, String component, String issueType) {
        return of(source, component, issueType);
    }

    /** Identity of an external alert that arrived without an upstream fingerprint */
    public static String external(String alertName, String instance) {
        return of(alertName, instance);
    }
}
