// file: core/src/main/java/io/capsulevault/core/Sha256IntegrityValidator.java
package io.capsulevault.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over the exact stored bytes.
 * <p>
 * MessageDigest is not thread-safe, so a fresh instance is taken per call.
 */
public final class Sha256IntegrityValidator implements IntegrityValidator {

    @Override
    public Fingerprint fingerprint(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        return new Fingerprint(newDigest().digest(content));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK is required to ship SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
