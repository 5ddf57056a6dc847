// file: core/src/main/java/io/capsulevault/core/IntegrityValidator.java
package io.capsulevault.core;

/**
 * Computes and checks content fingerprints.
 * <p>
 * Implementations are pure: no I/O, no shared mutable state.
 */
public interface IntegrityValidator {

    /**
     * Digest of the given bytes. Deterministic for equal input.
     *
     * @throws IllegalArgumentException if content is null
     */
    Fingerprint fingerprint(byte[] content);

    /**
     * Recompute the fingerprint of {@code content} and compare with {@code expected}.
     *
     * @return false on mismatch, never throws for a mismatch
     * @throws IllegalArgumentException if content or expected is null
     */
    default boolean verify(byte[] content, Fingerprint expected) {
        if (expected == null) {
            throw new IllegalArgumentException("expected fingerprint must not be null");
        }
        return fingerprint(content).equals(expected);
    }
}
