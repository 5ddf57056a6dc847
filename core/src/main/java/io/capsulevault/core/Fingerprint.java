// file: core/src/main/java/io/capsulevault/core/Fingerprint.java
package io.capsulevault.core;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest of a capsule's stored bytes (32 bytes).
 * Immutable value object, usable as a map key.
 */
public record Fingerprint(byte[] bytes) {
    public static final int LENGTH = 32;
    private static final HexFormat HEX = HexFormat.of();

    public Fingerprint {
        Objects.requireNonNull(bytes, "fingerprint bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "fingerprint must be " + LENGTH + " bytes (SHA-256), got: " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Parses a lowercase or uppercase 64-character hex string.
     */
    public static Fingerprint fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                    "SHA-256 hex string must be " + (LENGTH * 2) + " characters, got: " + hex.length());
        }
        try {
            return new Fingerprint(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid hex string: " + hex, e);
        }
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fingerprint other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
