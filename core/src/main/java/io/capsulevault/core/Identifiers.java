// file: core/src/main/java/io/capsulevault/core/Identifiers.java
package io.capsulevault.core;

import java.util.regex.Pattern;

/**
 * Checks for names that end up as file names or index keys.
 * <p>
 * Owners and version ids become path segments, so they are limited to a
 * conservative character set with no separators and no leading dot.
 */
public final class Identifiers {
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
    private static final int MAX_TAG_LENGTH = 128;

    private Identifiers() {
        // utility
    }

    public static String requireOwner(String owner) {
        return requireSegment("owner", owner);
    }

    public static String requireVersionId(String versionId) {
        return requireSegment("versionId", versionId);
    }

    public static String requireTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("tag must not be blank");
        }
        if (tag.length() > MAX_TAG_LENGTH) {
            throw new ValidationException("tag longer than " + MAX_TAG_LENGTH + " characters");
        }
        return tag;
    }

    public static boolean isSegment(String value) {
        return value != null && SEGMENT.matcher(value).matches();
    }

    private static String requireSegment(String what, String value) {
        if (!isSegment(value)) {
            throw new ValidationException(what + " must match " + SEGMENT.pattern() + ", got: " + value);
        }
        return value;
    }
}
