// file: storage/src/main/java/io/capsulevault/storage/CapsuleDescriptor.java
package io.capsulevault.storage;

/**
 * Descriptive fields pulled out of capsule content by a schema validator.
 * Every field may be null; they are carried into the index unchanged.
 */
public record CapsuleDescriptor(String schemaVersion, String producerId, String sourceTag) {

    private static final CapsuleDescriptor EMPTY = new CapsuleDescriptor(null, null, null);

    public static CapsuleDescriptor empty() {
        return EMPTY;
    }
}
