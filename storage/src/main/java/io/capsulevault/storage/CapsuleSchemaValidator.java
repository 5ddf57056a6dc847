// file: storage/src/main/java/io/capsulevault/storage/CapsuleSchemaValidator.java
package io.capsulevault.storage;

/**
 * Structural check the object store runs before committing a blob.
 * <p>
 * The producer owns the schema; the store only checks that the agreed
 * sections are present and extracts the descriptive metadata it indexes.
 */
@FunctionalInterface
public interface CapsuleSchemaValidator {

    /**
     * @param content non-empty capsule bytes
     * @return descriptive metadata for the index
     * @throws io.capsulevault.core.ValidationException if required structure is missing
     */
    CapsuleDescriptor validate(byte[] content);

    /** Accepts any non-empty payload without looking inside it. */
    static CapsuleSchemaValidator opaque() {
        return content -> CapsuleDescriptor.empty();
    }
}
