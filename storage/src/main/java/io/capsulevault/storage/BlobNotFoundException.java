// file: storage/src/main/java/io/capsulevault/storage/BlobNotFoundException.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleStoreException;

/**
 * Thrown when a read or delete targets a blob that does not exist.
 * <p>
 * This is a storage-level miss. When the index still references the blob,
 * the store reports it as a corrupt index rather than a plain not-found.
 */
public class BlobNotFoundException extends CapsuleStoreException {

    private final String owner;
    private final String versionId;

    public BlobNotFoundException(String owner, String versionId) {
        super("Blob not found: owner=" + owner + " version=" + versionId);
        this.owner = owner;
        this.versionId = versionId;
    }

    public String owner() {
        return owner;
    }

    public String versionId() {
        return versionId;
    }
}
