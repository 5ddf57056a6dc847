// file: storage/src/main/java/io/capsulevault/storage/PartialFailureException.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleStoreException;

/**
 * The blob was written but the index could not be updated.
 * <p>
 * The blob stays on disk as an orphan; {@link Reconciler} can find and re-index it.
 */
public class PartialFailureException extends CapsuleStoreException {

    private final String owner;
    private final String versionId;

    public PartialFailureException(String owner, String versionId, Throwable cause) {
        super("Blob " + versionId + " for owner " + owner + " was written but not indexed", cause);
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
