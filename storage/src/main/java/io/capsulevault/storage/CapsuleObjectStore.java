// file: storage/src/main/java/io/capsulevault/storage/CapsuleObjectStore.java
package io.capsulevault.storage;

import java.time.Instant;
import java.util.List;

/**
 * Write-once blob storage, one namespace per owner.
 * <p>
 * Semantics:
 *  - write() validates the content, fingerprints it, and commits it so that a
 *    half-written blob is never visible under its final key.
 *  - A key is written at most once; blobs are never modified after commit.
 *  - No method touches the owner index. Callers order blob and index changes.
 */
public interface CapsuleObjectStore {

    /**
     * Validate and commit a new blob.
     *
     * @throws io.capsulevault.core.ValidationException if content is empty or structurally invalid
     * @throws BlobAlreadyExistsException if the key is already taken
     * @throws StorageIoException if the disk write fails after retries
     */
    BlobReceipt write(String owner, String versionId, byte[] content);

    /**
     * @throws BlobNotFoundException if the blob is absent
     * @throws StorageIoException on I/O errors
     */
    byte[] read(String owner, String versionId);

    /**
     * @throws BlobNotFoundException if the blob is absent
     * @throws StorageIoException on I/O errors
     */
    void delete(String owner, String versionId);

    boolean exists(String owner, String versionId);

    /**
     * Re-derive a receipt for an existing blob (fingerprint, size, descriptor).
     * Content the schema validator rejects gets an empty descriptor.
     */
    BlobReceipt inspect(String owner, String versionId);

    /** Last modification time of a committed blob. */
    Instant modifiedAt(String owner, String versionId);

    /** Version ids with a committed blob; in-flight temp files are excluded. */
    List<String> listVersionIds(String owner);

    /** Owners that have an object directory. */
    List<String> listOwners();

    /** Remove an owner's (empty) namespace. A no-op when it still holds blobs or is absent. */
    void deleteOwnerIfEmpty(String owner);
}
