// file: storage/src/main/java/io/capsulevault/storage/CapsuleStore.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.Selector;

import java.util.List;

/**
 * Public operation surface of the capsule vault.
 * <p>
 * Semantics:
 *  - store() is durable before returning: blob committed, index persisted.
 *  - Blobs are immutable; only tags on the metadata record change.
 *  - Mutations for one owner are serialized; different owners run in parallel.
 *  - Failures are typed (see io.capsulevault.core.CapsuleStoreException and subtypes).
 */
public interface CapsuleStore {

    /**
     * Store a new immutable version for {@code owner}.
     *
     * @return the new version id
     * @throws io.capsulevault.core.ValidationException if content is empty or structurally invalid
     * @throws PartialFailureException if the blob was written but the index was not
     * @throws StorageIoException if the blob could not be written
     */
    String store(String owner, byte[] content);

    /**
     * Resolve and load one version, re-checking its fingerprint.
     *
     * @throws io.capsulevault.core.NotFoundException with kind OWNER, VERSION or TAG
     * @throws io.capsulevault.core.CorruptIndexException if the index references a missing blob
     */
    RetrievalResult retrieve(String owner, Selector selector);

    /** Idempotent. */
    void addTag(String owner, String versionId, String tag);

    /** Idempotent; removing a tag the version does not carry is not an error. */
    void removeTag(String owner, String versionId, String tag);

    /**
     * Metadata of every version (newest first), optionally only those carrying {@code tag}.
     * Unknown owners yield an empty list.
     */
    List<CapsuleVersion> list(String owner, String tag);

    default List<CapsuleVersion> list(String owner) {
        return list(owner, null);
    }

    /**
     * Delete the blob, then the index entry.
     * If the blob cannot be deleted the index is left untouched. Deleting the last
     * version keeps the owner; later lookups of that version fail with kind VERSION.
     */
    void delete(String owner, String versionId);

    /**
     * Owners that have an index, sorted. An owner whose versions were all deleted
     * is still listed, with no versions.
     */
    List<String> listOwners();

    OwnerSummary ownerSummary(String owner);

    /**
     * Diff storage against the index for {@code owner}; with {@code repair}, fix both directions.
     * Also runs for an owner whose index could not be loaded: every blob is then an orphan,
     * and repair sets the unreadable document aside and rebuilds the index from the blobs.
     */
    ReconciliationReport reconcile(String owner, boolean repair);
}
