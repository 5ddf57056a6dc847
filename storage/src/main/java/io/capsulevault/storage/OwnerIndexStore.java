// file: storage/src/main/java/io/capsulevault/storage/OwnerIndexStore.java
package io.capsulevault.storage;

import io.capsulevault.core.OwnerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of each owner's {@link OwnerRecord}.
 * <p>
 * The record is stored as one document and replaced wholesale on every persist;
 * there are no incremental appends.
 */
public interface OwnerIndexStore {

    /**
     * Load the persisted record.
     *
     * @return empty if the owner has no index yet
     * @throws io.capsulevault.core.CorruptIndexException if an index exists but cannot be trusted
     */
    Optional<OwnerRecord> load(String owner);

    /**
     * Atomically replace the owner's index with {@code record}.
     *
     * @throws StorageIoException if the write fails after retries
     */
    void persist(String owner, OwnerRecord record);

    /** Remove the owner's index. A no-op when absent. */
    void delete(String owner);

    /**
     * Move an index that cannot be loaded out of the way, keeping its bytes for
     * inspection. Afterwards {@link #load} reports the owner as having no index.
     *
     * @return where the old document now lives, or empty if there was none
     */
    Optional<String> quarantine(String owner);

    /** Owners that have an index document. */
    List<String> listOwners();
}
