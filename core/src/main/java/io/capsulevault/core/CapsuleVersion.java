// file: core/src/main/java/io/capsulevault/core/CapsuleVersion.java
package io.capsulevault.core;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Metadata record for one immutable stored capsule.
 * <p>
 * Fields:
 *  - owner:           logical instance name the capsule belongs to.
 *  - versionId:       unique within the owner, assigned at store time.
 *  - createdAt:       strictly increasing per owner.
 *  - fingerprint:     SHA-256 of the blob bytes.
 *  - storageLocation: opaque key of the blob inside the object store.
 *  - byteSize:        blob length in bytes.
 *  - tags:            mutable labels; not part of the fingerprinted content.
 *  - schemaVersion, producerId, sourceTag: descriptive, carried through from the
 *    producer unchanged. Any of them may be null.
 * <p>
 * Invariants:
 *  - The record itself is immutable; tag changes produce a new record.
 *  - Tag changes never touch fingerprint, size or location.
 */
public record CapsuleVersion(
        String owner,
        String versionId,
        Instant createdAt,
        Fingerprint fingerprint,
        String storageLocation,
        long byteSize,
        Set<String> tags,
        String schemaVersion,
        String producerId,
        String sourceTag
) {
    public CapsuleVersion {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(storageLocation, "storageLocation");
        if (byteSize < 0) throw new IllegalArgumentException("byteSize must be >= 0");
        tags = Collections.unmodifiableSortedSet(new TreeSet<String>(tags == null ? Set.<String>of() : tags));
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public CapsuleVersion withTag(String tag) {
        if (tags.contains(tag)) return this;
        var next = new TreeSet<>(tags);
        next.add(tag);
        return withTags(next);
    }

    public CapsuleVersion withoutTag(String tag) {
        if (!tags.contains(tag)) return this;
        var next = new TreeSet<>(tags);
        next.remove(tag);
        return withTags(next);
    }

    private CapsuleVersion withTags(Set<String> next) {
        return new CapsuleVersion(owner, versionId, createdAt, fingerprint, storageLocation,
                byteSize, next, schemaVersion, producerId, sourceTag);
    }
}
