// file: core/src/main/java/io/capsulevault/core/TagIndex.java
package io.capsulevault.core;

import java.util.Objects;
import java.util.Set;

/**
 * Tag operations over an {@link OwnerRecord}'s inverted index (tag -> version ids).
 * <p>
 * Both mutations are idempotent so callers can retry them freely:
 *  - adding a tag a version already carries returns the record unchanged;
 *  - removing a tag a version does not carry returns the record unchanged.
 */
public final class TagIndex {
    private final OwnerIndex ownerIndex;

    public TagIndex(OwnerIndex ownerIndex) {
        this.ownerIndex = Objects.requireNonNull(ownerIndex, "ownerIndex");
    }

    /**
     * @throws NotFoundException (VERSION) if versionId is not part of the record
     */
    public OwnerRecord addTag(OwnerRecord record, String versionId, String tag) {
        CapsuleVersion version = record.version(versionId)
                .orElseThrow(() -> NotFoundException.version(versionId));
        if (version.hasTag(tag)) {
            return record;
        }
        return ownerIndex.replaceVersion(record, version.withTag(tag));
    }

    /**
     * @throws NotFoundException (VERSION) if versionId is not part of the record
     */
    public OwnerRecord removeTag(OwnerRecord record, String versionId, String tag) {
        CapsuleVersion version = record.version(versionId)
                .orElseThrow(() -> NotFoundException.version(versionId));
        if (!version.hasTag(tag)) {
            return record;
        }
        return ownerIndex.replaceVersion(record, version.withoutTag(tag));
    }

    /** Members of a tag; empty when nobody carries it. */
    public static Set<String> versionsForTag(OwnerRecord record, String tag) {
        Set<String> ids = record.tagIndex().get(tag);
        return ids == null ? Set.of() : ids;
    }
}
