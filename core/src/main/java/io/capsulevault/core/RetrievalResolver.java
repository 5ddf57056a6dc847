// file: core/src/main/java/io/capsulevault/core/RetrievalResolver.java
package io.capsulevault.core;

import java.util.Objects;
import java.util.Set;

/**
 * Turns a {@link Selector} into one concrete version id of an owner.
 * <p>
 * Rules:
 *  - Latest:      the record's latest pointer; NotFound(VERSION) when the owner is empty.
 *  - ByVersionId: the id itself if the record knows it, else NotFound(VERSION).
 *  - ByTag:       NotFound(TAG) when nobody carries the tag; otherwise the most recent
 *                 member under {@link VersionOrdering#RECENCY}, never an ambiguity error.
 * <p>
 * Loading the blob and checking its fingerprint is the store's job, not the resolver's.
 */
public final class RetrievalResolver {

    public String resolve(OwnerRecord record, Selector selector) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(selector, "selector");

        if (selector instanceof Selector.Latest) {
            String latest = record.latestVersionId();
            if (latest == null) {
                throw NotFoundException.version("latest of " + record.owner());
            }
            return latest;
        } else if (selector instanceof Selector.ByVersionId byId) {
            if (!record.versions().containsKey(byId.versionId())) {
                throw NotFoundException.version(byId.versionId());
            }
            return byId.versionId();
        } else if (selector instanceof Selector.ByTag byTag) {
            Set<String> members = TagIndex.versionsForTag(record, byTag.tag());
            if (members.isEmpty()) {
                throw NotFoundException.tag(byTag.tag());
            }
            return members.stream()
                    .map(record.versions()::get)
                    .max(VersionOrdering.RECENCY)
                    .map(CapsuleVersion::versionId)
                    .orElseThrow();
        }
        throw new IllegalStateException("Unknown selector type: " + selector);
    }
}
