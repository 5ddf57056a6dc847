// file: core/src/main/java/io/capsulevault/core/VersionOrdering.java
package io.capsulevault.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Recency order used wherever one version must be picked out of many:
 * recomputing the latest pointer and resolving a tag with several members.
 * <p>
 * Greatest createdAt wins; equal timestamps fall back to the lexicographically
 * greatest versionId, because clocks can repeat at sub-resolution intervals.
 */
public final class VersionOrdering {

    /** Oldest first. */
    public static final Comparator<CapsuleVersion> RECENCY =
            Comparator.comparing(CapsuleVersion::createdAt)
                    .thenComparing(CapsuleVersion::versionId);

    /** Newest first, the order listings are returned in. */
    public static final Comparator<CapsuleVersion> NEWEST_FIRST = RECENCY.reversed();

    private VersionOrdering() {
        // utility
    }

    public static Optional<CapsuleVersion> mostRecent(Collection<CapsuleVersion> versions) {
        return versions.stream().max(RECENCY);
    }
}
