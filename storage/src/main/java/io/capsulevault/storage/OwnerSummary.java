// file: storage/src/main/java/io/capsulevault/storage/OwnerSummary.java
package io.capsulevault.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view of one owner.
 *
 * @param tagCounts       tag -> number of versions carrying it
 * @param oldestVersionAt createdAt of the oldest version (null when empty)
 * @param newestVersionAt createdAt of the newest version (null when empty)
 */
public record OwnerSummary(
        String owner,
        int versionCount,
        Map<String, Integer> tagCounts,
        String latestVersionId,
        Instant createdAt,
        Instant updatedAt,
        Instant oldestVersionAt,
        Instant newestVersionAt
) {
    public OwnerSummary {
        tagCounts = Map.copyOf(tagCounts);
    }
}
