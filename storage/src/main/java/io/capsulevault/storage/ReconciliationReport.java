// file: storage/src/main/java/io/capsulevault/storage/ReconciliationReport.java
package io.capsulevault.storage;

import java.util.List;

/**
 * Result of diffing an owner's object directory against its index.
 *
 * @param orphanedBlobs   blobs on disk without an index entry
 * @param danglingEntries index entries whose blob is missing
 * @param reindexed       orphans added back to the index (repair mode only)
 * @param dropped         dangling entries removed from the index (repair mode only)
 */
public record ReconciliationReport(
        String owner,
        List<String> orphanedBlobs,
        List<String> danglingEntries,
        List<String> reindexed,
        List<String> dropped
) {
    public ReconciliationReport {
        orphanedBlobs = List.copyOf(orphanedBlobs);
        danglingEntries = List.copyOf(danglingEntries);
        reindexed = List.copyOf(reindexed);
        dropped = List.copyOf(dropped);
    }

    public boolean consistent() {
        return orphanedBlobs.isEmpty() && danglingEntries.isEmpty();
    }
}
