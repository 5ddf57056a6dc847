// file: storage/src/main/java/io/capsulevault/storage/Reconciler.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.OwnerIndex;
import io.capsulevault.core.OwnerRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Operator-triggered repair pass for one owner.
 * <p>
 * Steps:
 *  1) List committed blobs and diff them against the index entries.
 *  2) Report orphans (blob, no entry) and dangling entries (entry, no blob).
 *  3) In repair mode:
 *      - drop dangling entries,
 *      - re-index orphans with a recomputed fingerprint, the file size, the file's
 *        modification time as createdAt and whatever descriptor the schema check yields,
 *      - persist the result; an owner left with no versions keeps an empty index.
 * <p>
 * Callers must hold the owner's write lock. Nothing here runs on the read path.
 */
public final class Reconciler {
    private static final Logger log = Logger.getLogger(Reconciler.class.getName());

    /** Report plus the owner's record after the pass (null if the owner has no index). */
    public record Outcome(ReconciliationReport report, OwnerRecord record) {}

    private final CapsuleObjectStore objects;
    private final OwnerIndexStore indexes;
    private final OwnerIndex ownerIndex;
    private final Clock clock;

    public Reconciler(CapsuleObjectStore objects, OwnerIndexStore indexes, OwnerIndex ownerIndex, Clock clock) {
        this.objects = Objects.requireNonNull(objects, "objects");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.ownerIndex = Objects.requireNonNull(ownerIndex, "ownerIndex");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param current the owner's record, or null if the owner has no index
     */
    public Outcome reconcile(String owner, OwnerRecord current, boolean repair) {
        Set<String> onDisk = new HashSet<>(objects.listVersionIds(owner));
        Set<String> indexed = current == null ? Set.of() : current.versions().keySet();

        var orphans = new TreeSet<>(onDisk);
        orphans.removeAll(indexed);
        var dangling = new TreeSet<>(indexed);
        dangling.removeAll(onDisk);

        if (!repair || (orphans.isEmpty() && dangling.isEmpty())) {
            var report = new ReconciliationReport(owner, List.copyOf(orphans), List.copyOf(dangling), List.of(), List.of());
            return new Outcome(report, current);
        }

        OwnerRecord record = current != null ? current : OwnerRecord.empty(owner, clock.instant());
        List<String> dropped = new ArrayList<>();
        for (String versionId : dangling) {
            record = ownerIndex.removeVersion(record, versionId);
            dropped.add(versionId);
        }

        List<String> reindexed = new ArrayList<>();
        for (String versionId : orphans) {
            BlobReceipt receipt = objects.inspect(owner, versionId);
            var version = new CapsuleVersion(
                    owner,
                    versionId,
                    objects.modifiedAt(owner, versionId),
                    receipt.fingerprint(),
                    receipt.storageLocation(),
                    receipt.byteSize(),
                    Set.of(),
                    receipt.descriptor().schemaVersion(),
                    receipt.descriptor().producerId(),
                    receipt.descriptor().sourceTag());
            record = ownerIndex.addVersion(record, version);
            reindexed.add(versionId);
        }

        indexes.persist(owner, record);
        if (record.isEmpty()) {
            objects.deleteOwnerIfEmpty(owner);
        }

        log.info(String.format("reconciled %s: reindexed=%d dropped=%d", owner, reindexed.size(), dropped.size()));
        var report = new ReconciliationReport(owner, List.copyOf(orphans), List.copyOf(dangling), reindexed, dropped);
        return new Outcome(report, record);
    }
}
