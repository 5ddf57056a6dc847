// file: storage/src/main/java/io/capsulevault/storage/DurableCapsuleStore.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.CorruptIndexException;
import io.capsulevault.core.Identifiers;
import io.capsulevault.core.IntegrityValidator;
import io.capsulevault.core.NotFoundException;
import io.capsulevault.core.OwnerIndex;
import io.capsulevault.core.OwnerRecord;
import io.capsulevault.core.RetrievalResolver;
import io.capsulevault.core.Selector;
import io.capsulevault.core.Sha256IntegrityValidator;
import io.capsulevault.core.TagIndex;
import io.capsulevault.core.ValidationException;
import io.capsulevault.core.VersionOrdering;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable capsule store over a blob store and a per-owner index.
 * <p>
 * Responsibilities:
 *  - Own the in-memory OwnerRecord of every owner (owner -> record).
 *  - On store:
 *      1) validate + commit the blob (CapsuleObjectStore.write),
 *      2) add the version to a copy of the record,
 *      3) persist the record wholesale,
 *      4) publish the new record in memory.
 *    A failure in 3) leaves an orphaned blob and surfaces as PartialFailureException.
 *  - On delete: blob first, then index. A failed blob delete leaves the index alone.
 *    Deleting the last version leaves an empty record behind, so the owner stays known.
 *  - On startup: load every persisted index. An index that fails to load marks its
 *    owner as corrupt; every later call for that owner raises CorruptIndexException
 *    rather than silently starting a fresh history. Only reconcile() runs for such an
 *    owner: it reports every blob as an orphan, and with repair moves the bad document
 *    aside and rebuilds the index from the blobs.
 * <p>
 * Concurrency:
 *  - Mutations take the owner's write lock, reads its read lock ({@link OwnerLocks}).
 *  - Records are immutable, so a reader holding one never sees a partial update.
 */
public class DurableCapsuleStore implements CapsuleStore {
    private static final Logger log = Logger.getLogger(DurableCapsuleStore.class.getName());

    private final Map<String, OwnerRecord> mem = new ConcurrentHashMap<>();
    private final Map<String, CorruptIndexException> corrupt = new ConcurrentHashMap<>();
    private final OwnerLocks locks = new OwnerLocks();

    private final CapsuleObjectStore objects;
    private final OwnerIndexStore indexes;
    private final IntegrityValidator integrity;
    private final Clock clock;

    private final OwnerIndex ownerIndex;
    private final TagIndex tagIndex;
    private final RetrievalResolver resolver = new RetrievalResolver();
    private final Reconciler reconciler;

    public DurableCapsuleStore(CapsuleObjectStore objects,
                               OwnerIndexStore indexes,
                               IntegrityValidator integrity,
                               Clock clock) {
        this.objects = Objects.requireNonNull(objects, "objects");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.integrity = Objects.requireNonNull(integrity, "integrity");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownerIndex = new OwnerIndex(clock);
        this.tagIndex = new TagIndex(ownerIndex);
        this.reconciler = new Reconciler(objects, indexes, ownerIndex, clock);
        recover();
    }

    /**
     * Filesystem store under {@code root} with the default JSON schema check and retries.
     */
    public static DurableCapsuleStore open(Path root) {
        return open(root, new RequiredSectionsValidator(), IoRetry.defaults().maxAttempts());
    }

    public static DurableCapsuleStore open(Path root, CapsuleSchemaValidator schema, int ioAttempts) {
        var retry = new IoRetry(ioAttempts, Duration.ofMillis(20));
        var integrity = new Sha256IntegrityValidator();
        return new DurableCapsuleStore(
                new FileCapsuleObjectStore(root, integrity, schema, retry),
                new FileOwnerIndexStore(root, retry),
                integrity,
                Clock.systemUTC());
    }

    @Override
    public String store(String owner, byte[] content) {
        Identifiers.requireOwner(owner);
        if (content == null || content.length == 0) {
            throw new ValidationException("capsule content must not be empty");
        }

        return locks.withWrite(owner, () -> {
            requireLoadable(owner);
            OwnerRecord current = mem.get(owner);
            if (current == null) {
                current = OwnerRecord.empty(owner, clock.instant());
            }

            String versionId = UUID.randomUUID().toString();
            BlobReceipt receipt = objects.write(owner, versionId, content);

            var version = new CapsuleVersion(
                    owner,
                    versionId,
                    nextCreatedAt(current),
                    receipt.fingerprint(),
                    receipt.storageLocation(),
                    receipt.byteSize(),
                    null,
                    receipt.descriptor().schemaVersion(),
                    receipt.descriptor().producerId(),
                    receipt.descriptor().sourceTag());
            OwnerRecord next = ownerIndex.addVersion(current, version);

            try {
                indexes.persist(owner, next);
            } catch (StorageIoException e) {
                log.log(Level.WARNING, String.format(
                        "blob %s/%s written but index persist failed; left as orphan", owner, versionId), e);
                throw new PartialFailureException(owner, versionId, e);
            }
            mem.put(owner, next);

            log.info(String.format("stored %s/%s (%d bytes, sha256=%s)",
                    owner, versionId, receipt.byteSize(), receipt.fingerprint().toHex().substring(0, 16)));
            return versionId;
        });
    }

    @Override
    public RetrievalResult retrieve(String owner, Selector selector) {
        Identifiers.requireOwner(owner);
        Objects.requireNonNull(selector, "selector");

        return locks.withRead(owner, () -> {
            OwnerRecord record = requireRecord(owner);
            String versionId = resolver.resolve(record, selector);
            CapsuleVersion meta = record.versions().get(versionId);

            byte[] content;
            try {
                content = objects.read(owner, versionId);
            } catch (BlobNotFoundException e) {
                throw new CorruptIndexException(owner, "index references missing blob " + versionId, e);
            }

            boolean valid = integrity.verify(content, meta.fingerprint());
            if (!valid) {
                log.warning(String.format("integrity mismatch for %s/%s: expected sha256=%s",
                        owner, versionId, meta.fingerprint().toHex()));
            }
            return new RetrievalResult(content, meta, valid);
        });
    }

    @Override
    public void addTag(String owner, String versionId, String tag) {
        Identifiers.requireOwner(owner);
        Identifiers.requireTag(tag);
        mutate(owner, record -> tagIndex.addTag(record, versionId, tag));
    }

    @Override
    public void removeTag(String owner, String versionId, String tag) {
        Identifiers.requireOwner(owner);
        Identifiers.requireTag(tag);
        mutate(owner, record -> tagIndex.removeTag(record, versionId, tag));
    }

    @Override
    public List<CapsuleVersion> list(String owner, String tag) {
        Identifiers.requireOwner(owner);
        return locks.withRead(owner, () -> {
            requireLoadable(owner);
            OwnerRecord record = mem.get(owner);
            if (record == null) {
                return List.of();
            }
            return record.versions().values().stream()
                    .filter(v -> tag == null || v.hasTag(tag))
                    .sorted(VersionOrdering.NEWEST_FIRST)
                    .toList();
        });
    }

    @Override
    public void delete(String owner, String versionId) {
        Identifiers.requireOwner(owner);
        locks.withWrite(owner, () -> {
            OwnerRecord record = requireRecord(owner);
            if (!record.versions().containsKey(versionId)) {
                throw NotFoundException.version(versionId);
            }

            try {
                objects.delete(owner, versionId);
            } catch (BlobNotFoundException e) {
                log.warning(String.format("blob %s/%s already missing; removing index entry", owner, versionId));
            }

            // an owner outlives its last version: later lookups are version misses, not owner misses
            OwnerRecord next = ownerIndex.removeVersion(record, versionId);
            // the blob is gone either way; memory follows storage even if the persist below fails
            mem.put(owner, next);
            indexes.persist(owner, next);
            if (next.isEmpty()) {
                objects.deleteOwnerIfEmpty(owner);
            }
            log.info(String.format("deleted %s/%s", owner, versionId));
            return null;
        });
    }

    @Override
    public List<String> listOwners() {
        var owners = new TreeSet<>(mem.keySet());
        owners.addAll(corrupt.keySet());
        return List.copyOf(owners);
    }

    /**
     * Owners worth reconciling: indexed ones plus any with an object directory.
     */
    public List<String> reconcilableOwners() {
        var owners = new TreeSet<>(listOwners());
        owners.addAll(objects.listOwners());
        return List.copyOf(owners);
    }

    @Override
    public OwnerSummary ownerSummary(String owner) {
        Identifiers.requireOwner(owner);
        return locks.withRead(owner, () -> {
            OwnerRecord record = requireRecord(owner);

            Map<String, Integer> tagCounts = new TreeMap<>();
            record.tagIndex().forEach((tag, ids) -> tagCounts.put(tag, ids.size()));

            List<CapsuleVersion> ordered = new ArrayList<>(record.versions().values());
            ordered.sort(VersionOrdering.RECENCY);
            Instant oldest = ordered.isEmpty() ? null : ordered.get(0).createdAt();
            Instant newest = ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).createdAt();

            return new OwnerSummary(
                    owner,
                    record.versions().size(),
                    tagCounts,
                    record.latestVersionId(),
                    record.createdAt(),
                    record.updatedAt(),
                    oldest,
                    newest);
        });
    }

    @Override
    public ReconciliationReport reconcile(String owner, boolean repair) {
        Identifiers.requireOwner(owner);
        return locks.withWrite(owner, () -> {
            boolean blocked = corrupt.containsKey(owner);
            if (blocked && repair) {
                // rebuild from the blobs alone; tags in the unreadable document are lost
                indexes.quarantine(owner);
            }
            Reconciler.Outcome outcome = reconciler.reconcile(owner, blocked ? null : mem.get(owner), repair);
            if (blocked && repair) {
                corrupt.remove(owner);
                log.warning(String.format("rebuilt index of %s from %d blob(s)", owner, outcome.report().reindexed().size()));
            }
            if (blocked && !repair) {
                return outcome.report();
            }
            if (outcome.record() == null) {
                mem.remove(owner);
            } else {
                mem.put(owner, outcome.record());
            }
            return outcome.report();
        });
    }

    // ------------ helpers ------------

    /**
     * Startup: seed memory from every persisted index.
     */
    private void recover() {
        for (String owner : indexes.listOwners()) {
            try {
                indexes.load(owner).ifPresent(record -> mem.put(owner, record));
            } catch (CorruptIndexException e) {
                corrupt.put(owner, e);
                log.log(Level.SEVERE, "index for " + owner + " could not be loaded; owner is read-blocked", e);
            }
        }
        log.info(String.format("capsule store ready: %d owner(s), %d corrupt", mem.size(), corrupt.size()));
    }

    private void mutate(String owner, UnaryOperator<OwnerRecord> change) {
        locks.withWrite(owner, () -> {
            OwnerRecord record = requireRecord(owner);
            OwnerRecord next = change.apply(record);
            if (next != record) {
                indexes.persist(owner, next);
                mem.put(owner, next);
            }
            return null;
        });
    }

    private OwnerRecord requireRecord(String owner) {
        requireLoadable(owner);
        OwnerRecord record = mem.get(owner);
        if (record == null) {
            throw NotFoundException.owner(owner);
        }
        return record;
    }

    private void requireLoadable(String owner) {
        CorruptIndexException failure = corrupt.get(owner);
        if (failure != null) {
            throw new CorruptIndexException(owner, "index failed to load at startup", failure);
        }
    }

    /**
     * createdAt strictly increases per owner, even if the wall clock stalls or goes backwards.
     */
    private Instant nextCreatedAt(OwnerRecord record) {
        Instant now = clock.instant();
        return record.latest()
                .map(CapsuleVersion::createdAt)
                .filter(latest -> !latest.isBefore(now))
                .map(latest -> latest.plusNanos(1))
                .orElse(now);
    }
}
