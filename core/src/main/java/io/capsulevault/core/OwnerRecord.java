// file: core/src/main/java/io/capsulevault/core/OwnerRecord.java
package io.capsulevault.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of everything the index knows about one owner.
 * <p>
 * Contents:
 *  - versions:        versionId -> CapsuleVersion.
 *  - tagIndex:        tag -> versionIds carrying that tag (never an empty set).
 *  - latestVersionId: id of the most recent version, null iff versions is empty.
 *  - createdAt / updatedAt: bookkeeping for the owner summary.
 * <p>
 * Transformations live in {@link OwnerIndex} and {@link TagIndex}; this class only
 * holds state and checks its own invariants on construction.
 */
public final class OwnerRecord {
    private final String owner;
    private final Map<String, CapsuleVersion> versions;
    private final Map<String, SortedSet<String>> tagIndex;
    private final String latestVersionId;
    private final Instant createdAt;
    private final Instant updatedAt;

    public OwnerRecord(String owner,
                       Map<String, CapsuleVersion> versions,
                       Map<String, ? extends Set<String>> tagIndex,
                       String latestVersionId,
                       Instant createdAt,
                       Instant updatedAt) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.versions = Collections.unmodifiableMap(new LinkedHashMap<>(versions));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");

        var tags = new TreeMap<String, SortedSet<String>>();
        for (var e : tagIndex.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            tags.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        this.tagIndex = Collections.unmodifiableMap(tags);

        if (latestVersionId == null && !this.versions.isEmpty()) {
            throw new IllegalArgumentException("latestVersionId is null but owner " + owner + " has versions");
        }
        if (latestVersionId != null && !this.versions.containsKey(latestVersionId)) {
            throw new IllegalArgumentException("latestVersionId " + latestVersionId + " is not a version of " + owner);
        }
        this.latestVersionId = latestVersionId;
    }

    /** Record for an owner that has never stored anything. */
    public static OwnerRecord empty(String owner, Instant now) {
        return new OwnerRecord(owner, Map.of(), Map.of(), null, now, now);
    }

    public String owner() { return owner; }

    public Map<String, CapsuleVersion> versions() { return versions; }

    public Map<String, SortedSet<String>> tagIndex() { return tagIndex; }

    public String latestVersionId() { return latestVersionId; }

    public Instant createdAt() { return createdAt; }

    public Instant updatedAt() { return updatedAt; }

    public boolean isEmpty() { return versions.isEmpty(); }

    public Optional<CapsuleVersion> version(String versionId) {
        return Optional.ofNullable(versions.get(versionId));
    }

    public Optional<CapsuleVersion> latest() {
        return latestVersionId == null ? Optional.empty() : Optional.of(versions.get(latestVersionId));
    }

    @Override
    public String toString() {
        return "OwnerRecord{owner=" + owner + ", versions=" + versions.size()
                + ", tags=" + tagIndex.keySet() + ", latest=" + latestVersionId + "}";
    }
}
