// file: core/src/main/java/io/capsulevault/core/OwnerIndex.java
package io.capsulevault.core;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pure transformations over {@link OwnerRecord}.
 * <p>
 * Nothing here touches disk: callers persist the returned record themselves
 * (see the storage module's OwnerIndexStore). The only input besides the record
 * is the clock used to stamp updatedAt.
 * <p>
 * Latest pointer policy:
 *  - After every change, latestVersionId is the version with the greatest createdAt,
 *    ties broken by the greatest versionId ({@link VersionOrdering#RECENCY}).
 */
public final class OwnerIndex {
    private final Clock clock;

    public OwnerIndex(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Insert a new version and recompute the latest pointer.
     * Tags already present on the version are registered in the tag index.
     *
     * @throws IllegalArgumentException if the version belongs to another owner or its id is taken
     */
    public OwnerRecord addVersion(OwnerRecord record, CapsuleVersion version) {
        Objects.requireNonNull(version, "version");
        if (!record.owner().equals(version.owner())) {
            throw new IllegalArgumentException(
                    "version " + version.versionId() + " belongs to " + version.owner() + ", not " + record.owner());
        }
        if (record.versions().containsKey(version.versionId())) {
            throw new IllegalArgumentException(
                    "version id " + version.versionId() + " already used by " + record.owner());
        }

        var versions = new LinkedHashMap<>(record.versions());
        versions.put(version.versionId(), version);

        var tags = copyTags(record.tagIndex());
        for (String tag : version.tags()) {
            tags.computeIfAbsent(tag, t -> new TreeSet<>()).add(version.versionId());
        }

        return new OwnerRecord(
                record.owner(), versions, tags, latestOf(versions),
                record.createdAt(), clock.instant());
    }

    /**
     * Remove a version and all of its tag memberships.
     * If it was the latest, the pointer moves to the next most recent version (or null).
     *
     * @throws NotFoundException (VERSION) if the id is unknown
     */
    public OwnerRecord removeVersion(OwnerRecord record, String versionId) {
        CapsuleVersion removed = record.versions().get(versionId);
        if (removed == null) {
            throw NotFoundException.version(versionId);
        }

        var versions = new LinkedHashMap<>(record.versions());
        versions.remove(versionId);

        var tags = copyTags(record.tagIndex());
        for (String tag : removed.tags()) {
            Set<String> members = tags.get(tag);
            if (members != null) {
                members.remove(versionId);
                if (members.isEmpty()) tags.remove(tag);
            }
        }

        String latest = versionId.equals(record.latestVersionId())
                ? latestOf(versions)
                : record.latestVersionId();

        return new OwnerRecord(record.owner(), versions, tags, latest, record.createdAt(), clock.instant());
    }

    /**
     * Replace an existing version's metadata, keeping the tag index in step with its tags.
     * Used by tag mutations; fingerprint, size and location must be unchanged.
     */
    OwnerRecord replaceVersion(OwnerRecord record, CapsuleVersion updated) {
        CapsuleVersion current = record.versions().get(updated.versionId());
        if (current == null) {
            throw NotFoundException.version(updated.versionId());
        }
        if (!current.fingerprint().equals(updated.fingerprint())
                || !current.storageLocation().equals(updated.storageLocation())
                || current.byteSize() != updated.byteSize()) {
            throw new IllegalArgumentException("blob attributes of " + updated.versionId() + " are immutable");
        }

        var versions = new LinkedHashMap<>(record.versions());
        versions.put(updated.versionId(), updated);

        var tags = copyTags(record.tagIndex());
        for (String tag : current.tags()) {
            if (!updated.hasTag(tag)) {
                Set<String> members = tags.get(tag);
                if (members != null) {
                    members.remove(updated.versionId());
                    if (members.isEmpty()) tags.remove(tag);
                }
            }
        }
        for (String tag : updated.tags()) {
            tags.computeIfAbsent(tag, t -> new TreeSet<>()).add(updated.versionId());
        }

        return new OwnerRecord(
                record.owner(), versions, tags, record.latestVersionId(),
                record.createdAt(), clock.instant());
    }

    /**
     * Version id that should be the latest pointer for the given versions, or null if empty.
     */
    public static String latestOf(Map<String, CapsuleVersion> versions) {
        return VersionOrdering.mostRecent(versions.values())
                .map(CapsuleVersion::versionId)
                .orElse(null);
    }

    private static Map<String, Set<String>> copyTags(Map<String, ? extends Set<String>> tagIndex) {
        var copy = new HashMap<String, Set<String>>(tagIndex.size() * 2);
        tagIndex.forEach((tag, ids) -> copy.put(tag, new TreeSet<>(ids)));
        return copy;
    }
}
