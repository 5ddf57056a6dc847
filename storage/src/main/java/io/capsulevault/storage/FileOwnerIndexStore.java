// file: storage/src/main/java/io/capsulevault/storage/FileOwnerIndexStore.java
package io.capsulevault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.CorruptIndexException;
import io.capsulevault.core.Fingerprint;
import io.capsulevault.core.Identifiers;
import io.capsulevault.core.OwnerIndex;
import io.capsulevault.core.OwnerRecord;
import io.capsulevault.storage.dto.OwnerIndexDocument;
import io.capsulevault.storage.dto.VersionEntry;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * JSON index documents, one file per owner.
 * <p>
 * Layout: {@code {root}/index/{owner}.idx}
 * <p>
 * Atomicity:
 *   - We write to ".{owner}.idx.{random}.tmp" first and fsync it,
 *   - then move to "{owner}.idx" using ATOMIC_MOVE, replacing the previous snapshot.
 * <p>
 * Loading is strict: malformed JSON, an unknown format, an owner mismatch, a null
 * or unknown tag member, or any other inconsistent field raises
 * {@link CorruptIndexException} and nothing else. A stale latest pointer is derived
 * data and is recomputed instead.
 * <p>
 * An unloadable document can be moved aside to "{owner}.idx.corrupt-{millis}".
 */
public final class FileOwnerIndexStore implements OwnerIndexStore {
    private static final Logger log = Logger.getLogger(FileOwnerIndexStore.class.getName());
    static final String INDEX_DIR = "index";
    static final String SUFFIX = ".idx";
    static final String QUARANTINE_INFIX = ".corrupt-";
    public static final int FORMAT = 1;

    private final Path dir;
    private final IoRetry retry;
    private final ObjectMapper json;

    public FileOwnerIndexStore(Path root, IoRetry retry) {
        this.dir = Objects.requireNonNull(root, "root").resolve(INDEX_DIR);
        this.retry = Objects.requireNonNull(retry, "retry");
        this.json = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create index directory " + dir, e);
        }
    }

    @Override
    public Optional<OwnerRecord> load(String owner) {
        Path path = pathFor(owner);
        byte[] raw = retry.call("read index " + owner, () -> {
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                return null;
            }
        });
        if (raw == null) {
            return Optional.empty();
        }

        OwnerIndexDocument doc;
        try {
            doc = json.readValue(raw, OwnerIndexDocument.class);
        } catch (IOException e) {
            throw new CorruptIndexException(owner, "unreadable index document", e);
        }
        if (doc == null) {
            throw new CorruptIndexException(owner, "empty index document");
        }
        try {
            return Optional.of(toRecord(owner, doc));
        } catch (CorruptIndexException e) {
            throw e;
        } catch (RuntimeException e) {
            // any other shape the document can take is just as untrustworthy
            throw new CorruptIndexException(owner, "inconsistent index document", e);
        }
    }

    @Override
    public void persist(String owner, OwnerRecord record) {
        Path path = pathFor(owner);
        if (!owner.equals(record.owner())) {
            throw new IllegalArgumentException("record of " + record.owner() + " persisted as " + owner);
        }
        byte[] bytes;
        try {
            bytes = json.writeValueAsBytes(toDocument(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode index for " + owner, e);
        }

        retry.call("persist index " + owner, () -> {
            Path tmp = dir.resolve("." + owner + SUFFIX + "." + UUID.randomUUID() + ".tmp");
            try {
                try (FileChannel out = FileChannel.open(tmp, CREATE_NEW, WRITE)) {
                    ByteBuffer buf = ByteBuffer.wrap(bytes);
                    while (buf.hasRemaining()) {
                        out.write(buf);
                    }
                    out.force(true);
                }
                Files.move(tmp, path, ATOMIC_MOVE, REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return null;
        });
    }

    @Override
    public void delete(String owner) {
        Path path = pathFor(owner);
        retry.call("delete index " + owner, () -> Files.deleteIfExists(path));
    }

    @Override
    public Optional<String> quarantine(String owner) {
        Path path = pathFor(owner);
        Path aside = dir.resolve(owner + SUFFIX + QUARANTINE_INFIX + System.currentTimeMillis());
        return retry.call("quarantine index " + owner, () -> {
            try {
                Files.move(path, aside, ATOMIC_MOVE);
            } catch (NoSuchFileException e) {
                return Optional.<String>empty();
            }
            log.warning(String.format("moved unreadable index of %s to %s", owner, aside.getFileName()));
            return Optional.of(INDEX_DIR + "/" + aside.getFileName());
        });
    }

    @Override
    public List<String> listOwners() {
        return retry.call("list indexes", () -> {
            List<String> owners = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
                for (Path p : files) {
                    String name = p.getFileName().toString();
                    String owner = name.substring(0, name.length() - SUFFIX.length());
                    if (Files.isRegularFile(p) && Identifiers.isSegment(owner)) {
                        owners.add(owner);
                    }
                }
            }
            owners.sort(null);
            return owners;
        });
    }

    private Path pathFor(String owner) {
        return dir.resolve(Identifiers.requireOwner(owner) + SUFFIX);
    }

    // ---------- document <-> record ----------

    private static OwnerIndexDocument toDocument(OwnerRecord record) {
        var doc = new OwnerIndexDocument();
        doc.format = FORMAT;
        doc.owner = record.owner();
        doc.createdAt = record.createdAt().toString();
        doc.updatedAt = record.updatedAt().toString();
        doc.latestVersionId = record.latestVersionId();

        doc.versions = new TreeMap<>();
        for (CapsuleVersion v : record.versions().values()) {
            var e = new VersionEntry();
            e.versionId = v.versionId();
            e.createdAt = v.createdAt().toString();
            e.fingerprint = v.fingerprint().toHex();
            e.storageLocation = v.storageLocation();
            e.byteSize = v.byteSize();
            e.tags = new ArrayList<>(v.tags());
            e.schemaVersion = v.schemaVersion();
            e.producerId = v.producerId();
            e.sourceTag = v.sourceTag();
            doc.versions.put(v.versionId(), e);
        }

        doc.tags = new TreeMap<>();
        record.tagIndex().forEach((tag, ids) -> doc.tags.put(tag, new ArrayList<>(ids)));
        return doc;
    }

    private static OwnerRecord toRecord(String owner, OwnerIndexDocument doc) {
        if (doc.format != FORMAT) {
            throw new CorruptIndexException(owner, "unsupported index format " + doc.format);
        }
        if (!owner.equals(doc.owner)) {
            throw new CorruptIndexException(owner, "document names owner " + doc.owner);
        }

        Map<String, CapsuleVersion> versions = new LinkedHashMap<>();
        Map<String, Set<String>> derivedTags = new HashMap<>();
        Map<String, VersionEntry> entries = doc.versions == null ? Map.of() : doc.versions;
        for (var e : entries.entrySet()) {
            VersionEntry entry = e.getValue();
            if (entry == null || !e.getKey().equals(entry.versionId) || !Identifiers.isSegment(entry.versionId)) {
                throw new CorruptIndexException(owner, "bad version entry under key " + e.getKey());
            }
            CapsuleVersion v;
            try {
                v = new CapsuleVersion(
                        owner,
                        entry.versionId,
                        Instant.parse(entry.createdAt),
                        Fingerprint.fromHex(entry.fingerprint),
                        entry.storageLocation,
                        entry.byteSize,
                        entry.tags == null ? Set.of() : new TreeSet<>(entry.tags),
                        entry.schemaVersion,
                        entry.producerId,
                        entry.sourceTag);
            } catch (NullPointerException | IllegalArgumentException | DateTimeParseException ex) {
                throw new CorruptIndexException(owner, "bad version entry " + entry.versionId, ex);
            }
            versions.put(v.versionId(), v);
            for (String tag : v.tags()) {
                derivedTags.computeIfAbsent(tag, t -> new TreeSet<>()).add(v.versionId());
            }
        }

        Map<String, Set<String>> storedTags = new HashMap<>();
        if (doc.tags != null) {
            for (var e : doc.tags.entrySet()) {
                List<String> ids = e.getValue();
                if (ids == null || ids.isEmpty()) continue;
                if (ids.contains(null)) {
                    throw new CorruptIndexException(owner, "null member in tag " + e.getKey());
                }
                storedTags.put(e.getKey(), new TreeSet<>(ids));
            }
        }
        if (!storedTags.equals(derivedTags)) {
            throw new CorruptIndexException(owner, "tag index disagrees with version tags");
        }

        String latest = OwnerIndex.latestOf(versions);
        if (!Objects.equals(latest, doc.latestVersionId)) {
            log.warning(String.format("index for %s had latest=%s, recomputed %s",
                    owner, doc.latestVersionId, latest));
        }

        try {
            return new OwnerRecord(owner, versions, derivedTags, latest,
                    Instant.parse(doc.createdAt), Instant.parse(doc.updatedAt));
        } catch (NullPointerException | DateTimeParseException e) {
            throw new CorruptIndexException(owner, "bad owner timestamps", e);
        }
    }
}
