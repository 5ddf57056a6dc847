// file: storage/src/main/java/io/capsulevault/storage/FileCapsuleObjectStore.java
package io.capsulevault.storage;

import io.capsulevault.core.Fingerprint;
import io.capsulevault.core.Identifiers;
import io.capsulevault.core.IntegrityValidator;
import io.capsulevault.core.ValidationException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Filesystem-backed CapsuleObjectStore.
 * <p>
 * Layout: {@code {root}/objects/{owner}/{versionId}}
 * <p>
 * Write path:
 *  1) reject empty content, run the schema validator, fingerprint the bytes;
 *  2) write to ".{versionId}.{random}.tmp" in the owner directory and fsync;
 *  3) refuse if the final name already exists (write-once);
 *  4) ATOMIC_MOVE the temp file to its final name.
 * <p>
 * The existence check and the move are not one atomic step. The store relies on
 * its caller serializing writers per owner, which DurableCapsuleStore does.
 */
public final class FileCapsuleObjectStore implements CapsuleObjectStore {
    private static final Logger log = Logger.getLogger(FileCapsuleObjectStore.class.getName());
    static final String OBJECTS_DIR = "objects";

    private final Path objectsRoot;
    private final IntegrityValidator integrity;
    private final CapsuleSchemaValidator schema;
    private final IoRetry retry;

    public FileCapsuleObjectStore(Path root,
                                  IntegrityValidator integrity,
                                  CapsuleSchemaValidator schema,
                                  IoRetry retry) {
        this.objectsRoot = Objects.requireNonNull(root, "root").resolve(OBJECTS_DIR);
        this.integrity = Objects.requireNonNull(integrity, "integrity");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.retry = Objects.requireNonNull(retry, "retry");
        try {
            Files.createDirectories(objectsRoot);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create objects directory " + objectsRoot, e);
        }
    }

    @Override
    public BlobReceipt write(String owner, String versionId, byte[] content) {
        Path path = resolvePath(owner, versionId);
        if (content == null || content.length == 0) {
            throw new ValidationException("capsule content must not be empty");
        }
        CapsuleDescriptor descriptor = schema.validate(content);
        Fingerprint fingerprint = integrity.fingerprint(content);

        retry.call("write blob " + owner + "/" + versionId, () -> {
            Files.createDirectories(path.getParent());
            Path tmp = path.resolveSibling("." + versionId + "." + UUID.randomUUID() + ".tmp");
            try {
                try (FileChannel out = FileChannel.open(tmp, CREATE_NEW, WRITE)) {
                    ByteBuffer buf = ByteBuffer.wrap(content);
                    while (buf.hasRemaining()) {
                        out.write(buf);
                    }
                    out.force(true);
                }
                if (Files.exists(path)) {
                    throw new BlobAlreadyExistsException(owner, versionId);
                }
                Files.move(tmp, path, ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return null;
        });

        return new BlobReceipt(storageLocation(owner, versionId), fingerprint, content.length, descriptor);
    }

    @Override
    public byte[] read(String owner, String versionId) {
        Path path = resolvePath(owner, versionId);
        return retry.call("read blob " + owner + "/" + versionId, () -> {
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(owner, versionId);
            }
        });
    }

    @Override
    public void delete(String owner, String versionId) {
        Path path = resolvePath(owner, versionId);
        retry.call("delete blob " + owner + "/" + versionId, () -> {
            if (!Files.deleteIfExists(path)) {
                throw new BlobNotFoundException(owner, versionId);
            }
            return null;
        });
    }

    @Override
    public boolean exists(String owner, String versionId) {
        return Files.isRegularFile(resolvePath(owner, versionId));
    }

    @Override
    public BlobReceipt inspect(String owner, String versionId) {
        byte[] content = read(owner, versionId);
        CapsuleDescriptor descriptor;
        try {
            descriptor = content.length == 0 ? CapsuleDescriptor.empty() : schema.validate(content);
        } catch (ValidationException e) {
            log.log(Level.FINE, "blob " + owner + "/" + versionId + " does not pass schema check: " + e.getMessage());
            descriptor = CapsuleDescriptor.empty();
        }
        return new BlobReceipt(
                storageLocation(owner, versionId),
                integrity.fingerprint(content),
                content.length,
                descriptor);
    }

    @Override
    public Instant modifiedAt(String owner, String versionId) {
        Path path = resolvePath(owner, versionId);
        return retry.call("stat blob " + owner + "/" + versionId, () -> {
            try {
                return Files.getLastModifiedTime(path).toInstant();
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(owner, versionId);
            }
        });
    }

    @Override
    public List<String> listVersionIds(String owner) {
        Path dir = objectsRoot.resolve(Identifiers.requireOwner(owner));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        return retry.call("list blobs of " + owner, () -> {
            List<String> ids = new ArrayList<>();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
                for (Path p : entries) {
                    String name = p.getFileName().toString();
                    // temp files start with '.', which is never a valid version id
                    if (Files.isRegularFile(p) && Identifiers.isSegment(name)) {
                        ids.add(name);
                    }
                }
            }
            ids.sort(null);
            return ids;
        });
    }

    @Override
    public List<String> listOwners() {
        return retry.call("list owners", () -> {
            List<String> owners = new ArrayList<>();
            try (DirectoryStream<Path> dirs = Files.newDirectoryStream(objectsRoot)) {
                for (Path dir : dirs) {
                    String name = dir.getFileName().toString();
                    if (Files.isDirectory(dir) && Identifiers.isSegment(name)) {
                        owners.add(name);
                    }
                }
            }
            owners.sort(null);
            return owners;
        });
    }

    @Override
    public void deleteOwnerIfEmpty(String owner) {
        Path dir = objectsRoot.resolve(Identifiers.requireOwner(owner));
        retry.call("remove owner directory " + owner, () -> {
            if (!Files.isDirectory(dir)) return null;
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
                if (entries.iterator().hasNext()) return null;
            }
            Files.deleteIfExists(dir);
            return null;
        });
    }

    private Path resolvePath(String owner, String versionId) {
        Identifiers.requireOwner(owner);
        Identifiers.requireVersionId(versionId);
        return objectsRoot.resolve(owner).resolve(versionId);
    }

    static String storageLocation(String owner, String versionId) {
        return OBJECTS_DIR + "/" + owner + "/" + versionId;
    }
}
