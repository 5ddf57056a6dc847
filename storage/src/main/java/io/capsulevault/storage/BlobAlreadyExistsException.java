// file: storage/src/main/java/io/capsulevault/storage/BlobAlreadyExistsException.java
package io.capsulevault.storage;

/**
 * A write targeted a blob key that is already taken. Blobs are write-once.
 */
public class BlobAlreadyExistsException extends StorageIoException {

    public BlobAlreadyExistsException(String owner, String versionId) {
        super("Blob already exists: owner=" + owner + " version=" + versionId);
    }
}
