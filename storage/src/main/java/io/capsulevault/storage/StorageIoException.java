// file: storage/src/main/java/io/capsulevault/storage/StorageIoException.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleStoreException;

/**
 * Wraps checked I/O exceptions from storage operations once retries are used up.
 */
public class StorageIoException extends CapsuleStoreException {

    public StorageIoException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageIoException(String message) {
        super(message);
    }
}
