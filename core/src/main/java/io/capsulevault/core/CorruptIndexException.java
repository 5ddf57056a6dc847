// file: core/src/main/java/io/capsulevault/core/CorruptIndexException.java
package io.capsulevault.core;

/**
 * The persisted index and the object storage disagree, or the index document
 * itself cannot be trusted.
 * <p>
 * Never repaired on the read path. An operator runs reconciliation instead.
 */
public class CorruptIndexException extends CapsuleStoreException {

    private final String owner;

    public CorruptIndexException(String owner, String message) {
        super("corrupt index for owner " + owner + ": " + message);
        this.owner = owner;
    }

    public CorruptIndexException(String owner, String message, Throwable cause) {
        super("corrupt index for owner " + owner + ": " + message, cause);
        this.owner = owner;
    }

    public String owner() {
        return owner;
    }
}
