// file: core/src/main/java/io/capsulevault/core/CapsuleStoreException.java
package io.capsulevault.core;

/**
 * Root of the capsule store's failure taxonomy.
 * <p>
 * All store failures are unchecked. Callers that need to distinguish
 * expected misses from storage trouble catch the concrete subtypes.
 */
public class CapsuleStoreException extends RuntimeException {

    public CapsuleStoreException(String message) {
        super(message);
    }

    public CapsuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
