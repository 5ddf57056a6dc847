// file: core/src/main/java/io/capsulevault/core/ValidationException.java
package io.capsulevault.core;

/**
 * Content or an identifier was rejected before anything was written.
 */
public class ValidationException extends CapsuleStoreException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
