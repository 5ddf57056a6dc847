// file: storage/src/main/java/io/capsulevault/storage/RetrievalResult.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleVersion;

import java.util.Arrays;

/**
 * Outcome of a retrieval.
 * <p>
 * {@code integrityValid == false} means the blob no longer matches the fingerprint
 * recorded at store time. The content is still returned so the caller can inspect it.
 */
public record RetrievalResult(byte[] content, CapsuleVersion metadata, boolean integrityValid) {

    public RetrievalResult {
        content = Arrays.copyOf(content, content.length);
    }

    @Override
    public byte[] content() {
        return Arrays.copyOf(content, content.length);
    }
}
