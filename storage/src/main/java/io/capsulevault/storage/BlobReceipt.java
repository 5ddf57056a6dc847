// file: storage/src/main/java/io/capsulevault/storage/BlobReceipt.java
package io.capsulevault.storage;

import io.capsulevault.core.Fingerprint;

/**
 * What the object store knows about a committed blob.
 */
public record BlobReceipt(
        String storageLocation,
        Fingerprint fingerprint,
        long byteSize,
        CapsuleDescriptor descriptor
) {}
