// file: storage/src/main/java/io/capsulevault/storage/dto/VersionEntry.java
package io.capsulevault.storage.dto;

import java.util.List;

public class VersionEntry {
    public String versionId;
    public String createdAt;
    public String fingerprint;
    public String storageLocation;
    public long byteSize;
    public List<String> tags;
    public String schemaVersion;
    public String producerId;
    public String sourceTag;
}
