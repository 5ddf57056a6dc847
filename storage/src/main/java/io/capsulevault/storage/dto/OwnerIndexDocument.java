// file: storage/src/main/java/io/capsulevault/storage/dto/OwnerIndexDocument.java
package io.capsulevault.storage.dto;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of {@code index/<owner>.idx}.
 * <p>
 * {@code format} selects the parsing rules; instants are ISO-8601 strings.
 */
public class OwnerIndexDocument {
    public int format;
    public String owner;
    public String createdAt;
    public String updatedAt;
    public String latestVersionId;
    public Map<String, VersionEntry> versions;
    public Map<String, List<String>> tags;
}
