// file: storage/src/main/java/io/capsulevault/storage/RequiredSectionsValidator.java
package io.capsulevault.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.capsulevault.core.ValidationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default schema check for JSON capsules.
 * <p>
 * Rules:
 *  - Content must be a JSON object.
 *  - metadata.capsule_version selects the rule set by its major number
 *    ("1.0.0" when the field is absent). Unknown majors are rejected.
 *  - The selected rule set lists the top-level sections that must be present.
 * <p>
 * Extracted descriptor:
 *  - schemaVersion = metadata.capsule_version
 *  - producerId    = metadata.generator
 *  - sourceTag     = metadata.vault_source
 */
public final class RequiredSectionsValidator implements CapsuleSchemaValidator {

    public static final String DEFAULT_SCHEMA_VERSION = "1.0.0";
    public static final List<String> V1_SECTIONS =
            List.of("metadata", "traits", "personality", "memory", "environment");

    private final ObjectMapper json;
    private final Map<String, List<String>> sectionsByMajor;

    public RequiredSectionsValidator() {
        this(new ObjectMapper(), Map.of("1", V1_SECTIONS));
    }

    private RequiredSectionsValidator(ObjectMapper json, Map<String, List<String>> sectionsByMajor) {
        this.json = json;
        this.sectionsByMajor = Map.copyOf(sectionsByMajor);
    }

    /**
     * Copy of this validator that also accepts the given major schema version.
     */
    public RequiredSectionsValidator withRuleSet(String major, List<String> requiredSections) {
        Objects.requireNonNull(major, "major");
        var next = new HashMap<>(sectionsByMajor);
        next.put(major, List.copyOf(requiredSections));
        return new RequiredSectionsValidator(json, next);
    }

    @Override
    public CapsuleDescriptor validate(byte[] content) {
        JsonNode root;
        try {
            root = json.readTree(content);
        } catch (IOException e) {
            throw new ValidationException("capsule content is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("capsule content must be a JSON object");
        }

        JsonNode metadata = root.path("metadata");
        String schemaVersion = text(metadata, "capsule_version");
        if (schemaVersion == null) schemaVersion = DEFAULT_SCHEMA_VERSION;

        String major = majorOf(schemaVersion);
        List<String> required = sectionsByMajor.get(major);
        if (required == null) {
            throw new ValidationException("unsupported schema_version: " + schemaVersion);
        }

        List<String> missing = new ArrayList<>();
        for (String section : required) {
            if (!root.has(section) || root.get(section).isNull()) {
                missing.add(section);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("missing required section(s): " + String.join(", ", missing));
        }

        return new CapsuleDescriptor(
                schemaVersion,
                text(metadata, "generator"),
                text(metadata, "vault_source"));
    }

    private static String majorOf(String schemaVersion) {
        int dot = schemaVersion.indexOf('.');
        return (dot < 0 ? schemaVersion : schemaVersion.substring(0, dot)).trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
