// file: core/src/main/java/io/capsulevault/core/NotFoundException.java
package io.capsulevault.core;

import java.util.Objects;

/**
 * An owner, version or tag named by the caller is not known to the index.
 * <p>
 * The {@link Kind} lets calling layers render a precise message instead of
 * a generic "not found".
 */
public class NotFoundException extends CapsuleStoreException {

    public enum Kind { OWNER, VERSION, TAG }

    private final Kind kind;
    private final String subject;

    public NotFoundException(Kind kind, String subject) {
        super(kind.name().toLowerCase() + " not found: " + subject);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = subject;
    }

    public static NotFoundException owner(String owner) {
        return new NotFoundException(Kind.OWNER, owner);
    }

    public static NotFoundException version(String versionId) {
        return new NotFoundException(Kind.VERSION, versionId);
    }

    public static NotFoundException tag(String tag) {
        return new NotFoundException(Kind.TAG, tag);
    }

    public Kind kind() {
        return kind;
    }

    public String subject() {
        return subject;
    }
}
