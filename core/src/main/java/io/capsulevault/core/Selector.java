// file: core/src/main/java/io/capsulevault/core/Selector.java
package io.capsulevault.core;

import java.util.Objects;

/**
 * Which version of an owner a retrieval asks for.
 */
public sealed interface Selector permits Selector.Latest, Selector.ByVersionId, Selector.ByTag {

    static Selector latest() {
        return Latest.INSTANCE;
    }

    static Selector byVersionId(String versionId) {
        return new ByVersionId(versionId);
    }

    static Selector byTag(String tag) {
        return new ByTag(tag);
    }

    final class Latest implements Selector {
        static final Latest INSTANCE = new Latest();

        private Latest() {
        }

        @Override
        public String toString() {
            return "Latest";
        }
    }

    record ByVersionId(String versionId) implements Selector {
        public ByVersionId {
            Objects.requireNonNull(versionId, "versionId");
        }
    }

    record ByTag(String tag) implements Selector {
        public ByTag {
            Objects.requireNonNull(tag, "tag");
        }
    }
}
