// file: storage/src/test/java/io/capsulevault/storage/DurableCapsuleStoreTest.java
package io.capsulevault.storage;

import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.NotFoundException;
import io.capsulevault.core.Selector;
import io.capsulevault.core.Sha256IntegrityValidator;
import io.capsulevault.core.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior of the store facade over real files in a temp directory.
 */
class DurableCapsuleStoreTest {

    @TempDir
    Path root;

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    private DurableCapsuleStore newStore() {
        var integrity = new Sha256IntegrityValidator();
        return new DurableCapsuleStore(
                new FileCapsuleObjectStore(root, integrity, new RequiredSectionsValidator(), IoRetry.none()),
                new FileOwnerIndexStore(root, IoRetry.none()),
                integrity,
                clock);
    }

    @Test
    void stored_capsule_comes_back_byte_for_byte_as_latest() {
        var store = newStore();
        byte[] content = Capsules.capsule("first boot");

        String id = store.store("Nova", content);
        RetrievalResult result = store.retrieve("Nova", Selector.latest());

        assertArrayEquals(content, result.content());
        assertTrue(result.integrityValid());
        assertEquals(id, result.metadata().versionId());
        assertEquals(content.length, result.metadata().byteSize());
        assertEquals("1.0.0", result.metadata().schemaVersion());
        assertEquals("CapsuleForge", result.metadata().producerId());
        assertEquals("VVAULT", result.metadata().sourceTag());
    }

    @Test
    void every_store_creates_a_new_version_and_moves_latest() {
        var store = newStore();
        byte[] same = Capsules.capsule("same bytes");

        String v1 = store.store("Nova", same);
        String v2 = store.store("Nova", same);
        String v3 = store.store("Nova", Capsules.capsule("third"));

        assertEquals(3, Set.of(v1, v2, v3).size());
        assertEquals(v3, store.retrieve("Nova", Selector.latest()).metadata().versionId());
        assertArrayEquals(same, store.retrieve("Nova", Selector.byVersionId(v1)).content());

        List<CapsuleVersion> listed = store.list("Nova");
        assertEquals(List.of(v3, v2, v1), listed.stream().map(CapsuleVersion::versionId).toList());
        assertTrue(listed.get(0).createdAt().isAfter(listed.get(1).createdAt()),
                "createdAt strictly increases even under a frozen clock");
    }

    @Test
    void tag_pins_an_older_version_after_newer_stores() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("before the break"));
        store.addTag("Nova", v1, "post-mirror-break");
        store.store("Nova", Capsules.capsule("after the break"));

        RetrievalResult tagged = store.retrieve("Nova", Selector.byTag("post-mirror-break"));

        assertEquals(v1, tagged.metadata().versionId());
        assertEquals(Set.of("post-mirror-break"), tagged.metadata().tags());
    }

    @Test
    void tag_on_several_versions_resolves_to_most_recent_member() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        String v2 = store.store("Nova", Capsules.capsule("b"));
        store.store("Nova", Capsules.capsule("c"));
        store.addTag("Nova", v2, "stable");
        store.addTag("Nova", v1, "stable");

        assertEquals(v2, store.retrieve("Nova", Selector.byTag("stable")).metadata().versionId());
    }

    @Test
    void unknown_tag_version_and_owner_are_distinguished() {
        var store = newStore();
        store.store("Nova", Capsules.capsule("a"));

        var tag = assertThrows(NotFoundException.class,
                () -> store.retrieve("Nova", Selector.byTag("nonexistent-tag")));
        var version = assertThrows(NotFoundException.class,
                () -> store.retrieve("Nova", Selector.byVersionId("no-such-version")));
        var owner = assertThrows(NotFoundException.class,
                () -> store.retrieve("Echo", Selector.latest()));

        assertEquals(NotFoundException.Kind.TAG, tag.kind());
        assertEquals(NotFoundException.Kind.VERSION, version.kind());
        assertEquals(NotFoundException.Kind.OWNER, owner.kind());
    }

    @Test
    void invalid_content_is_rejected_and_nothing_is_indexed() {
        var store = newStore();

        assertThrows(ValidationException.class, () -> store.store("Nova", new byte[0]));
        assertThrows(ValidationException.class, () -> store.store("Nova", null));
        assertThrows(ValidationException.class,
                () -> store.store("Nova", "{\"metadata\":{}}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(ValidationException.class, () -> store.store("../Nova", Capsules.capsule("a")));

        assertTrue(store.list("Nova").isEmpty());
        assertTrue(store.listOwners().isEmpty());
    }

    @Test
    void tag_operations_are_idempotent() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));

        store.addTag("Nova", v1, "x");
        store.addTag("Nova", v1, "x");
        assertEquals(1, store.list("Nova", "x").size());
        assertEquals(Map.of("x", 1), store.ownerSummary("Nova").tagCounts());

        store.removeTag("Nova", v1, "x");
        store.removeTag("Nova", v1, "x");
        store.removeTag("Nova", v1, "never-there");
        assertTrue(store.list("Nova", "x").isEmpty());

        assertThrows(NotFoundException.class, () -> store.addTag("Nova", "ghost", "x"));
        assertThrows(NotFoundException.class, () -> store.addTag("Echo", v1, "x"));
        assertThrows(ValidationException.class, () -> store.addTag("Nova", v1, " "));
    }

    @Test
    void tagging_does_not_touch_the_blob_or_its_fingerprint() throws Exception {
        var store = newStore();
        byte[] content = Capsules.capsule("a");
        String v1 = store.store("Nova", content);
        var before = store.list("Nova").get(0);

        store.addTag("Nova", v1, "x");

        var after = store.list("Nova").get(0);
        assertEquals(before.fingerprint(), after.fingerprint());
        assertEquals(before.createdAt(), after.createdAt());
        assertArrayEquals(content, Files.readAllBytes(root.resolve(after.storageLocation())));
    }

    @Test
    void list_filters_by_tag_and_unknown_owner_is_empty() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        String v2 = store.store("Nova", Capsules.capsule("b"));
        String v3 = store.store("Nova", Capsules.capsule("c"));
        store.addTag("Nova", v1, "keep");
        store.addTag("Nova", v3, "keep");

        assertEquals(List.of(v3, v1), store.list("Nova", "keep").stream().map(CapsuleVersion::versionId).toList());
        assertEquals(3, store.list("Nova").size());
        assertTrue(store.list("Nova", "nothing").isEmpty());
        assertTrue(store.list("Echo").isEmpty());
        assertNotNull(v2);
    }

    @Test
    void tampered_blob_is_returned_with_integrity_flag_cleared() throws Exception {
        var store = newStore();
        String id = store.store("Nova", Capsules.capsule("original"));

        Path blob = root.resolve("objects/Nova/" + id);
        byte[] tampered = Capsules.capsule("tampered");
        Files.write(blob, tampered);

        RetrievalResult result = store.retrieve("Nova", Selector.byVersionId(id));

        assertFalse(result.integrityValid());
        assertArrayEquals(tampered, result.content());
    }

    @Test
    void result_content_is_a_private_copy() {
        var store = newStore();
        store.store("Nova", Capsules.capsule("a"));

        RetrievalResult result = store.retrieve("Nova", Selector.latest());
        result.content()[0] = 'X';

        assertTrue(store.retrieve("Nova", Selector.latest()).integrityValid());
        assertEquals('{', result.content()[0]);
    }

    @Test
    void deleting_latest_moves_pointer_back() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        String v2 = store.store("Nova", Capsules.capsule("b"));

        store.delete("Nova", v2);

        assertEquals(v1, store.retrieve("Nova", Selector.latest()).metadata().versionId());
        assertFalse(Files.exists(root.resolve("objects/Nova/" + v2)));
        var e = assertThrows(NotFoundException.class,
                () -> store.retrieve("Nova", Selector.byVersionId(v2)));
        assertEquals(NotFoundException.Kind.VERSION, e.kind());
    }

    @Test
    void deleting_the_last_version_keeps_the_owner_with_an_empty_history() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        store.addTag("Nova", v1, "only");

        store.delete("Nova", v1);

        assertEquals(List.of("Nova"), store.listOwners());
        assertTrue(store.list("Nova").isEmpty());
        assertFalse(Files.exists(root.resolve("objects/Nova")));
        assertTrue(Files.exists(root.resolve("index/Nova.idx")));

        var latest = assertThrows(NotFoundException.class, () -> store.retrieve("Nova", Selector.latest()));
        var byId = assertThrows(NotFoundException.class, () -> store.retrieve("Nova", Selector.byVersionId(v1)));
        var byTag = assertThrows(NotFoundException.class, () -> store.retrieve("Nova", Selector.byTag("only")));
        assertEquals(NotFoundException.Kind.VERSION, latest.kind());
        assertEquals(NotFoundException.Kind.VERSION, byId.kind());
        assertEquals(NotFoundException.Kind.TAG, byTag.kind());

        OwnerSummary summary = store.ownerSummary("Nova");
        assertEquals(0, summary.versionCount());
        assertNull(summary.latestVersionId());
        assertNull(summary.newestVersionAt());

        // the owner can start a new history, and a restart sees the same state
        String v2 = store.store("Nova", Capsules.capsule("b"));
        assertEquals(v2, newStore().retrieve("Nova", Selector.latest()).metadata().versionId());
    }

    @Test
    void nova_capsule_tagged_then_deleted() {
        var store = newStore();
        byte[] capsuleA = Capsules.capsule("Nova", "before the mirror break");
        String a = store.store("Nova", capsuleA);
        store.addTag("Nova", a, "post-mirror-break");

        RetrievalResult tagged = store.retrieve("Nova", Selector.byTag("post-mirror-break"));
        assertEquals(a, tagged.metadata().versionId());
        assertEquals(Set.of("post-mirror-break"), tagged.metadata().tags());
        assertArrayEquals(capsuleA, tagged.content());
        assertTrue(tagged.integrityValid());

        var noTag = assertThrows(NotFoundException.class,
                () -> store.retrieve("Nova", Selector.byTag("nonexistent-tag")));
        assertEquals(NotFoundException.Kind.TAG, noTag.kind());
        assertEquals("nonexistent-tag", noTag.subject());

        store.delete("Nova", a);

        var gone = assertThrows(NotFoundException.class,
                () -> store.retrieve("Nova", Selector.byVersionId(a)));
        assertEquals(NotFoundException.Kind.VERSION, gone.kind());
        assertEquals(a, gone.subject());
        assertTrue(store.list("Nova").stream().noneMatch(v -> v.versionId().equals(a)));
    }

    @Test
    void deleting_unknown_version_is_not_found() {
        var store = newStore();
        store.store("Nova", Capsules.capsule("a"));

        var e = assertThrows(NotFoundException.class, () -> store.delete("Nova", "ghost"));
        assertEquals(NotFoundException.Kind.VERSION, e.kind());
        assertEquals(1, store.list("Nova").size());
    }

    @Test
    void delete_tolerates_an_already_missing_blob() throws Exception {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        String v2 = store.store("Nova", Capsules.capsule("b"));
        Files.delete(root.resolve("objects/Nova/" + v1));

        store.delete("Nova", v1);

        assertEquals(List.of(v2), store.list("Nova").stream().map(CapsuleVersion::versionId).toList());
    }

    @Test
    void owner_summary_reports_counts_and_timeline() {
        var store = newStore();
        String v1 = store.store("Nova", Capsules.capsule("a"));
        String v2 = store.store("Nova", Capsules.capsule("b"));
        store.addTag("Nova", v1, "x");
        store.addTag("Nova", v2, "x");
        store.addTag("Nova", v2, "y");

        OwnerSummary s = store.ownerSummary("Nova");

        assertEquals("Nova", s.owner());
        assertEquals(2, s.versionCount());
        assertEquals(Map.of("x", 2, "y", 1), s.tagCounts());
        assertEquals(v2, s.latestVersionId());
        assertTrue(s.oldestVersionAt().isBefore(s.newestVersionAt()));
        assertThrows(NotFoundException.class, () -> store.ownerSummary("Echo"));
    }

    @Test
    void owners_are_isolated_and_listed_sorted() {
        var store = newStore();
        String nova = store.store("Nova", Capsules.capsule("Nova", "n"));
        store.store("Echo", Capsules.capsule("Echo", "e"));
        store.addTag("Nova", nova, "shared-name");

        assertEquals(List.of("Echo", "Nova"), store.listOwners());
        assertThrows(NotFoundException.class,
                () -> store.retrieve("Echo", Selector.byTag("shared-name")));
        assertThrows(NotFoundException.class,
                () -> store.retrieve("Echo", Selector.byVersionId(nova)));
    }
}
