// file: storage/src/test/java/io/capsulevault/storage/DurableCapsuleStoreRecoveryTest.java
package io.capsulevault.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.CorruptIndexException;
import io.capsulevault.core.Selector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * What a fresh process sees after a previous one wrote to the same root.
 */
class DurableCapsuleStoreRecoveryTest {

    @TempDir
    Path root;

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void history_tags_and_latest_survive_a_restart() {
        var first = DurableCapsuleStore.open(root);
        String v1 = first.store("Nova", Capsules.capsule("one"));
        String v2 = first.store("Nova", Capsules.capsule("two"));
        first.addTag("Nova", v1, "post-mirror-break");
        List<CapsuleVersion> before = first.list("Nova");

        var second = DurableCapsuleStore.open(root);

        assertEquals(before, second.list("Nova"));
        assertEquals(v2, second.retrieve("Nova", Selector.latest()).metadata().versionId());
        assertEquals(v1, second.retrieve("Nova", Selector.byTag("post-mirror-break")).metadata().versionId());
        assertArrayEquals(Capsules.capsule("one"), second.retrieve("Nova", Selector.byVersionId(v1)).content());
    }

    @Test
    void corrupt_index_blocks_only_its_owner() throws Exception {
        var first = DurableCapsuleStore.open(root);
        first.store("Nova", Capsules.capsule("Nova", "n"));
        String echo = first.store("Echo", Capsules.capsule("Echo", "e"));

        Files.write(root.resolve("index/Nova.idx"), "{\"format\":1,".getBytes(StandardCharsets.UTF_8));
        var second = DurableCapsuleStore.open(root);

        assertThrows(CorruptIndexException.class, () -> second.retrieve("Nova", Selector.latest()));
        assertThrows(CorruptIndexException.class, () -> second.list("Nova"));
        assertThrows(CorruptIndexException.class, () -> second.store("Nova", Capsules.capsule("again")));
        assertEquals(List.of("Echo", "Nova"), second.listOwners(), "blocked owners stay visible");

        assertEquals(echo, second.retrieve("Echo", Selector.latest()).metadata().versionId());
    }

    @Test
    void malformed_tag_list_blocks_only_its_owner() throws Exception {
        var first = DurableCapsuleStore.open(root);
        String echo = first.store("Echo", Capsules.capsule("Echo", "e"));
        String nova = first.store("Nova", Capsules.capsule("Nova", "n"));
        first.addTag("Nova", nova, "post-mirror-break");

        Path index = root.resolve("index/Nova.idx");
        ObjectNode doc = (ObjectNode) json.readTree(index.toFile());
        ((ObjectNode) doc.get("tags")).putArray("post-mirror-break").addNull();
        json.writeValue(index.toFile(), doc);

        var second = DurableCapsuleStore.open(root);

        assertThrows(CorruptIndexException.class, () -> second.retrieve("Nova", Selector.latest()));
        assertEquals(echo, second.retrieve("Echo", Selector.latest()).metadata().versionId());
    }

    @Test
    void reconcile_rebuilds_an_owner_whose_index_cannot_be_loaded() throws Exception {
        var first = DurableCapsuleStore.open(root);
        String v1 = first.store("Nova", Capsules.capsule("one"));
        String v2 = first.store("Nova", Capsules.capsule("two"));
        Files.write(root.resolve("index/Nova.idx"), "garbage".getBytes(StandardCharsets.UTF_8));
        var second = DurableCapsuleStore.open(root);

        ReconciliationReport dryRun = second.reconcile("Nova", false);
        assertEquals(List.of(v1, v2).stream().sorted().toList(), dryRun.orphanedBlobs());
        assertThrows(CorruptIndexException.class, () -> second.list("Nova"), "a dry run changes nothing");

        ReconciliationReport repaired = second.reconcile("Nova", true);

        assertEquals(2, repaired.reindexed().size());
        assertEquals(2, second.list("Nova").size());
        assertArrayEquals(Capsules.capsule("one"), second.retrieve("Nova", Selector.byVersionId(v1)).content());
        try (Stream<Path> files = Files.list(root.resolve("index"))) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("Nova.idx.corrupt-")),
                    "the unreadable document is kept for inspection");
        }
        assertEquals(2, DurableCapsuleStore.open(root).list("Nova").size());
    }

    @Test
    void index_entry_without_blob_is_reported_as_corruption_on_read() throws Exception {
        var first = DurableCapsuleStore.open(root);
        String id = first.store("Nova", Capsules.capsule("soon gone"));
        Files.delete(root.resolve("objects/Nova/" + id));

        var second = DurableCapsuleStore.open(root);

        var e = assertThrows(CorruptIndexException.class, () -> second.retrieve("Nova", Selector.latest()));
        assertEquals("Nova", e.owner());
        assertEquals(1, second.list("Nova").size(), "read path never repairs the index");
    }
}
