// file: cli/src/main/java/io/capsulevault/cli/Cli.java
package io.capsulevault.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.capsulevault.core.CapsuleStoreException;
import io.capsulevault.core.CapsuleVersion;
import io.capsulevault.core.NotFoundException;
import io.capsulevault.core.Selector;
import io.capsulevault.core.ValidationException;
import io.capsulevault.storage.CapsuleSchemaValidator;
import io.capsulevault.storage.CapsuleStore;
import io.capsulevault.storage.DurableCapsuleStore;
import io.capsulevault.storage.OwnerSummary;
import io.capsulevault.storage.ReconciliationReport;
import io.capsulevault.storage.RequiredSectionsValidator;
import io.capsulevault.storage.RetrievalResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator CLI over a local capsule vault.
 *
 * Usage:
 *   capsulevault [--root dir] store <owner> <file>
 *   capsulevault [--root dir] get <owner> [--version <id> | --tag <tag>] [--out <file>]
 *   capsulevault [--root dir] tag <owner> <version> <tag>
 *   capsulevault [--root dir] untag <owner> <version> <tag>
 *   capsulevault [--root dir] list <owner> [--tag <tag>]
 *   capsulevault [--root dir] delete <owner> <version>
 *   capsulevault [--root dir] owners
 *   capsulevault [--root dir] summary <owner>
 *   capsulevault [--root dir] reconcile <owner> [--repair]
 *
 * Exit codes: 0 ok, 1 usage / validation / not found, 2 storage or index failure.
 */
public final class Cli {

    private static final String USAGE = """
            Usage:
              capsulevault [options] store <owner> <file>
              capsulevault [options] get <owner> [--version <id> | --tag <tag>] [--out <file>]
              capsulevault [options] tag <owner> <version> <tag>
              capsulevault [options] untag <owner> <version> <tag>
              capsulevault [options] list <owner> [--tag <tag>]
              capsulevault [options] delete <owner> <version>
              capsulevault [options] owners
              capsulevault [options] summary <owner>
              capsulevault [options] reconcile <owner> [--repair]

            Options:
              --root,  -r        Vault root directory (default: ./vault)
              --io-attempts      Attempts per filesystem action (default: 3)
              --no-schema-check  Store payloads without the JSON section check
              --help,  -h        Show this help message
            """;

    private final CapsuleStore store;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    Cli(CapsuleStore store, PrintStream out, PrintStream err) {
        this.store = store;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            VaultConfig.Parsed parsed = VaultConfig.fromArgs(args);
            if (parsed.help()) {
                out.println(USAGE);
                return 0;
            }
            if (parsed.rest().length == 0) {
                throw new CliException("missing command");
            }

            VaultConfig cfg = parsed.config();
            CapsuleSchemaValidator schema = cfg.schemaCheck()
                    ? new RequiredSectionsValidator()
                    : CapsuleSchemaValidator.opaque();
            CapsuleStore store = DurableCapsuleStore.open(cfg.root(), schema, cfg.ioAttempts());

            new Cli(store, out, err).dispatch(parsed.rest());
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        } catch (ValidationException | NotFoundException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (CapsuleStoreException e) {
            err.println("failure: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            err.println("failure: " + e);
            return 2;
        }
    }

    void dispatch(String[] rest) throws IOException {
        String cmd = rest[0];
        switch (cmd) {
            case "store" -> {
                requireArgs(rest, 3, "store requires <owner> <file>");
                store(rest[1], Path.of(rest[2]));
            }
            case "get" -> {
                requireArgs(rest, 2, "get requires <owner>");
                get(rest[1], options(rest, 2));
            }
            case "tag" -> {
                requireExactly(rest, 4, "tag requires <owner> <version> <tag>");
                store.addTag(rest[1], rest[2], rest[3]);
                out.println("OK");
            }
            case "untag" -> {
                requireExactly(rest, 4, "untag requires <owner> <version> <tag>");
                store.removeTag(rest[1], rest[2], rest[3]);
                out.println("OK");
            }
            case "list" -> {
                requireArgs(rest, 2, "list requires <owner>");
                Map<String, String> opts = options(rest, 2);
                List<Map<String, Object>> rows = store.list(rest[1], opts.get("tag")).stream()
                        .map(Cli::view)
                        .toList();
                printJson(rows);
            }
            case "delete" -> {
                requireExactly(rest, 3, "delete requires <owner> <version>");
                store.delete(rest[1], rest[2]);
                out.println("OK");
            }
            case "owners" -> {
                requireExactly(rest, 1, "owners takes no arguments");
                store.listOwners().forEach(out::println);
            }
            case "summary" -> {
                requireExactly(rest, 2, "summary requires <owner>");
                printJson(view(store.ownerSummary(rest[1])));
            }
            case "reconcile" -> {
                requireArgs(rest, 2, "reconcile requires <owner>");
                boolean repair = rest.length == 3 && "--repair".equals(rest[2]);
                if (rest.length > 3 || (rest.length == 3 && !repair)) {
                    throw new CliException("reconcile accepts only --repair");
                }
                printJson(view(store.reconcile(rest[1], repair)));
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void store(String owner, Path file) throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new CliException("no such file: " + file);
        }
        out.println(store.store(owner, content));
    }

    private void get(String owner, Map<String, String> opts) throws IOException {
        if (opts.containsKey("version") && opts.containsKey("tag")) {
            throw new CliException("use either --version or --tag, not both");
        }
        Selector selector;
        if (opts.containsKey("version")) {
            selector = Selector.byVersionId(opts.get("version"));
        } else if (opts.containsKey("tag")) {
            selector = Selector.byTag(opts.get("tag"));
        } else {
            selector = Selector.latest();
        }

        RetrievalResult result = store.retrieve(owner, selector);
        if (!result.integrityValid()) {
            err.println("warning: integrity check failed for "
                    + owner + "/" + result.metadata().versionId() + "; content may have been altered");
        }

        String target = opts.get("out");
        if (target != null) {
            Files.write(Path.of(target), result.content());
            Map<String, Object> v = view(result.metadata());
            v.put("integrityValid", result.integrityValid());
            printJson(v);
        } else {
            out.write(result.content());
            out.flush();
        }
    }

    // ------------ argument helpers ------------

    private static void requireArgs(String[] rest, int min, String msg) {
        if (rest.length < min) throw new CliException(msg);
    }

    private static void requireExactly(String[] rest, int n, String msg) {
        if (rest.length != n) throw new CliException(msg);
    }

    /** Parses "--name value" pairs starting at {@code from}. */
    private static Map<String, String> options(String[] rest, int from) {
        Map<String, String> opts = new LinkedHashMap<>();
        for (int i = from; i < rest.length; i++) {
            String a = rest[i];
            if (!a.startsWith("--")) {
                throw new CliException("unexpected argument: " + a);
            }
            if (i + 1 >= rest.length) {
                throw new CliException("missing value for " + a);
            }
            String name = a.substring(2);
            if (!List.of("version", "tag", "out").contains(name)) {
                throw new CliException("unknown option: " + a);
            }
            opts.put(name, rest[++i]);
        }
        return opts;
    }

    // ------------ view models ------------

    private void printJson(Object value) {
        try {
            out.println(json.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON", e);
        }
    }

    static Map<String, Object> view(CapsuleVersion v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("owner", v.owner());
        m.put("versionId", v.versionId());
        m.put("createdAt", v.createdAt().toString());
        m.put("fingerprint", v.fingerprint().toHex());
        m.put("storageLocation", v.storageLocation());
        m.put("byteSize", v.byteSize());
        m.put("tags", List.copyOf(v.tags()));
        m.put("schemaVersion", v.schemaVersion());
        m.put("producerId", v.producerId());
        m.put("sourceTag", v.sourceTag());
        return m;
    }

    static Map<String, Object> view(OwnerSummary s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("owner", s.owner());
        m.put("versionCount", s.versionCount());
        m.put("tags", s.tagCounts());
        m.put("latestVersionId", s.latestVersionId());
        m.put("createdAt", String.valueOf(s.createdAt()));
        m.put("updatedAt", String.valueOf(s.updatedAt()));
        m.put("oldestVersionAt", s.oldestVersionAt() == null ? null : s.oldestVersionAt().toString());
        m.put("newestVersionAt", s.newestVersionAt() == null ? null : s.newestVersionAt().toString());
        return m;
    }

    static Map<String, Object> view(ReconciliationReport r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("owner", r.owner());
        m.put("consistent", r.consistent());
        m.put("orphanedBlobs", r.orphanedBlobs());
        m.put("danglingEntries", r.danglingEntries());
        m.put("reindexed", r.reindexed());
        m.put("dropped", r.dropped());
        return m;
    }
}
