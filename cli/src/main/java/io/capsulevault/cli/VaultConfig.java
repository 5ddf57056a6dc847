// file: cli/src/main/java/io/capsulevault/cli/VaultConfig.java
package io.capsulevault.cli;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Vault configuration parsed from the global CLI flags.
 *
 * Supports:
 *  - root:           vault root directory (objects/ and index/ live under it)
 *  - ioAttempts:     attempts per filesystem action before an I/O failure surfaces
 *  - schemaCheck:    run the JSON required-sections check on store
 */
public record VaultConfig(
        Path root,
        int ioAttempts,
        boolean schemaCheck
) {

    public static final String DEFAULT_ROOT = "./vault";
    public static final int DEFAULT_IO_ATTEMPTS = 3;

    public VaultConfig {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (ioAttempts <= 0) throw new IllegalArgumentException("ioAttempts must be > 0");
    }

    /**
     * Global flags plus whatever follows them (the command and its arguments).
     */
    public record Parsed(VaultConfig config, String[] rest, boolean help) {}

    /**
     * Very small flag parser. Global flags must precede the command.
     *
     * Supported flags:
     *   --root,      -r   <path>
     *   --io-attempts     <n>
     *   --no-schema-check
     *   --help,      -h
     *
     * @throws CliException on a malformed or unknown flag
     */
    public static Parsed fromArgs(String[] args) {
        // Defaults
        String root = DEFAULT_ROOT;
        int ioAttempts = DEFAULT_IO_ATTEMPTS;
        boolean schemaCheck = true;

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new Parsed(new VaultConfig(Path.of(root), ioAttempts, schemaCheck), new String[0], true);
                }

                case "--root", "-r" -> {
                    ensureValue(args, i);
                    root = args[++i];
                }

                case "--io-attempts" -> {
                    ensureValue(args, i);
                    try {
                        ioAttempts = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new CliException("Invalid io-attempts: " + args[i]);
                    }
                    if (ioAttempts <= 0) {
                        throw new CliException("io-attempts must be > 0");
                    }
                }

                case "--no-schema-check" -> schemaCheck = false;

                default -> throw new CliException("Unknown option: " + args[i]);
            }
        }
        return new Parsed(
                new VaultConfig(Path.of(root), ioAttempts, schemaCheck),
                Arrays.copyOfRange(args, i, args.length),
                false
        );
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("Missing value for option: " + args[i]);
        }
    }
}
