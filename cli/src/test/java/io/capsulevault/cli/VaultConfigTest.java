// file: cli/src/test/java/io/capsulevault/cli/VaultConfigTest.java
package io.capsulevault.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class VaultConfigTest {

    @Test
    void defaults_apply_when_no_flags_are_given() {
        VaultConfig.Parsed p = VaultConfig.fromArgs(new String[]{"owners"});

        assertEquals(Path.of(VaultConfig.DEFAULT_ROOT), p.config().root());
        assertEquals(VaultConfig.DEFAULT_IO_ATTEMPTS, p.config().ioAttempts());
        assertTrue(p.config().schemaCheck());
        assertArrayEquals(new String[]{"owners"}, p.rest());
        assertFalse(p.help());
    }

    @Test
    void global_flags_precede_the_command() {
        VaultConfig.Parsed p = VaultConfig.fromArgs(
                new String[]{"-r", "/data/vault", "--io-attempts", "5", "--no-schema-check", "list", "Nova", "--tag", "x"});

        assertEquals(Path.of("/data/vault"), p.config().root());
        assertEquals(5, p.config().ioAttempts());
        assertFalse(p.config().schemaCheck());
        assertArrayEquals(new String[]{"list", "Nova", "--tag", "x"}, p.rest());
    }

    @Test
    void help_short_circuits() {
        assertTrue(VaultConfig.fromArgs(new String[]{"--help", "--bogus"}).help());
        assertTrue(VaultConfig.fromArgs(new String[]{"-h"}).help());
    }

    @Test
    void malformed_flags_are_rejected() {
        assertThrows(CliException.class, () -> VaultConfig.fromArgs(new String[]{"--root"}));
        assertThrows(CliException.class, () -> VaultConfig.fromArgs(new String[]{"--io-attempts", "many"}));
        assertThrows(CliException.class, () -> VaultConfig.fromArgs(new String[]{"--io-attempts", "0"}));
        assertThrows(CliException.class, () -> VaultConfig.fromArgs(new String[]{"--verbose", "owners"}));
    }
}
