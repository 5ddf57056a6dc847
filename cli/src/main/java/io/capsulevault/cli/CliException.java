// file: cli/src/main/java/io/capsulevault/cli/CliException.java
package io.capsulevault.cli;

/**
 * Bad command line. Reported with the usage text and exit code 1.
 */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
