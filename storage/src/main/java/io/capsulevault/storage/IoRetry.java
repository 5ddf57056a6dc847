// file: storage/src/main/java/io/capsulevault/storage/IoRetry.java
package io.capsulevault.storage;

import java.io.IOException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded retry for filesystem actions.
 * <p>
 * Semantics:
 *  - Only {@link IOException} is retried; unchecked exceptions (write-once conflicts,
 *    missing blobs, validation errors) propagate on the first occurrence.
 *  - Between attempts we sleep {@code backoff * attempt}.
 *  - When every attempt failed, the last IOException is wrapped in {@link StorageIoException}.
 */
public final class IoRetry {
    private static final Logger log = Logger.getLogger(IoRetry.class.getName());

    @FunctionalInterface
    public interface IoAction<T> {
        T run() throws IOException;
    }

    private final int maxAttempts;
    private final Duration backoff;

    public IoRetry(int maxAttempts, Duration backoff) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (backoff == null || backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /** Three attempts, 20ms apart (growing linearly). */
    public static IoRetry defaults() {
        return new IoRetry(3, Duration.ofMillis(20));
    }

    /** Single attempt, no retry. */
    public static IoRetry none() {
        return new IoRetry(1, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String what, IoAction<T> action) {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.run();
            } catch (IOException e) {
                last = e;
                if (attempt < maxAttempts) {
                    log.log(Level.WARNING, String.format(
                            "%s failed (attempt %d/%d), retrying: %s", what, attempt, maxAttempts, e));
                    pause(attempt);
                }
            }
        }
        throw new StorageIoException(what + " failed after " + maxAttempts + " attempt(s)", last);
    }

    private void pause(int attempt) {
        long millis = backoff.toMillis() * attempt;
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageIoException("interrupted while waiting to retry");
        }
    }
}
