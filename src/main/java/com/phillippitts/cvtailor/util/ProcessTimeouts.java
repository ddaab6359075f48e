package com.phillippitts.cvtailor.util;

import java.time.Duration;

/**
 * Timeouts for external process and stream-reader thread management.
 *
 * @see com.phillippitts.cvtailor.service.compiler.ProcessRunner
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream reader threads to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort join during cleanup. Reader threads are daemons.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Grace period after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
