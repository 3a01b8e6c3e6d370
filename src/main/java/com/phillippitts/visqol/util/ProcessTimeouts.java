package com.phillippitts.visqol.util;

import java.time.Duration;

/**
 * Timeouts for native process and stream-reader thread shutdown.
 *
 * @see com.phillippitts.visqol.service.backend.visqolcli.VisqolProcessManager
 */
public final class ProcessTimeouts {

    /** Time for stream readers to drain after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of stream readers during cleanup; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
