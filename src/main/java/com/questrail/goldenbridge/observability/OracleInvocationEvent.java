package com.questrail.goldenbridge.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing one finished oracle subprocess.
 *
 * @param frameCount tables decoded from the output; 0 when the run failed
 * @param exitCode   process exit code, or -1 when the process was killed on timeout
 */
public record OracleInvocationEvent(
    Instant timestamp,
    Mode mode,
    int requestCount,
    int frameCount,
    int exitCode,
    Duration elapsed
) {
    public enum Mode { BATCH, SINGLE }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
