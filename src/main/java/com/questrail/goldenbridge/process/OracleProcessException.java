package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * OracleProcessException
 * -----------------------------------------------------------------------------
 * The oracle was launched but did not complete successfully: a non-zero exit,
 * a timeout, or output that could not be read.
 *
 * <p>The message is the oracle's captured stderr, verbatim, so that a test
 * report shows the oracle's own diagnosis rather than a bridge stack trace.
 * No partial results accompany this failure.</p>
 */
public final class OracleProcessException extends OracleBridgeException
{
    private final int exitCode;
    private final String stderr;

    public OracleProcessException(int exitCode, String stderr) {
        super(FailureKind.INFRASTRUCTURE, describe(exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public OracleProcessException(String message, Throwable cause) {
        super(FailureKind.INFRASTRUCTURE, message, cause);
        this.exitCode = -1;
        this.stderr = "";
    }

    public OracleProcessException(String message) {
        this(message, "", -1);
    }

    private OracleProcessException(String message, String stderr, int exitCode) {
        super(FailureKind.INFRASTRUCTURE, message);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    static OracleProcessException timedOut(Duration timeout, String stderr) {
        String message = "Oracle timed out after " + timeout.toMillis() + " ms and was killed";
        if (stderr != null && !stderr.isBlank()) {
            message += "\n" + stderr.strip();
        }
        return new OracleProcessException(message, stderr == null ? "" : stderr, -1);
    }

    /**
     * @return the exit code, or empty when the process was killed or never reported one
     */
    public OptionalInt exitCode() {
        return exitCode < 0 ? OptionalInt.empty() : OptionalInt.of(exitCode);
    }

    public String stderr() {
        return stderr;
    }

    private static String describe(int exitCode, String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "Oracle exited with code " + exitCode + " and no error output";
        }
        return "Oracle exited with code " + exitCode + ":\n" + stderr.strip();
    }
}
