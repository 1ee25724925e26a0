package com.questrail.goldenbridge;

import java.util.Objects;

/**
 * Base type of every failure raised by the golden bridge.
 *
 * <p>Each concrete subtype reports a fixed {@link FailureKind}; none of them
 * are retried. Callers that need to attribute a failure switch on
 * {@link #kind()} rather than on concrete classes.</p>
 */
public abstract class OracleBridgeException extends RuntimeException
{
    private final FailureKind kind;

    protected OracleBridgeException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected OracleBridgeException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
