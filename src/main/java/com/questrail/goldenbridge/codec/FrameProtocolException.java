package com.questrail.goldenbridge.codec;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

/**
 * Indicates that oracle output violates the framed CSV protocol
 * (unterminated or nested frames, missing header, field-count mismatch).
 *
 * <p>Such output means the oracle and this codec disagree about the protocol
 * version, so it is classified as an infrastructure failure.</p>
 */
public final class FrameProtocolException extends OracleBridgeException
{
    private final int lineNumber;

    public FrameProtocolException(String message, int lineNumber) {
        super(FailureKind.INFRASTRUCTURE,
                lineNumber > 0 ? message + " (output line " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public FrameProtocolException(String message) {
        this(message, 0);
    }

    /**
     * 1-based line of oracle output where the violation was detected, or 0 if
     * it applies to the output as a whole.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
