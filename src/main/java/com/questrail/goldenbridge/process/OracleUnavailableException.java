package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

/**
 * The oracle could not be located or launched: no command configured, a
 * missing executable, or a missing runtime. Aborts collection.
 */
public final class OracleUnavailableException extends OracleBridgeException
{
    public OracleUnavailableException(String message) {
        super(FailureKind.INFRASTRUCTURE, message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(FailureKind.INFRASTRUCTURE, message, cause);
    }
}
