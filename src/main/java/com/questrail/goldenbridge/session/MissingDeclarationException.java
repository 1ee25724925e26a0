package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

/**
 * Oracle data was requested by a test that never declared a dump module.
 */
public final class MissingDeclarationException extends OracleBridgeException
{
    public MissingDeclarationException(String message) {
        super(FailureKind.USAGE, message);
    }
}
