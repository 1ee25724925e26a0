package com.questrail.goldenbridge.model;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

/**
 * Indicates that a {@link DumpRequest} could not be constructed because a
 * module name, argument key or argument value is not representable on the
 * wire (empty, or containing {@code '='} or whitespace).
 */
public class InvalidRequestException extends OracleBridgeException
{
    public InvalidRequestException(String message) {
        super(FailureKind.USAGE, message);
    }
}
