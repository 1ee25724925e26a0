package com.questrail.goldenbridge.cache;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;

/**
 * Second bulk load of a {@link ResultCache}; the oracle was invoked twice in one session.
 */
public final class CacheAlreadyPopulatedException extends OracleBridgeException
{
    public CacheAlreadyPopulatedException(int existingEntries) {
        super(FailureKind.FRAMEWORK_DEFECT,
              "Result cache already populated with " + existingEntries + " tables");
    }
}
