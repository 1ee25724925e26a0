package com.questrail.goldenbridge.cache;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;
import com.questrail.goldenbridge.model.DumpRequest;

import java.util.Objects;

/**
 * A test asked for a request that was never populated into the cache.
 *
 * <p>Either the request was built differently at lookup than at collection,
 * or the oracle omitted its frame. Never an empty result.</p>
 */
public final class CacheMissException extends OracleBridgeException
{
    private final DumpRequest request;

    public CacheMissException(DumpRequest request, String reason) {
        super(FailureKind.FRAMEWORK_DEFECT,
              "No oracle result for [" + Objects.requireNonNull(request, "request").toWireLine() + "]: " + reason);
        this.request = request;
    }

    public DumpRequest request() {
        return request;
    }
}
