package com.questrail.goldenbridge.cache;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ResultCache
 * -----------------------------------------------------------------------------
 * Write-once, read-many store of raw oracle tables for one session.
 *
 * <p>{@link #populate(Map)} publishes an immutable snapshot through a volatile
 * field; after that, lookups need no locking. No eviction or invalidation.</p>
 *
 * <p>Every lookup of equal requests returns the same {@link RawTable} instance.</p>
 */
public final class ResultCache
{
    private final Object populateLock = new Object();
    private volatile Map<DumpRequest, RawTable> tables;

    /**
     * One-time bulk load.
     *
     * @throws CacheAlreadyPopulatedException on a second call
     */
    public void populate(Map<DumpRequest, RawTable> results) {
        Objects.requireNonNull(results, "results");
        synchronized (populateLock) {
            if (tables != null) {
                throw new CacheAlreadyPopulatedException(tables.size());
            }
            tables = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        }
    }

    /**
     * @throws CacheMissException if {@code request} was never populated
     */
    public RawTable lookup(DumpRequest request) {
        Objects.requireNonNull(request, "request");
        final Map<DumpRequest, RawTable> snapshot = tables;
        if (snapshot == null) {
            throw new CacheMissException(request, "result cache was never populated");
        }
        RawTable table = snapshot.get(request);
        if (table == null) {
            throw new CacheMissException(request,
                    "request was not collected, or the oracle emitted no frame for it");
        }
        return table;
    }

    public boolean isPopulated() {
        return tables != null;
    }

    public int size() {
        final Map<DumpRequest, RawTable> snapshot = tables;
        return snapshot == null ? 0 : snapshot.size();
    }
}
