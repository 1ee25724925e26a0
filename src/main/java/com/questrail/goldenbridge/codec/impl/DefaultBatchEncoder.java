package com.questrail.goldenbridge.codec.impl;

import com.questrail.goldenbridge.codec.BatchEncoder;
import com.questrail.goldenbridge.model.DumpRequest;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Concrete implementation of {@link BatchEncoder}.
 *
 * <p>Requests are de-duplicated and written in wire-line order, so the same
 * request set always produces byte-identical input.</p>
 */
public final class DefaultBatchEncoder implements BatchEncoder
{
    @Override
    public String encode(Collection<DumpRequest> requests)
    {
        Objects.requireNonNull(requests, "requests");

        StringBuilder sb = new StringBuilder();
        for (DumpRequest request : new TreeSet<>(requests)) {
            sb.append(request.toWireLine()).append('\n');
        }
        return sb.toString();
    }
}
