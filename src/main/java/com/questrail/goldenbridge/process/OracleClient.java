package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;

import java.util.Map;
import java.util.Set;

/**
 * Transport to the oracle.
 *
 * <p>Implementations own the full lifecycle of whatever they launch; nothing
 * is left running when a call returns or throws.</p>
 */
public interface OracleClient
{
    /**
     * Resolves all {@code requests} with exactly one oracle invocation.
     *
     * <p>The result holds one table per frame the oracle emitted. A request
     * without a frame is simply absent; completeness is checked at lookup.</p>
     *
     * @throws OracleUnavailableException if the oracle cannot be launched
     * @throws OracleProcessException if it exits non-zero or times out
     * @throws com.questrail.goldenbridge.codec.FrameProtocolException if its output is malformed
     */
    Map<DumpRequest, RawTable> runBatch(Set<DumpRequest> requests);

    /**
     * Resolves one request through the oracle's unframed single mode. Never cached.
     */
    RawTable runSingle(DumpRequest request);
}
