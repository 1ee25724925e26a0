package com.questrail.goldenbridge.codec;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;

import java.util.Map;

/**
 * OracleOutputDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the oracle wire protocol: parses the oracle's complete
 * batch-mode standard output into one raw table per echoed request.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Recognizing frame boundaries</li>
 *   <li>Reconstructing the canonical request from each frame marker</li>
 *   <li>Matching data fields positionally to the header</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting values (they stay opaque strings)</li>
 *   <li>Checking that every submitted request received a frame</li>
 * </ul>
 */
public interface OracleOutputDecoder
{
    /**
     * @param output complete standard output of one oracle invocation
     * @return one entry per frame, in output order
     * @throws FrameProtocolException if the output is not well-formed
     */
    Map<DumpRequest, RawTable> decode(String output);
}
