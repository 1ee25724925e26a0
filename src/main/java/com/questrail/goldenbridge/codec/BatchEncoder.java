package com.questrail.goldenbridge.codec;

import com.questrail.goldenbridge.model.DumpRequest;

import java.util.Collection;

/**
 * BatchEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the oracle wire protocol: renders a set of requests as the
 * text written to the oracle's standard input in batch mode.
 *
 * <p>The encoding is one wire line per distinct request, in a deterministic
 * order, with a trailing newline terminating the batch. Order affects log
 * readability only, never correctness.</p>
 */
public interface BatchEncoder
{
    String encode(Collection<DumpRequest> requests);
}
