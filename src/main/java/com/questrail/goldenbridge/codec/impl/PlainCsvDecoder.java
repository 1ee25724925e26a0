package com.questrail.goldenbridge.codec.impl;

import com.questrail.goldenbridge.codec.FrameProtocolException;
import com.questrail.goldenbridge.model.RawTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PlainCsvDecoder
 * -----------------------------------------------------------------------------
 * Decoder for single-mode oracle output: a header line followed by data rows,
 * without {@code #BEGIN}/{@code #END} framing.
 *
 * <p>Single mode is a debugging convenience; its output carries no request
 * echo and is never cached.</p>
 */
public final class PlainCsvDecoder
{
    public RawTable decode(String output)
    {
        Objects.requireNonNull(output, "output");

        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();

        final String[] lines = output.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final String line = WireFormat.stripLineEnd(lines[i]);
            if (line.isEmpty()) {
                continue;
            }

            List<String> fields = WireFormat.splitFields(line);
            if (header == null) {
                header = fields;
                continue;
            }
            if (fields.size() != header.size()) {
                throw new FrameProtocolException(
                        "Row has " + fields.size() + " fields but header has " + header.size(), i + 1);
            }
            rows.add(fields);
        }

        if (header == null) {
            throw new FrameProtocolException("Oracle produced no CSV header");
        }
        try {
            return new RawTable(header, rows);
        } catch (IllegalArgumentException e) {
            throw new FrameProtocolException(e.getMessage());
        }
    }
}
