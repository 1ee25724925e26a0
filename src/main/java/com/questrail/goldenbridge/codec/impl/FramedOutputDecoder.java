package com.questrail.goldenbridge.codec.impl;

import com.questrail.goldenbridge.codec.FrameProtocolException;
import com.questrail.goldenbridge.codec.OracleOutputDecoder;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.InvalidRequestException;
import com.questrail.goldenbridge.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FramedOutputDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OracleOutputDecoder} for batch output.
 *
 * <p>The decoder scans line by line:</p>
 * <ol>
 *   <li>{@code #BEGIN dump=<request-line>} opens a frame. The request line is
 *       parsed with {@link DumpRequest#parseWireLine(String)}, which re-sorts
 *       whatever argument order the oracle echoed.</li>
 *   <li>The next line is the header.</li>
 *   <li>Following lines are data rows until a line equal to {@code #END}.</li>
 * </ol>
 *
 * <p>Blank lines between frames are ignored. Any other text between frames is
 * skipped with a warning (launcher wrappers occasionally print banners).
 * Everything else that deviates from the grammar is a
 * {@link FrameProtocolException}.</p>
 */
public final class FramedOutputDecoder implements OracleOutputDecoder
{
    private static final Logger log = LoggerFactory.getLogger(FramedOutputDecoder.class);

    @Override
    public Map<DumpRequest, RawTable> decode(String output)
    {
        Objects.requireNonNull(output, "output");

        Map<DumpRequest, RawTable> tables = new LinkedHashMap<>();

        DumpRequest current = null;
        int beginLine = 0;
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();

        final String[] lines = output.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final int lineNumber = i + 1;
            final String line = WireFormat.stripLineEnd(lines[i]);

            if (current == null) {
                if (line.startsWith(WireFormat.BEGIN_PREFIX)) {
                    current = parseMarker(line, lineNumber);
                    beginLine = lineNumber;
                    header = null;
                    rows = new ArrayList<>();
                } else if (line.equals(WireFormat.END_MARKER)) {
                    throw new FrameProtocolException("#END without #BEGIN", lineNumber);
                } else if (line.startsWith("#BEGIN")) {
                    throw new FrameProtocolException("Malformed frame marker: " + line, lineNumber);
                } else if (!line.isBlank()) {
                    log.warn("Skipping text outside of any frame at line {}: {}", lineNumber, line);
                }
                continue;
            }

            // Inside a frame
            if (line.startsWith("#BEGIN")) {
                throw new FrameProtocolException(
                        "Nested #BEGIN inside frame opened at line " + beginLine, lineNumber);
            }

            if (line.equals(WireFormat.END_MARKER)) {
                if (header == null) {
                    throw new FrameProtocolException(
                            "Frame for '" + current.toWireLine() + "' has no header row", lineNumber);
                }
                if (tables.containsKey(current)) {
                    throw new FrameProtocolException(
                            "Duplicate frame for '" + current.toWireLine() + "'", beginLine);
                }
                tables.put(current, new RawTable(header, rows));
                current = null;
                continue;
            }

            if (header == null) {
                if (line.isEmpty()) {
                    throw new FrameProtocolException(
                            "Empty header row in frame for '" + current.toWireLine() + "'", lineNumber);
                }
                header = WireFormat.splitFields(line);
                requireDistinct(header, lineNumber);
                continue;
            }

            List<String> fields = WireFormat.splitFields(line);
            if (fields.size() != header.size()) {
                throw new FrameProtocolException(
                        "Row has " + fields.size() + " fields but header has " + header.size()
                                + " in frame for '" + current.toWireLine() + "'",
                        lineNumber);
            }
            rows.add(fields);
        }

        if (current != null) {
            throw new FrameProtocolException(
                    "Unterminated frame for '" + current.toWireLine() + "'", beginLine);
        }

        return Collections.unmodifiableMap(tables);
    }

    private static DumpRequest parseMarker(String line, int lineNumber)
    {
        final String requestLine = line.substring(WireFormat.BEGIN_PREFIX.length());
        try {
            return DumpRequest.parseWireLine(requestLine);
        } catch (InvalidRequestException e) {
            throw new FrameProtocolException(
                    "Invalid request in frame marker '" + line + "': " + e.getMessage(), lineNumber);
        }
    }

    private static void requireDistinct(List<String> header, int lineNumber)
    {
        for (int a = 0; a < header.size(); a++) {
            for (int b = a + 1; b < header.size(); b++) {
                if (header.get(a).equals(header.get(b))) {
                    throw new FrameProtocolException(
                            "Duplicate column '" + header.get(a) + "' in header", lineNumber);
                }
            }
        }
    }
}
