package com.questrail.goldenbridge.codec.impl;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;

import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * FrameWriter
 * -----------------------------------------------------------------------------
 * Oracle-side emitter of the CSV protocol; the mechanical inverse of
 * {@link FramedOutputDecoder} and {@link PlainCsvDecoder}.
 *
 * <p>A table is written only as a whole, so a module that fails half way never
 * leaves a partial frame on the stream.</p>
 */
public final class FrameWriter
{
    private final PrintWriter out;

    public FrameWriter(PrintWriter out)
    {
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Writes one complete frame followed by a blank separator line.
     */
    public void writeFrame(DumpRequest request, RawTable table)
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(table, "table");
        validate(table);

        out.print(WireFormat.BEGIN_PREFIX);
        out.print(request.toWireLine());
        out.print('\n');
        writeRows(table);
        out.print(WireFormat.END_MARKER);
        out.print('\n');
        out.print('\n');
        out.flush();
    }

    /**
     * Writes the table as plain CSV, without framing.
     */
    public void writeTable(RawTable table)
    {
        Objects.requireNonNull(table, "table");
        validate(table);
        writeRows(table);
        out.flush();
    }

    private void writeRows(RawTable table)
    {
        writeLine(table.header());
        for (List<String> row : table.rows()) {
            writeLine(row);
        }
    }

    private void writeLine(List<String> fields)
    {
        out.print(WireFormat.joinFields(fields));
        out.print('\n');
    }

    private static void validate(RawTable table)
    {
        for (String column : table.header()) {
            if (column.isEmpty() || !WireFormat.isSafeField(column)) {
                throw new IllegalArgumentException("Column name not writable on the wire: '" + column + "'");
            }
        }
        for (List<String> row : table.rows()) {
            for (String value : row) {
                if (!WireFormat.isSafeField(value)) {
                    throw new IllegalArgumentException("Field value not writable on the wire: '" + value + "'");
                }
            }
        }
    }
}
