package com.questrail.goldenbridge.oracle;

import com.questrail.goldenbridge.schema.DumpSchema;

/**
 * One named capability of the oracle: reads its arguments from a
 * {@link DumpContext} and emits rows that conform to {@link #schema()}.
 */
public interface DumpModule
{
    /**
     * Module name used on the command line and in wire lines.
     */
    default String name() {
        return schema().module();
    }

    /**
     * One-line argument synopsis printed after an argument error.
     */
    default String usage() {
        return "";
    }

    DumpSchema schema();

    /**
     * @throws IllegalArgumentException for missing, malformed or out-of-range arguments
     */
    void run(DumpContext context);
}
