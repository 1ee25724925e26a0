package com.questrail.goldenbridge.codec.impl;

import java.util.Arrays;
import java.util.List;

/**
 * WireFormat
 * -----------------------------------------------------------------------------
 * Markers and field rules of the oracle's framed CSV output.
 *
 * <p>This class only knows how lines are delimited and split. It does not
 * track frame state or build requests.</p>
 */
public final class WireFormat
{
    /** Prefix of a frame's opening line; the remainder is the echoed request line. */
    public static final String BEGIN_PREFIX = "#BEGIN dump=";

    /** Complete closing line of a frame. */
    public static final String END_MARKER = "#END";

    /** Field separator in header and data rows. No quoting is defined. */
    public static final char FIELD_SEPARATOR = ',';

    private WireFormat() {}

    /**
     * Splits a header or data row into fields. Empty fields, including
     * trailing ones, are preserved: {@code "a,,"} has three fields.
     */
    public static List<String> splitFields(String line) {
        return Arrays.asList(line.split(String.valueOf(FIELD_SEPARATOR), -1));
    }

    public static String joinFields(List<String> fields) {
        return String.join(String.valueOf(FIELD_SEPARATOR), fields);
    }

    /**
     * Returns true if {@code value} can be written as a field without
     * corrupting the row structure.
     */
    public static boolean isSafeField(String value) {
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == FIELD_SEPARATOR || c == '\n' || c == '\r') {
                return false;
            }
        }
        return true;
    }

    /**
     * Strips a trailing carriage return so output produced on Windows decodes
     * the same as on other platforms.
     */
    static String stripLineEnd(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
