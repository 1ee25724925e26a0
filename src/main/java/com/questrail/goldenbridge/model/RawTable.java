package com.questrail.goldenbridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RawTable
 * -----------------------------------------------------------------------------
 * Ordered, untyped result rows for one {@link DumpRequest}, exactly as the
 * oracle emitted them.
 *
 * <p>Values are opaque strings; an empty string is the wire form of "no
 * value". Numeric interpretation is left to the schema layer.</p>
 *
 * <p>A table with a header and no rows is a legitimate answer ("the reference
 * data is the empty set") and is distinct from having no table at all.</p>
 */
public record RawTable(List<String> header, List<List<String>> rows)
{
    public RawTable {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(rows, "rows");

        header = List.copyOf(header);
        Set<String> names = new HashSet<>();
        for (String column : header) {
            if (!names.add(column)) {
                throw new IllegalArgumentException("Duplicate column name: " + column);
            }
        }

        List<List<String>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != header.size()) {
                throw new IllegalArgumentException(
                        "Row " + i + " has " + row.size() + " fields, header has " + header.size());
            }
            copied.add(List.copyOf(row));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public static RawTable empty(List<String> header) {
        return new RawTable(header, List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns row {@code index} as a column-name to raw-value mapping, in
     * header order.
     */
    public Map<String, String> row(int index) {
        List<String> values = rows.get(index);
        Map<String, String> map = new LinkedHashMap<>();
        for (int c = 0; c < header.size(); c++) {
            map.put(header.get(c), values.get(c));
        }
        return Collections.unmodifiableMap(map);
    }
}
