package com.questrail.goldenbridge.schema;

import java.util.Objects;

/**
 * One declared column of a {@link DumpSchema}.
 */
public record Column(String name, ColumnType type, boolean nullable)
{
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
    }

    public static Column required(String name, ColumnType type) {
        return new Column(name, type, false);
    }

    public static Column nullable(String name, ColumnType type) {
        return new Column(name, type, true);
    }
}
