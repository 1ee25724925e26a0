package com.questrail.goldenbridge.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DumpSchema
 * -----------------------------------------------------------------------------
 * Fixed, ordered column declaration of one oracle dump module.
 *
 * <p>The same instance describes what the oracle emits ({@code CsvRowBuilder})
 * and what the client accepts ({@link SchemaValidator}). Output column order
 * always follows declaration order.</p>
 */
public record DumpSchema(String module, List<Column> columns)
{
    public DumpSchema {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(columns, "columns");
        columns = List.copyOf(columns);

        Set<String> names = new HashSet<>();
        for (Column column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.name() + "' in schema for " + module);
            }
        }
    }

    public static DumpSchema of(String module, Column... columns) {
        return new DumpSchema(module, List.of(columns));
    }

    /**
     * Column names in declaration order.
     */
    public List<String> header() {
        List<String> header = new ArrayList<>(columns.size());
        for (Column column : columns) {
            header.add(column.name());
        }
        return header;
    }

    public Optional<Column> column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /**
     * @return index of the named column, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
