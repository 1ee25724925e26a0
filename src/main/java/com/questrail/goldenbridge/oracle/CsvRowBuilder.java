package com.questrail.goldenbridge.oracle;

import com.questrail.goldenbridge.schema.Column;
import com.questrail.goldenbridge.schema.DumpSchema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds one output row of a {@link DumpSchema}. Columns may be set in any
 * order; {@link #build()} renders them in declaration order.
 */
public final class CsvRowBuilder
{
    private final DumpSchema schema;
    private final Map<String, String> fields = new HashMap<>();

    public CsvRowBuilder(DumpSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * @throws IllegalArgumentException for an unknown column or a value of the wrong type
     * @throws IllegalStateException for null in a non-nullable column
     */
    public CsvRowBuilder set(String column, Object value) {
        Column declared = schema.column(column)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown column '" + column + "' for " + schema.module()));
        if (value == null && !declared.nullable()) {
            throw new IllegalStateException("Column '" + column + "' of " + schema.module() + " is not nullable");
        }
        fields.put(column, declared.type().format(value));
        return this;
    }

    /**
     * @throws IllegalStateException if a non-nullable column was never set
     */
    public List<String> build() {
        List<String> row = new ArrayList<>(schema.columns().size());
        for (Column column : schema.columns()) {
            String field = fields.get(column.name());
            if (field == null) {
                if (!column.nullable()) {
                    throw new IllegalStateException(
                            "Missing value for column '" + column.name() + "' of " + schema.module());
                }
                field = "";
            }
            row.add(field);
        }
        return row;
    }
}
