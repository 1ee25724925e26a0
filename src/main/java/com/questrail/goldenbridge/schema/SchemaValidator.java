package com.questrail.goldenbridge.schema;

import com.questrail.goldenbridge.model.RawTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SchemaValidator
 * -----------------------------------------------------------------------------
 * Promotes raw string rows to {@link TypedRecord}s.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The table header must contain exactly the declared columns; a missing
 *       or extra column is rejected before any row is read.</li>
 *   <li>For each row, columns are parsed in schema order with
 *       {@link ColumnType#parse(String)}.</li>
 *   <li>An empty (or blank) field is null, accepted only for nullable columns.</li>
 * </ul>
 *
 * <p>On success callers never need to re-check presence or type.</p>
 */
public final class SchemaValidator
{
    private final SchemaRegistry registry;

    public SchemaValidator(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Validates {@code table} against the registered schema of {@code module}.
     */
    public List<TypedRecord> validate(String module, RawTable table) {
        return validate(table, registry.require(module));
    }

    /**
     * @throws SchemaViolationException on the first violation found
     */
    public static List<TypedRecord> validate(RawTable table, DumpSchema schema) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(schema, "schema");

        final List<Column> columns = schema.columns();
        final int[] positions = new int[columns.size()];

        for (int c = 0; c < columns.size(); c++) {
            Column column = columns.get(c);
            positions[c] = table.header().indexOf(column.name());
            if (positions[c] < 0) {
                throw new SchemaViolationException(schema.module(), column.name(), -1,
                        "missing column");
            }
        }
        for (String name : table.header()) {
            if (schema.indexOf(name) < 0) {
                throw new SchemaViolationException(schema.module(), name, -1,
                        "column is not declared in the schema");
            }
        }

        List<TypedRecord> records = new ArrayList<>(table.size());
        for (int r = 0; r < table.size(); r++) {
            List<String> row = table.rows().get(r);
            Object[] values = new Object[columns.size()];

            for (int c = 0; c < columns.size(); c++) {
                Column column = columns.get(c);
                String raw = row.get(positions[c]);

                if (raw.isBlank()) {
                    if (!column.nullable()) {
                        throw new SchemaViolationException(schema.module(), column.name(), r,
                                "empty value in non-nullable " + column.type() + " column");
                    }
                    continue;
                }

                try {
                    values[c] = column.type().parse(raw);
                } catch (IllegalArgumentException e) {
                    throw new SchemaViolationException(schema.module(), column.name(), r,
                            "cannot parse '" + raw + "' as " + column.type());
                }
            }
            records.add(new TypedRecord(schema, values));
        }
        return Collections.unmodifiableList(records);
    }
}
