package com.questrail.goldenbridge.oracle;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.schema.DumpSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DumpContext
 * -----------------------------------------------------------------------------
 * Execution context of one module invocation: typed access to the request's
 * arguments and a row buffer.
 *
 * <p>Rows are held in memory until the module returns. A module that throws
 * half way therefore never puts a partial table on the wire.</p>
 */
public final class DumpContext
{
    private final DumpRequest request;
    private final DumpSchema schema;
    private final List<List<String>> rows = new ArrayList<>();

    public DumpContext(DumpRequest request, DumpSchema schema) {
        this.request = Objects.requireNonNull(request, "request");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public DumpRequest request() {
        return request;
    }

    public Map<String, String> args() {
        return request.argumentMap();
    }

    /**
     * @throws IllegalArgumentException if the argument is missing
     */
    public String get(String key) {
        return request.argument(key)
                .orElseThrow(() -> new IllegalArgumentException("Missing required argument: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return request.argument(key).orElse(defaultValue);
    }

    public int getInt(String key) {
        String value = get(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for argument '" + key + "': " + value);
        }
    }

    /**
     * Range-checked integer argument; {@code min} and {@code max} are inclusive.
     */
    public int getInt(String key, int min, int max) {
        int value = getInt(key);
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "Argument '" + key + "' value " + value + " is out of range [" + min + "-" + max + "]");
        }
        return value;
    }

    public double getDouble(String key) {
        String value = get(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for argument '" + key + "': " + value);
        }
    }

    public CsvRowBuilder newRow() {
        return new CsvRowBuilder(schema);
    }

    public void emit(CsvRowBuilder row) {
        rows.add(row.build());
    }

    /**
     * The buffered rows as a table with the schema's header.
     */
    RawTable table() {
        return new RawTable(schema.header(), rows);
    }
}
