package com.questrail.goldenbridge.schema;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * TypedRecord
 * -----------------------------------------------------------------------------
 * One validated result row. Every declared column of the schema is present,
 * holds a value of the column's {@link ColumnType#javaType()}, and is
 * {@code null} only if the column is nullable.
 *
 * <p>Accessors fail with {@link IllegalArgumentException} for an unknown
 * column or a column of a different type, and with
 * {@link IllegalStateException} when a non-optional accessor meets a null.</p>
 */
public final class TypedRecord
{
    private final DumpSchema schema;
    private final Object[] values;

    TypedRecord(DumpSchema schema, Object[] values) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.values = values.clone();
    }

    public DumpSchema schema() {
        return schema;
    }

    public Optional<Object> value(String column) {
        return Optional.ofNullable(values[index(column)]);
    }

    public boolean isNull(String column) {
        return values[index(column)] == null;
    }

    public String stringValue(String column) {
        return (String) required(column, ColumnType.STRING);
    }

    public int intValue(String column) {
        return (Integer) required(column, ColumnType.INT);
    }

    public double doubleValue(String column) {
        return (Double) required(column, ColumnType.DOUBLE);
    }

    public boolean booleanValue(String column) {
        return (Boolean) required(column, ColumnType.BOOL);
    }

    public Optional<Double> optionalDouble(String column) {
        checkType(column, ColumnType.DOUBLE);
        return Optional.ofNullable((Double) values[index(column)]);
    }

    public Optional<Boolean> optionalBoolean(String column) {
        checkType(column, ColumnType.BOOL);
        return Optional.ofNullable((Boolean) values[index(column)]);
    }

    /**
     * Binds this record to a Java record class; see {@link RecordBinder}.
     */
    public <R extends Record> R as(Class<R> type) {
        return RecordBinder.bind(this, type);
    }

    Object rawValue(int index) {
        return values[index];
    }

    private Object required(String column, ColumnType type) {
        checkType(column, type);
        Object value = values[index(column)];
        if (value == null) {
            throw new IllegalStateException(
                    "Column '" + column + "' of " + schema.module() + " is null");
        }
        return value;
    }

    private void checkType(String column, ColumnType type) {
        ColumnType declared = schema.columns().get(index(column)).type();
        if (declared != type) {
            throw new IllegalArgumentException(
                    "Column '" + column + "' of " + schema.module() + " is " + declared + ", not " + type);
        }
    }

    private int index(String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "Unknown column '" + column + "' for " + schema.module());
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedRecord)) {
            return false;
        }
        TypedRecord other = (TypedRecord) o;
        return schema.equals(other.schema) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(schema.module()).append('{');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(schema.columns().get(i).name()).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
