package com.questrail.goldenbridge.schema;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Primitive column types of the oracle protocol, with their wire rendering.
 *
 * <p>{@link #format(Object)} is used by the oracle side and {@link #parse(String)}
 * by the client side; both sides therefore agree on one representation. The
 * empty string is reserved for null and is handled by callers, never here.</p>
 */
public enum ColumnType
{
    STRING(String.class) {
        @Override
        public Object parse(String raw) {
            return raw;
        }

        @Override
        String render(Object value) {
            return value.toString();
        }
    },

    INT(Integer.class) {
        @Override
        public Object parse(String raw) {
            return Integer.parseInt(raw.trim());
        }

        @Override
        String render(Object value) {
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return Integer.toString(((Number) value).intValue());
            }
            if (value instanceof Long) {
                return Integer.toString(Math.toIntExact((Long) value));
            }
            throw new IllegalArgumentException("Not an integer: " + value.getClass().getName());
        }
    },

    /**
     * Fixed scientific notation, 12 fractional digits, {@link Locale#ROOT}.
     * The precision must stay finer than any tolerance used by comparisons
     * downstream.
     */
    DOUBLE(Double.class) {
        @Override
        public Object parse(String raw) {
            final String s = raw.trim();
            if (!DECIMAL.matcher(s).matches()) {
                throw new IllegalArgumentException("Not a decimal number: '" + raw + "'");
            }
            return Double.parseDouble(s);
        }

        @Override
        String render(Object value) {
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Not a number: " + value.getClass().getName());
            }
            return String.format(Locale.ROOT, "%.12e", ((Number) value).doubleValue());
        }
    },

    BOOL(Boolean.class) {
        @Override
        public Object parse(String raw) {
            final String s = raw.trim();
            if (s.equalsIgnoreCase("true")) {
                return Boolean.TRUE;
            }
            if (s.equalsIgnoreCase("false")) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Not a boolean: '" + raw + "'");
        }

        @Override
        String render(Object value) {
            if (!(value instanceof Boolean)) {
                throw new IllegalArgumentException("Not a boolean: " + value.getClass().getName());
            }
            return value.toString();
        }
    };

    /** Plain or scientific decimal; no type suffixes, no hex. */
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(NaN|Infinity)");

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Boxed Java type produced by {@link #parse(String)}.
     */
    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Parses a non-empty raw field.
     *
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    public abstract Object parse(String raw);

    /**
     * Renders a value for the wire; {@code null} renders as the empty field.
     *
     * @throws IllegalArgumentException if the value does not belong to this type
     */
    public String format(Object value) {
        return value == null ? "" : render(value);
    }

    abstract String render(Object value);
}
