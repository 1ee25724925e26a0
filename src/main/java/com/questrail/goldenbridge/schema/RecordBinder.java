package com.questrail.goldenbridge.schema;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import java.util.Objects;

/**
 * RecordBinder
 * -----------------------------------------------------------------------------
 * Binds a {@link TypedRecord} to a caller-defined Java {@code record}, so
 * assertions can read {@code row.atomicWeight()} instead of
 * {@code row.doubleValue("atomic_weight")}.
 *
 * <p>Each record component is matched to a column by exact name, or else by the
 * camelCase form of a snake_case column name ({@code edge_energy_eV} binds to
 * {@code edgeEnergyEV}). A component may use the primitive or boxed form of the
 * column type; a nullable column that is null requires the boxed form.</p>
 *
 * <p>Only public records can be bound; a nested record may sit inside a
 * package-private test class as long as the record itself is public.</p>
 */
public final class RecordBinder
{
    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            int.class, Integer.class,
            double.class, Double.class,
            boolean.class, Boolean.class);

    private RecordBinder() {}

    public static <R extends Record> R bind(TypedRecord source, Class<R> type) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");

        if (!Modifier.isPublic(type.getModifiers())) {
            throw new IllegalArgumentException("Record " + type.getName() + " must be public to be bound");
        }

        final DumpSchema schema = source.schema();
        final RecordComponent[] components = type.getRecordComponents();
        final Class<?>[] parameterTypes = new Class<?>[components.length];
        final Object[] arguments = new Object[components.length];

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();

            int index = columnFor(schema, component.getName());
            if (index < 0) {
                throw new IllegalArgumentException(
                        "No column of " + schema.module() + " matches component '"
                                + component.getName() + "' of " + type.getSimpleName());
            }

            Column column = schema.columns().get(index);
            Class<?> boxed = BOXES.getOrDefault(component.getType(), component.getType());
            if (!boxed.equals(column.type().javaType())) {
                throw new IllegalArgumentException(
                        "Component '" + component.getName() + "' of " + type.getSimpleName()
                                + " is " + component.getType().getSimpleName()
                                + " but column '" + column.name() + "' is " + column.type());
            }

            Object value = source.rawValue(index);
            if (value == null && component.getType().isPrimitive()) {
                throw new SchemaViolationException(schema.module(), column.name(), -1,
                        "null value cannot bind to primitive component '" + component.getName() + "'");
            }
            arguments[i] = value;
        }

        try {
            Constructor<R> constructor = type.getConstructor(parameterTypes);
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new IllegalArgumentException(
                    "Constructor of " + type.getSimpleName() + " rejected " + source, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate " + type.getName(), e);
        }
    }

    private static int columnFor(DumpSchema schema, String componentName) {
        int exact = schema.indexOf(componentName);
        if (exact >= 0) {
            return exact;
        }
        for (int i = 0; i < schema.columns().size(); i++) {
            if (toCamelCase(schema.columns().get(i).name()).equals(componentName)) {
                return i;
            }
        }
        return -1;
    }

    static String toCamelCase(String snake) {
        StringBuilder sb = new StringBuilder(snake.length());
        boolean upper = false;
        for (int i = 0; i < snake.length(); i++) {
            char c = snake.charAt(i);
            if (c == '_') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }
}
