package com.questrail.goldenbridge.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * SchemaRegistry
 * -----------------------------------------------------------------------------
 * Explicit, immutable association of dump module names to their schemas.
 *
 * <p>The registry is passed to the {@link SchemaValidator}; nothing is looked
 * up by class name or discovered implicitly at validation time.</p>
 */
public final class SchemaRegistry
{
    private final Map<String, DumpSchema> schemas;

    private SchemaRegistry(Map<String, DumpSchema> schemas) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    /**
     * Builds a registry from every {@link DumpSchemaProvider} visible to
     * {@code classLoader}.
     *
     * @throws IllegalArgumentException if two providers declare the same module
     */
    public static SchemaRegistry installed(ClassLoader classLoader) {
        Builder builder = builder();
        for (DumpSchemaProvider provider : ServiceLoader.load(DumpSchemaProvider.class, classLoader)) {
            provider.schemas().forEach(builder::register);
        }
        return builder.build();
    }

    public static SchemaRegistry of(DumpSchema... schemas) {
        Builder builder = builder();
        for (DumpSchema schema : schemas) {
            builder.register(schema);
        }
        return builder.build();
    }

    public Optional<DumpSchema> find(String module) {
        return Optional.ofNullable(schemas.get(module));
    }

    /**
     * @throws SchemaViolationException if no schema is registered for {@code module}
     */
    public DumpSchema require(String module) {
        DumpSchema schema = schemas.get(module);
        if (schema == null) {
            throw SchemaViolationException.unknownModule(module);
        }
        return schema;
    }

    public Set<String> modules() {
        return schemas.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, DumpSchema> schemas = new LinkedHashMap<>();

        public Builder register(DumpSchema schema) {
            Objects.requireNonNull(schema, "schema");
            DumpSchema previous = schemas.putIfAbsent(schema.module(), schema);
            if (previous != null && !previous.equals(schema)) {
                throw new IllegalArgumentException(
                        "Conflicting schemas registered for module " + schema.module());
            }
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(schemas);
        }
    }
}
