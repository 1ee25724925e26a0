package com.questrail.goldenbridge.schema;

import java.util.Collection;

/**
 * Service interface through which a test suite contributes the schemas of the
 * dump modules it consumes.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.questrail.goldenbridge.schema.DumpSchemaProvider}
 * and collected by {@link SchemaRegistry#installed(ClassLoader)}.</p>
 */
public interface DumpSchemaProvider
{
    Collection<DumpSchema> schemas();
}
