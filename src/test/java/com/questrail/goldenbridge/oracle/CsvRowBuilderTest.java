package com.questrail.goldenbridge.oracle;

import com.questrail.goldenbridge.schema.Column;
import com.questrail.goldenbridge.schema.ColumnType;
import com.questrail.goldenbridge.schema.DumpSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CsvRowBuilderTest
{
    private static final DumpSchema SCHEMA = DumpSchema.of("AtomicShell",
            Column.required("Z", ColumnType.INT),
            Column.required("shell", ColumnType.STRING),
            Column.nullable("edge_energy", ColumnType.DOUBLE),
            Column.required("occupied", ColumnType.BOOL));

    @Test
    void rendersInSchemaOrderRegardlessOfSetOrder()
    {
        List<String> row = new CsvRowBuilder(SCHEMA)
                .set("occupied", true)
                .set("edge_energy", 7112.0)
                .set("shell", "K")
                .set("Z", 26)
                .build();

        assertEquals(List.of("26", "K", "7.112000000000e+03", "true"), row);
    }

    @Test
    void unsetNullableColumnIsEmpty()
    {
        List<String> row = new CsvRowBuilder(SCHEMA).set("Z", 1).set("shell", "K").set("occupied", false).build();
        assertEquals("", row.get(2));
    }

    @Test
    void rejectsUnknownColumnsAndMisplacedNulls()
    {
        CsvRowBuilder builder = new CsvRowBuilder(SCHEMA);
        assertThrows(IllegalArgumentException.class, () -> builder.set("density", 7.87));
        assertThrows(IllegalStateException.class, () -> builder.set("Z", null));
        assertThrows(IllegalArgumentException.class, () -> builder.set("Z", "26"));
    }

    @Test
    void missingRequiredColumnFailsAtBuild()
    {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new CsvRowBuilder(SCHEMA).set("Z", 26).build());
        assertTrue(e.getMessage().contains("shell"), e.getMessage());
    }
}
