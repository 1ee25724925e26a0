package com.questrail.goldenbridge.schema;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SchemaValidatorTest
 * -----------------------------------------------------------------------------
 * Promotion of raw rows to typed records, and every way a raw table can fail
 * to fit its schema.
 */
final class SchemaValidatorTest
{
    private static final DumpSchema ELEMENT = DumpSchema.of("Element",
            Column.required("Z", ColumnType.INT),
            Column.required("symbol", ColumnType.STRING),
            Column.required("atomic_weight", ColumnType.DOUBLE),
            Column.nullable("ionization_energy", ColumnType.DOUBLE),
            Column.required("metal", ColumnType.BOOL));

    private final SchemaValidator validator = new SchemaValidator(SchemaRegistry.of(ELEMENT));

    private static RawTable table(List<String> header, List<String>... rows) {
        return new RawTable(header, List.of(rows));
    }

    private static final List<String> HEADER = List.of("Z", "symbol", "atomic_weight", "ionization_energy", "metal");

    @Test
    void validRowsBecomeTypedRecords()
    {
        List<TypedRecord> records = validator.validate("Element", table(HEADER,
                List.of("26", "Fe", "5.584500000000e+01", "7.902400000000e+00", "true"),
                List.of("118", "Og", "2.940000000000e+02", "", "TRUE")));

        assertEquals(2, records.size());
        TypedRecord fe = records.get(0);
        assertEquals(26, fe.intValue("Z"));
        assertEquals("Fe", fe.stringValue("symbol"));
        assertEquals(55.845, fe.doubleValue("atomic_weight"), 1e-12);
        assertTrue(fe.booleanValue("metal"));

        TypedRecord og = records.get(1);
        assertTrue(og.isNull("ionization_energy"));
        assertTrue(og.optionalDouble("ionization_energy").isEmpty());
    }

    @Test
    void headerOrderDoesNotMatter()
    {
        List<TypedRecord> records = validator.validate("Element", table(
                List.of("metal", "ionization_energy", "atomic_weight", "symbol", "Z"),
                List.of("false", "", "2.80855e+01", "Si", "14")));

        assertEquals("Si", records.get(0).stringValue("symbol"));
        assertEquals(14, records.get(0).intValue("Z"));
    }

    @Test
    void emptyTableValidatesToNoRecords()
    {
        assertEquals(List.of(), validator.validate("Element", RawTable.empty(HEADER)));
    }

    @Test
    void missingColumnIsNamed()
    {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", table(List.of("Z", "symbol", "ionization_energy", "metal"),
                        List.of("26", "Fe", "", "true"))));

        assertEquals(FailureKind.SCHEMA_DRIFT, e.kind());
        assertEquals("atomic_weight", e.column().orElseThrow());
        assertTrue(e.getMessage().contains("atomic_weight"), e.getMessage());
        assertTrue(e.rowIndex().isEmpty());
    }

    @Test
    void extraColumnIsNamed()
    {
        List<String> header = List.of("Z", "symbol", "atomic_weight", "ionization_energy", "metal", "density");
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", RawTable.empty(header)));
        assertEquals("density", e.column().orElseThrow());
    }

    @Test
    void nonNumericDoubleNamesColumnAndRow()
    {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", table(HEADER,
                        List.of("26", "Fe", "5.5845e+01", "", "true"),
                        List.of("79", "Au", "heavy", "", "true"))));

        assertEquals("atomic_weight", e.column().orElseThrow());
        assertEquals(1, e.rowIndex().getAsInt());
        assertTrue(e.getMessage().contains("row 1"), e.getMessage());
    }

    @Test
    void emptyValueInRequiredColumnIsRejected()
    {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", table(HEADER, List.of("26", "", "5.5845e+01", "", "true"))));
        assertEquals("symbol", e.column().orElseThrow());
        assertEquals(0, e.rowIndex().getAsInt());
    }

    @Test
    void invalidIntAndBoolAreRejected()
    {
        assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", table(HEADER, List.of("26.0", "Fe", "1", "", "true"))));
        assertThrows(SchemaViolationException.class, () ->
                validator.validate("Element", table(HEADER, List.of("26", "Fe", "1", "", "yes"))));
    }

    @Test
    void unknownModuleIsASchemaFailure()
    {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () ->
                validator.validate("AtomicShell", RawTable.empty(List.of("Z"))));
        assertEquals("AtomicShell", e.module());
    }

    @Test
    void forRequestPrefixesWireLine()
    {
        SchemaViolationException e = new SchemaViolationException("Element", "Z", 0, "bad");
        DumpRequest request = DumpRequest.parseWireLine("Element Z=26");

        SchemaViolationException attributed = e.forRequest(request);

        assertEquals("[Element Z=26] Schema violation in Element, column 'Z', row 0: bad", attributed.getMessage());
        assertEquals(request, attributed.request().orElseThrow());
        assertSame(e, attributed.getCause());
    }
}
