package com.questrail.goldenbridge.golden;

import com.questrail.goldenbridge.junit.OracleArg;
import com.questrail.goldenbridge.junit.OracleCase;
import com.questrail.goldenbridge.junit.OracleDump;
import com.questrail.goldenbridge.junit.OracleParam;
import com.questrail.goldenbridge.junit.OracleResult;
import com.questrail.goldenbridge.junit.OracleTest;
import com.questrail.goldenbridge.schema.TypedRecord;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Element properties checked against the reference oracle. The local tables
 * stand in for a reimplementation under test.
 */
@OracleDump("Element")
final class ElementGoldenTest
{
    private static final double DALTON_KG = 1.66053906660e-27;

    private static final Map<Integer, String> SYMBOLS = Map.of(
            14, "Si",
            26, "Fe",
            29, "Cu",
            79, "Au");

    public record Element(String symbol, String name, double atomicWeight, double massInKg, Double ionizationEnergy) {}

    @OracleTest
    @OracleParam(name = "Z", values = {"26", "79"})
    void symbolMatches(OracleResult expected, @OracleArg("Z") int z)
    {
        TypedRecord row = expected.single();

        assertEquals(z, row.intValue("Z"));
        assertEquals(SYMBOLS.get(z), row.stringValue("symbol"));
    }

    @OracleTest
    @OracleParam(name = "Z", values = {"14", "26", "29", "79"})
    void massFollowsAtomicWeight(OracleResult expected)
    {
        Element element = expected.as(Element.class).get(0);

        assertEquals(element.atomicWeight() * DALTON_KG, element.massInKg(), element.massInKg() * 1e-12);
    }

    @OracleTest
    @OracleCase("Z=118")
    void superheavyElementHasNoIonizationEnergy(OracleResult expected)
    {
        Element element = expected.as(Element.class).get(0);

        assertEquals("Og", element.symbol());
        assertNull(element.ionizationEnergy());
        assertTrue(expected.single().optionalDouble("ionization_energy").isEmpty());
    }
}
