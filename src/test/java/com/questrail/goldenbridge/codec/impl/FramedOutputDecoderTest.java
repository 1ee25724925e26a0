package com.questrail.goldenbridge.codec.impl;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.codec.FrameProtocolException;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FramedOutputDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link FramedOutputDecoder}.
 *
 * <ul>
 *   <li>frame boundaries and request reconstruction</li>
 *   <li>empty tables versus missing frames</li>
 *   <li>structural errors raised as {@link FrameProtocolException}</li>
 * </ul>
 */
final class FramedOutputDecoderTest
{
    private final FramedOutputDecoder decoder = new FramedOutputDecoder();

    @Test
    void decodesConsecutiveFrames()
    {
        String output = ""
                + "#BEGIN dump=Element Z=26\n"
                + "Z,symbol\n"
                + "26,Fe\n"
                + "#END\n"
                + "\n"
                + "#BEGIN dump=Element Z=79\n"
                + "Z,symbol\n"
                + "79,Au\n"
                + "#END\n"
                + "\n";

        Map<DumpRequest, RawTable> tables = decoder.decode(output);

        assertEquals(2, tables.size());
        RawTable fe = tables.get(DumpRequest.parseWireLine("Element Z=26"));
        assertEquals(List.of("Z", "symbol"), fe.header());
        assertEquals(List.of(List.of("26", "Fe")), fe.rows());
        assertEquals("Au", tables.get(DumpRequest.parseWireLine("Element Z=79")).row(0).get("symbol"));
    }

    @Test
    void markerEchoInAnyOrderMapsToCanonicalRequest()
    {
        String output = "#BEGIN dump=XRayTransition trans=1 Z=26\nZ,trans\n26,1\n#END\n";

        Map<DumpRequest, RawTable> tables = decoder.decode(output);

        assertTrue(tables.containsKey(DumpRequest.parseWireLine("XRayTransition Z=26 trans=1")));
    }

    @Test
    void headerWithoutRowsIsAnEmptyTable()
    {
        Map<DumpRequest, RawTable> tables =
                decoder.decode("#BEGIN dump=XRayTransition Z=1 trans=0\nZ,trans,energy_eV\n#END\n");

        RawTable table = tables.get(DumpRequest.parseWireLine("XRayTransition Z=1 trans=0"));
        assertNotNull(table);
        assertTrue(table.isEmpty());
        assertEquals(3, table.header().size());
    }

    @Test
    void emptyFieldsArePreserved()
    {
        RawTable table = decoder.decode("#BEGIN dump=Element Z=118\nZ,ionization_energy,name\n118,,Og\n#END\n")
                .values().iterator().next();
        assertEquals(List.of("118", "", "Og"), table.rows().get(0));
    }

    @Test
    void crlfLineEndingsAreAccepted()
    {
        Map<DumpRequest, RawTable> tables = decoder.decode("#BEGIN dump=Element Z=26\r\nZ\r\n26\r\n#END\r\n");
        assertEquals(List.of("26"), tables.values().iterator().next().rows().get(0));
    }

    @Test
    void strayLinesOutsideFramesAreSkipped()
    {
        String output = "Picked up JAVA_TOOL_OPTIONS\n#BEGIN dump=Element Z=26\nZ\n26\n#END\ntrailing noise\n";
        assertEquals(1, decoder.decode(output).size());
    }

    @Test
    void emptyOutputHasNoFrames()
    {
        assertTrue(decoder.decode("").isEmpty());
    }

    @Test
    void unterminatedFrameIsRejected()
    {
        FrameProtocolException e = assertThrows(FrameProtocolException.class,
                () -> decoder.decode("#BEGIN dump=Element Z=26\nZ\n26\n"));
        assertEquals(FailureKind.INFRASTRUCTURE, e.kind());
        assertEquals(1, e.lineNumber());
    }

    @Test
    void fieldCountMismatchIsRejected()
    {
        FrameProtocolException e = assertThrows(FrameProtocolException.class,
                () -> decoder.decode("#BEGIN dump=Element Z=26\nZ,symbol\n26,Fe,extra\n#END\n"));
        assertEquals(3, e.lineNumber());
    }

    @Test
    void endWithoutBeginIsRejected()
    {
        assertThrows(FrameProtocolException.class, () -> decoder.decode("#END\n"));
    }

    @Test
    void nestedBeginIsRejected()
    {
        assertThrows(FrameProtocolException.class,
                () -> decoder.decode("#BEGIN dump=Element Z=26\nZ\n#BEGIN dump=Element Z=79\n#END\n"));
    }

    @Test
    void frameWithoutHeaderIsRejected()
    {
        assertThrows(FrameProtocolException.class, () -> decoder.decode("#BEGIN dump=Element Z=26\n#END\n"));
    }

    @Test
    void duplicateFrameIsRejected()
    {
        String frame = "#BEGIN dump=Element Z=26\nZ\n26\n#END\n";
        assertThrows(FrameProtocolException.class, () -> decoder.decode(frame + frame));
    }

    @Test
    void malformedMarkerIsRejected()
    {
        assertThrows(FrameProtocolException.class, () -> decoder.decode("#BEGIN dump=Element Z\nZ\n#END\n"));
        assertThrows(FrameProtocolException.class, () -> decoder.decode("#BEGIN Element Z=26\nZ\n#END\n"));
    }

    @Test
    void duplicateHeaderColumnIsRejected()
    {
        assertThrows(FrameProtocolException.class,
                () -> decoder.decode("#BEGIN dump=Element Z=26\nZ,Z\n26,26\n#END\n"));
    }
}
