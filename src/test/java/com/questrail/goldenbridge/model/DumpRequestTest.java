package com.questrail.goldenbridge.model;

import com.questrail.goldenbridge.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DumpRequestTest
 * -----------------------------------------------------------------------------
 * Canonical form, identity and wire-line parsing of {@link DumpRequest}.
 */
final class DumpRequestTest
{
    @Test
    void permutationsShareWireLineAndIdentity()
    {
        DumpRequest ba = DumpRequest.of("X", DumpArgument.of("b", "2"), DumpArgument.of("a", "1"));
        DumpRequest ab = DumpRequest.of("X", DumpArgument.of("a", "1"), DumpArgument.of("b", "2"));

        assertEquals("X a=1 b=2", ba.toWireLine());
        assertEquals("X a=1 b=2", ab.toWireLine());
        assertEquals(ab, ba);
        assertEquals(ab.hashCode(), ba.hashCode());
    }

    @Test
    void allPermutationsOfThreeArgumentsCollapse()
    {
        List<DumpArgument> arguments = new ArrayList<>(List.of(
                DumpArgument.of("trans", 3), DumpArgument.of("Z", 26), DumpArgument.of("E0", "20.0")));
        Set<DumpRequest> seen = new HashSet<>();
        for (int i = 0; i < 6; i++) {
            Collections.rotate(arguments, 1);
            if (i == 3) {
                Collections.swap(arguments, 0, 1);
            }
            seen.add(DumpRequest.build("XRayTransition", arguments));
        }
        assertEquals(1, seen.size());
        assertEquals("XRayTransition E0=20.0 Z=26 trans=3", seen.iterator().next().toWireLine());
    }

    @Test
    void moduleParticipatesInIdentity()
    {
        assertNotEquals(
                DumpRequest.of("Element", DumpArgument.of("Z", 26)),
                DumpRequest.of("AtomicShell", DumpArgument.of("Z", 26)));
    }

    @Test
    void requestWithoutArgumentsIsJustTheModule()
    {
        assertEquals("Element", DumpRequest.of("Element").toWireLine());
    }

    @Test
    void duplicateKeyIsRejected()
    {
        DuplicateArgumentException e = assertThrows(DuplicateArgumentException.class, () ->
                DumpRequest.of("Element", DumpArgument.of("Z", 26), DumpArgument.of("Z", 79)));
        assertEquals("Z", e.key());
        assertEquals("Element", e.module());
        assertEquals(FailureKind.USAGE, e.kind());
    }

    @Test
    void fromPairsCoercesValuesToStrings()
    {
        DumpRequest request = DumpRequest.fromPairs("XRayTransition", List.of(
                new AbstractMap.SimpleEntry<>("trans", 1),
                Map.entry("Z", 26)));

        assertEquals("XRayTransition Z=26 trans=1", request.toWireLine());
        assertEquals("26", request.argument("Z").orElseThrow());
        assertTrue(request.argument("E0").isEmpty());
    }

    @Test
    void parseWireLineCanonicalizesEchoOrder()
    {
        DumpRequest parsed = DumpRequest.parseWireLine("XRayTransition trans=1  Z=26\r");
        assertEquals("XRayTransition Z=26 trans=1", parsed.toWireLine());
        assertEquals(List.of("Z", "trans"), new ArrayList<>(parsed.argumentMap().keySet()));
    }

    @Test
    void parseRejectsMalformedTokens()
    {
        assertThrows(InvalidRequestException.class, () -> DumpRequest.parseWireLine("   "));
        assertThrows(InvalidRequestException.class, () -> DumpRequest.parseWireLine("Element Z"));
        assertThrows(InvalidRequestException.class, () -> DumpRequest.parseWireLine("Element =26"));
        assertThrows(InvalidRequestException.class, () -> DumpRequest.parseWireLine("Element Z="));
        assertThrows(InvalidRequestException.class, () -> DumpRequest.parseWireLine("Element Z=2=6"));
    }

    @Test
    void argumentTokensMustStayOnOneWireToken()
    {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> DumpArgument.of("Z", "2 6"));
        assertTrue(e.getMessage().contains("whitespace"), e.getMessage());
        assertThrows(InvalidRequestException.class, () -> DumpRequest.of("Ele ment"));
    }

    @Test
    void ordersByWireLine()
    {
        DumpRequest a = DumpRequest.of("Element", DumpArgument.of("Z", 26));
        DumpRequest b = DumpRequest.of("Element", DumpArgument.of("Z", 79));
        assertTrue(a.compareTo(b) < 0);
        assertEquals(0, a.compareTo(DumpRequest.parseWireLine("Element Z=26")));
    }
}
