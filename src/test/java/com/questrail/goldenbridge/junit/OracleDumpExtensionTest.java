package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.cache.CacheMissException;
import com.questrail.goldenbridge.config.OracleBridgeConfig;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.process.OracleProcessException;
import com.questrail.goldenbridge.process.OracleUnavailableException;
import com.questrail.goldenbridge.session.MissingDeclarationException;
import com.questrail.goldenbridge.session.OrchestratorPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.junit.platform.engine.DiscoverySelector;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder;
import org.junit.platform.launcher.core.LauncherFactory;
import org.junit.platform.launcher.listeners.SummaryGeneratingListener;
import org.junit.platform.launcher.listeners.TestExecutionSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectMethod;

/**
 * OracleDumpExtensionTest
 * -----------------------------------------------------------------------------
 * Runs small scenario classes through a nested JUnit Platform launch, so that
 * {@link OracleTestPlanListener} collects for exactly the selected tests and
 * the reference oracle is launched for real.
 *
 * <p>The scenario classes are static nested classes; Surefire and the
 * Jupiter class selector for this class do not pick them up on their own.</p>
 */
final class OracleDumpExtensionTest
{
    static final List<RawTable> TABLES = Collections.synchronizedList(new ArrayList<>());
    static final List<Integer> CACHE_SIZES = Collections.synchronizedList(new ArrayList<>());
    static final List<String> NAMES = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void reset()
    {
        TABLES.clear();
        CACHE_SIZES.clear();
        NAMES.clear();
    }

    private static TestExecutionSummary launch(DiscoverySelector selector, Map<String, String> parameters)
    {
        LauncherDiscoveryRequest request = LauncherDiscoveryRequestBuilder.request()
                .selectors(selector)
                .configurationParameters(parameters)
                .build();
        SummaryGeneratingListener summary = new SummaryGeneratingListener();
        LauncherFactory.create().execute(request, summary);
        return summary.getSummary();
    }

    private static Throwable onlyFailure(TestExecutionSummary summary)
    {
        assertEquals(1, summary.getFailures().size(), () -> summary.getFailures().toString());
        return summary.getFailures().get(0).getException();
    }

    // ---------------------------------------------------------------------
    // Scenarios
    // ---------------------------------------------------------------------

    @OracleDump("XRayTransition")
    static class ArgumentOrderScenario
    {
        @OracleTest
        @OracleCase("Z=26 trans=1")
        void zThenTrans(OracleResult result, @OracleArg("Z") int z)
        {
            assertEquals(26, z);
            record(result);
        }

        @OracleTest
        @OracleParam(name = "trans", values = "1")
        @OracleParam(name = "Z", values = "26")
        void transThenZ(OracleResult result, @OracleArg("trans") long trans)
        {
            assertEquals(1L, trans);
            record(result);
        }

        private static void record(OracleResult result)
        {
            TABLES.add(result.table());
            CACHE_SIZES.add(OracleSessions.current().orElseThrow().cache().size());
            assertEquals(6390.84, result.single().doubleValue("energy_eV"), 1e-9);
        }
    }

    @OracleDump("XRayTransition")
    @OracleParam(name = "Z", values = {"26", "29"})
    static class GridScenario
    {
        @OracleTest(name = "{module} {arguments}")
        @OracleCase("trans=0")
        @OracleCase("trans=2")
        void everyCombination(OracleResult result, TestInfo info, @OracleArg("Z") String z)
        {
            NAMES.add(info.getDisplayName());
            assertEquals(z, result.request().argument("Z").orElseThrow());
            assertFalse(result.isEmpty());
        }
    }

    static class DependentAndIndependentScenario
    {
        @OracleTest
        @OracleDump("Element")
        @OracleParam(name = "Z", values = {"26", "200"})
        void element(OracleResult result)
        {
            assertFalse(result.isEmpty());
        }

        @Test
        void plain()
        {
            assertTrue(OracleSessions.current().isPresent());
        }

        @Test
        void noOracleNeeded()
        {
            assertEquals(OrchestratorPhase.DONE_EMPTY, OracleSessions.current().orElseThrow().phase());
        }
    }

    static class UndeclaredScenario
    {
        @OracleTest
        @OracleParam(name = "Z", values = "26")
        void forgotTheModule(OracleResult result)
        {
            fail("must not run");
        }
    }

    // ---------------------------------------------------------------------
    // Tests
    // ---------------------------------------------------------------------

    @Test
    void argumentOrderResolvesToOneCachedTable()
    {
        TestExecutionSummary summary = launch(selectClass(ArgumentOrderScenario.class), Map.of());

        assertEquals(2, summary.getTestsSucceededCount(), () -> summary.getFailures().toString());
        assertEquals(0, summary.getTotalFailureCount());
        assertEquals(2, TABLES.size());
        assertSame(TABLES.get(0), TABLES.get(1));
        assertEquals(List.of(1, 1), CACHE_SIZES);
        assertTrue(OracleSessions.current().isEmpty() || OracleSessions.current().get().phase().isTerminal());
    }

    @Test
    void casesAndClassLevelParametersMultiply()
    {
        TestExecutionSummary summary = launch(selectClass(GridScenario.class), Map.of());

        assertEquals(4, summary.getTestsSucceededCount(), () -> summary.getFailures().toString());
        assertEquals(List.of(
                "XRayTransition trans=0 Z=26",
                "XRayTransition trans=0 Z=29",
                "XRayTransition trans=2 Z=26",
                "XRayTransition trans=2 Z=29"), NAMES);
    }

    @Test
    void unavailableOracleFailsOnlyDependentTests()
    {
        TestExecutionSummary summary = launch(selectClass(DependentAndIndependentScenario.class),
                Map.of(OracleBridgeConfig.COMMAND, "/nonexistent/oracle"));

        assertEquals(1, summary.getTestsSucceededCount());
        assertEquals(2, summary.getTotalFailureCount(), () -> summary.getFailures().toString());
        summary.getFailures().stream()
                .filter(f -> !f.getTestIdentifier().getDisplayName().startsWith("noOracleNeeded"))
                .forEach(f -> assertInstanceOf(OracleUnavailableException.class, f.getException()));
    }

    @Test
    void strictBatchFailureReachesTheDependentTest()
    {
        TestExecutionSummary summary = launch(
                selectMethod(DependentAndIndependentScenario.class, "element", OracleResult.class.getName()),
                Map.of());

        OracleProcessException e = assertInstanceOf(OracleProcessException.class, onlyFailure(summary));
        assertTrue(e.getMessage().contains("Argument 'Z' value 200 is out of range [1-118]"), e.getMessage());
    }

    @Test
    void lenientBatchTurnsAMissingFrameIntoACacheMiss()
    {
        TestExecutionSummary summary = launch(
                selectMethod(DependentAndIndependentScenario.class, "element", OracleResult.class.getName()),
                Map.of(OracleBridgeConfig.LENIENT, "true"));

        assertEquals(1, summary.getTestsSucceededCount());
        CacheMissException e = assertInstanceOf(CacheMissException.class, onlyFailure(summary));
        assertTrue(e.getMessage().contains("[Element Z=200]"), e.getMessage());
    }

    @Test
    void oracleIsNotLaunchedWhenNoSelectedTestNeedsIt()
    {
        TestExecutionSummary summary = launch(
                selectMethod(DependentAndIndependentScenario.class, "noOracleNeeded"),
                Map.of(OracleBridgeConfig.COMMAND, "/nonexistent/oracle"));

        assertEquals(1, summary.getTestsSucceededCount());
        assertEquals(0, summary.getTotalFailureCount(), () -> summary.getFailures().toString());
    }

    @Test
    void undeclaredModuleIsAUsageError()
    {
        TestExecutionSummary summary = launch(selectClass(UndeclaredScenario.class), Map.of());

        assertInstanceOf(MissingDeclarationException.class, onlyFailure(summary));
    }
}
