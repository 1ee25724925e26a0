package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.config.OracleBridgeConfig;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.observability.BridgeObservabilitySink;
import com.questrail.goldenbridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.goldenbridge.process.OracleClient;
import com.questrail.goldenbridge.process.OracleUnavailableException;
import com.questrail.goldenbridge.process.SubprocessOracleClient;
import com.questrail.goldenbridge.schema.SchemaRegistry;
import com.questrail.goldenbridge.session.OracleDependency;
import com.questrail.goldenbridge.session.OracleSession;
import org.junit.platform.engine.TestSource;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * OracleTestPlanListener
 * -----------------------------------------------------------------------------
 * Registered with the JUnit Platform launcher through
 * {@code META-INF/services}. When a test plan starts, it scans exactly the
 * tests selected for execution, runs collection once, and publishes the
 * session through {@link OracleSessions} until the plan finishes.
 *
 * <p>The platform does not let a listener abort a launch, so a collection
 * failure is kept in the session and rethrown by every dependent test.
 * Tests without an oracle dependency run normally.</p>
 *
 * <p>Configuration comes from the plan's configuration parameters
 * ({@code goldenbridge.oracle.*}); see {@link OracleBridgeConfig}.</p>
 */
public final class OracleTestPlanListener implements TestExecutionListener
{
    private static final Logger log = LoggerFactory.getLogger(OracleTestPlanListener.class);

    private final BridgeObservabilitySink sink;
    private OracleSession session;

    public OracleTestPlanListener() {
        this(new Slf4jBridgeObservabilitySink());
    }

    OracleTestPlanListener(BridgeObservabilitySink sink) {
        this.sink = sink;
    }

    @Override
    public void testPlanExecutionStarted(TestPlan testPlan) {
        final List<OracleDependency> dependencies = scan(testPlan);
        log.debug("Found {} oracle-backed test methods in the test plan", dependencies.size());

        session = newSession(testPlan);
        OracleSessions.push(session);
        try {
            session.collect(dependencies);
        } catch (RuntimeException e) {
            // Kept in the session; each dependent test rethrows it.
            log.debug("Oracle collection failed", e);
        }
    }

    @Override
    public void testPlanExecutionFinished(TestPlan testPlan) {
        if (session != null) {
            OracleSessions.remove(session);
            session = null;
        }
    }

    static List<OracleDependency> scan(TestPlan testPlan) {
        List<OracleDependency> dependencies = new ArrayList<>();
        Set<Method> seen = new HashSet<>();
        for (TestIdentifier root : testPlan.getRoots()) {
            for (TestIdentifier identifier : testPlan.getDescendants(root)) {
                Optional<TestSource> source = identifier.getSource();
                if (source.isEmpty() || !(source.get() instanceof MethodSource)) {
                    continue;
                }
                MethodSource methodSource = (MethodSource) source.get();
                final Method method;
                try {
                    method = methodSource.getJavaMethod();
                } catch (RuntimeException e) {
                    log.debug("Cannot resolve test method {}", methodSource, e);
                    continue;
                }
                if (!AnnotatedOracleDependency.isOracleTest(method)) {
                    continue;
                }
                if (!seen.add(method)) {
                    continue;
                }
                // Without a declaration the test fails itself with MissingDeclarationException.
                AnnotatedOracleDependency.find(methodSource.getJavaClass(), method)
                        .ifPresent(dependencies::add);
            }
        }
        return dependencies;
    }

    private OracleSession newSession(TestPlan testPlan) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        OracleClient client;
        SchemaRegistry schemas;
        try {
            OracleBridgeConfig config = OracleBridgeConfig.fromParameters(testPlan.getConfigurationParameters()::get);
            client = new SubprocessOracleClient(config, sink);
            schemas = SchemaRegistry.installed(loader != null ? loader : getClass().getClassLoader());
        } catch (RuntimeException e) {
            // Reported only if some selected test actually needs the oracle.
            client = new MisconfiguredClient(
                    new OracleUnavailableException("Invalid golden bridge configuration: " + e.getMessage(), e));
            schemas = SchemaRegistry.of();
        }
        return OracleSession.builder()
                .withClient(client)
                .withSchemas(schemas)
                .withObservabilitySink(sink)
                .build();
    }

    private static final class MisconfiguredClient implements OracleClient {
        private final OracleUnavailableException problem;

        MisconfiguredClient(OracleUnavailableException problem) {
            this.problem = problem;
        }

        @Override
        public Map<DumpRequest, RawTable> runBatch(Set<DumpRequest> requests) {
            throw problem;
        }

        @Override
        public RawTable runSingle(DumpRequest request) {
            throw problem;
        }
    }
}
