package com.questrail.goldenbridge.observability;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;
import com.questrail.goldenbridge.session.OrchestratorPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {
        if (event.to() == OrchestratorPhase.BATCHING) {
            log.info("[Oracle] Invoking oracle for {} unique dumps...", event.requestCount());
        } else if (event.to() == OrchestratorPhase.DONE_EMPTY) {
            log.debug("[Oracle] No oracle-backed tests selected; oracle not started");
        } else {
            log.debug("Oracle collection phase: {} -> {}", event.from(), event.to());
        }
    }

    @Override
    public void onOracleInvocation(OracleInvocationEvent event) {
        if (event.succeeded()) {
            log.info("[Oracle] {} run finished: {} requests, {} tables in {} ms",
                event.mode(), event.requestCount(), event.frameCount(), event.elapsed().toMillis());
        } else {
            log.warn("[Oracle] {} run failed with exit code {} after {} ms",
                event.mode(), event.exitCode(), event.elapsed().toMillis());
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        // Infrastructure failures carry the oracle's stderr in the message; a stack trace adds nothing.
        if (event.cause() instanceof OracleBridgeException
                && ((OracleBridgeException) event.cause()).kind() == FailureKind.INFRASTRUCTURE) {
            log.error("[Oracle] {}", event.message());
        } else {
            log.error("[Oracle] {}", event.message(), event.cause());
        }
    }
}
