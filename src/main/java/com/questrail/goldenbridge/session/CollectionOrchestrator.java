package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.cache.ResultCache;
import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.observability.BridgeErrorEvent;
import com.questrail.goldenbridge.observability.BridgeObservabilitySink;
import com.questrail.goldenbridge.observability.PhaseTransitionEvent;
import com.questrail.goldenbridge.process.OracleClient;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CollectionOrchestrator
 * -----------------------------------------------------------------------------
 * Runs once per session, before any test body: gathers every request the
 * selected tests will need, resolves them with a single oracle invocation and
 * populates the {@link ResultCache}.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Equal requests from different tests are batched once.</li>
 *   <li>With no requests the oracle client is not called at all.</li>
 *   <li>Any failure moves to {@link OrchestratorPhase#FAILED} and is rethrown;
 *       nothing is cached.</li>
 * </ul>
 */
public final class CollectionOrchestrator
{
    private final OracleClient client;
    private final ResultCache cache;
    private final BridgeObservabilitySink sink;

    private OrchestratorPhase phase = OrchestratorPhase.IDLE;
    private Set<DumpRequest> requests = Set.of();

    public CollectionOrchestrator(OracleClient client, ResultCache cache, BridgeObservabilitySink sink) {
        this.client = Objects.requireNonNull(client, "client");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @return the unique requests that were batched (empty for DONE_EMPTY)
     * @throws IllegalStateException if called more than once
     */
    public synchronized Set<DumpRequest> collect(Iterable<? extends OracleDependency> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies");
        if (phase != OrchestratorPhase.IDLE) {
            throw new IllegalStateException("Collection already ran; phase is " + phase);
        }

        transition(OrchestratorPhase.SCANNING, 0);
        Set<DumpRequest> unique = new LinkedHashSet<>();
        try {
            for (OracleDependency dependency : dependencies) {
                for (List<DumpArgument> invocation : dependency.invocations()) {
                    unique.add(DumpRequest.build(dependency.module(), invocation));
                }
            }
        } catch (RuntimeException e) {
            throw fail(e, unique.size());
        }
        requests = Collections.unmodifiableSet(unique);

        if (requests.isEmpty()) {
            transition(OrchestratorPhase.DONE_EMPTY, 0);
            return requests;
        }

        transition(OrchestratorPhase.BATCHING, requests.size());
        try {
            Map<DumpRequest, RawTable> results = client.runBatch(requests);
            cache.populate(results);
        } catch (RuntimeException e) {
            throw fail(e, requests.size());
        }
        transition(OrchestratorPhase.POPULATED, requests.size());
        transition(OrchestratorPhase.DONE, requests.size());
        return requests;
    }

    public synchronized OrchestratorPhase phase() {
        return phase;
    }

    public synchronized Set<DumpRequest> requests() {
        return requests;
    }

    private RuntimeException fail(RuntimeException e, int requestCount) {
        transition(OrchestratorPhase.FAILED, requestCount);
        sink.onError(new BridgeErrorEvent(Instant.now(),
                "Oracle collection failed: " + e.getMessage(), e));
        return e;
    }

    private void transition(OrchestratorPhase next, int requestCount) {
        OrchestratorPhase previous = phase;
        phase = next;
        sink.onPhaseTransition(new PhaseTransitionEvent(Instant.now(), previous, next, requestCount));
    }
}
