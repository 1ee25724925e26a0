package com.questrail.goldenbridge.observability;

import com.questrail.goldenbridge.session.OrchestratorPhase;

import java.time.Instant;

/**
 * Record representing a phase change of the collection orchestrator.
 *
 * @param requestCount number of unique requests known at the time of the transition
 */
public record PhaseTransitionEvent(
    Instant timestamp,
    OrchestratorPhase from,
    OrchestratorPhase to,
    int requestCount
) {
}
