package com.questrail.goldenbridge.session;

/**
 * Phases of {@link CollectionOrchestrator}.
 *
 * <pre>
 *   IDLE -&gt; SCANNING -&gt; DONE_EMPTY
 *                     -&gt; BATCHING -&gt; POPULATED -&gt; DONE
 *   (SCANNING | BATCHING) -&gt; FAILED
 * </pre>
 */
public enum OrchestratorPhase
{
    IDLE,
    SCANNING,
    /** No selected test needs oracle data; the oracle was never launched. */
    DONE_EMPTY,
    BATCHING,
    POPULATED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE_EMPTY || this == DONE || this == FAILED;
    }
}
