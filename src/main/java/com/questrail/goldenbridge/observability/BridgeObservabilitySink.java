package com.questrail.goldenbridge.observability;

/**
 * Receives golden bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the collection orchestrator changes phase.
     * @param event the transition details
     */
    void onPhaseTransition(PhaseTransitionEvent event);

    /**
     * Called after each oracle subprocess has finished, successfully or not.
     * @param event the invocation details
     */
    void onOracleInvocation(OracleInvocationEvent event);

    /**
     * Called when a collection or retrieval failure is detected.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
