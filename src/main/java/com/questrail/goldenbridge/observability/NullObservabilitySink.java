package com.questrail.goldenbridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {}

    @Override
    public void onOracleInvocation(OracleInvocationEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
