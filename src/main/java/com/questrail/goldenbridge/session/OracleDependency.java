package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.model.DumpArgument;

import java.util.List;
import java.util.Objects;

/**
 * What a test needs from the oracle: one module, and every concrete argument
 * combination it will be invoked with.
 *
 * <p>Host-framework adapters produce these from their own declaration and
 * parametrization mechanisms; the orchestrator knows nothing else about tests.</p>
 */
public interface OracleDependency
{
    String module();

    /**
     * Argument combinations, one per test invocation. Order is irrelevant to
     * request identity.
     */
    List<List<DumpArgument>> invocations();

    static OracleDependency of(String module, ArgumentGrid grid) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(grid, "grid");
        final List<List<DumpArgument>> combinations = grid.combinations();
        return new OracleDependency() {
            @Override
            public String module() {
                return module;
            }

            @Override
            public List<List<DumpArgument>> invocations() {
                return combinations;
            }

            @Override
            public String toString() {
                return module + " x" + combinations.size();
            }
        };
    }
}
