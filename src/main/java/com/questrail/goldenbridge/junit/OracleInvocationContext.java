package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.session.OracleSession;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One invocation of an {@link OracleTest}: a display name and the resolver
 * bound to this invocation's arguments.
 */
final class OracleInvocationContext implements TestTemplateInvocationContext
{
    private final String pattern;
    private final String module;
    private final List<DumpArgument> arguments;
    private final OracleSession session;

    OracleInvocationContext(String pattern, String module, List<DumpArgument> arguments, OracleSession session) {
        this.pattern = pattern;
        this.module = module;
        this.arguments = arguments;
        this.session = session;
    }

    @Override
    public String getDisplayName(int invocationIndex) {
        String rendered = arguments.stream()
                .map(DumpArgument::toWireToken)
                .collect(Collectors.joining(" "));
        return pattern
                .replace("{index}", Integer.toString(invocationIndex))
                .replace("{module}", module)
                .replace("{arguments}", rendered);
    }

    @Override
    public List<Extension> getAdditionalExtensions() {
        return List.of(new OracleResultResolver(session, module, arguments));
    }
}
