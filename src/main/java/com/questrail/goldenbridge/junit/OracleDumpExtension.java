package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.session.MissingDeclarationException;
import com.questrail.goldenbridge.session.OracleSession;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;
import org.junit.platform.commons.support.AnnotationSupport;

import java.lang.reflect.Method;
import java.util.List;
import java.util.stream.Stream;

/**
 * OracleDumpExtension
 * -----------------------------------------------------------------------------
 * Expands each {@link OracleTest} into one invocation per declared argument
 * combination and resolves every invocation's data from the active
 * {@link OracleSession}.
 *
 * <p>The combinations are recomputed from the same annotations that
 * {@link OracleTestPlanListener} scanned, so the request built here for an
 * invocation equals the one that was batched.</p>
 */
public final class OracleDumpExtension implements TestTemplateInvocationContextProvider
{
    @Override
    public boolean supportsTestTemplate(ExtensionContext context) {
        return context.getTestMethod().map(AnnotatedOracleDependency::isOracleTest).orElse(false);
    }

    @Override
    public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
        final Method method = context.getRequiredTestMethod();
        final AnnotatedOracleDependency dependency =
                AnnotatedOracleDependency.find(context.getRequiredTestClass(), method)
                        .orElseThrow(() -> new MissingDeclarationException(
                                method.getName() + " is an @OracleTest but no @OracleDump is declared on it or its class"));

        final OracleSession session = OracleSessions.current()
                .orElseThrow(() -> new IllegalStateException(
                        "No oracle session is active; OracleTestPlanListener must be registered with the launcher"));
        session.failure().ifPresent(e -> {
            throw e;
        });

        final String pattern = AnnotationSupport.findAnnotation(method, OracleTest.class)
                .map(OracleTest::name)
                .orElse("[{index}] {arguments}");
        final List<List<DumpArgument>> invocations = dependency.invocations();

        return invocations.stream().map(arguments ->
                new OracleInvocationContext(pattern, dependency.module(), arguments, session));
    }
}
