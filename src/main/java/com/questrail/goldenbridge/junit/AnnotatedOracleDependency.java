package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.session.ArgumentGrid;
import com.questrail.goldenbridge.session.OracleDependency;
import org.junit.platform.commons.support.AnnotationSupport;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link OracleDependency} read from the annotations of one test method.
 *
 * <p>The argument grid is built on first use so that a malformed
 * {@link OracleCase} surfaces as a collection failure rather than as an
 * error while the test plan is being scanned.</p>
 */
final class AnnotatedOracleDependency implements OracleDependency
{
    private final String module;
    private final Class<?> testClass;
    private final Method method;
    private volatile List<List<DumpArgument>> invocations;

    private AnnotatedOracleDependency(String module, Class<?> testClass, Method method) {
        this.module = module;
        this.testClass = testClass;
        this.method = method;
    }

    /**
     * @return the dependency, or empty if neither the method nor its classes declare {@link OracleDump}
     */
    static Optional<AnnotatedOracleDependency> find(Class<?> testClass, Method method) {
        Objects.requireNonNull(testClass, "testClass");
        Objects.requireNonNull(method, "method");
        return declaredModule(testClass, method)
                .map(module -> new AnnotatedOracleDependency(module, testClass, method));
    }

    static boolean isOracleTest(Method method) {
        return AnnotationSupport.isAnnotated(method, OracleTest.class);
    }

    @Override
    public String module() {
        return module;
    }

    @Override
    public List<List<DumpArgument>> invocations() {
        List<List<DumpArgument>> result = invocations;
        if (result == null) {
            result = grid().combinations();
            invocations = result;
        }
        return result;
    }

    Method method() {
        return method;
    }

    private ArgumentGrid grid() {
        ArgumentGrid.Builder builder = ArgumentGrid.builder();
        for (OracleCase c : AnnotationSupport.findRepeatableAnnotations(testClass, OracleCase.class)) {
            builder.addCase(c.value());
        }
        for (OracleCase c : AnnotationSupport.findRepeatableAnnotations(method, OracleCase.class)) {
            builder.addCase(c.value());
        }
        for (OracleParam p : AnnotationSupport.findRepeatableAnnotations(testClass, OracleParam.class)) {
            builder.addAxis(p.name(), Arrays.asList(p.values()));
        }
        for (OracleParam p : AnnotationSupport.findRepeatableAnnotations(method, OracleParam.class)) {
            builder.addAxis(p.name(), Arrays.asList(p.values()));
        }
        return builder.build();
    }

    private static Optional<String> declaredModule(Class<?> testClass, Method method) {
        Optional<OracleDump> declared = AnnotationSupport.findAnnotation(method, OracleDump.class);
        for (Class<?> c = testClass; declared.isEmpty() && c != null; c = c.getEnclosingClass()) {
            declared = AnnotationSupport.findAnnotation(c, OracleDump.class);
        }
        return declared.map(OracleDump::value);
    }

    @Override
    public String toString() {
        return testClass.getSimpleName() + "#" + method.getName() + " -> " + module;
    }
}
