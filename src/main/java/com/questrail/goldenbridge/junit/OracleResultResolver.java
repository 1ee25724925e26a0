package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.schema.ColumnType;
import com.questrail.goldenbridge.session.OracleSession;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.util.List;
import java.util.Optional;

/**
 * Retrieves the invocation's {@link OracleResult} before the test body runs,
 * then injects it and any {@link OracleArg} parameters.
 *
 * <p>Retrieval happens even when the method takes no {@link OracleResult}, so
 * a cache miss or schema violation always fails the invocation.</p>
 */
final class OracleResultResolver implements BeforeEachCallback, ParameterResolver
{
    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(OracleResultResolver.class);
    private static final String RESULT = "result";

    private final OracleSession session;
    private final String module;
    private final List<DumpArgument> arguments;

    OracleResultResolver(OracleSession session, String module, List<DumpArgument> arguments) {
        this.session = session;
        this.module = module;
        this.arguments = arguments;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        OracleResult result = new OracleResult(session.retrieve(module, arguments));
        context.getStore(NAMESPACE).put(RESULT, result);
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == OracleResult.class
                || parameterContext.isAnnotated(OracleArg.class);
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        final Class<?> type = parameterContext.getParameter().getType();
        if (type == OracleResult.class) {
            OracleResult result = extensionContext.getStore(NAMESPACE).get(RESULT, OracleResult.class);
            if (result == null) {
                result = new OracleResult(session.retrieve(module, arguments));
            }
            return result;
        }

        final String key = parameterContext.findAnnotation(OracleArg.class)
                .map(OracleArg::value)
                .orElseThrow(() -> new ParameterResolutionException("Missing @OracleArg"));
        final String value = argument(key).orElseThrow(() -> new ParameterResolutionException(
                "No argument '" + key + "' in this invocation of " + module));
        return convert(key, value, type);
    }

    private Optional<String> argument(String key) {
        for (DumpArgument argument : arguments) {
            if (argument.key().equals(key)) {
                return Optional.of(argument.value());
            }
        }
        return Optional.empty();
    }

    static Object convert(String key, String value, Class<?> type) {
        try {
            if (type == String.class) {
                return value;
            }
            if (type == int.class || type == Integer.class) {
                return Integer.parseInt(value);
            }
            if (type == long.class || type == Long.class) {
                return Long.parseLong(value);
            }
            if (type == double.class || type == Double.class) {
                return ColumnType.DOUBLE.parse(value);
            }
            if (type == boolean.class || type == Boolean.class) {
                return ColumnType.BOOL.parse(value);
            }
        } catch (IllegalArgumentException e) {
            throw new ParameterResolutionException(
                    "Argument '" + key + "' value '" + value + "' is not a valid " + type.getSimpleName(), e);
        }
        throw new ParameterResolutionException(
                "@OracleArg(\"" + key + "\") cannot be converted to " + type.getName());
    }
}
