package com.questrail.goldenbridge.junit;

import org.junit.jupiter.api.TestTemplate;
import org.junit.jupiter.api.extension.ExtendWith;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a golden test: a template invoked once per argument combination
 * declared with {@link OracleParam} and {@link OracleCase}, each invocation
 * receiving the oracle's validated answer for its own arguments.
 *
 * <pre>
 * &#64;OracleTest
 * &#64;OracleDump("Element")
 * &#64;OracleParam(name = "Z", values = {"26", "79"})
 * void atomicWeight(OracleResult expected, &#64;OracleArg("Z") int z) { ... }
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@TestTemplate
@ExtendWith(OracleDumpExtension.class)
public @interface OracleTest
{
    /**
     * Invocation display name; {@code {index}}, {@code {module}} and
     * {@code {arguments}} are substituted.
     */
    String name() default "[{index}] {arguments}";
}
