package com.questrail.goldenbridge.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Injects the current invocation's value for one argument key, converted to
 * {@code String}, {@code int}, {@code long}, {@code double} or {@code boolean}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OracleArg
{
    String value();
}
