package com.questrail.goldenbridge.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An explicit argument tuple, written as {@code key=value} tokens separated by
 * whitespace, e.g. {@code @OracleCase("Z=26 trans=0")}. Each case is combined
 * with every {@link OracleParam} dimension.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Repeatable(OracleCases.class)
public @interface OracleCase
{
    String value();
}
