package org.frugal.ls.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a log event the test must produce. The test fails if fewer than
 * {@link #occurrences()} matching events are logged.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {
    LogLevel level();
    String loggerPattern() default ".*";
    String messagePattern() default ".*";
    int occurrences() default 1;
}
