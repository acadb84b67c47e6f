package org.empiresim.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the threshold of {@link LogWatchExtension} for a class or a single test.
 * A method-level annotation wins over the class-level one.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface FailOnLog {

    /** Lowest level at which an unpermitted event fails the test. */
    LogLevel level() default LogLevel.WARN;

    /** Only checks {@link ExpectLog} when set. */
    boolean disabled() default false;
}
