package com.feedcron.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marker annotation indicating a job must not run concurrently with itself.
 * A firing that arrives while an instance of the same job is still running is
 * vetoed by {@link ConcurrentExecutionGuard} instead of being run in parallel.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DisallowConcurrentExecution {
}
