package com.geoenrich.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for timing: a log line and a sample on the {@code geoenrich.timed} timer
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Operation tag; defaults to Class#method
     */
    String value() default "";

    /**
     * Log level for timing output
     */
    LogLevel logLevel() default LogLevel.DEBUG;

    enum LogLevel {
        DEBUG, INFO, WARN
    }
}
