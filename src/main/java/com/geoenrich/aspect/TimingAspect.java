package com.geoenrich.aspect;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Measures methods annotated with {@link Timed}
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    public static final String TIMER_NAME = "geoenrich.timed";

    private final MeterRegistry meterRegistry;

    public TimingAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        String operation = timed.value().isEmpty() ? className + "#" + methodName : timed.value();
        long startNanos = System.nanoTime();
        String outcome = "success";

        try {
            Object result = joinPoint.proceed();
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            if (timed.logLevel() == Timed.LogLevel.DEBUG) {
                log.debug("{} executed in {}ms", operation, durationMs);
            } else if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{} executed in {}ms", operation, durationMs);
            } else {
                log.warn("{} executed in {}ms", operation, durationMs);
            }
            return result;
        } catch (Throwable e) {
            outcome = "failure";
            log.error("{} failed after {}ms", operation,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), e);
            throw e;
        } finally {
            Timer.builder(TIMER_NAME)
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }
}
