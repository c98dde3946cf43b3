package com.uitgo.proximity.aspect;

import com.uitgo.proximity.model.SearchStrategy;
import com.uitgo.proximity.model.param.NearbySearchParam;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Times methods annotated with {@link Timed} and labels each timing with the search strategy
 * found among the arguments, so flat scans and hierarchical queries show up side by side in the log.
 * The last duration on the request thread becomes the response {@code elapsed} value.
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    static final String DEFAULT_STRATEGY_TAG = "default";

    private static final ThreadLocal<Long> LAST_ELAPSED_MS = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object time(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        String label = label(joinPoint, timed);
        long started = System.nanoTime();
        boolean failed = true;
        try {
            Object result = joinPoint.proceed();
            failed = false;
            return result;
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
            LAST_ELAPSED_MS.set(elapsedMs);
            report(timed.logLevel(), label, elapsedMs, failed);
        }
    }

    private static void report(Timed.LogLevel level, String label, long elapsedMs, boolean failed) {
        if (failed) {
            log.debug("{} failed after {}ms", label, elapsedMs);
            return;
        }
        switch (level) {
            case INFO:
                log.info("{} took {}ms", label, elapsedMs);
                break;
            case WARN:
                log.warn("{} took {}ms", label, elapsedMs);
                break;
            default:
                log.debug("{} took {}ms", label, elapsedMs);
        }
    }

    /**
     * {@code operation[STRATEGY]}, e.g. {@code search[HIERARCHICAL]}
     */
    static String label(ProceedingJoinPoint joinPoint, Timed timed) {
        String operation = timed.value().isEmpty() ? joinPoint.getSignature().getName() : timed.value();
        return operation + "[" + strategyTag(joinPoint.getArgs()) + "]";
    }

    /**
     * Strategy requested by the call, or {@value #DEFAULT_STRATEGY_TAG} when it leaves the choice to configuration
     */
    static String strategyTag(Object[] args) {
        if (args != null) {
            for (Object arg : args) {
                if (arg instanceof SearchStrategy) {
                    return ((SearchStrategy) arg).name();
                }
                if (arg instanceof NearbySearchParam && ((NearbySearchParam) arg).getStrategy() != null) {
                    return ((NearbySearchParam) arg).getStrategy().name();
                }
            }
        }
        return DEFAULT_STRATEGY_TAG;
    }

    /**
     * Elapsed time of the last timed call on this thread as {@code "<n>ms"}, then forget it
     */
    public static String getAndClearExecutionTime() {
        Long elapsedMs = LAST_ELAPSED_MS.get();
        LAST_ELAPSED_MS.remove();
        return (elapsedMs != null ? elapsedMs : 0L) + "ms";
    }
}
