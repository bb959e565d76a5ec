package de.burger.dispatch.infrastructure.logging;

import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.AfterThrowing;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Logs entry, exit and failures of public library methods under the logger of the declaring
 * class. Weaving is opt-in: consumers enable it with load-time weaving and a {@code META-INF/aop.xml}
 * naming this aspect. Calls on one thread share a correlation id in the MDC key {@value #CID}.
 */
@SuppressWarnings("AspectJ") // no compile-time weaving in this module
@Aspect
public class MethodLoggingAspect {

    // Code-style accessors expected by the load-time weaver
    private static final MethodLoggingAspect INSTANCE = new MethodLoggingAspect();
    public static MethodLoggingAspect aspectOf() { return INSTANCE; }
    public static boolean hasAspect() { return true; }

    public static final String CID = "cid";

    private static final Map<Class<?>, Logger> PER_CLASS_LOGGERS = new ConcurrentHashMap<>();
    private static final ThreadLocal<Deque<Long>> START_NS = ThreadLocal.withInitial(ArrayDeque::new);

    @Pointcut("execution(public * de.burger.dispatch..*(..)) && !within(de.burger.dispatch.infrastructure..*)")
    public void libraryOps() {}

    @Pointcut("@annotation(de.burger.dispatch.infrastructure.logging.SuppressLogging)"
            + " || @within(de.burger.dispatch.infrastructure.logging.SuppressLogging)")
    public void suppressed() {}

    @Before("libraryOps() && !suppressed()")
    public void onEnter(final JoinPoint jp) {
        final Deque<Long> starts = START_NS.get();
        if (starts.isEmpty()) {
            MDC.put(CID, Optional.ofNullable(MDC.get(CID))
                    .filter(s -> !s.isBlank())
                    .orElseGet(() -> UUID.randomUUID().toString()));
        }
        starts.push(System.nanoTime());
        final Logger log = loggerFor(jp);
        if (log.isDebugEnabled()) {
            log.debug("enter {} {}", shortSig(jp), argsOf(jp));
        }
    }

    @AfterReturning("libraryOps() && !suppressed()")
    public void onReturn(final JoinPoint jp) {
        final long elapsedMs = finish();
        loggerFor(jp).debug("exit {} OK in {} ms", shortSig(jp), elapsedMs);
    }

    @AfterThrowing(pointcut = "libraryOps() && !suppressed()", throwing = "ex")
    public void onThrow(final JoinPoint jp, final Throwable ex) {
        final long elapsedMs = finish();
        loggerFor(jp).warn("fail {} in {} ms: {}", shortSig(jp), elapsedMs, ex.toString());
    }

    /** Pops the start time of the innermost call and clears the correlation id on the outermost. */
    private long finish() {
        final Deque<Long> starts = START_NS.get();
        final Long started = starts.poll();
        if (starts.isEmpty()) {
            MDC.remove(CID);
        }
        final long now = System.nanoTime();
        return TimeUnit.NANOSECONDS.toMillis(now - (started != null ? started : now));
    }

    private Logger loggerFor(JoinPoint jp) {
        final Class<?> type = jp.getSignature().getDeclaringType();
        return PER_CLASS_LOGGERS.computeIfAbsent(type, LoggerFactory::getLogger);
    }

    /** Short signature like 'TypeRegistry.create(..)'. */
    private String shortSig(JoinPoint jp) {
        return jp.getSignature().toShortString();
    }

    private String argsOf(JoinPoint jp) {
        return Arrays.stream(jp.getArgs())
                .map(o -> Optional.ofNullable(o).map(Objects::toString).orElse("null"))
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
