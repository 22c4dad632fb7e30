package com.calibrationplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the calibration trace id (and, for plan runs, the plan id) through Reactor pipelines.
 *
 * <p>Reactor Context is the source of truth. MDC is only written for the duration of a
 * single log statement via {@link #withMdc}, never left behind on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(service.calibrate(request), request.traceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String PLAN_ID_KEY = "planId";

    private TraceContextUtil() {}

    /** Caller-supplied id, or a fresh random one when blank. */
    public static String resolveTraceId(String supplied) {
        return supplied == null || supplied.isBlank() ? UUID.randomUUID().toString() : supplied;
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the trace id, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable logAction) {
        withMdc(traceId, null, logAction);
    }

    /**
     * Bridges the ids into MDC while {@code logAction} runs, then removes them.
     * A {@code null} plan id is not written.
     */
    public static void withMdc(String traceId, String planId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        if (planId != null) MDC.put(PLAN_ID_KEY, planId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(PLAN_ID_KEY);
        }
    }
}
