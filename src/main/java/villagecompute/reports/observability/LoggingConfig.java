package villagecompute.reports.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for report execution logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code org_id} - tenant the work belongs to</li>
 * <li>{@code schedule_id} - schedule being dispatched or executed</li>
 * <li>{@code run_id} - run row of the current execution</li>
 * <li>{@code request_origin} - {@code scheduled}, {@code manual}, or an HTTP path</li>
 * </ul>
 *
 * <p>
 * <b>Usage in run execution:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setScheduleContext(orgId, scheduleId);
 * LoggingConfig.setRequestOrigin("scheduled");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> all methods operate on thread-local {@link MDC}. Executor threads are reused, so every
 * execution must clear MDC when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_ORG_ID = "org_id";

    public static final String MDC_SCHEDULE_ID = "schedule_id";

    public static final String MDC_RUN_ID = "run_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace and span ids of the current OpenTelemetry span into MDC; empty strings when no span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setScheduleContext(Long orgId, Long scheduleId) {
        if (orgId != null) {
            MDC.put(MDC_ORG_ID, orgId.toString());
        }
        if (scheduleId != null) {
            MDC.put(MDC_SCHEDULE_ID, scheduleId.toString());
        }
    }

    public static void setRunId(Long runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId.toString());
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Removes every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_ORG_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
