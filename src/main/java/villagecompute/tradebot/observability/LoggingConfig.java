/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching conversation logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier, empty when no span is active</li>
 * <li>{@code span_id} - current span identifier</li>
 * <li>{@code principal_id} - identity whose event is being handled</li>
 * <li>{@code conversation_kind} - kind of the active or starting conversation</li>
 * <li>{@code moderation_action} - action tag while the moderation dispatcher runs</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the conversation controller:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setPrincipalId(event.principalId());
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> all methods operate on {@link MDC}, which is thread-local. Store calls run on the bounded
 * store executor and do not inherit these fields.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_PRINCIPAL_ID = "principal_id";

    public static final String MDC_CONVERSATION_KIND = "conversation_kind";

    public static final String MDC_MODERATION_ACTION = "moderation_action";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace and span ids of the current OpenTelemetry span into MDC. Empty strings keep the log schema stable
     * when no span is active.
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

    public static void setPrincipalId(long principalId) {
        MDC.put(MDC_PRINCIPAL_ID, Long.toString(principalId));
    }

    public static void setConversationKind(String kind) {
        if (kind != null) {
            MDC.put(MDC_CONVERSATION_KIND, kind);
        }
    }

    public static void setModerationAction(String action) {
        if (action != null) {
            MDC.put(MDC_MODERATION_ACTION, action);
        }
    }

    public static void clearModerationAction() {
        MDC.remove(MDC_MODERATION_ACTION);
    }

    /**
     * Clears every field set by this class. Called at the end of each handled event so pooled threads do not leak
     * context into the next event.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_PRINCIPAL_ID);
        MDC.remove(MDC_CONVERSATION_KIND);
        MDC.remove(MDC_MODERATION_ACTION);
    }
}
