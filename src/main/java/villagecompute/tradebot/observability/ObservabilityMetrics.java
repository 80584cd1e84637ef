/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.services.SessionStore;

/**
 * Registers the custom metrics of the conversation core.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counter:</b> {@code tradebot_conversation_events_total{kind,outcome}} - handled events by outcome
 * (advanced, rejected, completed, cancelled, storage_error, ...)</li>
 * <li><b>Counter:</b> {@code tradebot_moderation_actions_total{action,result}} - dispatcher outcomes</li>
 * <li><b>Counter:</b> {@code tradebot_internal_faults_total{type}} - unknown states and post-mutation audit
 * failures; any increment should page</li>
 * <li><b>Gauge:</b> {@code tradebot_sessions_active} - live sessions held by the session store</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    SessionStore sessionStore;

    @PostConstruct
    void registerGauges() {
        Gauge.builder("tradebot.sessions.active", sessionStore, SessionStore::size)
                .description("Live conversation sessions").register(registry);
        LOG.debug("Registered session gauge");
    }

    public void recordConversationEvent(String kind, String outcome) {
        Counter.builder("tradebot.conversation.events.total").description("Handled conversation events")
                .tag("kind", kind == null ? "none" : kind).tag("outcome", outcome).register(registry).increment();
    }

    public void recordModerationAction(String action, String result) {
        Counter.builder("tradebot.moderation.actions.total").description("Moderation dispatcher outcomes")
                .tag("action", action).tag("result", result).register(registry).increment();
    }

    public void recordInternalFault(String type) {
        Counter.builder("tradebot.internal.faults.total").description("Defects and post-mutation audit failures")
                .tag("type", type).register(registry).increment();
    }
}
