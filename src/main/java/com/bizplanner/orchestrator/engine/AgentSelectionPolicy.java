package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.model.orchestration.Intent;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Minimum-agent policy applied to model-inferred intents.
 *
 * <ol>
 *   <li>no agents: {@code [business_planner_lead, context_collector]}</li>
 *   <li>fewer than two: add {@code context_collector} when the numeric
 *       {@code currentPhase} (a number or numeric string) is set and below 3, else {@code customer_profiler}</li>
 *   <li>fewer than three: add the phase specialist, {@code market_analyst}
 *       for unmapped phases; phase 2 when the phase is absent or unparseable</li>
 * </ol>
 * An agent already in the list is never added twice.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
public class AgentSelectionPolicy {

    static final List<String> DEFAULT_AGENTS = List.of("business_planner_lead", "context_collector");
    static final int DEFAULT_PHASE = 2;
    static final String DEFAULT_SPECIALIST = "market_analyst";

    static final Map<Integer, String> PHASE_SPECIALISTS = ImmutableMap.<Integer, String>builder()
            .put(1, "context_collector")
            .put(2, "customer_profiler")
            .put(3, "market_analyst")
            .put(4, "financial_modeler")
            .put(5, "revenue_architect")
            .put(6, "gtm_strategist")
            .put(7, "funding_strategist")
            .build();

    public Intent apply(Intent intent, Map<String, ?> context) {
        List<String> agents = new ArrayList<>(intent.getAgents());
        String reasoning = intent.getReasoning();
        Object rawPhase = context == null ? null : context.get(ContextKeys.CURRENT_PHASE);

        if (agents.isEmpty()) {
            log.warn("No agents selected, using default agents");
            agents.addAll(DEFAULT_AGENTS);
            reasoning = "Default agents selected for comprehensive analysis";
        }

        if (agents.size() < 2) {
            String second = isEarlyPhase(rawPhase) ? "context_collector" : "customer_profiler";
            if (!agents.contains(second)) {
                agents.add(second);
                log.info("Added second agent for depth: {}", second);
            }
        }

        if (agents.size() < 3) {
            int phase = ContextKeys.phaseNumber(rawPhase).orElse(DEFAULT_PHASE);
            String specialist = PHASE_SPECIALISTS.getOrDefault(phase, DEFAULT_SPECIALIST);
            if (!agents.contains(specialist)) {
                agents.add(specialist);
                log.info("Added third agent {} for phase {}", specialist, phase);
            }
        }

        log.info("Final agent selection: {}", agents);
        return intent.toBuilder()
                .agents(List.copyOf(agents))
                .reasoning(reasoning)
                .build();
    }

    /**
     * Numbers and numeric strings ({@code "2"}) count; labels such as
     * {@code "Phase 2"} do not.
     */
    private static boolean isEarlyPhase(Object rawPhase) {
        Double phase = null;
        if (rawPhase instanceof Number) {
            phase = ((Number) rawPhase).doubleValue();
        } else if (rawPhase instanceof String) {
            phase = Doubles.tryParse(((String) rawPhase).trim());
        }
        return phase != null && phase != 0 && phase < 3;
    }
}
