package com.bizplanner.orchestrator.model.rules;

import com.bizplanner.orchestrator.model.flow.FieldPredicate;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Agent to queue when a rule fires. {@code guard}, when set, is evaluated on
 * the merged answers and must hold for the agent to be queued.
 */
@Value
@Builder
@Jacksonized
public class AgentTrigger {
    String agentId;
    String promptTemplate;
    FieldPredicate guard;
}
