package com.bizplanner.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Umbrella configuration for the orchestration pipeline.
 *
 * <p>Groups the completion parameters of each pipeline stage, the per-call
 * deadlines and the worker pool used for parallel agent tasks. Properties are
 * bound from the {@code app.orchestrator} namespace:
 * <pre>
 * app:
 *   orchestrator:
 *     default-language: en-US
 *     fallback-reply: "Thanks for sharing that!"
 *     intent:
 *       temperature: 0.2
 *       max-tokens: 1000
 *     agent:
 *       max-tokens: 2000
 *       per-task-estimate-seconds: 10
 *     synthesis:
 *       temperature: 0.7
 *       max-tokens: 300
 *     deadlines:
 *       completion-seconds: 60
 *       skill-seconds: 30
 *     pool:
 *       core-size: 4
 *       max-size: 8
 *       queue-capacity: 100
 * </pre>
 *
 * @since 2.0.0
 */
@Data
@ConfigurationProperties(prefix = "app.orchestrator")
public class OrchestratorConfig {

    /**
     * Language code treated as "no translation needed".
     */
    private String defaultLanguage = "en-US";

    /**
     * Reply returned when synthesis fails entirely.
     */
    private String fallbackReply = "Thanks for sharing that!";

    private IntentConfig intent = new IntentConfig();

    private AgentConfig agent = new AgentConfig();

    private SynthesisConfig synthesis = new SynthesisConfig();

    private DeadlineConfig deadlines = new DeadlineConfig();

    private PoolConfig pool = new PoolConfig();

    /**
     * Completion parameters for natural-language intent inference.
     */
    @Data
    public static class IntentConfig {
        private double temperature = 0.2;
        private int maxTokens = 1000;
    }

    @Data
    public static class AgentConfig {
        private double defaultTemperature = 0.7;
        private int maxTokens = 2000;

        /**
         * Rough per-task figure behind {@code ExecutionPlan.estimatedDurationSeconds}.
         * Not used for scheduling.
         */
        private int perTaskEstimateSeconds = 10;
    }

    @Data
    public static class SynthesisConfig {
        private double temperature = 0.7;
        private int maxTokens = 300;
    }

    /**
     * Upper bounds for a single blocking call. A call that overruns is reported
     * as a failed agent output or a skill error payload.
     */
    @Data
    public static class DeadlineConfig {
        private long completionSeconds = 60;
        private long skillSeconds = 30;
    }

    @Data
    public static class PoolConfig {
        private int coreSize = 4;
        private int maxSize = 8;
        private int queueCapacity = 100;
    }
}
