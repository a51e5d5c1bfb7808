package com.example.udahub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Orchestrator policy.
 *
 * @param maxTransitions stage executions allowed in one run; a well-formed ticket needs at most four
 * @param stageAttempts  attempts per stage before a collaborator failure becomes fatal
 * @param backoffInitial delay before the first retry, doubled per attempt
 * @param backoffMax     cap on the retry delay
 * @param knowledgeTopK  articles requested from the knowledge search
 */
@ConfigurationProperties(prefix = "app.routing")
public record RoutingProperties(
    @DefaultValue("5") int maxTransitions,
    @DefaultValue("3") int stageAttempts,
    @DefaultValue("500ms") Duration backoffInitial,
    @DefaultValue("5s") Duration backoffMax,
    @DefaultValue("3") int knowledgeTopK
) {

    public RoutingProperties {
        if (maxTransitions < 1) {
            throw new IllegalArgumentException("app.routing.max-transitions must be positive");
        }
        if (stageAttempts < 1) {
            throw new IllegalArgumentException("app.routing.stage-attempts must be positive");
        }
    }

    public static RoutingProperties defaults() {
        return new RoutingProperties(5, 3, Duration.ofMillis(500), Duration.ofSeconds(5), 3);
    }
}
