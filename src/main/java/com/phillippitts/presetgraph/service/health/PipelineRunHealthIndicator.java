package com.phillippitts.presetgraph.service.health;

import com.phillippitts.presetgraph.service.completion.CompletionProvider;
import com.phillippitts.presetgraph.service.completion.UnconfiguredCompletionProvider;
import com.phillippitts.presetgraph.service.runner.PipelineRunRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for pipeline execution.
 *
 * <ul>
 *   <li>UP: a completion provider is configured</li>
 *   <li>DEGRADED: only the placeholder provider is present, so every node fails with a
 *       missing-key message</li>
 * </ul>
 *
 * <p>Always reports the number of active runs. Exposed via /actuator/health.
 */
@Component
public class PipelineRunHealthIndicator implements HealthIndicator {

    private final PipelineRunRegistry registry;
    private final CompletionProvider completionProvider;

    public PipelineRunHealthIndicator(PipelineRunRegistry registry, CompletionProvider completionProvider) {
        this.registry = registry;
        this.completionProvider = completionProvider;
    }

    @Override
    public Health health() {
        boolean configured = !(completionProvider instanceof UnconfiguredCompletionProvider);
        Health.Builder builder = configured ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("activeRuns", registry.activeCount())
                .withDetail("completionProvider", configured
                        ? completionProvider.getClass().getSimpleName()
                        : "not configured")
                .build();
    }
}
