package com.example.bloodlink.observability.metrics;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.PolicyDecision;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Counts access decisions per resource type, action, outcome and deny reason.
 * All tag values are enum constants, so cardinality is bounded.
 */
@Component
@ConditionalOnProperty(name = "app.authz.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class PolicyMetrics {

    static final String DECISION_METER = "authz.decision";
    private static final String TAG_NONE = "none";
    private static final String TAG_UNKNOWN = "unknown";

    private final MeterRegistry registry;

    public PolicyMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(@Nullable ResourceType resourceType, @Nullable Action action,
                               @NonNull PolicyDecision decision) {
        Tags tags = Tags.of(
                "resource", resourceType != null ? resourceType.name() : TAG_UNKNOWN,
                "action", action != null ? action.name() : TAG_UNKNOWN,
                "outcome", decision.decision().name(),
                "reason", decision.reason() != null ? decision.reason().name() : TAG_NONE);

        Counter.builder(DECISION_METER)
                .tags(tags)
                .description("Access policy decisions")
                .register(registry)
                .increment();
    }
}
