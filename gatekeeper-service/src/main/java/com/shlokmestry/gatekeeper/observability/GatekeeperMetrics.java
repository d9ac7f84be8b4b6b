package com.shlokmestry.gatekeeper.observability;

import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.shlokmestry.gatekeeper.usage.StatusClass;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class GatekeeperMetrics {

    private final MeterRegistry registry;
    private final Counter undetermined;
    private final Counter tokenCollisions;

    public GatekeeperMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.undetermined = Counter.builder("gatekeeper.authorize.undetermined.total")
                .description("Authorization checks the store could not answer")
                .register(registry);

        this.tokenCollisions = Counter.builder("gatekeeper.keys.token_collisions.total")
                .description("Generated key tokens that were already taken")
                .register(registry);
    }

    public void decision(boolean authenticated, boolean banned) {
        Counter.builder("gatekeeper.authorize.total")
                .description("Total authorization decisions")
                .tag("authenticated", String.valueOf(authenticated))
                .tag("banned", String.valueOf(banned))
                .register(registry)
                .increment();
    }

    public void undetermined() {
        undetermined.increment();
    }

    public void tokenCollision() {
        tokenCollisions.increment();
    }

    public void usageRecorded(StatusClass statusClass) {
        Counter.builder("gatekeeper.usage.recorded.total")
                .description("Request outcomes folded into aggregate buckets")
                .tag("status_class", statusClass == null ? "other" : statusClass.label())
                .register(registry)
                .increment();
    }

    public void indexSize(Supplier<Number> ranges) {
        Gauge.builder("gatekeeper.index.ranges", ranges)
                .description("Network ranges currently held by the ban index")
                .register(registry);
    }
}
