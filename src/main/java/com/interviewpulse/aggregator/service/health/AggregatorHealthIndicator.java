package com.interviewpulse.aggregator.service.health;

import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.scheduling.AbstractSchedulerLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the ingest and aggregation loops.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every enabled loop is running</li>
 *   <li>DEGRADED: some enabled loops are running</li>
 *   <li>DOWN: no enabled loop is running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class AggregatorHealthIndicator implements HealthIndicator {

    private final List<AbstractSchedulerLoop> loops;
    private final AggregationEngine engine;

    public AggregatorHealthIndicator(List<AbstractSchedulerLoop> loops, AggregationEngine engine) {
        this.loops = List.copyOf(loops);
        this.engine = engine;
    }

    @Override
    public Health health() {
        int enabled = 0;
        int running = 0;
        Health.Builder builder = new Health.Builder();
        for (AbstractSchedulerLoop loop : loops) {
            if (loop.isAutoStartup()) {
                enabled++;
                if (loop.isRunning()) {
                    running++;
                }
            }
            builder.withDetail(loop.getName(), loopStatus(loop));
        }

        if (running == enabled) {
            builder.up();
        } else if (running > 0) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder.withDetail("activeSessions", engine.activeSessions().size()).build();
    }

    private String loopStatus(AbstractSchedulerLoop loop) {
        if (!loop.isAutoStartup()) {
            return "disabled";
        }
        return loop.isRunning() ? "running" : "stopped";
    }
}
