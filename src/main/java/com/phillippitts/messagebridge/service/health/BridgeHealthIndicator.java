package com.phillippitts.messagebridge.service.health;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.service.delivery.DeliveryWorker;
import com.phillippitts.messagebridge.service.delivery.OutboundDeliveryQueue;
import com.phillippitts.messagebridge.service.watcher.CallWatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the two long-running tasks.
 *
 * <ul>
 *   <li>UP: delivery worker alive and call watcher alive (or disabled by configuration)</li>
 *   <li>DEGRADED: delivery worker alive, watcher enabled but not running</li>
 *   <li>DOWN: delivery worker not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BridgeHealthIndicator implements HealthIndicator {

    private final DeliveryWorker worker;
    private final CallWatcher watcher;
    private final OutboundDeliveryQueue queue;
    private final WatcherProperties watcherProps;

    public BridgeHealthIndicator(DeliveryWorker worker,
                                 CallWatcher watcher,
                                 OutboundDeliveryQueue queue,
                                 WatcherProperties watcherProps) {
        this.worker = worker;
        this.watcher = watcher;
        this.queue = queue;
        this.watcherProps = watcherProps;
    }

    @Override
    public Health health() {
        boolean workerAlive = worker.isAlive();
        String watcherStatus = watcherStatus();

        Health.Builder builder;
        if (!workerAlive) {
            builder = Health.down();
        } else if ("stopped".equals(watcherStatus)) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("deliveryWorker", workerAlive ? "running" : "stopped")
                .withDetail("callWatcher", watcherStatus)
                .withDetail("queueDepth", queue.size())
                .build();
    }

    private String watcherStatus() {
        if (!watcherProps.isEnabled()) {
            return "disabled";
        }
        return watcher.isAlive() ? "running" : "stopped";
    }
}
