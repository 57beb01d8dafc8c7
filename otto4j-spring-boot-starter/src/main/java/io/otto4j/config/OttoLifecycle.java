package io.otto4j.config;

import io.otto4j.OttoScheduler;
import io.otto4j.outbound.OutboundQueueWorker;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges otto4j start/stop with the Spring container lifecycle.
 *
 * <p>When no scheduler is configured (no session gateway) the outbound worker is driven alone.
 */
public class OttoLifecycle implements SmartLifecycle {
    private final OttoScheduler scheduler;
    private final OutboundQueueWorker outboundWorker;
    private volatile boolean running = false;

    /**
     * @param scheduler      may be null
     * @param outboundWorker may be null; ignored when a scheduler is present, which owns it
     */
    public OttoLifecycle(OttoScheduler scheduler, OutboundQueueWorker outboundWorker) {
        this.scheduler = scheduler;
        this.outboundWorker = outboundWorker;
    }

    @Override
    public void start() {
        if (scheduler != null) {
            scheduler.start();
        } else if (outboundWorker != null) {
            outboundWorker.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (scheduler != null) {
            scheduler.stop();
        } else if (outboundWorker != null) {
            outboundWorker.stop();
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
