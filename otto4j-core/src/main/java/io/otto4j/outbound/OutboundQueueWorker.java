package io.otto4j.outbound;

import io.otto4j.internal.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Periodically drains the outbound queue on its own thread, independent of the scheduler kernel.
 */
public class OutboundQueueWorker {
    private static final Logger log = LoggerFactory.getLogger(OutboundQueueWorker.class);

    public static final Duration DEFAULT_DRAIN_INTERVAL = Duration.ofSeconds(2);

    private final OutboundQueueProcessor processor;
    private final Clock clock;
    private final PollingLoop loop;

    public OutboundQueueWorker(OutboundQueueProcessor processor, Duration drainInterval, Clock clock) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.loop = new PollingLoop("otto.outbound", drainInterval, this::drainOnce);
    }

    public void start() {
        log.info("outbound queue worker starting");
        loop.start();
    }

    public void stop() {
        loop.stop();
        log.info("outbound queue worker stopped");
    }

    public boolean isRunning() {
        return loop.isRunning();
    }

    void drainOnce() {
        processor.drainDueMessages(clock.instant());
    }
}
