package io.suite4j.config;

import io.suite4j.Discovery;
import io.suite4j.Scheduler;
import io.suite4j.core.DiscoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>When a {@link Discovery} bean is present its result is fed into the run right after start;
 * an exception thrown by it becomes a discovery failure.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final Scheduler scheduler;
    private final Discovery discovery;
    private volatile boolean running = false;

    public SchedulerLifecycle(Scheduler scheduler, Discovery discovery) {
        this.scheduler = scheduler;
        this.discovery = discovery;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;

        if (discovery != null) {
            scheduler.enqueueDiscovered(discover());
        }
    }

    @Override
    public void stop() {
        scheduler.stop();
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

    private DiscoveryResult discover() {
        try {
            return discovery.discover();
        } catch (Exception e) {
            log.error("discovery failed runId={} msg={}", scheduler.runId(), e.getMessage(), e);
            return DiscoveryResult.failed(e);
        }
    }
}
