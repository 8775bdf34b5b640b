package io.scrapehive.supervisor.spring;

import io.scrapehive.supervisor.runtime.ScrapeSupervisor;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the supervisor's run loop once the application context is ready and
 * stops it, together with its engine, on shutdown.
 */
public final class ScrapeSupervisorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScrapeSupervisorLifecycle.class);

    private final ScrapeSupervisor supervisor;
    private final Duration shutdownTimeout;
    private volatile boolean running;

    public ScrapeSupervisorLifecycle(ScrapeSupervisor supervisor, Duration shutdownTimeout) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        supervisor.start();
        running = true;
        if (log.isInfoEnabled()) {
            log.info("Scrape supervisor lifecycle started (instance={})", supervisor.instanceId());
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            supervisor.stop(shutdownTimeout);
        } catch (RuntimeException ex) {
            log.warn("Failed to stop scrape supervisor {}", supervisor.instanceId(), ex);
        }
        running = false;
        if (log.isInfoEnabled()) {
            log.info("Scrape supervisor lifecycle stopped (instance={})", supervisor.instanceId());
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
