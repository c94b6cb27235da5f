package com.autoflow.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks in-flight walks and drains them on shutdown.
 *
 * On shutdown:
 * 1. Stops accepting new dispatches
 * 2. Waits for in-flight walks to finish, up to the drain timeout
 *
 * Walks still running when the timeout passes stay RUNNING in the store and are
 * timed out by the supervisor on another node or after restart.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);
    private static final long POLL_MILLIS = 200;

    private final Duration drainTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Set<UUID> activeExecutions = ConcurrentHashMap.newKeySet();

    public GracefulShutdownHandler() {
        this(DEFAULT_DRAIN_TIMEOUT);
    }

    public GracefulShutdownHandler(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public boolean canAcceptDispatches() {
        return !shuttingDown.get();
    }

    /**
     * Register a walk as in flight.
     *
     * @return false when shutting down or when the execution is already being walked here
     */
    public boolean tryRegister(UUID executionId) {
        if (shuttingDown.get()) {
            return false;
        }
        return activeExecutions.add(executionId);
    }

    public void unregister(UUID executionId) {
        activeExecutions.remove(executionId);
    }

    public int getActiveCount() {
        return activeExecutions.size();
    }

    /**
     * Wrap a walk so it is tracked while it runs. The caller must have registered it.
     */
    public Runnable wrap(UUID executionId, Runnable walk) {
        return () -> {
            try {
                walk.run();
            } finally {
                unregister(executionId);
            }
        };
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        log.info("Initiating graceful shutdown");
        shuttingDown.set(true);
        awaitDrain();
        log.info("Graceful shutdown complete");
    }

    /**
     * Wait for in-flight walks to finish.
     *
     * @return true if none are left
     */
    public boolean awaitDrain() {
        if (activeExecutions.isEmpty()) {
            log.info("No in-flight executions to wait for");
            return true;
        }
        log.info("Waiting for {} in-flight executions (timeout: {}s)",
            activeExecutions.size(), drainTimeout.toSeconds());

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (!activeExecutions.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for executions to finish");
                break;
            }
        }

        if (!activeExecutions.isEmpty()) {
            log.warn("Shutdown timeout reached with {} executions still running: {}",
                activeExecutions.size(), activeExecutions);
            return false;
        }
        log.info("All in-flight executions finished");
        return true;
    }
}
