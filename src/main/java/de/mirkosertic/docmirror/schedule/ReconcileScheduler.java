package de.mirkosertic.docmirror.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs named tasks periodically with a fixed delay between the end of one execution and the
 * start of the next.
 * <p>
 * Registering a name again replaces the previous registration, so calling
 * {@link #register(String, Runnable, Duration)} repeatedly never stacks up triggers.
 */
public class ReconcileScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReconcileScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> registrations = new ConcurrentHashMap<>();

    public ReconcileScheduler() {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "reconcile-scheduler-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        });
    }

    /**
     * @param initialDelay delay before the first execution
     * @param interval     delay between the end of an execution and the start of the next
     */
    public synchronized void register(final String name, final Runnable task, final Duration initialDelay,
                                      final Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        final ScheduledFuture<?> previous = registrations.remove(name);
        if (previous != null) {
            previous.cancel(false);
            logger.info("Replacing existing schedule '{}'", name);
        }
        final ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
                () -> runGuarded(name, task),
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        registrations.put(name, future);
        logger.info("Scheduled '{}' every {} ms", name, interval.toMillis());
    }

    public void register(final String name, final Runnable task, final Duration interval) {
        register(name, task, interval, interval);
    }

    public synchronized boolean cancel(final String name) {
        final ScheduledFuture<?> future = registrations.remove(name);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        logger.info("Cancelled schedule '{}'", name);
        return true;
    }

    public Set<String> registeredNames() {
        return Set.copyOf(registrations.keySet());
    }

    /**
     * Stops scheduling new executions and waits for a running one to finish.
     */
    public void shutdown() {
        logger.info("Shutting down ReconcileScheduler");
        registrations.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("ReconcileScheduler did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for ReconcileScheduler to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean awaitTermination(final Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // An exception escaping a periodic task would silently cancel all later executions.
    private static void runGuarded(final String name, final Runnable task) {
        try {
            task.run();
        } catch (final RuntimeException e) {
            logger.error("Scheduled task '{}' failed", name, e);
        }
    }
}
