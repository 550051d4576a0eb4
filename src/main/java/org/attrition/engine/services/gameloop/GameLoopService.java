package org.attrition.engine.services.gameloop;

import com.typesafe.config.Config;
import org.attrition.engine.services.AbstractService;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link TickProcessor} on a fixed interval in the service thread. Ticks can also be
 * triggered manually through {@link #runOnce()} whether or not the loop is running.
 * <p>
 * Options:
 * <ul>
 *     <li>{@code intervalMs}: pause between ticks (default 1000)</li>
 * </ul>
 */
public class GameLoopService extends AbstractService {

    private final TickProcessor processor;
    private final long intervalMs;

    private final AtomicLong ticksCompleted = new AtomicLong();
    private final AtomicLong itemsCompleted = new AtomicLong();
    private final AtomicLong itemsCancelled = new AtomicLong();
    private final AtomicLong itemsActivated = new AtomicLong();
    private final AtomicLong itemsScheduled = new AtomicLong();
    private final AtomicLong itemErrors = new AtomicLong();
    private final AtomicLong incomeUpdates = new AtomicLong();
    private final AtomicLong lastTickDurationMs = new AtomicLong();
    private final AtomicReference<TickSummary> lastSummary = new AtomicReference<>();

    public GameLoopService(String name, Config options, TickProcessor processor) {
        super(name, options);
        this.processor = processor;
        this.intervalMs = options.hasPath("intervalMs") ? options.getLong("intervalMs") : 1000L;
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive but was " + intervalMs);
        }
    }

    @Override
    protected void logStarted() {
        log.info("GameLoopService started: intervalMs={}", intervalMs);
    }

    @Override
    protected void run() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            checkPause();
            runOnce();
            Thread.sleep(intervalMs);
        }
    }

    /**
     * Runs one tick on the calling thread.
     */
    public TickSummary runOnce() {
        TickSummary summary = processor.tick(this::recordError);
        ticksCompleted.incrementAndGet();
        lastTickDurationMs.set(summary.getDurationMs());
        incomeUpdates.addAndGet(summary.getIncomeUpdates());
        itemErrors.addAndGet(summary.totalErrors());
        summary.getCounters().values().forEach(c -> {
            itemsActivated.addAndGet(c.getActivated());
            itemsCompleted.addAndGet(c.getCompleted());
            itemsCancelled.addAndGet(c.getCancelled());
            itemsScheduled.addAndGet(c.getScheduled());
        });
        lastSummary.set(summary);
        return summary;
    }

    /**
     * @return the summary of the most recent tick, or {@code null} before the first one
     */
    public TickSummary getLastSummary() {
        return lastSummary.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("ticks_completed", ticksCompleted.get());
        metrics.put("items_activated", itemsActivated.get());
        metrics.put("items_completed", itemsCompleted.get());
        metrics.put("items_cancelled", itemsCancelled.get());
        metrics.put("items_scheduled", itemsScheduled.get());
        metrics.put("item_errors", itemErrors.get());
        metrics.put("income_updates", incomeUpdates.get());
        metrics.put("last_tick_duration_ms", lastTickDurationMs.get());
    }
}
