package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.CycleSummary;
import com.delta.adfeed.monitor.model.MonitorStatusResponse;
import com.delta.adfeed.monitor.model.SchedulerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives poll cycles on a fixed interval. The timer thread only decides whether a cycle may start;
 * the cycle itself runs on a separate single worker so a slow cycle never delays the timer.
 * State moves IDLE to RUNNING through a compare-and-set, so a tick that arrives while a cycle is
 * still running is dropped rather than queued.
 */
@Service
public class AdMonitorScheduler implements ConfigChangeListener {
    private static final Logger log = LoggerFactory.getLogger(AdMonitorScheduler.class);

    private final AdMonitorService monitorService;
    private final MonitorConfigService configService;
    private final MonitorProperties properties;
    private final Clock clock;
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STOPPED);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile ScheduledExecutorService timer;
    private ExecutorService worker;
    private ScheduledFuture<?> tickFuture;
    private volatile Duration interval;
    private volatile Instant nextRunAt;
    private volatile CycleSummary lastCycle;

    public AdMonitorScheduler(
        AdMonitorService monitorService,
        MonitorConfigService configService,
        MonitorProperties properties,
        Clock clock
    ) {
        this.monitorService = monitorService;
        this.configService = configService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        configService.addListener(this);
        if (properties.getScheduler().isEnabled()) {
            start(Duration.ofSeconds(properties.getScheduler().getStartupDelaySeconds()));
        } else {
            log.info("Monitor scheduler disabled; cycles only run on manual trigger");
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        configService.removeListener(this);
        stop();
    }

    public void start(Duration initialDelay) {
        Duration period = configService.getSnapshot().refreshInterval();
        synchronized (lifecycleLock) {
            if (timer != null) {
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("ad-monitor-timer");
                thread.setDaemon(true);
                return thread;
            });
            ensureWorker();
            state.compareAndSet(SchedulerState.STOPPED, SchedulerState.IDLE);
            scheduleTicks(initialDelay, period);
            log.info("Monitor scheduler started; first cycle in {} s, then every {} min",
                initialDelay.toSeconds(), interval.toMinutes());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (timer != null) {
                timer.shutdownNow();
                timer = null;
                tickFuture = null;
                nextRunAt = null;
            }
            if (worker != null) {
                worker.shutdownNow();
                try {
                    if (!worker.awaitTermination(properties.getScheduler().getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                        log.warn("Monitor cycle did not stop within the shutdown grace period");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                worker = null;
            }
            state.set(SchedulerState.STOPPED);
        }
    }

    /**
     * Replaces the running timer with one at the new interval. The next tick fires one full interval
     * from now; a cycle already running is not affected.
     */
    public void reschedule(Duration newInterval) {
        synchronized (lifecycleLock) {
            if (timer == null) {
                throw new IllegalStateException("Scheduler is not running");
            }
            if (newInterval.equals(interval)) {
                return;
            }
            scheduleTicks(newInterval, newInterval);
            log.info("Monitor scheduler rescheduled to every {} min", newInterval.toMinutes());
        }
    }

    @Override
    public void onConfigApplied(ConfigSnapshot previous, ConfigSnapshot current) {
        if (previous.refreshIntervalMinutes() == current.refreshIntervalMinutes()) {
            return;
        }
        synchronized (lifecycleLock) {
            if (timer == null) {
                return;
            }
            reschedule(current.refreshInterval());
        }
    }

    /**
     * Starts a cycle right away on the worker thread.
     *
     * @throws CycleInProgressException when a cycle is already running
     */
    public long triggerNow() {
        ConfigSnapshot config = configService.getSnapshot();
        synchronized (lifecycleLock) {
            ensureWorker();
            if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)
                && !state.compareAndSet(SchedulerState.STOPPED, SchedulerState.RUNNING)) {
                throw new CycleInProgressException("A monitor cycle is already running");
            }
            return submitCycle(config);
        }
    }

    public MonitorStatusResponse getStatus() {
        return new MonitorStatusResponse(
            state.get(),
            configService.getSnapshot().refreshIntervalMinutes(),
            nextRunAt,
            completedCycles.get(),
            skippedTicks.get(),
            lastCycle
        );
    }

    public SchedulerState getState() {
        return state.get();
    }

    public CycleSummary getLastCycle() {
        return lastCycle;
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    void onTick() {
        try {
            Duration current = interval;
            nextRunAt = current == null ? null : Instant.now(clock).plus(current);
            if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
                skippedTicks.incrementAndGet();
                log.warn("Skipping scheduled cycle: previous cycle still running (state={})", state.get());
                return;
            }
            ConfigSnapshot config = configService.getSnapshot();
            synchronized (lifecycleLock) {
                if (worker == null) {
                    state.compareAndSet(SchedulerState.RUNNING, SchedulerState.STOPPED);
                    return;
                }
                submitCycle(config);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel every later tick
            state.compareAndSet(SchedulerState.RUNNING, SchedulerState.IDLE);
            log.warn("Monitor tick failed", e);
        }
    }

    private long submitCycle(ConfigSnapshot config) {
        long cycleNumber = cycleCounter.incrementAndGet();
        try {
            worker.execute(() -> runGuarded(cycleNumber, config));
        } catch (RejectedExecutionException e) {
            state.set(timer == null ? SchedulerState.STOPPED : SchedulerState.IDLE);
            log.warn("Monitor cycle {} rejected by worker", cycleNumber, e);
        }
        return cycleNumber;
    }

    private void runGuarded(long cycleNumber, ConfigSnapshot config) {
        try {
            lastCycle = monitorService.runCycle(cycleNumber, config);
            completedCycles.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("Monitor cycle {} ended with an unexpected error", cycleNumber, e);
        } finally {
            state.compareAndSet(SchedulerState.RUNNING, timer == null ? SchedulerState.STOPPED : SchedulerState.IDLE);
        }
    }

    private void scheduleTicks(Duration initialDelay, Duration period) {
        if (tickFuture != null) {
            tickFuture.cancel(false);
        }
        interval = period;
        tickFuture = timer.scheduleAtFixedRate(
            this::onTick,
            initialDelay.toMillis(),
            period.toMillis(),
            TimeUnit.MILLISECONDS
        );
        nextRunAt = Instant.now(clock).plus(initialDelay);
    }

    private void ensureWorker() {
        if (worker == null) {
            worker = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("ad-monitor-cycle");
                thread.setDaemon(true);
                return thread;
            });
        }
    }
}
