package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.CycleSummary;
import com.delta.adfeed.monitor.model.SchedulerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdMonitorSchedulerTest {
    private static final ConfigSnapshot CONFIG =
        new ConfigSnapshot("0.0.0.0", 5000, "$", 15, "monitor.log", "ads.db", List.of());

    @Mock
    private AdMonitorService monitorService;
    @Mock
    private MonitorConfigService configService;

    private AdMonitorScheduler scheduler;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.getScheduler().setShutdownGraceSeconds(2);
        lenient().when(configService.getSnapshot()).thenReturn(CONFIG);
        scheduler = new AdMonitorScheduler(monitorService, configService, properties, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void tickWhileRunningIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(monitorService.runCycle(anyLong(), any(ConfigSnapshot.class))).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return summary(invocation.getArgument(0));
        });
        scheduler.start(Duration.ofHours(1));

        scheduler.onTick();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.onTick();

        assertThat(scheduler.getSkippedTicks()).isEqualTo(1);
        assertThatThrownBy(scheduler::triggerNow).isInstanceOf(CycleInProgressException.class);

        release.countDown();
        awaitState(SchedulerState.IDLE);
        verify(monitorService, times(1)).runCycle(anyLong(), any(ConfigSnapshot.class));
        assertThat(scheduler.getLastCycle().cycleNumber()).isEqualTo(1);
    }

    @Test
    void failingCycleReleasesTheLock() throws Exception {
        CountDownLatch secondRun = new CountDownLatch(1);
        when(monitorService.runCycle(anyLong(), any(ConfigSnapshot.class)))
            .thenThrow(new IllegalStateException("boom"))
            .thenAnswer(invocation -> {
                secondRun.countDown();
                return summary(invocation.getArgument(0));
            });
        scheduler.start(Duration.ofHours(1));

        scheduler.triggerNow();
        awaitState(SchedulerState.IDLE);
        scheduler.triggerNow();

        assertThat(secondRun.await(5, TimeUnit.SECONDS)).isTrue();
        awaitState(SchedulerState.IDLE);
        assertThat(scheduler.getSkippedTicks()).isZero();
    }

    @Test
    void manualTriggerWorksWhileTimerIsStopped() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        when(monitorService.runCycle(anyLong(), any(ConfigSnapshot.class))).thenAnswer(invocation -> {
            ran.countDown();
            return summary(invocation.getArgument(0));
        });

        long cycle = scheduler.triggerNow();

        assertThat(cycle).isEqualTo(1);
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        awaitState(SchedulerState.STOPPED);
    }

    @Test
    void rescheduleReplacesTimer() {
        scheduler.start(Duration.ofHours(1));
        Instant firstRun = scheduler.getStatus().nextRunAt();

        scheduler.onConfigApplied(CONFIG, withInterval(5));

        Instant nextRun = scheduler.getStatus().nextRunAt();
        assertThat(nextRun).isBefore(firstRun);
        assertThat(Duration.between(Instant.now(), nextRun)).isLessThanOrEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void rescheduleRequiresRunningTimer() {
        assertThatThrownBy(() -> scheduler.reschedule(Duration.ofMinutes(5)))
            .isInstanceOf(IllegalStateException.class);
    }

    private void awaitState(SchedulerState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (scheduler.getState() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(scheduler.getState()).isEqualTo(expected);
    }

    private static ConfigSnapshot withInterval(int minutes) {
        return new ConfigSnapshot("0.0.0.0", 5000, "$", minutes, "monitor.log", "ads.db", List.of());
    }

    private static CycleSummary summary(long cycleNumber) {
        Instant now = Instant.now();
        return new CycleSummary(cycleNumber, now, now, AdMonitorService.STATUS_COMPLETED, List.of(), 0);
    }
}
