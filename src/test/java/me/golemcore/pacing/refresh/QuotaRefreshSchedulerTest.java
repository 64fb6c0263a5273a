package me.golemcore.pacing.refresh;

import me.golemcore.pacing.domain.model.PlanMode;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.QuotaSettingsChangedEvent;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionOutcome;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.domain.service.QuotaRefreshService;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import me.golemcore.pacing.domain.service.QuotaState;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuotaRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-04-15T12:00:00Z");

    private QuotaRefreshService refreshService;
    private QuotaState quotaState;
    private PacingProperties properties;
    private ScheduledExecutorService executor;
    private List<ScheduledFuture<?>> oneShots;
    private List<ScheduledFuture<?>> periodics;
    private QuotaRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        refreshService = mock(QuotaRefreshService.class);
        when(refreshService.refresh(anyBoolean())).thenReturn(resolved());
        QuotaSettingsService settingsService = mock(QuotaSettingsService.class);
        when(settingsService.getSettings()).thenReturn(QuotaSettings.builder().build());
        quotaState = new QuotaState(Clock.fixed(NOW, ZoneOffset.UTC));
        properties = new PacingProperties();

        executor = mock(ScheduledExecutorService.class);
        oneShots = new ArrayList<>();
        periodics = new ArrayList<>();
        doAnswer(invocation -> track(oneShots)).when(executor)
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        doAnswer(invocation -> track(periodics)).when(executor)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

        scheduler = new QuotaRefreshScheduler(refreshService, settingsService, quotaState, properties,
                () -> executor);
    }

    @Test
    void shouldScheduleInitialCycleAfterStartupDelay() {
        scheduler.init();

        verify(executor).schedule(any(Runnable.class), eq(10_000L), eq(TimeUnit.MILLISECONDS));
        verify(executor, never()).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any());
    }

    @Test
    void shouldNotScheduleAnythingWhenDisabled() {
        properties.getRefresh().setEnabled(false);
        scheduler.init();

        assertTrue(scheduler.runCycle(false));

        verify(executor, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        verify(executor, never()).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any());
    }

    @Test
    void shouldArmPeriodicTimerAfterFirstCycle() {
        scheduler.init();

        scheduler.runCycle(false);
        scheduler.runCycle(false);

        verify(executor, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(30L), eq(30L),
                eq(TimeUnit.MINUTES));
        verify(refreshService, times(2)).refresh(false);
    }

    @Test
    void shouldPausePeriodicTimerAndBackOffWhenRateLimited() {
        scheduler.init();
        scheduler.runCycle(false);
        ScheduledFuture<?> periodic = periodics.get(0);

        when(refreshService.refresh(anyBoolean())).thenReturn(rateLimited(30));
        scheduler.runCycle(false);

        verify(periodic).cancel(false);
        verify(executor).schedule(any(Runnable.class), eq(90L), eq(TimeUnit.SECONDS));
        assertEquals(1, periodics.size());
    }

    @Test
    void shouldReplacePendingBackoffOnRepeatedRateLimit() {
        scheduler.init();
        when(refreshService.refresh(anyBoolean())).thenReturn(rateLimited(30));

        scheduler.runCycle(false);
        ScheduledFuture<?> firstBackoff = oneShots.get(oneShots.size() - 1);
        when(refreshService.refresh(anyBoolean())).thenReturn(rateLimited(120));
        scheduler.runCycle(false);

        verify(firstBackoff).cancel(false);
        verify(executor).schedule(any(Runnable.class), eq(180L), eq(TimeUnit.SECONDS));
        assertTrue(periodics.isEmpty());
    }

    @Test
    void shouldResumePeriodicTimerAfterBackoff() {
        scheduler.init();
        when(refreshService.refresh(anyBoolean())).thenReturn(rateLimited(30));
        scheduler.runCycle(false);
        ScheduledFuture<?> backoff = oneShots.get(oneShots.size() - 1);

        when(refreshService.refresh(anyBoolean())).thenReturn(resolved());
        scheduler.runCycle(false);

        verify(backoff).cancel(false);
        assertEquals(1, periodics.size());
    }

    @Test
    void shouldDropTriggerWhileCycleInFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(refreshService.refresh(anyBoolean())).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return resolved();
        });
        scheduler.init();

        AtomicBoolean firstRan = new AtomicBoolean();
        Thread first = new Thread(() -> firstRan.set(scheduler.runCycle(false)));
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.isRefreshing());
        assertFalse(scheduler.refreshNow());

        release.countDown();
        first.join(5000);
        assertTrue(firstRan.get());
        assertFalse(scheduler.isRefreshing());
        verify(refreshService, times(1)).refresh(anyBoolean());
    }

    @Test
    void shouldRunForcedRefreshOnceCycleOverlappingSettingsChangeFinishes() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(refreshService.refresh(false)).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return resolved();
        });
        when(refreshService.refresh(true)).thenReturn(resolved());
        scheduler.init();

        Thread inFlight = new Thread(() -> scheduler.runCycle(false));
        inFlight.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        QuotaSettings previous = QuotaSettings.builder().build();
        scheduler.onSettingsChanged(new QuotaSettingsChangedEvent(previous,
                previous.toBuilder().planMode(PlanMode.BUSINESS).build()));
        ArgumentCaptor<Runnable> submitted = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(submitted.capture());
        submitted.getValue().run();
        verify(refreshService, never()).refresh(true);

        release.countDown();
        inFlight.join(5000);

        verify(executor, times(2)).execute(submitted.capture());
        submitted.getAllValues().get(submitted.getAllValues().size() - 1).run();
        verify(refreshService, times(1)).refresh(false);
        verify(refreshService, times(1)).refresh(true);
        assertFalse(scheduler.isRefreshing());
    }

    @Test
    void shouldForceNextTimerCycleWhenSettingsChangedRefreshIsPending() {
        scheduler.init();
        scheduler.onSettingsChanged(new QuotaSettingsChangedEvent(QuotaSettings.builder().build(),
                QuotaSettings.builder().monthlyLimit(1500).build()));

        scheduler.runCycle(false);
        scheduler.runCycle(false);

        verify(refreshService, times(1)).refresh(true);
        verify(refreshService, times(1)).refresh(false);
    }

    @Test
    void shouldKeepRunningAfterUnexpectedFailure() {
        scheduler.init();
        when(refreshService.refresh(anyBoolean())).thenThrow(new IllegalStateException("boom"));

        assertTrue(scheduler.runCycle(false));
        assertTrue(scheduler.runCycle(false));

        assertFalse(scheduler.isRefreshing());
        assertEquals(1, periodics.size());
    }

    @Test
    void shouldReplaceTimerAndRefreshWhenIntervalChanges() {
        scheduler.init();
        scheduler.runCycle(false);
        ScheduledFuture<?> oldPeriodic = periodics.get(0);
        quotaState.publish(UsageSnapshot.billing(3, UsageSource.PERSONAL_BILLING, null, NOW),
                quotaState.getCacheGeneration());

        QuotaSettings previous = QuotaSettings.builder().refreshIntervalMinutes(30).build();
        QuotaSettings current = QuotaSettings.builder().refreshIntervalMinutes(10).build();
        scheduler.onSettingsChanged(new QuotaSettingsChangedEvent(previous, current));

        InOrder order = inOrder(oldPeriodic, executor);
        order.verify(oldPeriodic).cancel(false);
        order.verify(executor).scheduleAtFixedRate(any(Runnable.class), eq(10L), eq(10L), eq(TimeUnit.MINUTES));
        verify(executor).execute(any(Runnable.class));
        assertTrue(quotaState.freshSnapshot(NOW, Duration.ofMinutes(5)).isEmpty());
    }

    @Test
    void shouldKeepTimerWhenIntervalUnchanged() {
        scheduler.init();
        scheduler.runCycle(false);

        QuotaSettings previous = QuotaSettings.builder().build();
        scheduler.onSettingsChanged(new QuotaSettingsChangedEvent(previous,
                previous.toBuilder().monthlyLimit(1500).build()));

        verify(periodics.get(0), never()).cancel(anyBoolean());
        assertEquals(1, periodics.size());
        verify(executor).execute(any(Runnable.class));
    }

    @Test
    void shouldShutDownExecutorAndCancelTimers() throws Exception {
        scheduler.init();
        scheduler.runCycle(false);
        when(executor.awaitTermination(5, TimeUnit.SECONDS)).thenReturn(true);

        scheduler.shutdown();

        verify(periodics.get(0)).cancel(false);
        verify(executor).shutdown();
        verify(executor, never()).shutdownNow();
    }

    private static ScheduledFuture<?> track(List<ScheduledFuture<?>> futures) {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        futures.add(future);
        return future;
    }

    private static ResolutionOutcome resolved() {
        return ResolutionOutcome.resolved(UsageSnapshot.billing(3, UsageSource.PERSONAL_BILLING, null, NOW), false);
    }

    private static ResolutionOutcome rateLimited(int retryAfterSeconds) {
        return ResolutionOutcome.failed(ResolutionError.rateLimited(retryAfterSeconds), false);
    }
}
