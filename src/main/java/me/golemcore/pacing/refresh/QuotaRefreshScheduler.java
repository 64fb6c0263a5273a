package me.golemcore.pacing.refresh;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pacing.domain.model.QuotaSettingsChangedEvent;
import me.golemcore.pacing.domain.model.ResolutionOutcome;
import me.golemcore.pacing.domain.service.QuotaRefreshService;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import me.golemcore.pacing.domain.service.QuotaState;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives refresh cycles on a single daemon thread.
 *
 * <p>
 * Timers:
 * <ul>
 * <li>initial cycle - once, {@code pacing.refresh.initial-delay} after
 * startup</li>
 * <li>periodic timer - every {@code refreshIntervalMinutes}, armed after the
 * first cycle that was not rate limited</li>
 * <li>backoff timer - one-shot, {@code retryAfterSeconds + 60s} after a
 * rate-limited cycle; the periodic timer is cancelled meanwhile and re-armed
 * by the next cycle that is not rate limited</li>
 * </ul>
 *
 * <p>
 * At most one cycle runs at a time. A timer or manual trigger that arrives
 * while a cycle is in flight is dropped, not queued. A settings change is the
 * exception: its forced refresh stays pending and runs as soon as the cycle in
 * flight finishes, since that cycle was resolved under the old settings.
 */
@Component
@Slf4j
public class QuotaRefreshScheduler {

    static final long BACKOFF_GRACE_SECONDS = 60;

    private final QuotaRefreshService refreshService;
    private final QuotaSettingsService settingsService;
    private final QuotaState quotaState;
    private final PacingProperties.RefreshProperties refreshProperties;
    private final Supplier<ScheduledExecutorService> executorFactory;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicBoolean forcedRefreshPending = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> periodicTask;
    private ScheduledFuture<?> backoffTask;
    private boolean timersEnabled;

    @Autowired
    public QuotaRefreshScheduler(QuotaRefreshService refreshService, QuotaSettingsService settingsService,
            QuotaState quotaState, PacingProperties properties) {
        this(refreshService, settingsService, quotaState, properties, QuotaRefreshScheduler::newExecutor);
    }

    QuotaRefreshScheduler(QuotaRefreshService refreshService, QuotaSettingsService settingsService,
            QuotaState quotaState, PacingProperties properties,
            Supplier<ScheduledExecutorService> executorFactory) {
        this.refreshService = refreshService;
        this.settingsService = settingsService;
        this.quotaState = quotaState;
        this.refreshProperties = properties.getRefresh();
        this.executorFactory = executorFactory;
    }

    @PostConstruct
    public synchronized void init() {
        scheduler = executorFactory.get();
        if (!refreshProperties.isEnabled()) {
            log.info("[RefreshScheduler] Automatic refresh disabled");
            return;
        }
        timersEnabled = true;
        long delayMillis = refreshProperties.getInitialDelay().toMillis();
        scheduler.schedule(() -> runCycle(false), delayMillis, TimeUnit.MILLISECONDS);
        log.info("[RefreshScheduler] First refresh in {} ms", delayMillis);
    }

    @PreDestroy
    public synchronized void shutdown() {
        timersEnabled = false;
        cancelPeriodic();
        cancelBackoff();
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[RefreshScheduler] Shut down");
    }

    /**
     * Runs a forced cycle on the calling thread.
     *
     * @return {@code false} when another cycle was already running and this
     *         request was dropped
     */
    public boolean refreshNow() {
        return runCycle(true);
    }

    public boolean isRefreshing() {
        return executing.get();
    }

    @EventListener
    public void onSettingsChanged(QuotaSettingsChangedEvent event) {
        quotaState.invalidateCache();
        if (event.refreshIntervalChanged()) {
            resetTimers(event.current().getRefreshIntervalMinutes());
        }
        forcedRefreshPending.set(true);
        submit(this::runPendingRefresh);
    }

    boolean runCycle(boolean forceRefresh) {
        if (!executing.compareAndSet(false, true)) {
            if (forcedRefreshPending.get()) {
                log.debug("[RefreshScheduler] Cycle already running, forced refresh will follow it");
            } else {
                log.debug("[RefreshScheduler] Cycle already running, trigger dropped");
            }
            return false;
        }
        try {
            boolean force = forcedRefreshPending.getAndSet(false) || forceRefresh;
            ResolutionOutcome outcome = refreshService.refresh(force);
            onCycleCompleted(outcome);
        } catch (RuntimeException e) {
            log.error("[RefreshScheduler] Refresh cycle failed", e);
            onCycleCompleted(null);
        } finally {
            executing.set(false);
        }
        if (forcedRefreshPending.get()) {
            submit(this::runPendingRefresh);
        }
        return true;
    }

    private void runPendingRefresh() {
        // a cycle that started after the request already consumed it
        if (forcedRefreshPending.get()) {
            runCycle(true);
        }
    }

    synchronized void onCycleCompleted(ResolutionOutcome outcome) {
        if (!timersEnabled) {
            return;
        }
        if (outcome != null && outcome.isRateLimited()) {
            enterBackoff(outcome.getError().getRetryAfterSeconds());
            return;
        }
        if (backoffTask != null) {
            cancelBackoff();
            log.info("[RefreshScheduler] Backoff over, resuming periodic refresh");
        }
        if (periodicTask == null) {
            armPeriodic(settingsService.getSettings().getRefreshIntervalMinutes());
        }
    }

    private synchronized void resetTimers(int intervalMinutes) {
        if (!timersEnabled) {
            return;
        }
        cancelPeriodic();
        cancelBackoff();
        armPeriodic(intervalMinutes);
    }

    private void enterBackoff(int retryAfterSeconds) {
        cancelPeriodic();
        cancelBackoff();
        long delaySeconds = retryAfterSeconds + BACKOFF_GRACE_SECONDS;
        backoffTask = scheduler.schedule(() -> runCycle(false), delaySeconds, TimeUnit.SECONDS);
        log.warn("[RefreshScheduler] Rate limited, periodic refresh paused; next attempt in {}s", delaySeconds);
    }

    private void armPeriodic(int intervalMinutes) {
        periodicTask = scheduler.scheduleAtFixedRate(() -> runCycle(false), intervalMinutes, intervalMinutes,
                TimeUnit.MINUTES);
        log.info("[RefreshScheduler] Refreshing every {} min", intervalMinutes);
    }

    private void cancelPeriodic() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
        }
    }

    private void cancelBackoff() {
        if (backoffTask != null) {
            backoffTask.cancel(false);
            backoffTask = null;
        }
    }

    private void submit(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("[RefreshScheduler] Scheduler stopped, refresh not submitted");
        }
    }

    private static ScheduledExecutorService newExecutor() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "quota-refresh-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
