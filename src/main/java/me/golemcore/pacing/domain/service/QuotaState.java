package me.golemcore.pacing.domain.service;

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

import me.golemcore.pacing.domain.model.CachedQuota;
import me.golemcore.pacing.domain.model.LatestQuotaStatus;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.UsageReport;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-lifetime state shared by the resolution service, the refresh cycle
 * and the scheduler.
 *
 * <p>
 * Holds:
 * <ul>
 * <li>the cached quota - written only after a successful resolution, swapped
 * atomically so readers see either the old or the new snapshot. Each
 * invalidation starts a new cache generation, and a resolution that began in
 * an earlier generation cannot write its snapshot.</li>
 * <li>the session baseline - usage captured on the first successful cycle</li>
 * <li>the last session milestone that was announced</li>
 * <li>the latest cycle result for readers</li>
 * </ul>
 *
 * <p>
 * Nothing here is persisted; a restart starts a new session.
 */
@Component
@Slf4j
public class QuotaState {

    private final Clock clock;
    private final AtomicReference<CachedQuota> cachedQuota = new AtomicReference<>();
    private final AtomicLong cacheGeneration = new AtomicLong();
    private final AtomicReference<Integer> sessionBaseline = new AtomicReference<>();
    private final AtomicInteger lastMilestone = new AtomicInteger(0);
    private final AtomicReference<LatestQuotaStatus> latest = new AtomicReference<>(LatestQuotaStatus.pending());

    public QuotaState(Clock clock) {
        this.clock = clock;
    }

    // ==================== Cache ====================

    public Optional<UsageSnapshot> freshSnapshot(Instant now, Duration freshness) {
        CachedQuota cached = cachedQuota.get();
        if (cached == null || !cached.isFresh(now, freshness)) {
            return Optional.empty();
        }
        return Optional.of(cached.snapshot());
    }

    public long getCacheGeneration() {
        return cacheGeneration.get();
    }

    /**
     * Caches {@code snapshot} unless the cache was invalidated after
     * {@code generation} was read.
     *
     * @return whether the snapshot was cached
     */
    public synchronized boolean publish(UsageSnapshot snapshot, long generation) {
        if (cacheGeneration.get() != generation) {
            log.debug("[Quota] Snapshot from {} resolved before the cache was invalidated, not cached",
                    snapshot.source());
            return false;
        }
        cachedQuota.set(new CachedQuota(snapshot, clock.instant()));
        return true;
    }

    public synchronized void invalidateCache() {
        cacheGeneration.incrementAndGet();
        if (cachedQuota.getAndSet(null) != null) {
            log.debug("[Quota] Cached quota invalidated");
        }
    }

    // ==================== Session ====================

    /**
     * Captures {@code usedRequests} as the session baseline unless one is
     * already set, and returns the baseline in effect.
     */
    public int captureSessionBaseline(int usedRequests) {
        sessionBaseline.compareAndSet(null, usedRequests);
        return sessionBaseline.get();
    }

    public Optional<Integer> getSessionBaseline() {
        return Optional.ofNullable(sessionBaseline.get());
    }

    /**
     * Returns {@code true} when {@code sessionUsed} grew by at least
     * {@code step} since the last announced milestone, and records it as the
     * new milestone.
     */
    public boolean reachMilestone(int sessionUsed, int step) {
        int previous = lastMilestone.get();
        return sessionUsed >= previous + step && lastMilestone.compareAndSet(previous, sessionUsed);
    }

    // ==================== Latest status ====================

    public LatestQuotaStatus getLatest() {
        return latest.get();
    }

    public void recordReport(UsageReport report) {
        latest.set(new LatestQuotaStatus(LatestQuotaStatus.State.OK, report, null, clock.instant()));
    }

    public void recordFailure(LatestQuotaStatus.State state, ResolutionError error) {
        LatestQuotaStatus previous = latest.get();
        // keep the last good report visible next to the failure
        latest.set(new LatestQuotaStatus(state, previous.report(), error, clock.instant()));
    }
}
