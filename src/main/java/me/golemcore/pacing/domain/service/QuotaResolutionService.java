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

import me.golemcore.pacing.domain.model.DriverContext;
import me.golemcore.pacing.domain.model.DriverResult;
import me.golemcore.pacing.domain.model.PlanMode;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionException;
import me.golemcore.pacing.domain.model.ResolutionOutcome;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.CredentialPort;
import me.golemcore.pacing.port.outbound.IdentityPort;
import me.golemcore.pacing.port.outbound.UsageSourceDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Resolves the current usage snapshot from the best available source.
 *
 * <p>
 * Sources are tried in a fixed order, each step guarded by a predicate over
 * the state of the current attempt:
 * <ol>
 * <li>primary internal quota - always, when a delegated session exists</li>
 * <li>secondary internal quota - while nothing was found</li>
 * <li>personal billing - while nothing was found, unless the plan mode is
 * business</li>
 * <li>org billing - in business mode while nothing was found; in auto mode
 * as a best-effort upgrade when personal billing reported zero usage</li>
 * </ol>
 *
 * <p>
 * A rate-limited step aborts the attempt so no further requests are spent.
 * Other session-path failures fall through to the next source. Best-effort
 * failures are logged and the earlier result is kept. Any other token-path
 * failure ends the attempt with that error.
 *
 * <p>
 * Successful snapshots are cached for {@code pacing.cache.freshness}; a
 * non-forced call inside that window returns the cached snapshot without
 * touching any driver. An attempt that overlaps a cache invalidation still
 * returns its snapshot but does not cache it.
 */
@Service
@Slf4j
public class QuotaResolutionService {

    static final String NO_ORGANIZATION_MESSAGE = "Could not determine your GitHub organization. "
            + "Set pacing.plan.org-name or use a token with read:org scope.";

    private final QuotaSettingsService settingsService;
    private final CredentialPort credentialPort;
    private final IdentityPort identityPort;
    private final OrganizationResolver organizationResolver;
    private final QuotaState quotaState;
    private final Clock clock;
    private final Duration freshness;
    private final List<ResolutionStep> steps;

    public QuotaResolutionService(UsageSourceRegistry registry, QuotaSettingsService settingsService,
            CredentialPort credentialPort, IdentityPort identityPort, OrganizationResolver organizationResolver,
            QuotaState quotaState, PacingProperties properties, Clock clock) {
        this.settingsService = settingsService;
        this.credentialPort = credentialPort;
        this.identityPort = identityPort;
        this.organizationResolver = organizationResolver;
        this.quotaState = quotaState;
        this.clock = clock;
        this.freshness = properties.getCache().getFreshness();
        this.steps = List.of(
                new ResolutionStep(registry.get(UsageSource.PRIMARY_INTERNAL),
                        attempt -> true,
                        attempt -> false),
                new ResolutionStep(registry.get(UsageSource.SECONDARY_INTERNAL),
                        attempt -> !attempt.hasSnapshot(),
                        attempt -> false),
                new ResolutionStep(registry.get(UsageSource.PERSONAL_BILLING),
                        attempt -> !attempt.hasSnapshot() && attempt.mode() != PlanMode.BUSINESS,
                        attempt -> false),
                new ResolutionStep(registry.get(UsageSource.ORG_BILLING),
                        attempt -> attempt.mode() == PlanMode.BUSINESS
                                ? !attempt.hasSnapshot()
                                : attempt.mode() == PlanMode.AUTO && attempt.hasZeroPersonalUsage(),
                        attempt -> attempt.mode() == PlanMode.AUTO));
    }

    public ResolutionOutcome resolve(boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<UsageSnapshot> cached = quotaState.freshSnapshot(clock.instant(), freshness);
            if (cached.isPresent()) {
                log.debug("[Quota] Using cached snapshot from {}", cached.get().source());
                return ResolutionOutcome.resolved(cached.get(), true);
            }
        }

        long generation = quotaState.getCacheGeneration();
        Attempt attempt = new Attempt(settingsService.getSettings(), generation);
        for (ResolutionStep step : steps) {
            if (!step.applies().test(attempt)) {
                continue;
            }
            ResolutionOutcome aborted = runStep(step, attempt);
            if (aborted != null) {
                return aborted;
            }
        }
        return complete(attempt);
    }

    /**
     * @return an outcome when the attempt must stop here, {@code null} to
     *         continue with the next step
     */
    private ResolutionOutcome runStep(ResolutionStep step, Attempt attempt) {
        UsageSource source = step.driver().getSource();
        Optional<String> credential = source.isSessionPath()
                ? credentialPort.getDelegatedSessionToken()
                : credentialPort.getLongLivedToken();
        if (credential.isEmpty()) {
            if (source.isSessionPath()) {
                log.debug("[Quota] No delegated session, skipping {}", source);
            } else {
                attempt.tokenMissing = true;
            }
            return null;
        }

        boolean bestEffort = step.bestEffort().test(attempt);
        Optional<DriverResult> fetched;
        try {
            fetched = fetch(step.driver(), credential.get(), attempt.settings);
        } catch (ResolutionException e) {
            fetched = Optional.of(DriverResult.failed(e.getError()));
        }
        if (fetched.isEmpty()) {
            if (bestEffort) {
                log.debug("[Quota] No organization detected, keeping {}", attempt.snapshot.source());
                return null;
            }
            return ResolutionOutcome.failed(ResolutionError.transientFailure(NO_ORGANIZATION_MESSAGE), true);
        }
        DriverResult result = fetched.get();

        if (result.isFound()) {
            UsageSnapshot snapshot = result.getSnapshot();
            log.info("[Quota] {} reported used={}, remaining={}, quota={}", source, snapshot.usedRequests(),
                    snapshot.remaining(), snapshot.quotaCeiling());
            attempt.snapshot = snapshot;
            return null;
        }
        if (!result.isFailed()) {
            log.debug("[Quota] {} returned no usage data", source);
            return null;
        }
        return onFailure(source, bestEffort, result.getError());
    }

    private ResolutionOutcome onFailure(UsageSource source, boolean bestEffort, ResolutionError error) {
        if (bestEffort) {
            log.warn("[Quota] Optional {} lookup failed, keeping previous result: {}", source, error.getMessage());
            return null;
        }
        if (error.is(ResolutionError.Kind.RATE_LIMITED)) {
            log.warn("[Quota] {} rate limited, stopping this attempt (retry after {}s)", source,
                    error.getRetryAfterSeconds());
            return ResolutionOutcome.failed(error, !source.isSessionPath());
        }
        if (source.isSessionPath()) {
            log.warn("[Quota] {} failed, trying next source: {}", source, error.getMessage());
            return null;
        }
        log.warn("[Quota] {} failed: {} {}", source, error.getKind(), error.getMessage());
        return ResolutionOutcome.failed(error, true);
    }

    /**
     * @return empty when the org billing source has no organization to query
     */
    private Optional<DriverResult> fetch(UsageSourceDriver driver, String token, QuotaSettings settings) {
        return switch (driver.getSource()) {
        case PERSONAL_BILLING -> Optional.of(driver.fetch(token,
                DriverContext.forUser(identityPort.resolveUsername(token))));
        case ORG_BILLING -> organizationResolver.resolve(token, settings)
                .map(org -> org.hasDetectionResult()
                        ? org.detectionResult()
                        : driver.fetch(token, DriverContext.forOrg(org.name())));
        default -> Optional.of(driver.fetch(token, DriverContext.none()));
        };
    }

    private ResolutionOutcome complete(Attempt attempt) {
        if (attempt.snapshot != null) {
            quotaState.publish(attempt.snapshot, attempt.cacheGeneration);
            return ResolutionOutcome.resolved(attempt.snapshot, false);
        }
        if (attempt.tokenMissing) {
            log.info("[Quota] No delegated session and no long-lived token configured");
            return ResolutionOutcome.needsCredentials();
        }
        return ResolutionOutcome.failed(ResolutionError.transientFailure("No usage source returned data"), false);
    }

    private record ResolutionStep(UsageSourceDriver driver, Predicate<Attempt> applies,
            Predicate<Attempt> bestEffort) {
    }

    /**
     * Mutable state of one resolution attempt.
     */
    private static final class Attempt {

        private final QuotaSettings settings;
        private final long cacheGeneration;
        private UsageSnapshot snapshot;
        private boolean tokenMissing;

        private Attempt(QuotaSettings settings, long cacheGeneration) {
            this.settings = settings;
            this.cacheGeneration = cacheGeneration;
        }

        private PlanMode mode() {
            return settings.getPlanMode();
        }

        private boolean hasSnapshot() {
            return snapshot != null;
        }

        private boolean hasZeroPersonalUsage() {
            return snapshot != null && snapshot.source() == UsageSource.PERSONAL_BILLING
                    && snapshot.usedRequests() == 0;
        }
    }
}
