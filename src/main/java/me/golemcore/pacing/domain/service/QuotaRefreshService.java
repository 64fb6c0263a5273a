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

import me.golemcore.pacing.domain.model.LatestQuotaStatus;
import me.golemcore.pacing.domain.model.PacingResult;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionOutcome;
import me.golemcore.pacing.domain.model.UsageReport;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import me.golemcore.pacing.domain.model.UsageStatus;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.CredentialPort;
import me.golemcore.pacing.port.outbound.IdentityPort;
import me.golemcore.pacing.port.outbound.QuotaPresentationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * One refresh cycle: resolve, apply the recovery the outcome asks for, compute
 * pacing and hand the result to the presentation sink.
 *
 * <p>
 * The monthly limit used for pacing is the upstream quota ceiling when the
 * snapshot carries one, the configured limit otherwise. Scheduling and
 * single-flight are handled by
 * {@link me.golemcore.pacing.refresh.QuotaRefreshScheduler}.
 */
@Service
@Slf4j
public class QuotaRefreshService {

    private final QuotaResolutionService resolutionService;
    private final QuotaSettingsService settingsService;
    private final IdentityPort identityPort;
    private final OrganizationResolver organizationResolver;
    private final CredentialPort credentialPort;
    private final QuotaPresentationPort presentationPort;
    private final QuotaState quotaState;
    private final Clock clock;
    private final int milestoneStep;

    public QuotaRefreshService(QuotaResolutionService resolutionService, QuotaSettingsService settingsService,
            IdentityPort identityPort, OrganizationResolver organizationResolver, CredentialPort credentialPort,
            QuotaPresentationPort presentationPort, QuotaState quotaState, PacingProperties properties,
            Clock clock) {
        this.resolutionService = resolutionService;
        this.settingsService = settingsService;
        this.identityPort = identityPort;
        this.organizationResolver = organizationResolver;
        this.credentialPort = credentialPort;
        this.presentationPort = presentationPort;
        this.quotaState = quotaState;
        this.clock = clock;
        this.milestoneStep = properties.getRefresh().getSessionMilestoneStep();
    }

    public ResolutionOutcome refresh(boolean forceRefresh) {
        log.debug("[Refresh] Starting cycle (force={})", forceRefresh);
        ResolutionOutcome outcome = resolutionService.resolve(forceRefresh);

        if (outcome.getRecovery() == ResolutionOutcome.Recovery.REFRESH_IDENTITY_AND_RETRY) {
            log.info("[Refresh] Resource not found, refreshing identity and organization and retrying once");
            identityPort.invalidate();
            organizationResolver.invalidate();
            outcome = resolutionService.resolve(true);
        }

        switch (outcome.getStatus()) {
        case RESOLVED -> present(outcome);
        case NEEDS_CREDENTIALS -> {
            quotaState.recordFailure(LatestQuotaStatus.State.NEEDS_CREDENTIALS, null);
            presentationPort.showNeedsCredentials();
        }
        default -> handleFailure(outcome);
        }
        return outcome;
    }

    private void present(ResolutionOutcome outcome) {
        UsageSnapshot snapshot = outcome.getSnapshot();
        int monthlyLimit = snapshot.hasQuotaCeiling()
                ? snapshot.quotaCeiling()
                : settingsService.getSettings().getMonthlyLimit();
        int baseline = quotaState.captureSessionBaseline(snapshot.usedRequests());

        PacingResult pacing = PacingCalculator.calculatePacing(snapshot.usedRequests(), monthlyLimit,
                ZonedDateTime.now(clock), snapshot.remaining(), baseline);
        UsageStatus status = PacingCalculator.classifyStatus(pacing);

        UsageReport report = UsageReport.builder()
                .pacing(pacing)
                .status(status)
                .source(snapshot.source())
                .orgName(snapshot.orgName())
                .fetchedAt(snapshot.fetchedAt())
                .fromCache(outcome.isFromCache())
                .build();
        quotaState.recordReport(report);
        presentationPort.showReport(report);

        Integer sessionUsed = pacing.sessionUsed();
        if (sessionUsed != null && quotaState.reachMilestone(sessionUsed, milestoneStep)) {
            presentationPort.showSessionMilestone(sessionUsed);
        }
    }

    private void handleFailure(ResolutionOutcome outcome) {
        ResolutionError error = outcome.getError();
        if (outcome.getRecovery() == ResolutionOutcome.Recovery.REAUTHENTICATE) {
            log.warn("[Refresh] Long-lived token rejected, invalidating it");
            credentialPort.invalidateLongLivedToken();
            identityPort.invalidate();
            quotaState.recordFailure(LatestQuotaStatus.State.NEEDS_REAUTHENTICATION, error);
            presentationPort.showNeedsReauthentication(error);
            return;
        }
        quotaState.recordFailure(LatestQuotaStatus.State.FAILED, error);
        presentationPort.showFailure(error);
    }
}
