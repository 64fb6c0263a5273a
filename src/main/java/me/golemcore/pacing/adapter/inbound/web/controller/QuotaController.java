package me.golemcore.pacing.adapter.inbound.web.controller;

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

import me.golemcore.pacing.adapter.inbound.web.dto.QuotaSettingsDto;
import me.golemcore.pacing.adapter.inbound.web.dto.QuotaStatusResponse;
import me.golemcore.pacing.domain.model.DiagnosticsReport;
import me.golemcore.pacing.domain.model.LatestQuotaStatus;
import me.golemcore.pacing.domain.model.PacingResult;
import me.golemcore.pacing.domain.model.PlanMode;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.UsageReport;
import me.golemcore.pacing.domain.service.QuotaDiagnosticsService;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import me.golemcore.pacing.domain.service.QuotaState;
import me.golemcore.pacing.refresh.QuotaRefreshScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.Locale;

/**
 * Quota status, manual refresh, runtime settings and diagnostics endpoints.
 */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
@Slf4j
public class QuotaController {

    private final QuotaState quotaState;
    private final QuotaRefreshScheduler refreshScheduler;
    private final QuotaSettingsService settingsService;
    private final QuotaDiagnosticsService diagnosticsService;

    @GetMapping
    public Mono<ResponseEntity<QuotaStatusResponse>> getStatus() {
        return Mono.just(ResponseEntity.ok(toResponse(quotaState.getLatest())));
    }

    /**
     * Runs a forced refresh and answers with the resulting status, or 409 when
     * a refresh is already in progress.
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<QuotaStatusResponse>> refresh() {
        return Mono.fromCallable(refreshScheduler::refreshNow)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ran -> {
                    if (!ran) {
                        throw new ResponseStatusException(HttpStatus.CONFLICT, "Refresh already in progress");
                    }
                    return ResponseEntity.ok(toResponse(quotaState.getLatest()));
                });
    }

    @GetMapping("/settings")
    public Mono<ResponseEntity<QuotaSettingsDto>> getSettings() {
        return Mono.just(ResponseEntity.ok(toDto(settingsService.getSettings())));
    }

    @PutMapping("/settings")
    public Mono<ResponseEntity<QuotaSettingsDto>> updateSettings(@RequestBody QuotaSettingsDto request) {
        QuotaSettings current = settingsService.getSettings();
        QuotaSettings.QuotaSettingsBuilder builder = current.toBuilder();
        if (request.getPlanMode() != null) {
            builder.planMode(parsePlanMode(request.getPlanMode()));
        }
        if (request.getMonthlyLimit() != null) {
            builder.monthlyLimit(request.getMonthlyLimit());
        }
        if (request.getOrgName() != null) {
            builder.orgName(request.getOrgName());
        }
        if (request.getUsername() != null) {
            builder.username(request.getUsername());
        }
        if (request.getRefreshIntervalMinutes() != null) {
            builder.refreshIntervalMinutes(request.getRefreshIntervalMinutes());
        }
        QuotaSettings updated = settingsService.updateSettings(builder.build());
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @GetMapping("/diagnostics")
    public Mono<ResponseEntity<DiagnosticsReport>> diagnostics() {
        return Mono.fromCallable(diagnosticsService::runDiagnostics)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private QuotaStatusResponse toResponse(LatestQuotaStatus latest) {
        QuotaStatusResponse.QuotaStatusResponseBuilder builder = QuotaStatusResponse.builder()
                .state(latest.state().name().toLowerCase(Locale.ROOT))
                .refreshing(refreshScheduler.isRefreshing())
                .updatedAt(latest.updatedAt());

        UsageReport report = latest.report();
        if (report != null) {
            PacingResult pacing = report.pacing();
            builder.status(report.status().getValue())
                    .source(report.source().getTag())
                    .orgName(report.orgName())
                    .fetchedAt(report.fetchedAt())
                    .fromCache(report.fromCache())
                    .usedRequests(pacing.usedRequests())
                    .monthlyLimit(pacing.monthlyLimit())
                    .remaining(pacing.remaining())
                    .daysRemaining(pacing.daysRemaining())
                    .baseDailyBudget(pacing.baseDailyBudget())
                    .dailyAllowance(pacing.dailyAllowance())
                    .avgDailyUsage(pacing.avgDailyUsage())
                    .expectedByNow(pacing.expectedByNow())
                    .banked(pacing.banked())
                    .multiplier(pacing.multiplier())
                    .projectedEnd(pacing.projectedEnd())
                    .sessionUsed(pacing.sessionUsed());
        }

        ResolutionError error = latest.error();
        if (error != null) {
            builder.error(QuotaStatusResponse.ErrorDto.builder()
                    .kind(error.getKind().name())
                    .message(error.getMessage())
                    .scopeHint(error.getScopeHint())
                    .retryAfterSeconds(error.is(ResolutionError.Kind.RATE_LIMITED)
                            ? error.getRetryAfterSeconds()
                            : null)
                    .build());
        }
        return builder.build();
    }

    private static QuotaSettingsDto toDto(QuotaSettings settings) {
        return QuotaSettingsDto.builder()
                .planMode(settings.getPlanMode().name().toLowerCase(Locale.ROOT))
                .monthlyLimit(settings.getMonthlyLimit())
                .orgName(settings.getOrgName())
                .username(settings.getUsername())
                .refreshIntervalMinutes(settings.getRefreshIntervalMinutes())
                .build();
    }

    private static PlanMode parsePlanMode(String value) {
        return Arrays.stream(PlanMode.values())
                .filter(mode -> mode.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan mode: " + value
                        + " (expected auto, individual or business)"));
    }
}
