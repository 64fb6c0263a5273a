package me.golemcore.pacing.adapter.outbound.presentation;

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

import me.golemcore.pacing.domain.model.PacingResult;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.UsageReport;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.port.outbound.QuotaPresentationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders refresh results as log lines. The latest result is also available
 * over HTTP through {@code GET /api/quota}.
 */
@Component
@Slf4j
public class LoggingQuotaPresentationAdapter implements QuotaPresentationPort {

    @Override
    public void showReport(UsageReport report) {
        log.info("[Quota] {}", formatSummary(report));
    }

    @Override
    public void showFailure(ResolutionError error) {
        if (error.getScopeHint() != null) {
            log.warn("[Quota] {} (token needs {})", error.getMessage(), error.getScopeHint());
        } else {
            log.warn("[Quota] {}", error.getMessage());
        }
    }

    @Override
    public void showNeedsCredentials() {
        log.warn("[Quota] No Copilot session and no GitHub token: set GITHUB_SESSION_TOKEN or GITHUB_TOKEN");
    }

    @Override
    public void showNeedsReauthentication(ResolutionError error) {
        log.error("[Quota] {}. Provide a new GitHub token and restart.", error.getMessage());
    }

    @Override
    public void showSessionMilestone(int sessionUsed) {
        log.info("[Quota] {} premium requests used this session", sessionUsed);
    }

    static String formatSummary(UsageReport report) {
        PacingResult pacing = report.pacing();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%.1f/day left (x%.2f) | used %d/%d | %s %.1f | projected %d | %s",
                pacing.dailyAllowance(), pacing.multiplier(), pacing.usedRequests(), pacing.monthlyLimit(),
                pacing.banked() >= 0 ? "banked" : "over by", Math.abs(pacing.banked()), pacing.projectedEnd(),
                report.status().getValue()));
        sb.append(" | source ").append(report.source().getTag());
        if (report.source() == UsageSource.ORG_BILLING && report.orgName() != null) {
            sb.append(" (").append(report.orgName()).append(')');
        }
        if (pacing.sessionUsed() != null) {
            sb.append(" | session ").append(pacing.sessionUsed());
        }
        if (report.fromCache()) {
            sb.append(" | cached");
        }
        return sb.toString();
    }
}
