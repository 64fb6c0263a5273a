package me.golemcore.pacing.adapter.outbound.github;

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

import me.golemcore.pacing.adapter.outbound.github.dto.BillingUsageSummary;
import me.golemcore.pacing.domain.model.DriverResult;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.UsageSourceDriver;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Shared failure handling for the GitHub usage drivers: any exception thrown
 * by the Feign call or by response parsing is classified and returned as a
 * failed {@link DriverResult}.
 */
@Slf4j
abstract class AbstractGitHubDriver implements UsageSourceDriver {

    protected final GitHubApi gitHubApi;
    protected final PacingProperties.GitHubProperties github;
    protected final Clock clock;

    protected AbstractGitHubDriver(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        this.gitHubApi = gitHubApi;
        this.github = properties.getGithub();
        this.clock = clock;
    }

    protected DriverResult execute(String resource, String scopeHint, Supplier<DriverResult> call) {
        try {
            return call.get();
        } catch (RuntimeException e) { // NOSONAR - every failure becomes a classified result
            ResolutionError error = GitHubErrorClassifier.classify(e, resource, scopeHint, clock.instant());
            log.debug("[GitHub] {} failed for {}: {}", getSource(), resource, error.getMessage());
            return DriverResult.failed(error);
        }
    }

    /**
     * Premium request units for the configured SKU, rounded to whole requests.
     * A summary without that SKU counts as zero usage.
     */
    protected int premiumRequestsUsed(BillingUsageSummary summary) {
        if (summary == null || summary.getUsageItems() == null) {
            return 0;
        }
        return summary.getUsageItems().stream()
                .filter(item -> github.getPremiumRequestSku().equals(item.getSku()))
                .findFirst()
                .map(item -> (int) Math.max(0, Math.round(item.getGrossQuantity())))
                .orElse(0);
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    protected static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    protected static DriverResult missingContext(String what) {
        return DriverResult.failed(ResolutionError.transientFailure(what + " is required for this usage source"));
    }
}
