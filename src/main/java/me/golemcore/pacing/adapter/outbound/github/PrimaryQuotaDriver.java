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

import me.golemcore.pacing.domain.model.DriverContext;
import me.golemcore.pacing.domain.model.DriverResult;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Reads the premium interaction quota from the internal token endpoint. Works
 * with the delegated session token only.
 *
 * <p>
 * Business and Enterprise seats do not carry {@code limited_user_quotas}; the
 * driver answers {@link DriverResult#empty()} for them.
 */
@Component
@Slf4j
public class PrimaryQuotaDriver extends AbstractGitHubDriver {

    static final String RESOURCE = "/copilot_internal/v2/token";

    public PrimaryQuotaDriver(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        super(gitHubApi, properties, clock);
    }

    @Override
    public UsageSource getSource() {
        return UsageSource.PRIMARY_INTERNAL;
    }

    @Override
    public DriverResult fetch(String credential, DriverContext context) {
        return execute(RESOURCE, null, () -> parse(gitHubApi.getCopilotToken(credential,
                github.getEditorVersion(), github.getEditorPluginVersion())));
    }

    private DriverResult parse(JsonNode root) {
        if (root == null || !root.hasNonNull("limited_user_quotas")) {
            log.debug("[GitHub] No limited_user_quotas in token response");
            return DriverResult.empty();
        }
        JsonNode interaction = root.path("limited_user_quotas").path("copilot_premium_interaction");
        JsonNode storage = interaction.path("storage");
        if (!storage.hasNonNull("quota") || storage.get("quota").asInt() <= 0) {
            log.debug("[GitHub] Token response has no premium interaction quota");
            return DriverResult.empty();
        }
        int quota = storage.get("quota").asInt();
        int used = Math.max(0, storage.path("used").asInt(0));
        int remaining = clamp(storage.path("remaining").asInt(0), 0, quota);
        String resetAt = textOrNull(interaction, "quota_reset_at");

        return DriverResult.found(UsageSnapshot.quota(used, remaining, quota, getSource(), resetAt,
                clock.instant()));
    }
}
