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
 * Reads {@code quota_snapshots.premium_interactions} from the internal user
 * endpoint with the delegated session token.
 *
 * <p>
 * Unlimited plans and non-positive entitlements yield no data. When the
 * integer {@code remaining} is absent the fractional {@code quota_remaining}
 * is rounded instead.
 */
@Component
@Slf4j
public class SecondaryQuotaDriver extends AbstractGitHubDriver {

    static final String RESOURCE = "/copilot_internal/user";

    public SecondaryQuotaDriver(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        super(gitHubApi, properties, clock);
    }

    @Override
    public UsageSource getSource() {
        return UsageSource.SECONDARY_INTERNAL;
    }

    @Override
    public DriverResult fetch(String credential, DriverContext context) {
        return execute(RESOURCE, null, () -> parse(gitHubApi.getCopilotUser(credential)));
    }

    private DriverResult parse(JsonNode root) {
        if (root == null) {
            return DriverResult.empty();
        }
        JsonNode premium = root.path("quota_snapshots").path("premium_interactions");
        if (!premium.isObject()) {
            log.debug("[GitHub] No premium_interactions snapshot in user response");
            return DriverResult.empty();
        }
        if (premium.path("unlimited").asBoolean(false)) {
            log.debug("[GitHub] Premium interactions are unlimited");
            return DriverResult.empty();
        }
        int entitlement = premium.path("entitlement").asInt(0);
        if (entitlement <= 0) {
            return DriverResult.empty();
        }
        int reported = premium.hasNonNull("remaining")
                ? premium.get("remaining").asInt()
                : (int) Math.round(premium.path("quota_remaining").asDouble(0));
        int used = Math.max(0, entitlement - reported);
        int remaining = clamp(reported, 0, entitlement);
        String resetAt = textOrNull(root, "quota_reset_date_utc");
        if (resetAt == null) {
            resetAt = textOrNull(root, "quota_reset_date");
        }

        return DriverResult.found(UsageSnapshot.quota(used, remaining, entitlement, getSource(), resetAt,
                clock.instant()));
    }
}
