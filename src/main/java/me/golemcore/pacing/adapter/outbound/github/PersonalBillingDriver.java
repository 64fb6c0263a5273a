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
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Personal billing usage summary for the authenticated user. A successful
 * call always yields a snapshot; no premium request line item means zero
 * usage.
 */
@Component
public class PersonalBillingDriver extends AbstractGitHubDriver {

    static final String SCOPE_HINT = "read:billing (fine-grained: Plan read-only)";

    public PersonalBillingDriver(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        super(gitHubApi, properties, clock);
    }

    @Override
    public UsageSource getSource() {
        return UsageSource.PERSONAL_BILLING;
    }

    @Override
    public DriverResult fetch(String credential, DriverContext context) {
        String username = context.username();
        if (username == null || username.isBlank()) {
            return missingContext("A GitHub username");
        }
        String resource = "/users/" + username + "/settings/billing/usage/summary";
        return execute(resource, SCOPE_HINT, () -> {
            int used = premiumRequestsUsed(
                    gitHubApi.getUserBillingSummary(credential, github.getApiVersion(), username));
            return DriverResult.found(UsageSnapshot.billing(used, getSource(), null, clock.instant()));
        });
    }
}
