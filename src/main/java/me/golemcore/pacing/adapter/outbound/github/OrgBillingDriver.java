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
 * Organization billing usage summary. Requires an organization name in the
 * driver context.
 */
@Component
public class OrgBillingDriver extends AbstractGitHubDriver {

    static final String SCOPE_HINT = "read:org or manage_billing:copilot";

    public OrgBillingDriver(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        super(gitHubApi, properties, clock);
    }

    @Override
    public UsageSource getSource() {
        return UsageSource.ORG_BILLING;
    }

    @Override
    public DriverResult fetch(String credential, DriverContext context) {
        String org = context.orgName();
        if (org == null || org.isBlank()) {
            return missingContext("An organization name");
        }
        String resource = "/orgs/" + org + "/settings/billing/usage/summary";
        return execute(resource, SCOPE_HINT, () -> {
            int used = premiumRequestsUsed(
                    gitHubApi.getOrgBillingSummary(credential, github.getApiVersion(), org));
            return DriverResult.found(UsageSnapshot.billing(used, getSource(), org, clock.instant()));
        });
    }
}
