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

import me.golemcore.pacing.domain.model.DiagnosticsReport;
import me.golemcore.pacing.domain.model.DiagnosticsReport.Check;
import me.golemcore.pacing.domain.model.DriverContext;
import me.golemcore.pacing.domain.model.DriverResult;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.ResolutionException;
import me.golemcore.pacing.domain.model.UsageSnapshot;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.port.outbound.CredentialPort;
import me.golemcore.pacing.port.outbound.IdentityPort;
import me.golemcore.pacing.port.outbound.OrganizationDirectoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queries every upstream endpoint once and reports what each one answered.
 * Nothing is cached or published; the regular refresh cycle is unaffected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaDiagnosticsService {

    static final int MAX_ORG_CHECKS = 3;

    private final UsageSourceRegistry registry;
    private final CredentialPort credentialPort;
    private final IdentityPort identityPort;
    private final OrganizationDirectoryPort directory;
    private final QuotaSettingsService settingsService;
    private final Clock clock;

    public DiagnosticsReport runDiagnostics() {
        List<Check> checks = new ArrayList<>();

        Optional<String> session = credentialPort.getDelegatedSessionToken();
        if (session.isPresent()) {
            checks.add(checkDriver("primary-internal", UsageSource.PRIMARY_INTERNAL, session.get(),
                    DriverContext.none()));
            checks.add(checkDriver("secondary-internal", UsageSource.SECONDARY_INTERNAL, session.get(),
                    DriverContext.none()));
        } else {
            checks.add(new Check("session", false, "No delegated session available"));
        }

        Optional<String> token = credentialPort.getLongLivedToken();
        if (token.isEmpty()) {
            checks.add(new Check("token", false, "No long-lived token configured"));
            return finish(checks);
        }

        String username = null;
        try {
            username = identityPort.resolveUsername(token.get());
            checks.add(new Check("identity", true, username));
            checks.add(checkDriver("personal-billing", UsageSource.PERSONAL_BILLING, token.get(),
                    DriverContext.forUser(username)));
        } catch (ResolutionException e) {
            checks.add(new Check("identity", false, describe(e)));
        }

        try {
            List<String> orgs = directory.listOrganizations(token.get());
            checks.add(new Check("organizations", true, orgs.isEmpty() ? "(none)" : String.join(", ", orgs)));
            for (String org : orgs.stream().limit(MAX_ORG_CHECKS).toList()) {
                checks.add(checkDriver("org-billing:" + org, UsageSource.ORG_BILLING, token.get(),
                        DriverContext.forOrg(org)));
            }
        } catch (ResolutionException e) {
            checks.add(new Check("organizations", false, describe(e)));
        }

        QuotaSettings settings = settingsService.getSettings();
        if (settings.hasOrgName() && username != null) {
            String org = settings.getOrgName();
            checks.add(directory.findSeatActivity(token.get(), org, username)
                    .map(seat -> new Check("seat:" + org, true, "last activity " + seat.lastActivityAt()))
                    .orElseGet(() -> new Check("seat:" + org, false, "Seat list not readable or no seat")));
        }

        return finish(checks);
    }

    private Check checkDriver(String name, UsageSource source, String credential, DriverContext context) {
        DriverResult result = registry.get(source).fetch(credential, context);
        if (result.isFound()) {
            return new Check(name, true, describe(result.getSnapshot()));
        }
        if (result.isFailed()) {
            return new Check(name, false, result.getError().getKind() + ": " + result.getError().getMessage());
        }
        return new Check(name, true, "no usage data");
    }

    private DiagnosticsReport finish(List<Check> checks) {
        long failed = checks.stream().filter(check -> !check.ok()).count();
        log.info("[Diagnostics] {} checks, {} failed", checks.size(), failed);
        return new DiagnosticsReport(clock.instant(), List.copyOf(checks));
    }

    private static String describe(UsageSnapshot snapshot) {
        StringBuilder sb = new StringBuilder("used=").append(snapshot.usedRequests());
        if (snapshot.hasQuotaCeiling()) {
            sb.append(", remaining=").append(snapshot.remaining()).append(", quota=").append(snapshot.quotaCeiling());
        }
        return sb.toString();
    }

    private static String describe(ResolutionException e) {
        return e.getError().getKind() + ": " + e.getError().getMessage();
    }
}
