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
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.QuotaSettingsChangedEvent;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionException;
import me.golemcore.pacing.domain.model.ResolvedOrganization;
import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.port.outbound.OrganizationDirectoryPort;
import me.golemcore.pacing.port.outbound.UsageSourceDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Determines which organization the org billing source should query.
 *
 * <p>
 * A configured org name always wins. Otherwise the token owner's organizations
 * are listed and tried in order with the org billing driver; the first one
 * that answers is remembered until the settings change or
 * {@link #invalidate()} is called. The billing result that found it is handed
 * back so the caller does not query the same org twice.
 */
@Service
@Slf4j
public class OrganizationResolver {

    private final OrganizationDirectoryPort directory;
    private final UsageSourceDriver orgDriver;
    private final AtomicReference<String> detectedOrg = new AtomicReference<>();

    public OrganizationResolver(OrganizationDirectoryPort directory, UsageSourceRegistry registry) {
        this.directory = directory;
        this.orgDriver = registry.get(UsageSource.ORG_BILLING);
    }

    /**
     * @throws ResolutionException
     *             when listing organizations fails or a billing lookup hits
     *             the rate limit
     */
    public Optional<ResolvedOrganization> resolve(String token, QuotaSettings settings) {
        if (settings.hasOrgName()) {
            return Optional.of(ResolvedOrganization.of(settings.getOrgName().trim()));
        }
        String cached = detectedOrg.get();
        if (cached != null) {
            return Optional.of(ResolvedOrganization.of(cached));
        }
        Optional<ResolvedOrganization> detected = detect(token);
        detected.ifPresent(org -> detectedOrg.set(org.name()));
        return detected;
    }

    /**
     * Forgets the detected organization; the next call lists and checks again.
     */
    public void invalidate() {
        String previous = detectedOrg.getAndSet(null);
        if (previous != null) {
            log.debug("[Org] Forgot detected organization {}", previous);
        }
    }

    @EventListener
    public void onSettingsChanged(QuotaSettingsChangedEvent event) {
        invalidate();
    }

    private Optional<ResolvedOrganization> detect(String token) {
        List<String> orgs = directory.listOrganizations(token);
        log.debug("[Org] Checking {} organizations for billing access", orgs.size());
        for (String org : orgs) {
            DriverResult usage = orgDriver.fetch(token, DriverContext.forOrg(org));
            if (usage.isFound()) {
                log.info("[Org] Detected organization with billing access: {}", org);
                return Optional.of(ResolvedOrganization.detected(org, usage));
            }
            if (usage.isFailed() && usage.getError().is(ResolutionError.Kind.RATE_LIMITED)) {
                throw new ResolutionException(usage.getError());
            }
        }
        log.info("[Org] No organization with readable billing among {} candidates", orgs.size());
        return Optional.empty();
    }
}
