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

import me.golemcore.pacing.adapter.outbound.github.dto.CopilotSeatsResponse;
import me.golemcore.pacing.adapter.outbound.github.dto.GitHubOrganization;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionException;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.OrganizationDirectoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
@Slf4j
public class GitHubOrganizationDirectoryAdapter implements OrganizationDirectoryPort {

    static final String ORGS_RESOURCE = "/user/orgs";
    static final String ORGS_SCOPE_HINT = "read:org";

    private final GitHubApi gitHubApi;
    private final PacingProperties.GitHubProperties github;
    private final Clock clock;

    public GitHubOrganizationDirectoryAdapter(GitHubApi gitHubApi, PacingProperties properties, Clock clock) {
        this.gitHubApi = gitHubApi;
        this.github = properties.getGithub();
        this.clock = clock;
    }

    @Override
    public List<String> listOrganizations(String token) {
        List<GitHubOrganization> orgs;
        try {
            orgs = gitHubApi.listOrganizations(token, github.getApiVersion(), github.getOrgListLimit());
        } catch (RuntimeException e) { // NOSONAR - classified and rethrown
            ResolutionError error = GitHubErrorClassifier.classify(e, ORGS_RESOURCE, ORGS_SCOPE_HINT,
                    clock.instant());
            throw new ResolutionException(error, e);
        }
        if (orgs == null) {
            return List.of();
        }
        return orgs.stream()
                .map(GitHubOrganization::getLogin)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Seat listings need org admin rights; any failure here only means the
     * activity is not visible and is reported as empty.
     */
    @Override
    public Optional<SeatActivity> findSeatActivity(String token, String orgName, String username) {
        CopilotSeatsResponse response;
        try {
            response = gitHubApi.getCopilotSeats(token, github.getApiVersion(), orgName);
        } catch (RuntimeException e) { // NOSONAR - seat visibility is optional
            ResolutionError error = GitHubErrorClassifier.classify(e, "/orgs/" + orgName + "/copilot/billing/seats",
                    null, clock.instant());
            log.debug("[GitHub] Seat list for {} not readable: {}", orgName, error.getMessage());
            return Optional.empty();
        }
        if (response == null || response.getSeats() == null) {
            return Optional.empty();
        }
        return response.getSeats().stream()
                .filter(seat -> seat.getAssignee() != null
                        && username.equalsIgnoreCase(seat.getAssignee().getLogin()))
                .findFirst()
                .map(seat -> new SeatActivity(seat.getAssignee().getLogin(), seat.getLastActivityAt()));
    }
}
