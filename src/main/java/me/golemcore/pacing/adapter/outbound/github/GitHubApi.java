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
import me.golemcore.pacing.adapter.outbound.github.dto.CopilotSeatsResponse;
import me.golemcore.pacing.adapter.outbound.github.dto.GitHubOrganization;
import me.golemcore.pacing.adapter.outbound.github.dto.GitHubUser;
import com.fasterxml.jackson.databind.JsonNode;
import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.List;

/**
 * Declarative GitHub REST client.
 *
 * <p>
 * The internal Copilot endpoints take the delegated session token with the
 * {@code token} scheme and are read as raw JSON because their shape differs
 * between plan types. The billing endpoints take the long-lived token with the
 * {@code Bearer} scheme.
 */
public interface GitHubApi {

    @RequestLine("GET /copilot_internal/v2/token")
    @Headers({
            "Authorization: token {token}",
            "Accept: application/json",
            "editor-version: {editorVersion}",
            "editor-plugin-version: {pluginVersion}"
    })
    JsonNode getCopilotToken(@Param("token") String token,
            @Param("editorVersion") String editorVersion,
            @Param("pluginVersion") String pluginVersion);

    @RequestLine("GET /copilot_internal/user")
    @Headers({
            "Authorization: token {token}",
            "Accept: application/json"
    })
    JsonNode getCopilotUser(@Param("token") String token);

    @RequestLine("GET /users/{username}/settings/billing/usage/summary")
    @Headers({
            "Authorization: Bearer {token}",
            "Accept: application/vnd.github+json",
            "X-GitHub-Api-Version: {apiVersion}"
    })
    BillingUsageSummary getUserBillingSummary(@Param("token") String token,
            @Param("apiVersion") String apiVersion,
            @Param("username") String username);

    @RequestLine("GET /orgs/{org}/settings/billing/usage/summary")
    @Headers({
            "Authorization: Bearer {token}",
            "Accept: application/vnd.github+json",
            "X-GitHub-Api-Version: {apiVersion}"
    })
    BillingUsageSummary getOrgBillingSummary(@Param("token") String token,
            @Param("apiVersion") String apiVersion,
            @Param("org") String org);

    @RequestLine("GET /user")
    @Headers({
            "Authorization: Bearer {token}",
            "Accept: application/vnd.github+json",
            "X-GitHub-Api-Version: {apiVersion}"
    })
    GitHubUser getAuthenticatedUser(@Param("token") String token,
            @Param("apiVersion") String apiVersion);

    @RequestLine("GET /user/orgs?per_page={perPage}")
    @Headers({
            "Authorization: Bearer {token}",
            "Accept: application/vnd.github+json",
            "X-GitHub-Api-Version: {apiVersion}"
    })
    List<GitHubOrganization> listOrganizations(@Param("token") String token,
            @Param("apiVersion") String apiVersion,
            @Param("perPage") int perPage);

    @RequestLine("GET /orgs/{org}/copilot/billing/seats")
    @Headers({
            "Authorization: Bearer {token}",
            "Accept: application/vnd.github+json",
            "X-GitHub-Api-Version: {apiVersion}"
    })
    CopilotSeatsResponse getCopilotSeats(@Param("token") String token,
            @Param("apiVersion") String apiVersion,
            @Param("org") String org);
}
