package me.golemcore.pacing.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the quota pacer, bound from
 * application.properties.
 *
 * <p>
 * All configuration lives under the {@code pacing.*} prefix:
 * <ul>
 * <li>{@link GitHubProperties} - upstream API location and client
 * identification headers</li>
 * <li>{@link PlanProperties} - initial plan mode, limit, org and username</li>
 * <li>{@link CredentialsProperties} - delegated session and long-lived
 * tokens</li>
 * <li>{@link RefreshProperties} - refresh timer settings</li>
 * <li>{@link CacheProperties} - snapshot freshness window</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and pooling</li>
 * </ul>
 *
 * <p>
 * Plan values only seed
 * {@link me.golemcore.pacing.domain.service.QuotaSettingsService}; later
 * changes go through that service.
 */
@Component
@ConfigurationProperties(prefix = "pacing")
@Data
public class PacingProperties {

    private GitHubProperties github = new GitHubProperties();
    private PlanProperties plan = new PlanProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private RefreshProperties refresh = new RefreshProperties();
    private CacheProperties cache = new CacheProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class GitHubProperties {
        private String apiBaseUrl = "https://api.github.com";
        private String apiVersion = "2022-11-28";
        private String editorVersion = "vscode/1.90.0";
        private String editorPluginVersion = "copilot-tracer/1.0.0";
        private String premiumRequestSku = "copilot_premium_request";
        private int orgListLimit = 30;
    }

    @Data
    public static class PlanProperties {
        private String mode = "auto";
        private int monthlyLimit = 300;
        private String orgName = "";
        private String username = "";
    }

    @Data
    public static class CredentialsProperties {
        private String sessionToken;
        private String token;
    }

    @Data
    public static class RefreshProperties {
        private boolean enabled = true;
        private int intervalMinutes = 30;
        private Duration initialDelay = Duration.ofSeconds(10);
        private int sessionMilestoneStep = 10;
    }

    @Data
    public static class CacheProperties {
        private Duration freshness = Duration.ofMinutes(5);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private String userAgent = "golemcore-quota-pacer";
    }
}
