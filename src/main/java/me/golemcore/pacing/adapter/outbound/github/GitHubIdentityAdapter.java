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

import me.golemcore.pacing.adapter.outbound.github.dto.GitHubUser;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.QuotaSettingsChangedEvent;
import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.ResolutionException;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.IdentityPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the token owner's login.
 *
 * <p>
 * A configured username is used as-is until it is invalidated, after which
 * {@code GET /user} is asked instead. The resolved login is cached until the
 * next invalidation or settings change.
 */
@Component
@Slf4j
public class GitHubIdentityAdapter implements IdentityPort {

    static final String RESOURCE = "/user";

    private final GitHubApi gitHubApi;
    private final QuotaSettingsService settingsService;
    private final String apiVersion;
    private final Clock clock;
    private final AtomicReference<String> cachedUsername = new AtomicReference<>();
    private final AtomicBoolean configuredUsernameRejected = new AtomicBoolean(false);

    public GitHubIdentityAdapter(GitHubApi gitHubApi, QuotaSettingsService settingsService,
            PacingProperties properties, Clock clock) {
        this.gitHubApi = gitHubApi;
        this.settingsService = settingsService;
        this.apiVersion = properties.getGithub().getApiVersion();
        this.clock = clock;
    }

    @Override
    public String resolveUsername(String token) {
        String cached = cachedUsername.get();
        if (cached != null) {
            return cached;
        }
        QuotaSettings settings = settingsService.getSettings();
        String resolved = settings.hasUsername() && !configuredUsernameRejected.get()
                ? settings.getUsername()
                : fetchLogin(token);
        cachedUsername.set(resolved);
        return resolved;
    }

    @Override
    public void invalidate() {
        cachedUsername.set(null);
        if (settingsService.getSettings().hasUsername()) {
            configuredUsernameRejected.set(true);
        }
        log.debug("[Identity] Cached username invalidated");
    }

    @EventListener
    public void onSettingsChanged(QuotaSettingsChangedEvent event) {
        cachedUsername.set(null);
        configuredUsernameRejected.set(false);
    }

    private String fetchLogin(String token) {
        GitHubUser user;
        try {
            user = gitHubApi.getAuthenticatedUser(token, apiVersion);
        } catch (RuntimeException e) { // NOSONAR - classified and rethrown
            throw new ResolutionException(GitHubErrorClassifier.classify(e, RESOURCE, null, clock.instant()), e);
        }
        if (user == null || user.getLogin() == null || user.getLogin().isBlank()) {
            throw new ResolutionException(ResolutionError.transientFailure("GitHub /user returned no login"));
        }
        log.info("[Identity] Resolved GitHub username: {}", user.getLogin());
        return user.getLogin();
    }
}
