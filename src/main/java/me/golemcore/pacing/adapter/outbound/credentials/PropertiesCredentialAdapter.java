package me.golemcore.pacing.adapter.outbound.credentials;

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

import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.port.outbound.CredentialPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Credentials supplied through {@code pacing.credentials.*} (typically the
 * {@code GITHUB_SESSION_TOKEN} and {@code GITHUB_TOKEN} environment
 * variables).
 *
 * <p>
 * An invalidated long-lived token stays unavailable until the process is
 * restarted with a new one.
 */
@Component
@Slf4j
public class PropertiesCredentialAdapter implements CredentialPort {

    private final AtomicReference<String> sessionToken = new AtomicReference<>();
    private final AtomicReference<String> longLivedToken = new AtomicReference<>();

    public PropertiesCredentialAdapter(PacingProperties properties) {
        sessionToken.set(blankToNull(properties.getCredentials().getSessionToken()));
        longLivedToken.set(blankToNull(properties.getCredentials().getToken()));
        log.info("[Credentials] Delegated session: {}, long-lived token: {}",
                sessionToken.get() != null ? "configured" : "absent",
                longLivedToken.get() != null ? "configured" : "absent");
    }

    @Override
    public Optional<String> getDelegatedSessionToken() {
        return Optional.ofNullable(sessionToken.get());
    }

    @Override
    public Optional<String> getLongLivedToken() {
        return Optional.ofNullable(longLivedToken.get());
    }

    @Override
    public void invalidateLongLivedToken() {
        if (longLivedToken.getAndSet(null) != null) {
            log.warn("[Credentials] Long-lived token was rejected and has been discarded; "
                    + "restart with a new pacing.credentials.token");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
