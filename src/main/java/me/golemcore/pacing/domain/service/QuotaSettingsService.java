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

import me.golemcore.pacing.domain.model.PlanMode;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.model.QuotaSettingsChangedEvent;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.infrastructure.event.SpringEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the runtime {@link QuotaSettings}.
 *
 * <p>
 * Seeded from {@code pacing.plan.*} and {@code pacing.refresh.interval-minutes}
 * at startup. Every update is normalized, swapped in atomically and announced
 * with a {@link QuotaSettingsChangedEvent}:
 * <ul>
 * <li>non-positive monthly limit - reset to {@value QuotaSettings#DEFAULT_MONTHLY_LIMIT}</li>
 * <li>non-positive refresh interval - reset to
 * {@value QuotaSettings#DEFAULT_REFRESH_INTERVAL_MINUTES} minutes</li>
 * <li>refresh interval below {@value QuotaSettings#MIN_REFRESH_INTERVAL_MINUTES}
 * minutes - raised to that floor</li>
 * <li>blank org name or username - cleared</li>
 * </ul>
 */
@Service
@Slf4j
public class QuotaSettingsService {

    private final SpringEventBus eventBus;
    private final AtomicReference<QuotaSettings> settingsRef = new AtomicReference<>();

    public QuotaSettingsService(PacingProperties properties, SpringEventBus eventBus) {
        this.eventBus = eventBus;
        PacingProperties.PlanProperties plan = properties.getPlan();
        settingsRef.set(normalize(QuotaSettings.builder()
                .planMode(PlanMode.fromValue(plan.getMode()))
                .monthlyLimit(plan.getMonthlyLimit())
                .orgName(plan.getOrgName())
                .username(plan.getUsername())
                .refreshIntervalMinutes(properties.getRefresh().getIntervalMinutes())
                .build()));
        log.info("[Settings] Initial settings: {}", settingsRef.get());
    }

    /**
     * Returns a copy of the current settings.
     */
    public QuotaSettings getSettings() {
        return settingsRef.get().toBuilder().build();
    }

    /**
     * Replaces the settings and publishes the change.
     *
     * @return the normalized settings now in effect
     */
    public QuotaSettings updateSettings(QuotaSettings requested) {
        QuotaSettings normalized = normalize(requested);
        QuotaSettings previous = settingsRef.getAndSet(normalized);
        log.info("[Settings] Settings updated: {}", normalized);
        eventBus.publish(new QuotaSettingsChangedEvent(previous, normalized.toBuilder().build()));
        return normalized.toBuilder().build();
    }

    static QuotaSettings normalize(QuotaSettings settings) {
        int interval = settings.getRefreshIntervalMinutes();
        if (interval <= 0) {
            interval = QuotaSettings.DEFAULT_REFRESH_INTERVAL_MINUTES;
        }
        return QuotaSettings.builder()
                .planMode(settings.getPlanMode() != null ? settings.getPlanMode() : PlanMode.AUTO)
                .monthlyLimit(settings.getMonthlyLimit() > 0
                        ? settings.getMonthlyLimit()
                        : QuotaSettings.DEFAULT_MONTHLY_LIMIT)
                .orgName(blankToNull(settings.getOrgName()))
                .username(blankToNull(settings.getUsername()))
                .refreshIntervalMinutes(Math.max(QuotaSettings.MIN_REFRESH_INTERVAL_MINUTES, interval))
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
