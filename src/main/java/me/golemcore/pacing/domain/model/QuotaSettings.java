package me.golemcore.pacing.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Runtime settings read by the resolution and pacing core.
 *
 * <p>
 * Instances handed out by
 * {@link me.golemcore.pacing.domain.service.QuotaSettingsService} are
 * normalized copies; mutating them has no effect on the live settings.
 */
@Data
@Builder(toBuilder = true)
public class QuotaSettings {

    public static final int DEFAULT_MONTHLY_LIMIT = 300;
    public static final int DEFAULT_REFRESH_INTERVAL_MINUTES = 30;
    public static final int MIN_REFRESH_INTERVAL_MINUTES = 5;

    @Builder.Default
    private PlanMode planMode = PlanMode.AUTO;

    @Builder.Default
    private int monthlyLimit = DEFAULT_MONTHLY_LIMIT;

    private String orgName;

    private String username;

    @Builder.Default
    private int refreshIntervalMinutes = DEFAULT_REFRESH_INTERVAL_MINUTES;

    public boolean hasOrgName() {
        return orgName != null && !orgName.isBlank();
    }

    public boolean hasUsername() {
        return username != null && !username.isBlank();
    }
}
