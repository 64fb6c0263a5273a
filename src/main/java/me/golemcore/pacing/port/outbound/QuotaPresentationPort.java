package me.golemcore.pacing.port.outbound;

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

import me.golemcore.pacing.domain.model.ResolutionError;
import me.golemcore.pacing.domain.model.UsageReport;

/**
 * Sink for refresh cycle results. Implementations decide how to render them;
 * the core never formats human-readable text.
 */
public interface QuotaPresentationPort {

    void showReport(UsageReport report);

    void showFailure(ResolutionError error);

    /**
     * No credential of either kind is available.
     */
    void showNeedsCredentials();

    /**
     * The long-lived credential was rejected and has been invalidated.
     */
    void showNeedsReauthentication(ResolutionError error);

    /**
     * Session usage crossed another milestone.
     */
    void showSessionMilestone(int sessionUsed);
}
