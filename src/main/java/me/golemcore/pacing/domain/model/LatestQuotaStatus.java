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

import java.time.Instant;

/**
 * Last refresh cycle result as seen by readers such as the HTTP API.
 */
public record LatestQuotaStatus(State state, UsageReport report, ResolutionError error, Instant updatedAt) {

    public enum State {
        PENDING, OK, FAILED, NEEDS_CREDENTIALS, NEEDS_REAUTHENTICATION
    }

    public static LatestQuotaStatus pending() {
        return new LatestQuotaStatus(State.PENDING, null, null, null);
    }
}
