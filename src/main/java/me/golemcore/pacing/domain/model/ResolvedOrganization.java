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

/**
 * Organization the org billing source should query.
 *
 * @param name
 *            organization login
 * @param detectionResult
 *            org billing result obtained while detecting {@code name}, or
 *            {@code null} when the name was configured or remembered
 */
public record ResolvedOrganization(String name, DriverResult detectionResult) {

    public static ResolvedOrganization of(String name) {
        return new ResolvedOrganization(name, null);
    }

    public static ResolvedOrganization detected(String name, DriverResult detectionResult) {
        return new ResolvedOrganization(name, detectionResult);
    }

    public boolean hasDetectionResult() {
        return detectionResult != null;
    }
}
