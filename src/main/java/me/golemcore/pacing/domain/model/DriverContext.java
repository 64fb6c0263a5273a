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
 * Per-call context for a usage source driver. Fields a driver does not need
 * may be {@code null}.
 */
public record DriverContext(String username, String orgName) {

    public static DriverContext none() {
        return new DriverContext(null, null);
    }

    public static DriverContext forUser(String username) {
        return new DriverContext(username, null);
    }

    public static DriverContext forOrg(String orgName) {
        return new DriverContext(null, orgName);
    }
}
