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

import java.util.Locale;

/**
 * Selects which long-lived-token billing scope is queried when the delegated
 * session path yields nothing.
 */
public enum PlanMode {

    AUTO, INDIVIDUAL, BUSINESS;

    /**
     * Lenient parse used for configuration values. Unknown or blank values fall
     * back to {@link #AUTO}.
     */
    public static PlanMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return PlanMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return AUTO;
        }
    }
}
