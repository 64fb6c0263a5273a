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
 * Upstream source a {@link UsageSnapshot} was read from.
 *
 * <p>
 * The first two sources use the delegated session credential, the last two
 * use the long-lived token.
 */
public enum UsageSource {

    PRIMARY_INTERNAL("copilot-internal", true),
    SECONDARY_INTERNAL("copilot-internal-user", true),
    PERSONAL_BILLING("personal", false),
    ORG_BILLING("org", false);

    private final String tag;
    private final boolean sessionPath;

    UsageSource(String tag, boolean sessionPath) {
        this.tag = tag;
        this.sessionPath = sessionPath;
    }

    public String getTag() {
        return tag;
    }

    public boolean isSessionPath() {
        return sessionPath;
    }
}
