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

import me.golemcore.pacing.domain.model.DriverContext;
import me.golemcore.pacing.domain.model.DriverResult;
import me.golemcore.pacing.domain.model.UsageSource;

/**
 * Port for one upstream usage endpoint.
 *
 * <p>
 * Implementations own exactly one call shape, never retry, and never throw:
 * every transport or parse failure is classified into a
 * {@link me.golemcore.pacing.domain.model.ResolutionError} and returned as
 * {@link DriverResult#failed}.
 *
 * @see me.golemcore.pacing.domain.service.QuotaResolutionService
 */
public interface UsageSourceDriver {

    UsageSource getSource();

    /**
     * Query the endpoint once.
     *
     * @param credential
     *            delegated session token for session-path sources, long-lived
     *            token otherwise
     * @param context
     *            username or org name, where the endpoint needs one
     */
    DriverResult fetch(String credential, DriverContext context);
}
