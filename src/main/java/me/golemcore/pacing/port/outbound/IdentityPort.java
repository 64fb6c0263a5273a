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

/**
 * Resolves the canonical username of the long-lived token owner.
 */
public interface IdentityPort {

    /**
     * Returns the username, resolving it lazily.
     *
     * @throws me.golemcore.pacing.domain.model.ResolutionException
     *             when the upstream lookup fails
     */
    String resolveUsername(String token);

    /**
     * Drops any cached username so the next call re-resolves it.
     */
    void invalidate();
}
