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

import java.util.Optional;

/**
 * Supplies upstream credentials. The core never stores credentials; it only
 * reads them and signals when the long-lived one was rejected.
 */
public interface CredentialPort {

    /**
     * Short-lived, silently obtainable session token. Empty when no session is
     * available.
     */
    Optional<String> getDelegatedSessionToken();

    /**
     * Long-lived user-supplied token. Empty when none is configured.
     */
    Optional<String> getLongLivedToken();

    /**
     * Called after the upstream rejected the long-lived token.
     */
    void invalidateLongLivedToken();
}
