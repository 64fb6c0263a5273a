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

import java.util.List;
import java.util.Optional;

/**
 * Read access to the organizations visible to a long-lived token.
 */
public interface OrganizationDirectoryPort {

    /**
     * Logins of the organizations the token owner belongs to.
     *
     * @throws me.golemcore.pacing.domain.model.ResolutionException
     *             when the listing fails
     */
    List<String> listOrganizations(String token);

    /**
     * Last Copilot activity of {@code username} in {@code orgName}. Empty when
     * the seat list is not readable or the user holds no seat.
     */
    Optional<SeatActivity> findSeatActivity(String token, String orgName, String username);

    record SeatActivity(String login, String lastActivityAt) {
    }
}
