package me.golemcore.pacing.domain.service;

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

import me.golemcore.pacing.domain.model.UsageSource;
import me.golemcore.pacing.port.outbound.UsageSourceDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes the registered {@link UsageSourceDriver} beans by source. Exactly one
 * driver per {@link UsageSource} is expected.
 */
@Component
@Slf4j
public class UsageSourceRegistry {

    private final Map<UsageSource, UsageSourceDriver> drivers = new EnumMap<>(UsageSource.class);

    public UsageSourceRegistry(List<UsageSourceDriver> registered) {
        for (UsageSourceDriver driver : registered) {
            UsageSourceDriver existing = drivers.putIfAbsent(driver.getSource(), driver);
            if (existing != null) {
                throw new IllegalStateException("Duplicate driver for " + driver.getSource() + ": "
                        + existing.getClass().getSimpleName() + " and " + driver.getClass().getSimpleName());
            }
        }
        for (UsageSource source : UsageSource.values()) {
            if (!drivers.containsKey(source)) {
                throw new IllegalStateException("No driver registered for " + source);
            }
        }
        log.debug("[Quota] Registered {} usage source drivers", drivers.size());
    }

    public UsageSourceDriver get(UsageSource source) {
        return drivers.get(source);
    }
}
