package me.golemcore.pacing.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes domain events through Spring's ApplicationEventPublisher.
 *
 * <p>
 * Delivery is synchronous: every {@code @EventListener} has run by the time
 * {@link #publish(Object)} returns. Settings changes rely on this so that the
 * cache is invalidated before the follow-up refresh starts.
 *
 * <pre>{@code
 * eventBus.publish(new QuotaSettingsChangedEvent(previous, current));
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(Object event) {
        log.debug("[Events] Publishing {}", event.getClass().getSimpleName());
        eventPublisher.publishEvent(event);
    }
}
