package me.golemcore.pacing.infrastructure.config;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pacing.domain.model.QuotaSettings;
import me.golemcore.pacing.domain.service.QuotaSettingsService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared infrastructure beans and the startup banner.
 *
 * <p>
 * The {@link Clock} bean is the single time source for pacing, cache freshness
 * and snapshot timestamps; tests replace it with a fixed clock.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PacingConfiguration {

    private final PacingProperties properties;
    private final QuotaSettingsService settingsService;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        QuotaSettings settings = settingsService.getSettings();
        log.info("GolemCore Quota Pacer v{} starting...", version);
        log.info("GitHub API: {}", properties.getGithub().getApiBaseUrl());
        log.info("Plan mode: {}, monthly limit: {}, refresh every {} min",
                settings.getPlanMode(), settings.getMonthlyLimit(), settings.getRefreshIntervalMinutes());
        log.info("Cache freshness: {}", properties.getCache().getFreshness());
    }
}
