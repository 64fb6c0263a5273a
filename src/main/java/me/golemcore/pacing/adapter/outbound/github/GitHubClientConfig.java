package me.golemcore.pacing.adapter.outbound.github;

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

import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.infrastructure.http.FeignClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class GitHubClientConfig {

    @Bean
    public GitHubApi gitHubApi(FeignClientFactory feignClientFactory, PacingProperties properties) {
        String baseUrl = properties.getGithub().getApiBaseUrl();
        log.info("[GitHub] API client targeting {}", baseUrl);
        return feignClientFactory.create(GitHubApi.class, baseUrl);
    }
}
