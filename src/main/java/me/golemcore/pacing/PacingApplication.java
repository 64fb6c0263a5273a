package me.golemcore.pacing;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * GolemCore Quota Pacer - tracks Copilot premium request usage and turns it
 * into a daily spending plan.
 *
 * <h2>Architecture</h2>
 * <ul>
 * <li>{@code domain} - pacing math, source resolution and the refresh
 * cycle</li>
 * <li>{@code port.outbound} - drivers, credentials, identity, organization
 * directory and presentation contracts</li>
 * <li>{@code adapter} - GitHub Feign clients, property-backed credentials, log
 * presentation and the {@code /api/quota} endpoints</li>
 * <li>{@code refresh} - timer and backoff scheduling</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code pacing.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PacingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PacingApplication.class, args);
    }

}
