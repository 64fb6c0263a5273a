package me.golemcore.pacing.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest refresh result. Pacing fields are {@code null} until the first
 * successful cycle; error fields are set only while the last cycle failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaStatusResponse {
    private String state;
    private boolean refreshing;
    private Instant updatedAt;

    private String status;
    private String source;
    private String orgName;
    private Instant fetchedAt;
    private boolean fromCache;
    private Integer usedRequests;
    private Integer monthlyLimit;
    private Double remaining;
    private Integer daysRemaining;
    private Double baseDailyBudget;
    private Double dailyAllowance;
    private Double avgDailyUsage;
    private Double expectedByNow;
    private Double banked;
    private Double multiplier;
    private Long projectedEnd;
    private Integer sessionUsed;

    private ErrorDto error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDto {
        private String kind;
        private String message;
        private String scopeHint;
        private Integer retryAfterSeconds;
    }
}
