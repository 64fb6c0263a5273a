package me.golemcore.pacing.domain.model;

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

import lombok.Builder;

/**
 * Daily budget report derived from a usage snapshot and the current date.
 *
 * <p>
 * {@code dailyAllowance} is the headline number: how many requests can be
 * spent per remaining day (today included) without running out.
 * {@code banked} is positive when usage is behind the even-spend schedule and
 * negative when it is ahead of it.
 *
 * @param sessionUsed
 *            requests used since the process started, or {@code null} when no
 *            baseline was supplied
 */
@Builder
public record PacingResult(
        int usedRequests,
        int monthlyLimit,
        double remaining,
        int dayOfMonth,
        int daysInMonth,
        int daysRemaining,
        double baseDailyBudget,
        double dailyAllowance,
        double avgDailyUsage,
        double expectedByNow,
        double banked,
        double multiplier,
        long projectedEnd,
        double timeOfDayProgress,
        Integer sessionUsed) {
}
