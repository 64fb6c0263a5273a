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

import me.golemcore.pacing.domain.model.PacingResult;
import me.golemcore.pacing.domain.model.UsageStatus;

import java.time.ZonedDateTime;

/**
 * Converts a monthly usage reading into a daily spending plan.
 *
 * <p>
 * Pure functions: the result depends only on the arguments, and the local
 * calendar fields of {@code now} (day of month, hour, minute) drive all date
 * arithmetic. Inputs are expected to be non-negative already.
 */
public final class PacingCalculator {

    private static final double MINUTES_PER_DAY = 24 * 60;
    private static final double MIN_DAYS_ELAPSED = 0.1;

    private PacingCalculator() {
    }

    public static PacingResult calculatePacing(int usedRequests, int monthlyLimit, ZonedDateTime now) {
        return calculatePacing(usedRequests, monthlyLimit, now, null, null);
    }

    /**
     * @param remainingOverride
     *            remaining requests reported upstream; when {@code null} it is
     *            derived as {@code monthlyLimit - usedRequests}
     * @param sessionBaseline
     *            usage captured at process start; when {@code null} no session
     *            delta is computed
     */
    public static PacingResult calculatePacing(int usedRequests, int monthlyLimit, ZonedDateTime now,
            Integer remainingOverride, Integer sessionBaseline) {
        int daysInMonth = now.toLocalDate().lengthOfMonth();
        int dayOfMonth = now.getDayOfMonth();

        // today counts as a remaining day
        int daysRemaining = Math.max(1, daysInMonth - dayOfMonth + 1);
        double baseDailyBudget = (double) monthlyLimit / daysInMonth;
        double remaining = remainingOverride != null ? remainingOverride : (double) monthlyLimit - usedRequests;
        double dailyAllowance = Math.max(0, remaining) / daysRemaining;

        double timeOfDayProgress = (now.getHour() * 60 + now.getMinute()) / MINUTES_PER_DAY;
        double effectiveDaysElapsed = Math.max(MIN_DAYS_ELAPSED, dayOfMonth - 1 + timeOfDayProgress);
        double avgDailyUsage = usedRequests / effectiveDaysElapsed;

        double expectedByNow = effectiveDaysElapsed * baseDailyBudget;
        double banked = expectedByNow - usedRequests;
        double multiplier = baseDailyBudget > 0 ? dailyAllowance / baseDailyBudget : 1;
        long projectedEnd = Math.round(avgDailyUsage * daysInMonth);

        Integer sessionUsed = sessionBaseline != null ? Math.max(0, usedRequests - sessionBaseline) : null;

        return PacingResult.builder()
                .usedRequests(usedRequests)
                .monthlyLimit(monthlyLimit)
                .remaining(remaining)
                .dayOfMonth(dayOfMonth)
                .daysInMonth(daysInMonth)
                .daysRemaining(daysRemaining)
                .baseDailyBudget(baseDailyBudget)
                .dailyAllowance(dailyAllowance)
                .avgDailyUsage(avgDailyUsage)
                .expectedByNow(expectedByNow)
                .banked(banked)
                .multiplier(multiplier)
                .projectedEnd(projectedEnd)
                .timeOfDayProgress(timeOfDayProgress)
                .sessionUsed(sessionUsed)
                .build();
    }

    /**
     * Classifies budget health. Checks run in order, so an exhausted quota is
     * reported as such whatever the banked amount.
     */
    public static UsageStatus classifyStatus(PacingResult result) {
        if (result.remaining() <= 0) {
            return UsageStatus.EXHAUSTED;
        }
        if (result.banked() < 0) {
            return UsageStatus.OVER_BUDGET;
        }
        // more than one full day banked
        if (result.banked() > result.baseDailyBudget()) {
            return UsageStatus.AHEAD;
        }
        return UsageStatus.ON_TRACK;
    }
}
