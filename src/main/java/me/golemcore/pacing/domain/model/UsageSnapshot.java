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

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time reading of premium request consumption from one upstream
 * source.
 *
 * <p>
 * {@code remaining} and {@code quotaCeiling} are only reported by the internal
 * quota endpoints; billing endpoints report {@code usedRequests} alone.
 *
 * @param usedRequests
 *            requests consumed this month, never negative
 * @param remaining
 *            remaining requests reported upstream, or {@code null}
 * @param quotaCeiling
 *            monthly quota reported upstream, or {@code null}
 * @param source
 *            endpoint that produced the reading
 * @param orgName
 *            organization for {@link UsageSource#ORG_BILLING}, else
 *            {@code null}
 * @param resetAt
 *            upstream quota reset date as reported, or {@code null}
 * @param fetchedAt
 *            when the reading was taken
 */
public record UsageSnapshot(
        int usedRequests,
        Integer remaining,
        Integer quotaCeiling,
        UsageSource source,
        String orgName,
        String resetAt,
        Instant fetchedAt) {

    public UsageSnapshot {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (usedRequests < 0) {
            throw new IllegalArgumentException("usedRequests must not be negative: " + usedRequests);
        }
        if (remaining != null && remaining < 0) {
            throw new IllegalArgumentException("remaining must not be negative: " + remaining);
        }
        if (quotaCeiling != null && quotaCeiling <= 0) {
            throw new IllegalArgumentException("quotaCeiling must be positive: " + quotaCeiling);
        }
        if (remaining != null && quotaCeiling != null && remaining > quotaCeiling) {
            throw new IllegalArgumentException(
                    "remaining " + remaining + " exceeds quotaCeiling " + quotaCeiling);
        }
    }

    public static UsageSnapshot quota(int used, int remaining, int ceiling, UsageSource source, String resetAt,
            Instant fetchedAt) {
        return new UsageSnapshot(used, remaining, ceiling, source, null, resetAt, fetchedAt);
    }

    public static UsageSnapshot billing(int used, UsageSource source, String orgName, Instant fetchedAt) {
        return new UsageSnapshot(used, null, null, source, orgName, null, fetchedAt);
    }

    public boolean hasQuotaCeiling() {
        return quotaCeiling != null;
    }
}
