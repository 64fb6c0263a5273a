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

import me.golemcore.pacing.domain.model.ResolutionError;
import feign.FeignException;
import feign.codec.DecodeException;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Maps GitHub HTTP failures onto {@link ResolutionError} kinds.
 *
 * <p>
 * <ul>
 * <li>401 - unauthorized</li>
 * <li>403 - forbidden, unless {@code X-RateLimit-Remaining: 0} marks it as
 * GitHub's rate limit response</li>
 * <li>404 - not found</li>
 * <li>429 - rate limited</li>
 * <li>anything else, including I/O and decode failures - transient</li>
 * </ul>
 *
 * <p>
 * A rate limit waits for {@code Retry-After} seconds, else until the
 * {@code X-RateLimit-Reset} epoch second, else 60s.
 */
final class GitHubErrorClassifier {

    static final int HTTP_UNAUTHORIZED = 401;
    static final int HTTP_FORBIDDEN = 403;
    static final int HTTP_NOT_FOUND = 404;
    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final String RETRY_AFTER = "Retry-After";
    private static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    private static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    private static final int MAX_BODY_EXCERPT = 200;

    private GitHubErrorClassifier() {
    }

    static ResolutionError classify(Exception e, String resource, String scopeHint, Instant now) {
        if (e instanceof DecodeException) {
            return ResolutionError.transientFailure("Malformed GitHub response at " + resource + ": "
                    + e.getMessage());
        }
        if (e instanceof FeignException fe && fe.status() > 0) {
            return classifyStatus(fe.status(), fe.responseHeaders(), fe.contentUTF8(), resource, scopeHint, now);
        }
        return ResolutionError.transientFailure("GitHub request failed at " + resource + ": " + e.getMessage());
    }

    static ResolutionError classifyStatus(int status, Map<String, Collection<String>> headers, String body,
            String resource, String scopeHint, Instant now) {
        if (status == HTTP_UNAUTHORIZED) {
            return ResolutionError.unauthorized();
        }
        if (status == HTTP_FORBIDDEN) {
            if ("0".equals(header(headers, RATE_LIMIT_REMAINING))) {
                return rateLimited(headers, now);
            }
            return ResolutionError.forbidden(resource, scopeHint);
        }
        if (status == HTTP_NOT_FOUND) {
            return ResolutionError.notFound(resource);
        }
        if (status == HTTP_TOO_MANY_REQUESTS) {
            return rateLimited(headers, now);
        }
        String excerpt = body == null ? "" : body.substring(0, Math.min(body.length(), MAX_BODY_EXCERPT));
        return ResolutionError.transientFailure("GitHub API " + status + " at " + resource + ": " + excerpt);
    }

    private static ResolutionError rateLimited(Map<String, Collection<String>> headers, Instant now) {
        String retryAfter = header(headers, RETRY_AFTER);
        if (retryAfter == null || retryAfter.isBlank()) {
            return ResolutionError.rateLimited(secondsUntilReset(header(headers, RATE_LIMIT_RESET), now));
        }
        return ResolutionError.rateLimited(parseRetryAfter(retryAfter));
    }

    /**
     * @return seconds from {@code now} until the reset epoch second, or the
     *         default delay when the value is missing, unparsable or already
     *         past
     */
    static int secondsUntilReset(String resetEpochSeconds, Instant now) {
        if (resetEpochSeconds == null || resetEpochSeconds.isBlank()) {
            return ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            long seconds = Long.parseLong(resetEpochSeconds.trim()) - now.getEpochSecond();
            return seconds > 0 ? (int) Math.min(seconds, Integer.MAX_VALUE)
                    : ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        } catch (NumberFormatException e) {
            return ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    static int parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            int seconds = Integer.parseInt(value.trim());
            return seconds > 0 ? seconds : ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        } catch (NumberFormatException e) {
            return ResolutionError.DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private static String header(Map<String, Collection<String>> headers, String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, Collection<String>> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().iterator().next();
            }
        }
        return null;
    }
}
