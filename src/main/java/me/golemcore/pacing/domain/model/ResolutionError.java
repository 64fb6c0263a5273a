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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Classified failure of an upstream usage query.
 *
 * <p>
 * Kinds and the recovery they call for:
 * <ul>
 * <li>{@link Kind#UNAUTHORIZED} - credential invalid, re-authenticate</li>
 * <li>{@link Kind#FORBIDDEN} - missing permission, see {@link #getScopeHint()}</li>
 * <li>{@link Kind#NOT_FOUND} - stale derived identity, refresh and retry
 * once</li>
 * <li>{@link Kind#RATE_LIMITED} - wait {@link #getRetryAfterSeconds()}</li>
 * <li>{@link Kind#TRANSIENT} - network, parse or unexpected failure</li>
 * </ul>
 *
 * <p>
 * Messages are truncated to {@value #MAX_MESSAGE_LENGTH} characters so that
 * raw upstream bodies never travel further than a short diagnostic.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolutionError {

    public static final int MAX_MESSAGE_LENGTH = 200;
    public static final int DEFAULT_RETRY_AFTER_SECONDS = 60;

    public enum Kind {
        UNAUTHORIZED, FORBIDDEN, NOT_FOUND, RATE_LIMITED, TRANSIENT
    }

    private final Kind kind;
    private final String message;
    private final String scopeHint;
    private final int retryAfterSeconds;

    public static ResolutionError unauthorized() {
        return new ResolutionError(Kind.UNAUTHORIZED, "GitHub token is invalid or has been revoked (401)", null, 0);
    }

    public static ResolutionError forbidden(String resource, String scopeHint) {
        return new ResolutionError(Kind.FORBIDDEN,
                truncate("GitHub token lacks required permissions for: " + resource), scopeHint, 0);
    }

    public static ResolutionError notFound(String resource) {
        return new ResolutionError(Kind.NOT_FOUND, truncate("GitHub resource not found: " + resource), null, 0);
    }

    public static ResolutionError rateLimited(int retryAfterSeconds) {
        int retry = retryAfterSeconds > 0 ? retryAfterSeconds : DEFAULT_RETRY_AFTER_SECONDS;
        return new ResolutionError(Kind.RATE_LIMITED,
                "GitHub API rate limit exceeded, retry after " + retry + "s", null, retry);
    }

    public static ResolutionError transientFailure(String message) {
        return new ResolutionError(Kind.TRANSIENT, truncate(message), null, 0);
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
