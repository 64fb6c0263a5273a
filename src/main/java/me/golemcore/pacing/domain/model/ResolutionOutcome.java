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
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one resolution cycle, together with the recovery the caller is
 * expected to perform.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolutionOutcome {

    public enum Status {
        RESOLVED, FAILED, NEEDS_CREDENTIALS
    }

    public enum Recovery {
        /** Nothing beyond presenting the error. */
        NONE,
        /** The long-lived credential was rejected and must be replaced. */
        REAUTHENTICATE,
        /** Refresh the cached identity and resolve exactly once more. */
        REFRESH_IDENTITY_AND_RETRY,
        /** Wait for the advertised retry delay before the next attempt. */
        BACK_OFF
    }

    private final Status status;
    private final UsageSnapshot snapshot;
    private final boolean fromCache;
    private final ResolutionError error;
    private final Recovery recovery;

    public static ResolutionOutcome resolved(UsageSnapshot snapshot, boolean fromCache) {
        return new ResolutionOutcome(Status.RESOLVED, snapshot, fromCache, null, Recovery.NONE);
    }

    public static ResolutionOutcome failed(ResolutionError error, boolean tokenPath) {
        return new ResolutionOutcome(Status.FAILED, null, false, error, recoveryFor(error, tokenPath));
    }

    public static ResolutionOutcome needsCredentials() {
        return new ResolutionOutcome(Status.NEEDS_CREDENTIALS, null, false, null, Recovery.NONE);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public boolean isRateLimited() {
        return error != null && error.is(ResolutionError.Kind.RATE_LIMITED);
    }

    private static Recovery recoveryFor(ResolutionError error, boolean tokenPath) {
        return switch (error.getKind()) {
        case UNAUTHORIZED -> Recovery.REAUTHENTICATE;
        case NOT_FOUND -> tokenPath ? Recovery.REFRESH_IDENTITY_AND_RETRY : Recovery.NONE;
        case RATE_LIMITED -> Recovery.BACK_OFF;
        default -> Recovery.NONE;
        };
    }
}
