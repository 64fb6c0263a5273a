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
 * Outcome of a single usage source driver call: a snapshot, no data, or a
 * classified failure.
 *
 * <p>
 * "No data" is a normal outcome (for example an unlimited plan carries no
 * quota field) and is distinct from a failure.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DriverResult {

    public enum Status {
        FOUND, EMPTY, FAILED
    }

    private static final DriverResult EMPTY = new DriverResult(Status.EMPTY, null, null);

    private final Status status;
    private final UsageSnapshot snapshot;
    private final ResolutionError error;

    public static DriverResult found(UsageSnapshot snapshot) {
        return new DriverResult(Status.FOUND, snapshot, null);
    }

    public static DriverResult empty() {
        return EMPTY;
    }

    public static DriverResult failed(ResolutionError error) {
        return new DriverResult(Status.FAILED, null, error);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
