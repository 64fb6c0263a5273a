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

/**
 * Unchecked carrier for a {@link ResolutionError} raised by collaborators that
 * return a value rather than a {@link DriverResult}, such as identity
 * resolution.
 */
public class ResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ResolutionError error;

    public ResolutionException(ResolutionError error) {
        super(error.getMessage());
        this.error = error;
    }

    public ResolutionException(ResolutionError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public ResolutionError getError() {
        return error;
    }
}
