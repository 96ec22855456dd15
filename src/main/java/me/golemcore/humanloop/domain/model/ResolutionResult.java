package me.golemcore.humanloop.domain.model;

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
 * Outcome of a resolve or cancel call. {@code UNKNOWN_OR_CLOSED} is a soft
 * failure: the id was never issued, or the request already left the
 * {@code OPEN} state.
 */
public enum ResolutionResult {
    ACCEPTED, UNKNOWN_OR_CLOSED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
