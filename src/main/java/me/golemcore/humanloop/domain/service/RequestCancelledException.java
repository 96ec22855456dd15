package me.golemcore.humanloop.domain.service;

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
 * Terminal outcome of a request that was abandoned instead of answered. The
 * asker receives it as the failure cause of its awaited future.
 */
public class RequestCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String requestId;
    private final String reason;

    public RequestCancelledException(String requestId, String reason) {
        super("Request " + requestId + " cancelled: " + reason);
        this.requestId = requestId;
        this.reason = reason;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getReason() {
        return reason;
    }
}
