package me.golemcore.humanloop.port.outbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human a question from inside an agent loop. Used by
 * PizzaOrderAgent to fill gaps in the customer's request.
 */
public interface HumanInputPort {

    /**
     * Ask a human and wait for the answer asynchronously.
     *
     * @param question
     *            non-blank question text
     * @param metadata
     *            opaque data passed through to whoever renders the question
     * @return future that completes with the answer, or exceptionally if the
     *         question was cancelled. Cancelling the future abandons the
     *         question, so no observer is left answering it.
     */
    CompletableFuture<String> requestInput(String question, Map<String, Object> metadata);

    /**
     * Transport name for logs, e.g. {@code broker} or {@code console}.
     */
    String getTransportName();
}
