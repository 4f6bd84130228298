package me.relaybot.gateway.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the retrieval store used to enrich inbound messages with
 * previously indexed knowledge.
 */
public interface RagPort {

    /**
     * Retrieve the passages most relevant to the query.
     *
     * @param query
     *            the search query
     * @param topK
     *            maximum number of passages
     * @return passages ordered by relevance, empty when nothing matched
     */
    CompletableFuture<List<String>> retrieve(String query, int topK);

    /**
     * Check if the retrieval store is available (enabled + configured).
     */
    boolean isAvailable();
}
