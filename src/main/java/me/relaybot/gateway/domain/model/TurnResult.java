package me.relaybot.gateway.domain.model;

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

/**
 * Outcome of an orchestrated turn.
 *
 * @param finalText
 *            answer text, or the degraded text when the budget ran out
 * @param toolsUsed
 *            tool names in execution order
 * @param budgetExhausted
 *            true when the iteration limit was reached without a final answer
 * @param iterations
 *            number of model rounds performed
 */
public record TurnResult(String finalText, List<String> toolsUsed, boolean budgetExhausted, int iterations) {
}
