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

/**
 * Post-processed answer of a completed turn, ready to hand to a client.
 *
 * @param text
 *            answer cleaned for display and speech
 * @param emotion
 *            emotion label classified from the cleaned text
 * @param session
 *            session key the turn ran under
 * @param timestamp
 *            completion time in epoch seconds
 */
public record ChatReply(String text, String emotion, String session, double timestamp) {
}
