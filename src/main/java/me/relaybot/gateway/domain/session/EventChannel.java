package me.relaybot.gateway.domain.session;

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

import me.relaybot.gateway.domain.model.TurnEvent;

/**
 * Ordered conduit from a turn to the live connection that owns it. Events
 * arrive at the client in the order {@link #send} is called.
 */
public interface EventChannel {

    /**
     * Deliver one event. May throw if the transport has gone away; callers
     * treat delivery as best-effort.
     */
    void send(TurnEvent event);

    boolean isOpen();
}
