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

import me.relaybot.gateway.domain.model.OutboundMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Sender for one external messaging channel (feishu, telegram, ...). The
 * dispatch bus routes each queued message to the sender whose channel type
 * matches the message's channel tag.
 */
public interface OutboundChannelPort {

    /**
     * Channel tag this sender is registered under.
     */
    String getChannelType();

    /**
     * Whether credentials are present and the channel is enabled.
     */
    boolean isConfigured();

    /**
     * Deliver one message. Failures complete the future exceptionally.
     */
    CompletableFuture<Void> send(OutboundMessage message);
}
