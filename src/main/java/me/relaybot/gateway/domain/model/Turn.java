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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One end-to-end handling of a single inbound user message. Owned by the
 * connection session that created it and never shared between sessions.
 */
@Data
@Builder
public class Turn {

    private String id;
    private String sessionKey;
    private String originChannel;
    private String chatId;
    private String constraint;

    private int iteration;

    @Builder.Default
    private List<ToolInvocation> invocations = new ArrayList<>();

    @Builder.Default
    private TurnState state = TurnState.RUNNING;

    private String finalText;
    private String error;

    public void recordInvocation(ToolInvocation invocation) {
        invocations.add(invocation);
    }

    public void complete(String text) {
        this.finalText = text;
        this.state = TurnState.COMPLETED;
    }

    public void fail(String message) {
        this.error = message;
        this.state = TurnState.FAILED;
    }

    public boolean isTerminal() {
        return state != TurnState.RUNNING;
    }

    public enum TurnState {
        RUNNING, COMPLETED, FAILED
    }
}
