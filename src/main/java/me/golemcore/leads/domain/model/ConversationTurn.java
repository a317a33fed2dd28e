package me.golemcore.leads.domain.model;

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
import lombok.Value;

/**
 * A single turn of a buyer conversation, supplied by the caller in order.
 * Roles are {@code user} (the prospective buyer) and {@code agent}; the
 * provider-style {@code assistant} is accepted as an agent turn.
 */
@Value
@Builder
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_AGENT = "agent";

    String role;
    String text;
    int position;

    public static ConversationTurn user(int position, String text) {
        return new ConversationTurn(ROLE_USER, text, position);
    }

    public static ConversationTurn agent(int position, String text) {
        return new ConversationTurn(ROLE_AGENT, text, position);
    }

    /**
     * Checks if this turn was authored by the buyer.
     */
    public boolean isUserTurn() {
        return ROLE_USER.equalsIgnoreCase(role);
    }

    /**
     * Checks if this turn was authored by the agent side of the conversation.
     */
    public boolean isAgentTurn() {
        return ROLE_AGENT.equalsIgnoreCase(role) || "assistant".equalsIgnoreCase(role);
    }
}
