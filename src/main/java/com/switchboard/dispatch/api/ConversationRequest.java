package com.switchboard.dispatch.api;

import com.switchboard.core.model.ConversationContext;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/intents/conversation. The last message is resolved.
 */
public record ConversationRequest(
    List<String> messages,
    String mode,
    ConversationContext context
) {}
