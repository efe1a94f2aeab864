package com.switchboard.dispatch.api;

import com.switchboard.core.model.ConversationContext;
import com.switchboard.core.model.ResolvedIntent;

/**
 * The resolved intent plus the conversation context the caller should send
 * with its next message.
 */
public record ResolveResponse(
    ResolvedIntent intent,
    ConversationContext context
) {}
