package com.switchboard.dispatch.api;

import com.switchboard.core.model.ConversationContext;

/**
 * Inbound JSON body for POST /api/v1/intents/resolve.
 *
 * @param message free-text request
 * @param mode    rules, generative or hybrid; nullable, defaults to hybrid
 * @param context conversation context from the previous turn; nullable, starts a new session
 */
public record ResolveRequest(
    String message,
    String mode,
    ConversationContext context
) {}
