package com.switchboard.dispatch.api;

import com.switchboard.core.model.IntentDefinition;

import java.util.List;

public record CatalogResponse(
    List<IntentDefinition> intents,
    String source,
    boolean defaulted
) {}
