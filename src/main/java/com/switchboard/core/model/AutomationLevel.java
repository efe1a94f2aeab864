package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AutomationLevel {
    @JsonProperty("manual") MANUAL,
    @JsonProperty("semi-auto") SEMI_AUTO,
    @JsonProperty("full-auto") FULL_AUTO
}
