package com.switchboard.core.model;

import java.time.Instant;

/**
 * One entry of a session's cross-platform history.
 */
public record CrossPlatformEvent(
    String platform,
    String action,
    Instant timestamp,
    String result
) {}
