package com.switchboard.core.extract;

import java.util.List;

/**
 * A platform Switchboard knows how to target.
 *
 * @param name         canonical id used in resolved intents and integration keys
 * @param keywords     phrases that identify the platform in free text (matched on word boundaries)
 * @param capabilities what the platform is used for, e.g. {@code task_management}
 * @param actions      executor actions available on the platform, empty when not catalogued
 */
public record PlatformCapability(
    String name,
    List<String> keywords,
    List<String> capabilities,
    List<String> actions
) {}
