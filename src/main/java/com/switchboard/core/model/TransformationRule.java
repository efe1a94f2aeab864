package com.switchboard.core.model;

/**
 * One transformation step applied while moving data between platforms.
 */
public record TransformationRule(
    String source,
    String target,
    String operation
) {}
