package com.switchboard.core.extract;

import java.util.List;

/**
 * Platforms named in a message, plus whether the wording asks for a
 * cross-platform action ("sync", "across", "everywhere", ...).
 */
public record PlatformDetection(
    List<String> platforms,
    boolean crossPlatformRequested
) {

    public static final PlatformDetection NONE = new PlatformDetection(List.of(), false);

    public PlatformDetection {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }
}
