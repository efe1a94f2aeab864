package com.switchboard.core.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scans request text for platform names and cross-platform wording.
 * <p>
 * Platform keywords are matched on word boundaries so short names such as
 * "box" or "zoom" do not fire inside longer words ("inbox", "zoomed").
 * Cross-platform keywords are plain case-insensitive substrings.
 */
public final class PlatformDetector {

    static final List<String> CROSS_PLATFORM_KEYWORDS = List.of(
            "all platforms", "everywhere", "sync", "across", "all tools",
            "cross-platform", "in all", "each platform", "multiple");

    private static final Map<String, Pattern> PLATFORM_PATTERNS = PlatformCatalog.all().stream()
            .collect(Collectors.toUnmodifiableMap(
                    PlatformCapability::name,
                    p -> Pattern.compile("\\b(?:" + p.keywords().stream()
                            .map(Pattern::quote)
                            .collect(Collectors.joining("|")) + ")\\b")));

    private PlatformDetector() {} // utility class

    /**
     * Detects platforms (in {@link PlatformCatalog} order) and the cross-platform flag.
     *
     * @param text the raw request; blank input yields {@link PlatformDetection#NONE}
     */
    public static PlatformDetection detect(String text) {
        if (text == null || text.isBlank()) {
            return PlatformDetection.NONE;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        return new PlatformDetection(detectPlatforms(lowerText), isCrossPlatformRequest(lowerText));
    }

    static List<String> detectPlatforms(String lowerText) {
        var found = new ArrayList<String>();
        for (PlatformCapability platform : PlatformCatalog.all()) {
            if (PLATFORM_PATTERNS.get(platform.name()).matcher(lowerText).find()) {
                found.add(platform.name());
            }
        }
        return found;
    }

    static boolean isCrossPlatformRequest(String lowerText) {
        return CROSS_PLATFORM_KEYWORDS.stream().anyMatch(lowerText::contains);
    }
}
