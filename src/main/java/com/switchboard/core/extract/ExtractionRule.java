package com.switchboard.core.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One step of an entity rule chain: a matcher plus the transform that turns a
 * match into the entity value.
 */
public record ExtractionRule(
    Pattern pattern,
    Function<MatchResult, String> transform
) {

    /** Whole match, trimmed. */
    public static ExtractionRule whole(String regex, int flags) {
        return new ExtractionRule(Pattern.compile(regex, flags), m -> m.group());
    }

    /** A single capture group, trimmed. */
    public static ExtractionRule group(String regex, int flags, int group) {
        return new ExtractionRule(Pattern.compile(regex, flags), m -> m.group(group));
    }

    /**
     * A "from X to Y" style range collapsed into {@code "X to Y"} using capture
     * groups 2 and 3.
     */
    public static ExtractionRule range(String regex, int flags) {
        return new ExtractionRule(Pattern.compile(regex, flags),
                m -> m.group(2).trim() + " to " + m.group(3).trim());
    }

    /** A literal keyword; the value is the keyword itself. */
    public static ExtractionRule keyword(String keyword) {
        return new ExtractionRule(Pattern.compile(Pattern.quote(keyword), Pattern.CASE_INSENSITIVE),
                m -> keyword);
    }

    /**
     * Applies the rule to the first match in {@code text}.
     *
     * @return the trimmed value, empty when there is no match or the value is blank
     */
    public Optional<String> apply(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return clean(transform.apply(matcher.toMatchResult()));
    }

    /**
     * Applies the rule to every match in {@code text}, in order.
     */
    public List<String> applyAll(String text) {
        var values = new ArrayList<String>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            clean(transform.apply(matcher.toMatchResult())).ifPresent(values::add);
        }
        return values;
    }

    private static Optional<String> clean(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
