package com.switchboard.core.extract;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static com.switchboard.core.extract.ExtractionRule.group;
import static com.switchboard.core.extract.ExtractionRule.range;
import static com.switchboard.core.extract.ExtractionRule.whole;
import static java.util.regex.Pattern.CASE_INSENSITIVE;

/**
 * Built-in rule chains, one per supported entity type.
 * <p>
 * Rule order is significant: the first non-empty capture wins.
 */
public final class EntityRules {

    private static final String MONTHS =
            "january|february|march|april|may|june|july|august|september|october|november|december";
    private static final String WEEKDAYS = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";

    private static final Pattern TASK_PREFIX = Pattern.compile("^(?:called|named|for|to|:|\\s)+", CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?]$");
    private static final Pattern WORKFLOW_SUFFIX = Pattern.compile("\\s+(?:workflow|automation)$", CASE_INSENSITIVE);

    static final EntityRuleChain TASK_NAME = EntityRuleChain.firstMatch(List.of(
            group("(?:create|add|new)\\s+(?:a\\s+)?(?:task|todo|item)\\s+(?:called|named|for|to|:)?\\s*[\"']?([^\"'.!?]+)[\"']?",
                    CASE_INSENSITIVE, 1),
            group("(?:task|todo|item)\\s+(?:called|named|for|to|:)?\\s*[\"']?([^\"'.!?]+)[\"']?",
                    CASE_INSENSITIVE, 1)
    ), EntityRules::textAfterTaskKeyword);

    static final EntityRuleChain DATE = EntityRuleChain.firstMatch(List.of(
            whole("\\b(today|tomorrow|yesterday)\\b", CASE_INSENSITIVE),
            whole("\\b(next|this)\\s+(week|month|year|" + WEEKDAYS + ")\\b", CASE_INSENSITIVE),
            whole("\\b(in|after)\\s+(\\d+)\\s+(days|weeks|months|years)\\b", CASE_INSENSITIVE),
            whole("\\b(\\d{1,2}/\\d{1,2}/\\d{4})\\b", 0),
            whole("\\b(\\d{1,2}-\\d{1,2}-\\d{4})\\b", 0),
            whole("\\b(\\d{4}-\\d{2}-\\d{2})\\b", 0),
            whole("\\b(" + MONTHS + ")\\s+\\d{1,2}(?:st|nd|rd|th)?(?:\\s*,\\s*\\d{4})?\\b", CASE_INSENSITIVE),
            range("\\b(from|between)\\s+([^,]+?)\\s+(?:to|and)\\s+([^.!?]+)", CASE_INSENSITIVE)
    ));

    // Range first: otherwise "from 2pm to 4pm" stops at "2pm".
    static final EntityRuleChain TIME = EntityRuleChain.firstMatch(List.of(
            range("\\b(from|at)\\s+(\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)?)\\s+(?:to|until|-)\\s+(\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)?)(?!\\w)",
                    CASE_INSENSITIVE),
            whole("\\b(\\d{1,2}:\\d{2}\\s*(?:am|pm))\\b", CASE_INSENSITIVE),
            whole("\\b(\\d{1,2}\\s*(?:am|pm))\\b", CASE_INSENSITIVE),
            whole("\\b(\\d{1,2}:\\d{2})\\b", 0),
            whole("\\b(morning|afternoon|evening|noon|midnight)\\b", CASE_INSENSITIVE),
            whole("\\b(in|after)\\s+(\\d+)\\s+(minutes|hours)\\b", CASE_INSENSITIVE)
    ));

    static final EntityRuleChain PARTICIPANTS = EntityRuleChain.cumulative(List.of(
            group("(?<![\\w.])@(\\w+)", 0, 1),
            whole("\\b[A-Z][a-z]+ [A-Z][a-z]+\\b", 0),
            group("(?:with|meeting with|call with)\\s+(.+?)(?=\\s+(?:tomorrow|today|tonight|on|at|next|this|for|about|from|in|to)\\b|[,.!?]|$)",
                    CASE_INSENSITIVE, 1),
            whole("\\b[\\w.%+-]+@[\\w.-]+\\.[a-zA-Z]{2,}\\b", 0)
    ));

    static final EntityRuleChain PROJECT = EntityRuleChain.firstMatch(List.of(
            group("\\b(?:for|in|project)\\s+[\"']?([^\"'.!?]+)[\"']?(?:\\s+project)?", CASE_INSENSITIVE, 1),
            group("\\bproject\\s+[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1),
            group("(?:#|\\bproj(?:ect)?)\\s*(\\w+)\\b", CASE_INSENSITIVE, 1)
    ));

    static final EntityRuleChain PRIORITY = EntityRuleChain.firstMatch(List.of(
            lowerWhole("\\b(high|urgent|critical|priority 1|p1)\\b"),
            lowerWhole("\\b(medium|normal|standard|priority 2|p2)\\b"),
            lowerWhole("\\b(low|minor|low priority|priority 3|p3)\\b")
    ));

    static final EntityRuleChain SEARCH_QUERY = EntityRuleChain.firstMatch(List.of(
            group("(?:search|find|look up)\\s+(?:for|)\\s*[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1),
            group("(?:search|find|look up)\\s+(?:the|)\\s+[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1),
            group("(?:where is|show me|get)\\s+[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1)
    ), text -> text);

    static final EntityRuleChain DOCUMENT_TYPE = EntityRuleChain.firstMatch(keywords(
            "report", "document", "file", "spreadsheet", "presentation", "pdf", "word doc",
            "excel", "powerpoint", "image", "photo"));

    static final EntityRuleChain SERVICE_NAME = EntityRuleChain.firstMatch(keywords(
            "google drive", "dropbox", "slack", "github", "jira", "trello", "asana", "notion",
            "outlook", "gmail", "calendar"));

    static final EntityRuleChain WORKFLOW_NAME = EntityRuleChain.firstMatch(List.of(
            new ExtractionRule(Pattern.compile("(?:run|execute|trigger)\\s+(?:the|)\\s*[\"']?([^\"'.!?]+)[\"']?",
                    CASE_INSENSITIVE), m -> WORKFLOW_SUFFIX.matcher(m.group(1).trim()).replaceFirst("")),
            group("\\bworkflow\\s+[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1)
    ));

    static final EntityRuleChain TIME_PERIOD = EntityRuleChain.firstMatch(List.of(
            whole("\\b(q[1-4])\\s*(\\d{4})?\\b", CASE_INSENSITIVE),
            whole("\\b(quarter\\s*[1-4])\\s*(\\d{4})?\\b", CASE_INSENSITIVE),
            whole("\\b(\\d{4}\\s*[-–]\\s*\\d{2,4})\\b", 0),
            whole("\\b(\\d{4})\\b", 0),
            whole("\\b(last|this|next)\\s+(year|quarter|month|week)\\b", CASE_INSENSITIVE),
            whole("\\b(previous|current|upcoming)\\s+(year|quarter|month)\\b", CASE_INSENSITIVE),
            whole("\\b(" + MONTHS + ")(?:\\s+\\d{4})?\\b", CASE_INSENSITIVE),
            whole("\\b(spring|summer|fall|autumn|winter)(?:\\s+\\d{4})?\\b", CASE_INSENSITIVE),
            whole("\\b(fy\\s*\\d{4})\\b", CASE_INSENSITIVE),
            whole("\\b(fiscal\\s*(year|quarter)\\s*\\d{4})\\b", CASE_INSENSITIVE),
            range("\\b(from|between)\\s+([^,]+?)\\s+(?:to|and|through)\\s+([^.!?]+)", CASE_INSENSITIVE)
    ));

    static final EntityRuleChain DURATION = EntityRuleChain.firstMatch(List.of(
            whole("\\b\\d+(?:\\.\\d+)?\\s*-?\\s*(?:minutes?|mins?|hours?|hrs?)\\b", CASE_INSENSITIVE),
            whole("\\b(?:half an hour|an hour|all day)\\b", CASE_INSENSITIVE)
    ));

    static final EntityRuleChain TOPIC = EntityRuleChain.firstMatch(List.of(
            group("\\b(?:about|regarding|to discuss|re:)\\s+[\"']?([^\"'.!?]+)[\"']?", CASE_INSENSITIVE, 1)
    ));

    private static final Map<String, EntityRuleChain> CHAINS = Map.ofEntries(
            Map.entry("task_name", TASK_NAME),
            Map.entry("date", DATE),
            Map.entry("due_date", DATE),
            Map.entry("time", TIME),
            Map.entry("participants", PARTICIPANTS),
            Map.entry("project", PROJECT),
            Map.entry("priority", PRIORITY),
            Map.entry("search_query", SEARCH_QUERY),
            Map.entry("document_type", DOCUMENT_TYPE),
            Map.entry("service_name", SERVICE_NAME),
            Map.entry("workflow_name", WORKFLOW_NAME),
            Map.entry("time_period", TIME_PERIOD),
            Map.entry("duration", DURATION),
            Map.entry("topic", TOPIC)
    );

    private EntityRules() {} // utility class

    /**
     * All built-in chains keyed by entity type. {@code date} and {@code due_date}
     * share one chain.
     */
    public static Map<String, EntityRuleChain> defaults() {
        return CHAINS;
    }

    private static ExtractionRule lowerWhole(String regex) {
        return new ExtractionRule(Pattern.compile(regex, CASE_INSENSITIVE),
                m -> m.group().toLowerCase(Locale.ROOT));
    }

    private static List<ExtractionRule> keywords(String... keywords) {
        return Arrays.stream(keywords).map(ExtractionRule::keyword).toList();
    }

    /**
     * Fallback for task names: whatever follows the first task keyword, then the
     * whole message.
     */
    static String textAfterTaskKeyword(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : List.of("task", "todo", "item", "thing to do")) {
            int index = lower.indexOf(keyword);
            if (index != -1) {
                String after = message.substring(index + keyword.length()).trim();
                after = TASK_PREFIX.matcher(after).replaceFirst("");
                after = TRAILING_PUNCTUATION.matcher(after).replaceFirst("").trim();
                if (!after.isEmpty()) {
                    return after;
                }
            }
        }
        return message;
    }
}
