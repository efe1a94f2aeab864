package com.switchboard.core.integration;

import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.SyncOperation;
import com.switchboard.core.model.TransformationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of known cross-platform integration patterns, keyed by
 * {@link DataIntegrationPlan#key()}.
 * <p>
 * A pattern applies to a request only when every one of its source and target
 * platforms was detected. Re-registering a key replaces the previous plan; when
 * several patterns apply, the most recently registered one wins.
 */
@Component
public class CrossPlatformMapper {

    private static final Logger log = LoggerFactory.getLogger(CrossPlatformMapper.class);

    private record Registration(DataIntegrationPlan plan, long sequence) {}

    private final Map<String, Registration> patterns = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public CrossPlatformMapper() {
        defaultPatterns().forEach(this::register);
    }

    public void register(DataIntegrationPlan plan) {
        if (plan.sourcePlatforms().isEmpty() || plan.targetPlatforms().isEmpty()) {
            throw new IllegalArgumentException("Integration pattern needs source and target platforms: " + plan.key());
        }
        Registration previous = patterns.put(plan.key(), new Registration(plan, sequence.incrementAndGet()));
        if (previous != null) {
            log.info("Integration pattern {} replaced", plan.key());
        } else {
            log.debug("Integration pattern {} registered", plan.key());
        }
    }

    public Optional<DataIntegrationPlan> lookup(List<String> sourcePlatforms, List<String> targetPlatforms) {
        Registration registration = patterns.get(DataIntegrationPlan.keyOf(sourcePlatforms, targetPlatforms));
        return registration == null ? Optional.empty() : Optional.of(registration.plan());
    }

    /**
     * Finds the plan whose platforms are all contained in {@code detectedPlatforms}.
     */
    public Optional<DataIntegrationPlan> match(Collection<String> detectedPlatforms) {
        if (detectedPlatforms == null || detectedPlatforms.isEmpty()) {
            return Optional.empty();
        }
        var detected = new HashSet<>(detectedPlatforms);
        return patterns.values().stream()
                .filter(r -> detected.containsAll(r.plan().sourcePlatforms())
                        && detected.containsAll(r.plan().targetPlatforms()))
                .max(Comparator.comparingLong(Registration::sequence))
                .map(Registration::plan);
    }

    /** Registered plans, oldest registration first. */
    public List<DataIntegrationPlan> patterns() {
        return patterns.values().stream()
                .sorted(Comparator.comparingLong(Registration::sequence))
                .map(Registration::plan)
                .toList();
    }

    static List<DataIntegrationPlan> defaultPatterns() {
        return List.of(
                new DataIntegrationPlan(
                        List.of("gmail", "slack"), List.of("asana", "trello"), SyncOperation.CREATE,
                        orderedMap("email_subject", "task_name",
                                "email_body", "task_description",
                                "sender", "assignee",
                                "priority", "priority"),
                        List.of(new TransformationRule("email_contains_action_items",
                                "create_task_with_assignee", "extract_action_items"))),
                new DataIntegrationPlan(
                        List.of("calendar", "zoom"), List.of("slack", "teams"), SyncOperation.CREATE,
                        orderedMap("event_title", "message_content",
                                "start_time", "reminder_time",
                                "attendees", "mention_users"),
                        List.of(new TransformationRule("meeting_scheduled", "send_reminder",
                                "create_meeting_reminder"))),
                new DataIntegrationPlan(
                        List.of("github", "gitlab"), List.of("slack", "teams"), SyncOperation.UPDATE,
                        orderedMap("commit_message", "message_content",
                                "author", "user",
                                "branch", "project"),
                        List.of(new TransformationRule("code_committed", "notification",
                                "create_commit_notification"))),
                new DataIntegrationPlan(
                        List.of("asana"), List.of("slack"), SyncOperation.SYNC,
                        orderedMap("task_name", "message_content",
                                "assignee", "mention_users",
                                "due_date", "reminder_time"),
                        List.of(new TransformationRule("task_updated", "channel_update",
                                "post_task_status")))
        );
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
