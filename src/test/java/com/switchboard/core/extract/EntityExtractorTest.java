package com.switchboard.core.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Nested
    @DisplayName("task_name")
    class TaskName {

        @Test
        @DisplayName("captures what follows 'create a task for'")
        void afterCreateTask() {
            assertEquals("the report", extractor.extract("Please create a task for the report", "task_name"));
        }

        @Test
        @DisplayName("strips quotes around the task name")
        void quotedName() {
            assertEquals("Review PR", extractor.extract("add a task called \"Review PR\"", "task_name"));
        }

        @Test
        @DisplayName("falls back to the whole message when no task keyword occurs")
        void fallbackToMessage() {
            assertEquals("buy milk", extractor.extract("buy milk", "task_name"));
        }
    }

    @Nested
    @DisplayName("date and time")
    class DateAndTime {

        @Test
        @DisplayName("relative day words")
        void relativeDay() {
            assertEquals("tomorrow", extractor.extract("Schedule a meeting with John tomorrow at 2pm", "date"));
        }

        @Test
        @DisplayName("due_date shares the date rules")
        void dueDateAlias() {
            assertEquals("next friday", extractor.extract("finish it by next friday", "due_date"));
        }

        @Test
        @DisplayName("ISO dates")
        void isoDate() {
            assertEquals("2024-03-15", extractor.extract("deadline is 2024-03-15", "date"));
        }

        @Test
        @DisplayName("time ranges collapse to 'X to Y'")
        void timeRange() {
            assertEquals("2pm to 4pm", extractor.extract("block my calendar from 2pm to 4pm", "time"));
        }

        @Test
        @DisplayName("single clock time")
        void singleTime() {
            assertEquals("2pm", extractor.extract("Schedule a meeting with John tomorrow at 2pm", "time"));
        }
    }

    @Nested
    @DisplayName("participants")
    class Participants {

        @Test
        @DisplayName("collects mentions and 'with' phrases, split on 'and'")
        @SuppressWarnings("unchecked")
        void mentionsAndWith() {
            Object value = extractor.extract("set up a call with @alice and bob tomorrow", "participants");
            List<String> participants = (List<String>) value;
            assertTrue(participants.contains("alice"));
            assertTrue(participants.contains("bob"));
        }

        @Test
        @DisplayName("email addresses are participants")
        @SuppressWarnings("unchecked")
        void emails() {
            List<String> participants = (List<String>) extractor.extract(
                    "invite jane.doe@example.com to the sync", "participants");
            assertTrue(participants.contains("jane.doe@example.com"));
        }

        @Test
        @DisplayName("no participants gives an empty list")
        void none() {
            assertEquals(List.of(), extractor.extract("what is on today", "participants"));
        }
    }

    @Test
    @DisplayName("priority is lowercased")
    void priority() {
        assertEquals("urgent", extractor.extract("URGENT: fix the login page", "priority"));
    }

    @Test
    @DisplayName("search_query falls back to the whole message")
    void searchFallback() {
        assertEquals("quarterly numbers", extractor.extract("quarterly numbers", "search_query"));
        assertEquals("the budget", extractor.extract("search for the budget", "search_query"));
    }

    @Test
    @DisplayName("workflow_name drops the trailing 'workflow'")
    void workflowName() {
        assertEquals("daily report", extractor.extract("Run the daily report workflow", "workflow_name"));
    }

    @Test
    @DisplayName("service_name picks the first listed keyword present")
    void serviceName() {
        assertEquals("slack", extractor.extract("Integrate with Slack", "service_name"));
    }

    @Test
    @DisplayName("unknown entity types and blank input produce an empty string")
    void unknownType() {
        assertEquals("", extractor.extract("anything", "favourite_colour"));
        assertEquals("", extractor.extract("   ", "task_name"));
        assertFalse(extractor.supports("favourite_colour"));
        assertTrue(extractor.supports("due_date"));
    }

    @Test
    @DisplayName("a failing rule yields an empty value instead of an exception")
    void failingRuleIsContained() {
        var broken = EntityRuleChain.firstMatch(List.of(
                new ExtractionRule(Pattern.compile("x"), m -> { throw new IllegalStateException("boom"); })));
        var custom = new EntityExtractor(Map.of("broken", broken));
        assertEquals("", custom.extract("x marks the spot", "broken"));
    }

    @Test
    @DisplayName("extractAll keeps request order and omits empty values")
    void extractAll() {
        Map<String, Object> entities = extractor.extractAll("Please create a task for the report",
                List.of("task_name", "priority", "project"));
        assertEquals(List.of("task_name", "project"), List.copyOf(entities.keySet()));
        assertEquals("the report", entities.get("task_name"));
    }
}
