package com.switchboard.core.catalog;

import com.switchboard.core.model.IntentDefinition;

import java.util.List;

/**
 * Built-in intent catalog used when no catalog file is configured or the
 * configured one cannot be loaded. Cross-platform intents come first so that
 * exports list them in matching order.
 */
public final class DefaultIntentCatalog {

    private DefaultIntentCatalog() {} // utility class

    public static List<IntentDefinition> definitions() {
        return List.of(
                createCrossPlatformTask(),
                crossPlatformSearch(),
                syncData(),
                automatedWorkflowTrigger(),
                createTask(),
                scheduleMeeting(),
                searchInformation(),
                analyzeData(),
                integrateService(),
                executeWorkflow()
        );
    }

    // -- Cross-platform --

    static IntentDefinition createCrossPlatformTask() {
        return new IntentDefinition(
                "create_cross_platform_task",
                "Create the same task in several task-management platforms",
                List.of("create task across", "create a task everywhere", "create task in all",
                        "add task across", "create a task across"),
                List.of("Create a task across asana and trello for the launch checklist",
                        "Create a task everywhere to review the contract"),
                List.of("task_name", "project", "due_date", "priority"),
                "create_cross_platform_task",
                "cross_platform_task_creation",
                false, List.of(),
                List.of("asana", "trello", "jira", "monday", "linear"),
                true, null);
    }

    static IntentDefinition crossPlatformSearch() {
        return new IntentDefinition(
                "cross_platform_search",
                "Search for information in every connected platform at once",
                List.of("search across", "search everywhere", "search all platforms", "find across"),
                List.of("Search across all platforms for the Q3 budget",
                        "Find across drive and notion the onboarding guide"),
                List.of("search_query", "document_type", "time_period"),
                "cross_platform_search",
                "unified_search",
                false, List.of(),
                List.of("google_drive", "notion", "slack", "gmail", "dropbox"),
                true, null);
    }

    static IntentDefinition syncData() {
        return new IntentDefinition(
                "sync_data",
                "Keep records synchronized between platforms",
                List.of("sync tasks", "sync data", "keep in sync", "sync across"),
                List.of("Sync tasks across asana and slack",
                        "Keep my jira tickets in sync with trello"),
                List.of("service_name", "project"),
                "sync_platform_data",
                "cross_platform_sync",
                false, List.of(),
                List.of("asana", "slack", "trello", "jira"),
                true, null);
    }

    static IntentDefinition automatedWorkflowTrigger() {
        return new IntentDefinition(
                "automated_workflow_trigger",
                "Create an automation that reacts to events in one platform by acting in another",
                List.of("whenever", "every time", "automatically when"),
                List.of("Whenever I get an email from a client, create a task in asana",
                        "Every time a PR is merged, post in slack"),
                List.of("workflow_name", "service_name"),
                "create_automation",
                "automation_setup",
                true,
                List.of("Should I activate this automation now?",
                        "You can pause the automation at any time."),
                List.of("gmail", "slack", "asana", "calendar"),
                true, null);
    }

    // -- Generic --

    static IntentDefinition createTask() {
        return IntentDefinition.simple(
                "create_task",
                "Create a new task in a project management system",
                List.of("create a task", "add task", "new task", "create task for",
                        "add to my tasks", "create todo", "add todo item"),
                List.of("Create a task to finish the report",
                        "Add a task for meeting preparation",
                        "New task: Review PR #123"),
                List.of("task_name", "project", "due_date", "priority"),
                "create_task",
                "task_creation");
    }

    static IntentDefinition scheduleMeeting() {
        return IntentDefinition.simple(
                "schedule_meeting",
                "Schedule a meeting or calendar event",
                List.of("schedule meeting", "set up meeting", "create meeting", "book meeting",
                        "schedule call", "set up call", "schedule a meeting"),
                List.of("Schedule a meeting with John tomorrow at 2pm",
                        "Set up a team meeting for Friday",
                        "Book a 30-minute call with Sarah"),
                List.of("participants", "date", "time", "duration", "topic"),
                "schedule_meeting",
                "meeting_scheduling");
    }

    static IntentDefinition searchInformation() {
        return IntentDefinition.simple(
                "search_information",
                "Search for information or documents",
                List.of("search for", "find", "look up", "where is", "show me",
                        "get information about", "search documents"),
                List.of("Search for project documentation",
                        "Find the sales report from last quarter",
                        "Look up customer information for ABC Corp"),
                List.of("search_query", "document_type", "time_period"),
                "search",
                "information_retrieval");
    }

    static IntentDefinition analyzeData() {
        return IntentDefinition.simple(
                "analyze_data",
                "Analyze data or generate reports",
                List.of("analyze", "generate report", "create dashboard", "show analytics",
                        "data analysis", "performance report"),
                List.of("Analyze sales data for Q3",
                        "Generate a performance report",
                        "Show me analytics for the website"),
                List.of("time_period", "document_type"),
                "analyze_data",
                "data_analysis");
    }

    static IntentDefinition integrateService() {
        return new IntentDefinition(
                "integrate_service",
                "Connect or integrate with external services",
                List.of("connect to", "integrate with", "set up integration",
                        "connect google drive", "integrate slack"),
                List.of("Connect to my Google Drive",
                        "Integrate with Slack",
                        "Set up Dropbox integration"),
                List.of("service_name"),
                "integrate_service",
                null,
                true,
                List.of("Do you want me to start the connection now?",
                        "You will be redirected to authorize access."),
                List.of(), false, null);
    }

    static IntentDefinition executeWorkflow() {
        return IntentDefinition.simple(
                "execute_workflow",
                "Execute a specific workflow or automation",
                List.of("run workflow", "execute workflow", "start automation", "trigger workflow",
                        "run the", "execute the"),
                List.of("Run the daily report workflow",
                        "Execute the customer onboarding automation",
                        "Trigger the data sync workflow"),
                List.of("workflow_name"),
                "execute_workflow",
                "workflow_execution");
    }
}
