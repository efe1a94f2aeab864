package com.switchboard.core.extract;

import java.util.List;
import java.util.Optional;

/**
 * Static platform-capability table. Order matters: detection reports platforms
 * in table order.
 */
public final class PlatformCatalog {

    private static final List<PlatformCapability> PLATFORMS = List.of(
            platform("asana", List.of("asana"), List.of("task_management", "project_tracking"),
                    List.of("create_task", "update_task", "assign_task", "comment_task")),
            platform("slack", List.of("slack"), List.of("communication", "notifications"),
                    List.of("send_message", "create_channel", "invite_user", "set_status")),
            platform("google_drive", List.of("google_drive", "google drive", "gdrive"),
                    List.of("document_storage", "file_sharing"),
                    List.of("upload_file", "share_file", "create_folder", "search_docs")),
            platform("gmail", List.of("gmail"), List.of("email", "communication"),
                    List.of("send_email", "search_emails", "create_draft", "label_email")),
            platform("calendar", List.of("calendar", "google calendar"), List.of("scheduling", "events"),
                    List.of("create_event", "update_event", "invite_attendees", "schedule_meeting")),
            platform("zendesk", List.of("zendesk"), List.of("customer_support", "ticketing"),
                    List.of("create_ticket", "update_ticket", "reply_ticket", "escalate_ticket")),
            platform("hubspot", List.of("hubspot"), List.of("crm", "marketing"),
                    List.of("create_contact", "update_deal", "log_activity", "create_campaign")),
            platform("salesforce", List.of("salesforce"), List.of("crm", "sales"), List.of()),
            platform("notion", List.of("notion"), List.of("documentation", "knowledge_base"), List.of()),
            platform("github", List.of("github"), List.of("development", "version_control"), List.of()),
            platform("figma", List.of("figma"), List.of("design", "collaboration"), List.of()),
            platform("discord", List.of("discord"), List.of("communication", "community"), List.of()),
            platform("teams", List.of("teams", "microsoft teams", "ms teams"), List.of("communication", "meetings"),
                    List.of()),
            platform("trello", List.of("trello"), List.of("task_management", "kanban"), List.of()),
            platform("jira", List.of("jira"), List.of("issue_tracking", "project_management"), List.of()),
            // bare "monday" collides with the weekday
            platform("monday", List.of("monday.com", "monday board", "monday workspace"),
                    List.of("project_management", "workflows"), List.of()),
            platform("airtable", List.of("airtable"), List.of("database", "spreadsheets"), List.of()),
            platform("box", List.of("box"), List.of("document_storage", "file_sharing"), List.of()),
            platform("dropbox", List.of("dropbox"), List.of("file_storage", "sync"), List.of()),
            platform("onedrive", List.of("onedrive", "one drive"), List.of("document_storage", "collaboration"),
                    List.of()),
            platform("sharepoint", List.of("sharepoint"), List.of("document_management", "enterprise"), List.of()),
            platform("zoom", List.of("zoom"), List.of("meetings", "video_conferencing"), List.of()),
            platform("stripe", List.of("stripe"), List.of("payments", "billing"), List.of()),
            platform("plaid", List.of("plaid"), List.of("banking", "financial_data"), List.of()),
            platform("xero", List.of("xero"), List.of("accounting", "financial"), List.of()),
            platform("quickbooks", List.of("quickbooks"), List.of("accounting", "invoicing"), List.of()),
            platform("shopify", List.of("shopify"), List.of("ecommerce", "inventory"), List.of()),
            platform("gitlab", List.of("gitlab"), List.of("development", "ci_cd"), List.of()),
            platform("linear", List.of("linear"), List.of("issue_tracking", "development"), List.of()),
            platform("bamboohr", List.of("bamboohr", "bamboo hr"), List.of("hr", "employee_management"), List.of()),
            platform("vscode", List.of("vscode", "vs code"), List.of("development", "coding"), List.of()),
            platform("tableau", List.of("tableau"), List.of("analytics", "visualization"), List.of()),
            platform("nextjs", List.of("nextjs", "next.js"), List.of("development", "web_framework"), List.of())
    );

    private PlatformCatalog() {} // utility class

    public static List<PlatformCapability> all() {
        return PLATFORMS;
    }

    public static Optional<PlatformCapability> find(String name) {
        return PLATFORMS.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public static List<String> names() {
        return PLATFORMS.stream().map(PlatformCapability::name).toList();
    }

    private static PlatformCapability platform(String name, List<String> keywords,
                                               List<String> capabilities, List<String> actions) {
        return new PlatformCapability(name, keywords, capabilities, actions);
    }
}
