package com.auditsentinel.core.model;

import java.util.Objects;

/**
 * Run-level remediation advice, as opposed to the per-finding
 * recommendation strings.
 *
 * @since 1.0.0
 */
public final class RunRecommendation {

    private final String type;
    private final String priority;
    private final String title;
    private final String description;
    private final String action;

    public RunRecommendation(String type, String priority, String title, String description, String action) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = description;
        this.action = action;
    }

    public String getType() {
        return type;
    }

    public String getPriority() {
        return priority;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "RunRecommendation{priority='" + priority + "', title='" + title + "'}";
    }
}
