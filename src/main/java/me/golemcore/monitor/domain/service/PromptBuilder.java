package me.golemcore.monitor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.model.TrackerIssue;
import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.history.Exchange;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles the user message sent to the language model from the query, the
 * current status signals and the user's recent exchanges.
 */
@Component
public class PromptBuilder {

    static final int MAX_ISSUES_IN_PROMPT = 5;
    private static final String NO_ISSUES = "No issues found";

    public String build(String query, List<WebsiteStatus> websites, List<TrackerIssue> issues,
            List<String> projects, List<Exchange> history) {
        StringBuilder sb = new StringBuilder();
        sb.append("User Query: ").append(query).append("\n\n");

        sb.append("Current Status:\n");
        sb.append("Website Status:\n");
        if (websites.isEmpty()) {
            sb.append("- No websites monitored\n");
        }
        for (WebsiteStatus website : websites) {
            sb.append("- ").append(formatWebsite(website)).append('\n');
        }

        sb.append("Latest Sentry Issues:\n");
        if (issues.isEmpty()) {
            sb.append("- ").append(NO_ISSUES).append('\n');
        }
        issues.stream()
                .limit(MAX_ISSUES_IN_PROMPT)
                .forEach(issue -> sb.append("- ").append(formatIssue(issue)).append('\n'));

        sb.append("\nProjects being monitored: ").append(String.join(", ", projects)).append('\n');

        if (!history.isEmpty()) {
            sb.append("\nPrevious Conversation:\n");
            for (Exchange exchange : history) {
                sb.append("User: ").append(exchange.query()).append('\n');
                sb.append("Assistant: ").append(exchange.response()).append("\n\n");
            }
        }
        return sb.toString();
    }

    private String formatWebsite(WebsiteStatus website) {
        if (!website.hasResponse()) {
            return website.getUrl() + ": unreachable (" + website.getError() + ")";
        }
        return website.getUrl() + ": HTTP " + website.getStatus()
                + (website.isAccessible() ? " (accessible)" : " (not accessible)");
    }

    private String formatIssue(TrackerIssue issue) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(issue.getProject()).append("] ");
        if (issue.getShortId() != null) {
            sb.append(issue.getShortId()).append(' ');
        }
        sb.append(issue.getTitle());
        if (issue.getCulprit() != null && !issue.getCulprit().isBlank()) {
            sb.append(" in ").append(issue.getCulprit());
        }
        sb.append(" (level: ").append(issue.getLevel())
                .append(", events: ").append(issue.getCount())
                .append(", last seen: ").append(issue.getLastSeen()).append(')');
        return sb.toString();
    }
}
