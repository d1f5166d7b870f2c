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

import me.golemcore.monitor.cache.ExpiringCache;
import me.golemcore.monitor.domain.model.TrackerIssue;
import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.port.outbound.IssueTrackerPort;
import me.golemcore.monitor.port.outbound.WebsiteProbePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-through access to upstream status signals.
 *
 * <p>
 * Website statuses and tracker issues are each kept in their own
 * {@link ExpiringCache}. On a miss the upstream is queried and the result is
 * stored as an immutable list. Results of a failed fetch are never stored:
 * <ul>
 * <li>website statuses are cached only when every site produced an HTTP
 * response</li>
 * <li>tracker errors propagate as
 * {@link me.golemcore.monitor.port.outbound.UpstreamFetchException} before
 * anything is cached</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusService {

    static final String WEBSITE_STATUS_KEY = "website_status";
    static final String ISSUES_KEY = "sentry_issues";

    private final ExpiringCache<List<WebsiteStatus>> websiteStatusCache;
    private final ExpiringCache<List<TrackerIssue>> issueCache;
    private final WebsiteProbePort websiteProbePort;
    private final IssueTrackerPort issueTrackerPort;
    private final BotProperties properties;

    public List<WebsiteStatus> getWebsiteStatuses() {
        Optional<List<WebsiteStatus>> cached = websiteStatusCache.get(WEBSITE_STATUS_KEY);
        if (cached.isPresent()) {
            log.debug("Using cached website statuses");
            return cached.get();
        }

        List<WebsiteStatus> statuses = monitoredWebsites().stream()
                .map(websiteProbePort::probe)
                .toList();

        if (statuses.stream().allMatch(WebsiteStatus::hasResponse)) {
            websiteStatusCache.set(WEBSITE_STATUS_KEY, statuses);
            log.debug("Cached {} website statuses", statuses.size());
        } else {
            log.info("Website probe had failures, not caching statuses");
        }
        return statuses;
    }

    public List<TrackerIssue> getIssues() {
        Optional<List<TrackerIssue>> cached = issueCache.get(ISSUES_KEY);
        if (cached.isPresent()) {
            log.info("Using cached Sentry issues");
            return cached.get();
        }

        List<TrackerIssue> issues = List.copyOf(issueTrackerPort.fetchIssues());
        issueCache.set(ISSUES_KEY, issues);
        log.info("Cached {} new Sentry issues", issues.size());
        return issues;
    }

    public List<String> getMonitoredProjects() {
        return issueTrackerPort.getProjects();
    }

    /**
     * Drop all cached status so the next request fetches fresh data.
     */
    public void refresh() {
        websiteStatusCache.clear();
        issueCache.clear();
        log.info("Status caches cleared");
    }

    private List<String> monitoredWebsites() {
        List<String> websites = properties.getWebsites();
        if (websites == null) {
            return List.of();
        }
        return websites.stream()
                .map(String::trim)
                .filter(url -> !url.isEmpty())
                .toList();
    }
}
