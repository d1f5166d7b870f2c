package me.golemcore.monitor.adapter.outbound.sentry;

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
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.infrastructure.http.FeignClientFactory;
import me.golemcore.monitor.port.outbound.IssueTrackerPort;
import me.golemcore.monitor.port.outbound.UpstreamFetchException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Issue tracker adapter for the Sentry REST API.
 *
 * <p>
 * Reads {@code /api/0/projects/{org}/{project}/issues/} for every configured
 * project, tags each issue with its project, and returns the merged list
 * ordered by {@code lastSeen}, newest first.
 *
 * <p>
 * A project that fails is logged and skipped. If every project fails the call
 * raises {@link UpstreamFetchException} so the empty result is not mistaken
 * for "no issues" and cached.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.sentry.token} - auth token (bearer)
 * <li>{@code bot.sentry.org} - organization slug
 * <li>{@code bot.sentry.domain} - API host (default sentry.io)
 * <li>{@code bot.sentry.projects} - project slugs
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SentryIssueAdapter implements IssueTrackerPort {

    private static final Comparator<TrackerIssue> NEWEST_FIRST = Comparator
            .comparing((TrackerIssue issue) -> issue.getLastSeen() != null ? issue.getLastSeen() : "")
            .reversed();

    private final FeignClientFactory feignClientFactory;
    private final BotProperties properties;

    private SentryApi sentryApi;
    private List<String> projects = List.of();

    @PostConstruct
    public void init() {
        BotProperties.SentryProperties config = properties.getSentry();
        this.projects = config.getProjects() == null ? List.of()
                : config.getProjects().stream()
                        .map(String::trim)
                        .filter(project -> !project.isEmpty())
                        .toList();
        this.sentryApi = feignClientFactory.createBearerClient(SentryApi.class, config.getDomain(), config.getToken());
        log.info("Sentry adapter initialized for org {} ({} projects)", config.getOrg(), projects.size());
    }

    @Override
    public List<String> getProjects() {
        return projects;
    }

    @Override
    public List<TrackerIssue> fetchIssues() {
        if (projects.isEmpty()) {
            log.warn("No Sentry projects configured");
            return List.of();
        }

        BotProperties.SentryProperties config = properties.getSentry();
        List<TrackerIssue> issues = new ArrayList<>();
        int failures = 0;

        for (String project : projects) {
            try {
                List<SentryIssueDto> projectIssues = sentryApi.listIssues(config.getOrg(), project);
                if (projectIssues != null) {
                    projectIssues.forEach(dto -> issues.add(toIssue(dto, project)));
                }
            } catch (FeignException e) {
                failures++;
                log.error("[Sentry] Failed to fetch issues for project {}: {}", project, e.status());
            } catch (Exception e) { // NOSONAR
                failures++;
                log.error("[Sentry] Error fetching issues for project {}: {}", project, e.getMessage());
            }
        }

        if (failures == projects.size()) {
            throw new UpstreamFetchException("Sentry issues unavailable for all " + failures + " projects");
        }

        issues.sort(NEWEST_FIRST);
        return List.copyOf(issues);
    }

    private TrackerIssue toIssue(SentryIssueDto dto, String project) {
        return TrackerIssue.builder()
                .id(dto.getId())
                .shortId(dto.getShortId())
                .title(dto.getTitle())
                .culprit(dto.getCulprit())
                .level(dto.getLevel())
                .status(dto.getStatus())
                .count(dto.getCount())
                .lastSeen(dto.getLastSeen())
                .permalink(dto.getPermalink())
                .project(project)
                .build();
    }

    // Feign API interface
    interface SentryApi {
        @RequestLine("GET /api/0/projects/{org}/{project}/issues/")
        List<SentryIssueDto> listIssues(
                @Param("org") String org,
                @Param("project") String project);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SentryIssueDto {
        private String id;
        private String shortId;
        private String title;
        private String culprit;
        private String level;
        private String status;
        private String count;
        private String lastSeen;
        private String permalink;
    }
}
