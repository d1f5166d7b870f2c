package me.golemcore.monitor.port.outbound;

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

import java.util.List;

/**
 * Port for reading the latest issues from the issue tracker (Sentry).
 */
public interface IssueTrackerPort {

    /**
     * Fetches issues across all configured projects, most recently seen first.
     *
     * @throws UpstreamFetchException
     *             if no project could be read
     */
    List<TrackerIssue> fetchIssues();

    /**
     * Names of the projects being monitored.
     */
    List<String> getProjects();
}
