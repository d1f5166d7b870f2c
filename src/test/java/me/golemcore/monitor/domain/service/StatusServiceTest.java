package me.golemcore.monitor.domain.service;

import me.golemcore.monitor.cache.ExpiringCache;
import me.golemcore.monitor.domain.model.TrackerIssue;
import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.port.outbound.IssueTrackerPort;
import me.golemcore.monitor.port.outbound.UpstreamFetchException;
import me.golemcore.monitor.port.outbound.WebsiteProbePort;
import me.golemcore.monitor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StatusServiceTest {

    private static final String SITE_A = "https://a.example.com";
    private static final String SITE_B = "https://b.example.com";

    private MutableClock clock;
    private ExpiringCache<List<WebsiteStatus>> websiteStatusCache;
    private ExpiringCache<List<TrackerIssue>> issueCache;
    private WebsiteProbePort websiteProbePort;
    private IssueTrackerPort issueTrackerPort;
    private StatusService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        websiteStatusCache = new ExpiringCache<>(Duration.ofMinutes(5), clock);
        issueCache = new ExpiringCache<>(Duration.ofMinutes(5), clock);
        websiteProbePort = mock(WebsiteProbePort.class);
        issueTrackerPort = mock(IssueTrackerPort.class);

        BotProperties properties = new BotProperties();
        properties.setWebsites(List.of(SITE_A, " " + SITE_B + " ", ""));

        service = new StatusService(websiteStatusCache, issueCache, websiteProbePort, issueTrackerPort,
                properties);
    }

    // ===== websites =====

    @Test
    void shouldProbeTrimmedWebsitesAndCacheResult() {
        when(websiteProbePort.probe(SITE_A)).thenReturn(WebsiteStatus.responded(SITE_A, 200));
        when(websiteProbePort.probe(SITE_B)).thenReturn(WebsiteStatus.responded(SITE_B, 503));

        List<WebsiteStatus> first = service.getWebsiteStatuses();
        List<WebsiteStatus> second = service.getWebsiteStatuses();

        assertEquals(2, first.size());
        assertTrue(first.get(0).isAccessible());
        assertFalse(first.get(1).isAccessible());
        assertEquals(first, second);
        verify(websiteProbePort, times(1)).probe(SITE_A);
        verify(websiteProbePort, times(1)).probe(SITE_B);
    }

    @Test
    void shouldProbeAgainAfterTtl() {
        when(websiteProbePort.probe(anyString()))
                .thenAnswer(invocation -> WebsiteStatus.responded(invocation.getArgument(0), 200));

        service.getWebsiteStatuses();
        clock.advance(Duration.ofMinutes(6));
        service.getWebsiteStatuses();

        verify(websiteProbePort, times(2)).probe(SITE_A);
    }

    @Test
    void shouldNotCacheWebsiteStatusesWhenProbeFailed() {
        when(websiteProbePort.probe(SITE_A)).thenReturn(WebsiteStatus.responded(SITE_A, 200));
        when(websiteProbePort.probe(SITE_B)).thenReturn(WebsiteStatus.failed(SITE_B, "timeout"));

        List<WebsiteStatus> statuses = service.getWebsiteStatuses();
        service.getWebsiteStatuses();

        assertEquals("timeout", statuses.get(1).getError());
        assertEquals(0, websiteStatusCache.size());
        verify(websiteProbePort, times(2)).probe(SITE_B);
    }

    // ===== issues =====

    @Test
    void shouldFetchIssuesOnceWithinTtl() {
        TrackerIssue issue = TrackerIssue.builder().id("1").title("NPE").project("api").build();
        when(issueTrackerPort.fetchIssues()).thenReturn(List.of(issue));

        assertEquals(List.of(issue), service.getIssues());
        assertEquals(List.of(issue), service.getIssues());

        verify(issueTrackerPort, times(1)).fetchIssues();
    }

    @Test
    void shouldNotCacheFailedIssueFetch() {
        when(issueTrackerPort.fetchIssues())
                .thenThrow(new UpstreamFetchException("down"))
                .thenReturn(List.of());

        assertThrows(UpstreamFetchException.class, () -> service.getIssues());
        assertEquals(0, issueCache.size());

        assertTrue(service.getIssues().isEmpty());
        verify(issueTrackerPort, times(2)).fetchIssues();
    }

    @Test
    void shouldRefetchAfterRefresh() {
        when(issueTrackerPort.fetchIssues()).thenReturn(List.of());
        when(websiteProbePort.probe(anyString()))
                .thenAnswer(invocation -> WebsiteStatus.responded(invocation.getArgument(0), 200));

        service.getIssues();
        service.getWebsiteStatuses();
        service.refresh();
        service.getIssues();
        service.getWebsiteStatuses();

        verify(issueTrackerPort, times(2)).fetchIssues();
        verify(websiteProbePort, times(2)).probe(SITE_A);
    }

    @Test
    void shouldExposeMonitoredProjects() {
        when(issueTrackerPort.getProjects()).thenReturn(List.of("api", "web"));

        assertEquals(List.of("api", "web"), service.getMonitoredProjects());
    }
}
