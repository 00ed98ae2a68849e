package dev.chi.tui.service.impl;

import dev.chi.tui.entity.request.WatchdogJobCreateRequest;
import dev.chi.tui.entity.response.WatchdogJobStatusResponse;
import dev.chi.tui.entity.response.WatchdogJobSummaryResponse;
import dev.chi.tui.entity.response.WatchdogLogResponse;
import dev.chi.tui.entity.response.WatchdogStatsResponse;
import dev.chi.tui.entity.request.WatchdogStatRequest;
import dev.chi.tui.watchdog.WatchdogCollaborators;
import dev.chi.tui.watchdog.WatchdogConfigAssembler;
import dev.chi.tui.watchdog.WatchdogProperties;
import dev.chi.tui.watchdog.WatchdogRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WatchdogJobServiceImplTest {

    private WatchdogProperties props;
    private WatchdogRegistry registry;
    private WatchdogJobServiceImpl service;
    private final AtomicInteger spawns = new AtomicInteger();
    private final AtomicInteger kills = new AtomicInteger();

    @BeforeEach
    void setUp() {
        props = new WatchdogProperties();
        props.getJobs().put("web", job("echo web"));
        WatchdogProperties.JobProperties ext = new WatchdogProperties.JobProperties();
        ext.setExternalCheckCmd("check");
        ext.setExternalKillCmd("kill");
        props.getJobs().put("ext", ext);
        props.setExternalPollIntervalMs(50);

        registry = new WatchdogRegistry();
        WatchdogCollaborators collaborators = new WatchdogCollaborators(
                (log, cmdline, config, stop) -> {
                    spawns.incrementAndGet();
                    log.pushLine("ERROR from " + cmdline);
                    return true;
                },
                cmd -> () -> true,
                cmd -> kills::incrementAndGet);
        service = new WatchdogJobServiceImpl(props, new WatchdogConfigAssembler(props), registry, collaborators);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private static WatchdogProperties.JobProperties job(String... commands) {
        WatchdogProperties.JobProperties j = new WatchdogProperties.JobProperties();
        j.setCommands(new ArrayList<>(List.of(commands)));
        return j;
    }

    private static void awaitIdle(WatchdogJobServiceImpl service, String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (service.getStatus(jobId).getActiveWorkers() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void testOpenTwiceReattaches() throws Exception {
        WatchdogJobStatusResponse first = service.open("web");
        awaitIdle(service, "web");
        WatchdogJobStatusResponse second = service.open("web");

        assertEquals("Watchdog started", first.getMessage());
        assertEquals("Re-attached to running session", second.getMessage());
        assertEquals(1, spawns.get());
        List<String> lines = service.getLogs("web", 0).getCommands().get(0).getLines();
        assertEquals("[re-attached to running session]", lines.get(lines.size() - 1));
    }

    @Test
    void testUnknownJobRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.open("nope"));
        assertThrows(IllegalArgumentException.class, () -> service.getStatus("web"));
    }

    @Test
    void testDisabled() {
        props.setEnabled(false);
        assertThrows(IllegalArgumentException.class, () -> service.open("web"));
    }

    @Test
    void testStopWritesRequestLine() throws Exception {
        service.open("web");
        awaitIdle(service, "web");

        WatchdogJobStatusResponse r = service.stop("web");

        assertEquals("STOPPED", r.getOutcome());
        assertFalse(r.getStarted());
        assertTrue(service.getLogs("web", 0).getCommands().get(0).getLines().contains("[stop requested]"));
    }

    @Test
    void testToggleStartsAndStops() throws Exception {
        service.open("web");
        awaitIdle(service, "web");
        assertEquals("STOPPED", service.toggle("web").getOutcome());
        assertEquals("STARTED", service.toggle("web").getOutcome());
        assertEquals("ALREADY_STARTED", service.start("web").getOutcome());
    }

    @Test
    void testExternalControls() {
        service.open("ext");

        assertEquals("UNSUPPORTED", service.restart("ext", false).getOutcome());
        assertEquals("KILL_INVOKED", service.toggle("ext").getOutcome());
        assertEquals(1, kills.get());
        assertEquals(0, spawns.get());
        assertEquals("EXTERNAL", service.getStatus("ext").getMode());
    }

    @Test
    void testKillOutsideExternalMode() {
        service.open("web");
        WatchdogJobStatusResponse r = service.kill("web");
        assertEquals("UNSUPPORTED", r.getOutcome());
    }

    @Test
    void testCreateAdhocJobWithStats() throws Exception {
        WatchdogJobCreateRequest req = new WatchdogJobCreateRequest();
        req.setJobId("adhoc");
        req.setTitle("Ad hoc");
        req.setCommands(List.of("one", "two"));
        WatchdogStatRequest stat = new WatchdogStatRequest();
        stat.setLabel("errors");
        stat.setRegexp("ERROR");
        req.setStats(List.of(stat));

        WatchdogJobStatusResponse r = service.create(req);
        awaitIdle(service, "adhoc");

        assertEquals("Ad hoc", r.getTitle());
        WatchdogStatsResponse stats = service.getStats("adhoc");
        assertEquals(List.of("errors"), stats.getLabels());
        assertEquals(List.of(2L), stats.getCounts());

        WatchdogLogResponse logs = service.getLogs("adhoc", 1);
        assertEquals(2, logs.getCommands().size());
        assertEquals(1, logs.getCommands().get(0).getLines().size());

        List<WatchdogJobSummaryResponse> jobs = service.listJobs();
        WatchdogJobSummaryResponse adhoc = jobs.stream().filter(j -> j.getJobId().equals("adhoc")).findFirst().orElseThrow();
        assertTrue(adhoc.getLive());
        assertFalse(adhoc.getDefined());

        service.remove("adhoc");
        assertTrue(service.listJobs().stream().noneMatch(j -> j.getJobId().equals("adhoc")));
    }

    @Test
    void testCreateCannotShadowConfiguredJob() {
        WatchdogJobCreateRequest req = new WatchdogJobCreateRequest();
        req.setJobId("web");
        req.setCommands(List.of("x"));
        assertThrows(IllegalArgumentException.class, () -> service.create(req));
    }

    @Test
    void testCreateValidatesRetries() {
        WatchdogJobCreateRequest req = new WatchdogJobCreateRequest();
        req.setJobId("big");
        req.setCommands(List.of("x"));
        req.setMaxRetries(5000);
        assertThrows(IllegalArgumentException.class, () -> service.create(req));
        assertNull(registry.get("big"));
    }

    @Test
    void testAutostart() {
        props.getJobs().get("web").setAutostart(true);
        service.autostart();
        assertNotNull(registry.get("web"));
        assertNull(registry.get("ext"));
    }
}
