package dev.chi.tui.service.impl;

import dev.chi.tui.entity.request.WatchdogJobCreateRequest;
import dev.chi.tui.entity.request.WatchdogStatRequest;
import dev.chi.tui.entity.response.WatchdogCommandLogView;
import dev.chi.tui.entity.response.WatchdogJobStatusResponse;
import dev.chi.tui.entity.response.WatchdogJobSummaryResponse;
import dev.chi.tui.entity.response.WatchdogLogResponse;
import dev.chi.tui.entity.response.WatchdogStatsResponse;
import dev.chi.tui.service.WatchdogJobService;
import dev.chi.tui.watchdog.ControlOutcome;
import dev.chi.tui.watchdog.WatchdogCollaborators;
import dev.chi.tui.watchdog.WatchdogConfig;
import dev.chi.tui.watchdog.WatchdogConfigAssembler;
import dev.chi.tui.watchdog.WatchdogProperties;
import dev.chi.tui.watchdog.WatchdogRegistry;
import dev.chi.tui.watchdog.WatchdogSupervisor;
import dev.chi.tui.watchdog.output.CommandLog;
import dev.chi.tui.watchdog.output.RingBufferLog;
import dev.chi.tui.watchdog.output.StatsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class WatchdogJobServiceImpl implements WatchdogJobService {
    private static final Logger log = LoggerFactory.getLogger(WatchdogJobServiceImpl.class);

    private final WatchdogProperties props;
    private final WatchdogConfigAssembler assembler;
    private final WatchdogRegistry registry;
    private final WatchdogCollaborators collaborators;

    // jobs created through the API, keyed like configured ones
    private final Map<String, WatchdogProperties.JobProperties> adhocJobs = new ConcurrentHashMap<>();

    public WatchdogJobServiceImpl(WatchdogProperties props,
                                  WatchdogConfigAssembler assembler,
                                  WatchdogRegistry registry,
                                  WatchdogCollaborators collaborators) {
        this.props = props;
        this.assembler = assembler;
        this.registry = registry;
        this.collaborators = collaborators;
    }

    @Override
    public List<WatchdogJobSummaryResponse> listJobs() {
        Map<String, WatchdogProperties.JobProperties> all = new LinkedHashMap<>();
        if (props.getJobs() != null) all.putAll(props.getJobs());
        all.putAll(adhocJobs);

        Map<String, WatchdogSupervisor> live = registry.snapshot();
        List<WatchdogJobSummaryResponse> out = new ArrayList<>();
        for (var e : all.entrySet()) {
            WatchdogSupervisor s = live.get(e.getKey());
            WatchdogJobSummaryResponse r = new WatchdogJobSummaryResponse();
            r.setJobId(e.getKey());
            r.setTitle(titleOf(e.getKey(), e.getValue()));
            r.setDefined(props.getJobs() != null && props.getJobs().containsKey(e.getKey()));
            r.setLive(s != null);
            r.setMode(s == null ? null : s.mode());
            r.setStarted(s != null && s.isStarted());
            out.add(r);
        }
        return out;
    }

    @Override
    public WatchdogJobStatusResponse open(String jobId) {
        assertEnabled();
        WatchdogProperties.JobProperties def = requireDefinition(jobId);
        AtomicReference<WatchdogSupervisor> created = new AtomicReference<>();
        WatchdogSupervisor s = registry.getOrCreate(jobId, () -> {
            WatchdogConfig cfg = assembler.assemble(jobId, def);
            WatchdogSupervisor fresh = WatchdogSupervisor.create(jobId, assembler.commandsOf(def), cfg, collaborators);
            created.set(fresh);
            return fresh;
        });
        // a concurrent open may have won the registration
        if (s == created.get()) {
            log.info("watchdog: creating session for {}", jobId);
            return toStatus(s, null, "Watchdog started");
        }
        log.info("watchdog: reusing session for {}", jobId);
        s.attach();
        return toStatus(s, null, "Re-attached to running session");
    }

    @Override
    public WatchdogJobStatusResponse create(WatchdogJobCreateRequest request) {
        assertEnabled();
        if (request == null || !StringUtils.hasText(request.getJobId())) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        String jobId = request.getJobId().trim();
        if (props.getJobs() != null && props.getJobs().containsKey(jobId)) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' is defined in configuration");
        }
        WatchdogProperties.JobProperties def = toJobProperties(request);
        // fail fast before the definition becomes visible
        assembler.assemble(jobId, def);
        if (registry.get(jobId) != null) {
            // a live supervisor keeps the definition it was created with until removed
            WatchdogJobStatusResponse r = open(jobId);
            r.setMessage("Job already running; re-attached (remove it first to apply a new definition)");
            return r;
        }
        adhocJobs.put(jobId, def);
        return open(jobId);
    }

    @Override
    public WatchdogJobStatusResponse start(String jobId) {
        WatchdogSupervisor live = registry.get(jobId);
        if (live == null) {
            return open(jobId);
        }
        boolean started = live.start();
        return toStatus(live,
                started ? ControlOutcome.STARTED : ControlOutcome.ALREADY_STARTED,
                started ? "Watchdog started" : "Watchdog already running");
    }

    @Override
    public WatchdogJobStatusResponse stop(String jobId) {
        WatchdogSupervisor s = requireLive(jobId);
        for (CommandLog c : s.getCommands()) {
            c.getLog().pushLine("[stop requested]");
        }
        s.stopAll();
        return toStatus(s, ControlOutcome.STOPPED, "Watchdog stop requested");
    }

    @Override
    public WatchdogJobStatusResponse toggle(String jobId) {
        WatchdogSupervisor s = registry.get(jobId);
        if (s == null) {
            return open(jobId);
        }
        if (s.isExternal()) {
            return kill(jobId);
        }
        if (s.isStarted()) {
            return stop(jobId);
        }
        return start(jobId);
    }

    @Override
    public WatchdogJobStatusResponse restart(String jobId, boolean clear) {
        WatchdogSupervisor s = requireLive(jobId);
        ControlOutcome outcome = s.restartAll(clear);
        String message = outcome == ControlOutcome.UNSUPPORTED
                ? "External mode: restart not supported"
                : "Watchdog restarting...";
        return toStatus(s, outcome, message);
    }

    @Override
    public WatchdogJobStatusResponse kill(String jobId) {
        WatchdogSupervisor s = requireLive(jobId);
        if (!s.isExternal()) {
            return toStatus(s, ControlOutcome.UNSUPPORTED, "Kill is only available in external mode");
        }
        boolean ok = s.killExternal();
        return ok
                ? toStatus(s, ControlOutcome.KILL_INVOKED, "External kill invoked")
                : toStatus(s, ControlOutcome.UNSUPPORTED, "External mode: no kill command configured");
    }

    @Override
    public WatchdogJobStatusResponse getStatus(String jobId) {
        return toStatus(requireLive(jobId), null, null);
    }

    @Override
    public WatchdogLogResponse getLogs(String jobId, int tail) {
        WatchdogSupervisor s = requireLive(jobId);
        List<WatchdogCommandLogView> views = new ArrayList<>();
        List<CommandLog> commands = s.getCommands();
        for (int i = 0; i < commands.size(); i++) {
            CommandLog c = commands.get(i);
            RingBufferLog buf = c.getLog();
            WatchdogCommandLogView v = new WatchdogCommandLogView();
            v.setIndex(i);
            v.setCmdline(c.getCmdline());
            List<String> lines = tail > 0 ? buf.tail(tail) : buf.snapshot();
            v.setLines(lines);
            v.setTotalLines(buf.size());
            views.add(v);
        }
        WatchdogLogResponse resp = new WatchdogLogResponse();
        resp.setJobId(jobId);
        resp.setCommands(views);
        return resp;
    }

    @Override
    public WatchdogStatsResponse getStats(String jobId) {
        WatchdogSupervisor s = requireLive(jobId);
        StatsAggregator stats = s.refreshStats();
        WatchdogStatsResponse resp = new WatchdogStatsResponse();
        resp.setJobId(jobId);
        resp.setLabels(stats == null ? List.of() : stats.labels());
        resp.setCounts(stats == null ? List.of() : stats.counts());
        return resp;
    }

    @Override
    public void remove(String jobId) {
        if (!StringUtils.hasText(jobId)) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        WatchdogSupervisor removed = registry.remove(jobId);
        WatchdogProperties.JobProperties def = adhocJobs.remove(jobId);
        if (removed == null && def == null) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' is not running");
        }
    }

    @Override
    public void autostart() {
        if (!props.isEnabled() || props.getJobs() == null) return;
        for (var e : props.getJobs().entrySet()) {
            if (e.getValue() == null || !e.getValue().isAutostart()) continue;
            try {
                open(e.getKey());
            } catch (Exception ex) {
                log.warn("watchdog autostart failed: jobId={}, error={}", e.getKey(), ex.getMessage());
            }
        }
    }

    private WatchdogJobStatusResponse toStatus(WatchdogSupervisor s, ControlOutcome outcome, String message) {
        WatchdogJobStatusResponse r = new WatchdogJobStatusResponse();
        r.setJobId(s.getJobId());
        r.setTitle(titleOf(s.getJobId(), findDefinition(s.getJobId())));
        r.setMode(s.mode());
        r.setStarted(s.isStarted());
        r.setExternal(s.isExternal());
        r.setExternalRunning(s.isExternal() ? s.isExternalRunning() : null);
        r.setActiveWorkers(s.activeWorkers());
        r.setCommands(s.getCommands().stream().map(CommandLog::getCmdline).toList());
        r.setOutcome(outcome == null ? null : outcome.name());
        r.setMessage(message);
        return r;
    }

    private WatchdogProperties.JobProperties toJobProperties(WatchdogJobCreateRequest req) {
        WatchdogProperties.JobProperties def = new WatchdogProperties.JobProperties();
        def.setTitle(req.getTitle());
        def.setCommands(req.getCommands() == null ? new ArrayList<>() : new ArrayList<>(req.getCommands()));
        def.setSequential(Boolean.TRUE.equals(req.getSequential()));
        def.setAutoRestart(Boolean.TRUE.equals(req.getAutoRestart()));
        if (req.getMaxRetries() != null) def.setMaxRetries(req.getMaxRetries());
        if (req.getRestartDelayMs() != null) def.setRestartDelayMs(req.getRestartDelayMs());
        if (req.getAllowedExitCodes() != null) def.setAllowedExitCodes(new ArrayList<>(req.getAllowedExitCodes()));
        def.setStopOnFailure(Boolean.TRUE.equals(req.getStopOnFailure()));
        def.setOnPanicExitCmd(req.getOnPanicExitCmd());
        if (req.getStats() != null) {
            List<WatchdogProperties.StatProperties> stats = new ArrayList<>();
            for (WatchdogStatRequest sr : req.getStats()) {
                if (sr == null) continue;
                WatchdogProperties.StatProperties sp = new WatchdogProperties.StatProperties();
                sp.setLabel(sr.getLabel());
                sp.setRegexp(sr.getRegexp());
                stats.add(sp);
            }
            def.setStats(stats);
        }
        def.setExternalCheckCmd(req.getExternalCheckCmd());
        def.setExternalKillCmd(req.getExternalKillCmd());
        return def;
    }

    private WatchdogProperties.JobProperties findDefinition(String jobId) {
        if (jobId == null) return null;
        if (props.getJobs() != null && props.getJobs().containsKey(jobId)) {
            return props.getJobs().get(jobId);
        }
        return adhocJobs.get(jobId);
    }

    private WatchdogProperties.JobProperties requireDefinition(String jobId) {
        if (!StringUtils.hasText(jobId)) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        WatchdogProperties.JobProperties def = findDefinition(jobId);
        if (def == null) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' is not defined");
        }
        return def;
    }

    private WatchdogSupervisor requireLive(String jobId) {
        if (!StringUtils.hasText(jobId)) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        WatchdogSupervisor s = registry.get(jobId);
        if (s == null) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' is not running; open it first");
        }
        return s;
    }

    private String titleOf(String jobId, WatchdogProperties.JobProperties def) {
        if (def != null && StringUtils.hasText(def.getTitle())) return def.getTitle();
        return jobId;
    }

    private void assertEnabled() {
        if (!props.isEnabled()) {
            throw new IllegalArgumentException("watchdog 功能未开启（chi.watchdog.enabled=false）");
        }
    }
}
