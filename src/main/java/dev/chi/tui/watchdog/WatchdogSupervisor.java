package dev.chi.tui.watchdog;

import dev.chi.tui.watchdog.external.Detector;
import dev.chi.tui.watchdog.external.Killer;
import dev.chi.tui.watchdog.output.CommandLog;
import dev.chi.tui.watchdog.output.RingBufferLog;
import dev.chi.tui.watchdog.output.StatsAggregator;
import dev.chi.tui.watchdog.spawn.LocalSpawner;
import dev.chi.tui.watchdog.spawn.Spawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个 watchdog 任务的编排者：持有全部命令缓冲、策略和工作线程，
 * start / stopAll / restartAll / killExternal 是唯一的控制入口。
 * <p>
 * 运行模式：
 * - parallel：每条命令一个线程，各自独立重试
 * - sequential：单个编排线程按声明顺序逐条执行
 * - external：不 spawn，轮询探测命令推断外部进程是否存活
 * <p>
 * 控制操作在 {@code lock} 上串行；后台线程从不获取该锁，只写各自的缓冲和 volatile 状态，
 * 因此读取状态/日志不会被退避等待阻塞。
 */
public class WatchdogSupervisor {
    private static final Logger log = LoggerFactory.getLogger(WatchdogSupervisor.class);

    static final String EXTERNAL_NOTE = "[external mode] will not spawn commands";
    static final String EXTERNAL_RUNNING = "[external] running (detected)";
    static final String EXTERNAL_NOT_RUNNING = "[external] not running";

    private final String jobId;
    private final List<CommandLog> commands;
    private final WatchdogConfig config;
    private final Spawner spawner;
    private final StatsAggregator stats;

    private final Object lock = new Object();
    private final List<Worker> workers;
    private volatile Thread sequentialThread;
    private volatile boolean started;

    private final boolean external;
    private final Detector detector;
    private final Killer killer;
    private volatile boolean externalRunning;
    private final AtomicBoolean externalStop = new AtomicBoolean(false);
    private volatile Thread externalThread;

    private static final class Worker {
        final AtomicBoolean stop = new AtomicBoolean(false);
        volatile Thread handle;
    }

    private WatchdogSupervisor(String jobId, List<String> cmdlines, WatchdogConfig config, WatchdogCollaborators collaborators) {
        this.jobId = jobId;
        this.config = config;
        this.spawner = collaborators.getSpawner();

        List<CommandLog> logs = new ArrayList<>(cmdlines.size());
        List<Worker> ws = new ArrayList<>(cmdlines.size());
        for (String cmd : cmdlines) {
            logs.add(new CommandLog(cmd, config.getMaxLinesPerCommand()));
            ws.add(new Worker());
        }
        this.commands = List.copyOf(logs);
        this.workers = List.copyOf(ws);
        this.stats = config.getStatPatterns().isEmpty() ? null : new StatsAggregator(config.getStatPatterns(), logs.size());

        this.external = config.isExternalMode();
        this.detector = external ? collaborators.detector(config.getExternalCheckCmd()) : null;
        this.killer = external && config.hasExternalKillCmd() ? collaborators.killer(config.getExternalKillCmd()) : null;
    }

    /**
     * Builds one log per command line and starts it: spawning in parallel/sequential mode, or
     * polling the check command in external mode.
     */
    public static WatchdogSupervisor create(String jobId, List<String> cmdlines, WatchdogConfig config,
                                            WatchdogCollaborators collaborators) {
        WatchdogSupervisor s = new WatchdogSupervisor(jobId, cmdlines, config, collaborators);
        synchronized (s.lock) {
            if (s.external) {
                s.broadcast(EXTERNAL_NOTE);
                s.startPollerLocked();
            } else {
                s.seedLocked();
                s.startLocked();
            }
        }
        log.info("watchdog supervisor created: jobId={}, commands={}, mode={}", jobId, cmdlines.size(), s.mode());
        return s;
    }

    /**
     * Idempotent: returns false when already started.
     */
    public boolean start() {
        synchronized (lock) {
            if (external) {
                if (externalThread != null && externalThread.isAlive()) return false;
                startPollerLocked();
                return true;
            }
            if (started) return false;
            startLocked();
            return true;
        }
    }

    /**
     * Requests every worker to stop and joins them. Latency is bounded by the 50 ms polling
     * granularity, not by the configured backoff.
     */
    public void stopAll() {
        synchronized (lock) {
            stopAllLocked();
        }
    }

    public void clearOutputs() {
        for (CommandLog c : commands) {
            c.getLog().clear();
        }
    }

    public ControlOutcome restartAll(boolean clear) {
        synchronized (lock) {
            if (external) {
                if (clear) {
                    clearOutputs();
                }
                broadcast("[external mode] restart not supported");
                return ControlOutcome.UNSUPPORTED;
            }
            stopAllLocked();
            if (clear) {
                clearOutputs();
            }
            seedLocked();
            startLocked();
            log.info("watchdog restarted: jobId={}, clear={}", jobId, clear);
            return ControlOutcome.RESTARTED;
        }
    }

    /**
     * @return true if a kill action was available and has been invoked
     */
    public boolean killExternal() {
        // external/killer are final; the kill command may run for a while and must not hold the control lock
        if (!external || killer == null) {
            return false;
        }
        killer.kill();
        broadcast("[external] kill invoked");
        return true;
    }

    /**
     * Marks every log when a reader attaches to this live supervisor again.
     */
    public void attach() {
        broadcast("[re-attached to running session]");
    }

    private void startLocked() {
        started = true;
        for (Worker w : workers) {
            w.stop.set(false);
        }
        if (config.isSequential()) {
            spawnSequential();
        } else {
            spawnParallel();
        }
    }

    private void stopAllLocked() {
        for (Worker w : workers) {
            w.stop.set(true);
        }
        join(sequentialThread);
        sequentialThread = null;
        for (Worker w : workers) {
            join(w.handle);
            w.handle = null;
        }
        externalStop.set(true);
        join(externalThread);
        externalThread = null;
        started = false;
        log.info("watchdog stopped: jobId={}", jobId);
    }

    private void seedLocked() {
        // parallel workers write their own [start] line right away
        if (!config.isSequential()) return;
        for (CommandLog c : commands) {
            c.getLog().pushLine("[queued] " + c.getCmdline());
        }
    }

    private void spawnParallel() {
        for (int i = 0; i < commands.size(); i++) {
            CommandLog c = commands.get(i);
            Worker w = workers.get(i);
            w.handle = newThread("watchdog-" + jobId + "-" + i, () -> {
                c.getLog().pushLine("[start] " + c.getCmdline());
                spawner.runWithRetries(c.getLog(), c.getCmdline(), config, w.stop);
            });
        }
    }

    private void spawnSequential() {
        sequentialThread = newThread("watchdog-" + jobId + "-seq", () -> {
            for (int i = 0; i < commands.size(); i++) {
                CommandLog c = commands.get(i);
                AtomicBoolean stop = workers.get(i).stop;
                if (stop.get()) {
                    markRemaining(i, "[stopped]");
                    return;
                }
                c.getLog().pushLine("[start] " + c.getCmdline());
                boolean ok = spawner.runWithRetries(c.getLog(), c.getCmdline(), config, stop);
                if (stop.get()) {
                    markRemaining(i + 1, "[stopped]");
                    return;
                }
                if (!ok && config.isStopOnFailure()) {
                    markRemaining(i + 1, "[aborted by stop_on_failure]");
                    log.info("watchdog sequence aborted: jobId={}, failedIndex={}", jobId, i);
                    return;
                }
            }
        });
    }

    private void markRemaining(int from, String line) {
        for (int j = from; j < commands.size(); j++) {
            commands.get(j).getLog().pushLine(line);
        }
    }

    private void startPollerLocked() {
        externalStop.set(false);
        AtomicBoolean stop = externalStop;
        externalThread = newThread("watchdog-" + jobId + "-poll", () -> {
            Boolean last = null;
            while (!stop.get()) {
                boolean running;
                try {
                    running = detector.isRunning();
                } catch (RuntimeException e) {
                    log.warn("external check failed: jobId={}, error={}", jobId, e.getMessage());
                    running = false;
                }
                externalRunning = running;
                if (last == null) {
                    broadcast("[external] initial state: " + (running ? "running" : "not running"));
                } else if (last != running) {
                    broadcast(running ? EXTERNAL_RUNNING : EXTERNAL_NOT_RUNNING);
                    log.info("external state changed: jobId={}, running={}", jobId, running);
                }
                last = running;
                if (!LocalSpawner.sleepUnlessStopped(config.getExternalPollIntervalMs(), stop)) {
                    break;
                }
            }
        });
    }

    private void broadcast(String line) {
        for (CommandLog c : commands) {
            c.getLog().pushLine(line);
        }
    }

    private static Thread newThread(String name, Runnable body) {
        Thread t = new Thread(body, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void join(Thread t) {
        if (t == null) return;
        try {
            t.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Refreshes and returns the stats aggregator, or null when no stat pattern is configured.
     */
    public StatsAggregator refreshStats() {
        if (stats == null) return null;
        stats.updateFromBuffers(logs());
        return stats;
    }

    public List<RingBufferLog> logs() {
        List<RingBufferLog> out = new ArrayList<>(commands.size());
        for (CommandLog c : commands) out.add(c.getLog());
        return out;
    }

    public int activeWorkers() {
        int n = 0;
        Thread seq = sequentialThread;
        if (seq != null && seq.isAlive()) n++;
        for (Worker w : workers) {
            Thread h = w.handle;
            if (h != null && h.isAlive()) n++;
        }
        Thread poll = externalThread;
        if (poll != null && poll.isAlive()) n++;
        return n;
    }

    public String mode() {
        if (external) return "EXTERNAL";
        return config.isSequential() ? "SEQUENTIAL" : "PARALLEL";
    }

    public String getJobId() {
        return jobId;
    }

    public List<CommandLog> getCommands() {
        return commands;
    }

    public WatchdogConfig getConfig() {
        return config;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isExternal() {
        return external;
    }

    public boolean isExternalRunning() {
        return externalRunning;
    }

    public boolean hasKiller() {
        return killer != null;
    }
}
