package dev.chi.tui.watchdog.spawn;

import dev.chi.tui.watchdog.WatchdogConfig;
import dev.chi.tui.watchdog.output.RingBufferLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 本机 spawn：每次尝试重新展开变量，stdout/stderr 由两个读线程并发写入同一个缓冲，
 * 主循环每 50ms 检查一次退出状态和停止标志。
 */
public class LocalSpawner implements Spawner {
    private static final Logger log = LoggerFactory.getLogger(LocalSpawner.class);

    public static final long TICK_MS = 50L;

    // readers normally finish right after exit; grandchildren holding the pipe must not wedge the worker
    private static final long READER_JOIN_MS = 2000L;

    private final CommandEnvironment env;
    private final QuietCommandRunner quietRunner;

    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "watchdog-io");
        t.setDaemon(true);
        return t;
    });

    public LocalSpawner(CommandEnvironment env) {
        this(env, new QuietCommandRunner(env));
    }

    public LocalSpawner(CommandEnvironment env, QuietCommandRunner quietRunner) {
        this.env = env;
        this.quietRunner = quietRunner;
    }

    @Override
    public boolean runWithRetries(RingBufferLog out, String cmdline, WatchdogConfig config, AtomicBoolean stop) {
        int attempt = 0;
        while (true) {
            if (stop.get()) {
                out.pushLine("[stopped]");
                return false;
            }
            Integer code = runOnce(out, cmdline, stop);
            if (code != null && config.isExitCodeAllowed(code)) {
                out.pushLine("[done]");
                return true;
            }
            if (stop.get()) {
                out.pushLine("[stopped]");
                return false;
            }
            if (config.isAutoRestart() && attempt < config.getMaxRetries()) {
                int next = attempt + 1;
                out.pushLine("[retry " + next + "/" + config.getMaxRetries() + " in " + config.getRestartDelayMs() + "ms]");
                if (!sleepUnlessStopped(config.getRestartDelayMs(), stop)) {
                    out.pushLine("[stopped]");
                    return false;
                }
                attempt = next;
                continue;
            }
            out.pushLine("[panic: retries exhausted]");
            log.warn("watchdog command gave up: cmd={}, attempts={}, lastExit={}", cmdline, attempt + 1, code);
            if (config.hasPanicExitCmd()) {
                out.pushLine("[panic hook] running: " + config.getPanicExitCmd());
                Integer hookCode = quietRunner.run(config.getPanicExitCmd(), stop);
                log.info("panic hook finished: hook={}, exit={}", config.getPanicExitCmd(), hookCode);
            }
            return false;
        }
    }

    /**
     * Sleeps in {@link #TICK_MS} slices.
     *
     * @return false if the stop flag was observed before the delay elapsed
     */
    public static boolean sleepUnlessStopped(long delayMs, AtomicBoolean stop) {
        long waited = 0;
        while (waited < delayMs) {
            if (stop.get()) {
                return false;
            }
            long step = Math.min(TICK_MS, delayMs - waited);
            try {
                Thread.sleep(step);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            waited += step;
        }
        return !stop.get();
    }

    /**
     * @return the exit code, or null if nothing could be spawned
     */
    private Integer runOnce(RingBufferLog out, String cmdline, AtomicBoolean stop) {
        List<String> command;
        try {
            command = CommandLineSplitter.split(env.expand(cmdline));
        } catch (IllegalArgumentException e) {
            out.pushLine("[error] invalid command line: " + e.getMessage());
            return null;
        }
        if (command.isEmpty()) {
            out.pushLine("[error] empty command");
            return null;
        }

        Process p;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            env.applyMarker(pb);
            p = pb.start();
        } catch (Exception e) {
            out.pushLine("[spawn error] " + e.getMessage());
            log.debug("spawn failed: cmd={}, error={}", command, e.getMessage());
            return null;
        }

        CompletableFuture<Void> stdout = CompletableFuture.runAsync(() -> drain(p.getInputStream(), out, ""), ioPool);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(() -> drain(p.getErrorStream(), out, "[stderr] "), ioPool);

        boolean killed = false;
        try {
            while (!p.waitFor(TICK_MS, TimeUnit.MILLISECONDS)) {
                if (stop.get() && !killed) {
                    ProcessKiller.destroyTree(p);
                    killed = true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessKiller.destroyTree(p);
            killed = true;
        }

        joinReader(stdout, command);
        joinReader(stderr, command);
        // a child we killed has no exit code of its own
        if (killed || p.isAlive()) {
            return null;
        }
        return p.exitValue();
    }

    private void drain(InputStream in, RingBufferLog out, String prefix) {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                out.pushLine(prefix.isEmpty() ? line : prefix + line);
            }
        } catch (Exception e) {
            // stream closes under us when the child is killed
            log.debug("output reader stopped: error={}", e.getMessage());
        }
    }

    private void joinReader(CompletableFuture<Void> reader, List<String> command) {
        try {
            reader.get(READER_JOIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("output reader still open after exit: cmd={}", command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.debug("output reader failed: cmd={}, error={}", command, e.getMessage());
        }
    }
}
