package dev.chi.tui.watchdog.spawn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 静默执行一条命令行（stdout/stderr 丢弃），只关心退出码。
 * 用于 panic hook、external 模式的探测/kill 命令。
 */
public class QuietCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(QuietCommandRunner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final CommandEnvironment env;
    private final Duration timeout;

    public QuietCommandRunner(CommandEnvironment env) {
        this(env, DEFAULT_TIMEOUT);
    }

    public QuietCommandRunner(CommandEnvironment env, Duration timeout) {
        this.env = env;
        this.timeout = timeout;
    }

    /**
     * @return the exit code, or null when the command is empty, cannot be spawned or times out
     */
    public Integer run(String cmdline) {
        return run(cmdline, null);
    }

    /**
     * Same as {@link #run(String)}, but the child is killed as soon as {@code stop} is set
     * (checked every {@link LocalSpawner#TICK_MS}).
     *
     * @return the exit code, or null when the command is empty, cannot be spawned, times out or is stopped
     */
    public Integer run(String cmdline, AtomicBoolean stop) {
        List<String> command;
        try {
            command = CommandLineSplitter.split(env.expand(cmdline));
        } catch (IllegalArgumentException e) {
            log.warn("quiet command rejected: cmd={}, error={}", cmdline, e.getMessage());
            return null;
        }
        if (command.isEmpty()) {
            return null;
        }
        Process p = null;
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD);
            env.applyMarker(pb);
            p = pb.start();

            long ms = timeout == null ? 0 : timeout.toMillis();
            long deadline = ms <= 0 ? Long.MAX_VALUE : System.currentTimeMillis() + ms;
            while (!p.waitFor(LocalSpawner.TICK_MS, TimeUnit.MILLISECONDS)) {
                if (stop != null && stop.get()) {
                    log.info("quiet command stopped: cmd={}", command);
                    ProcessKiller.destroyTree(p);
                    return null;
                }
                if (System.currentTimeMillis() >= deadline) {
                    log.warn("quiet command timed out: cmd={}, timeoutMs={}", command, ms);
                    ProcessKiller.destroyTree(p);
                    return null;
                }
            }
            return p.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (p != null) {
                ProcessKiller.destroyTree(p);
            }
            return null;
        } catch (Exception e) {
            log.debug("quiet command failed: cmd={}, error={}", command, e.getMessage());
            return null;
        }
    }
}
