package dev.chi.tui.watchdog.spawn;

import dev.chi.tui.watchdog.WatchdogConfig;
import dev.chi.tui.watchdog.output.RingBufferLog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行一条命令直到成功、重试耗尽或被停止。
 */
public interface Spawner {

    /**
     * @param log       output buffer of the command; every terminal outcome appends a line to it
     * @param cmdline   unexpanded command line template
     * @param config    retry/backoff policy
     * @param stop      cooperative stop flag, observed within 50 ms
     * @return true if an attempt exited with an allowed code
     */
    boolean runWithRetries(RingBufferLog log, String cmdline, WatchdogConfig config, AtomicBoolean stop);
}
