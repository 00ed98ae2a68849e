package dev.chi.tui.watchdog.spawn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 强制终止子进程及其后代（sh -c 之类的包装进程退出后，孙进程仍可能占着输出管道）。
 */
final class ProcessKiller {
    private static final Logger log = LoggerFactory.getLogger(ProcessKiller.class);

    private ProcessKiller() {
    }

    static void destroyTree(Process p) {
        if (p == null) return;
        try {
            p.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException | SecurityException e) {
            log.debug("cannot enumerate descendants: pid={}, error={}", p.pid(), e.getMessage());
        }
        p.destroyForcibly();
        try {
            p.waitFor(200, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
