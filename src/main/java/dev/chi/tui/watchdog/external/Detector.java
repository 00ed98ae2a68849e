package dev.chi.tui.watchdog.external;

/**
 * external 模式：判断一个不由本系统启动的进程是否存活。
 */
public interface Detector {
    boolean isRunning();
}
