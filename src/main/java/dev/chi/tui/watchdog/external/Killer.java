package dev.chi.tui.watchdog.external;

/**
 * external 模式：终止一个不由本系统启动的进程（尽力而为，不重试）。
 */
public interface Killer {
    void kill();
}
