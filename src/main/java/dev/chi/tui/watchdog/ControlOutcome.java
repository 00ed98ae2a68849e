package dev.chi.tui.watchdog;

/**
 * 控制操作的结果；UNSUPPORTED 仅用于提示（例如 external 模式下 restart），不是错误。
 */
public enum ControlOutcome {
    STARTED,
    ALREADY_STARTED,
    STOPPED,
    RESTARTED,
    KILL_INVOKED,
    UNSUPPORTED
}
