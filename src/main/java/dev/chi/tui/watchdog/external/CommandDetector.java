package dev.chi.tui.watchdog.external;

import dev.chi.tui.watchdog.spawn.QuietCommandRunner;

/**
 * 执行探测命令，退出码 0 即认为目标进程在运行。
 */
public class CommandDetector implements Detector {
    private final String cmd;
    private final QuietCommandRunner runner;

    public CommandDetector(String cmd, QuietCommandRunner runner) {
        this.cmd = cmd;
        this.runner = runner;
    }

    @Override
    public boolean isRunning() {
        Integer code = runner.run(cmd);
        return code != null && code == 0;
    }

    public String getCmd() {
        return cmd;
    }
}
