package dev.chi.tui.watchdog.output;

/**
 * 一条受监管命令及其输出缓冲。cmdline 保留未展开的模板，每次尝试前重新展开。
 */
public class CommandLog {
    private final String cmdline;
    private final RingBufferLog log;

    public CommandLog(String cmdline, int capacity) {
        this.cmdline = cmdline;
        this.log = new RingBufferLog(capacity);
    }

    public String getCmdline() {
        return cmdline;
    }

    public RingBufferLog getLog() {
        return log;
    }
}
