package dev.chi.tui.watchdog.external;

import dev.chi.tui.watchdog.spawn.QuietCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CommandKiller implements Killer {
    private static final Logger log = LoggerFactory.getLogger(CommandKiller.class);

    private final String cmd;
    private final QuietCommandRunner runner;

    public CommandKiller(String cmd, QuietCommandRunner runner) {
        this.cmd = cmd;
        this.runner = runner;
    }

    @Override
    public void kill() {
        Integer code = runner.run(cmd);
        log.info("external kill command finished: cmd={}, exit={}", cmd, code);
    }

    public String getCmd() {
        return cmd;
    }
}
