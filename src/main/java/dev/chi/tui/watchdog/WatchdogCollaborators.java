package dev.chi.tui.watchdog;

import dev.chi.tui.watchdog.external.CommandDetector;
import dev.chi.tui.watchdog.external.CommandKiller;
import dev.chi.tui.watchdog.external.Detector;
import dev.chi.tui.watchdog.external.Killer;
import dev.chi.tui.watchdog.spawn.CommandEnvironment;
import dev.chi.tui.watchdog.spawn.LocalSpawner;
import dev.chi.tui.watchdog.spawn.QuietCommandRunner;
import dev.chi.tui.watchdog.spawn.Spawner;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Supervisor 依赖的外部协作者：spawner 与 external 模式下的探测/kill 工厂。
 */
public class WatchdogCollaborators {
    private final Spawner spawner;
    private final Function<String, Detector> detectorFactory;
    private final Function<String, Killer> killerFactory;

    public WatchdogCollaborators(Spawner spawner,
                                 Function<String, Detector> detectorFactory,
                                 Function<String, Killer> killerFactory) {
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.detectorFactory = Objects.requireNonNull(detectorFactory, "detectorFactory");
        this.killerFactory = Objects.requireNonNull(killerFactory, "killerFactory");
    }

    /**
     * Local processes, with every command line expanded against {@code env}.
     */
    public static WatchdogCollaborators local(CommandEnvironment env) {
        return local(env, QuietCommandRunner.DEFAULT_TIMEOUT);
    }

    /**
     * @param quietTimeout 探测 / kill / panic hook 命令的超时
     */
    public static WatchdogCollaborators local(CommandEnvironment env, Duration quietTimeout) {
        QuietCommandRunner quiet = new QuietCommandRunner(env, quietTimeout);
        return new WatchdogCollaborators(
                new LocalSpawner(env, quiet),
                cmd -> new CommandDetector(cmd, quiet),
                cmd -> new CommandKiller(cmd, quiet));
    }

    public Spawner getSpawner() {
        return spawner;
    }

    public Detector detector(String checkCmd) {
        return detectorFactory.apply(checkCmd);
    }

    public Killer killer(String killCmd) {
        return killerFactory.apply(killCmd);
    }
}
