package dev.chi.tui.config;

import dev.chi.tui.watchdog.WatchdogCollaborators;
import dev.chi.tui.watchdog.WatchdogProperties;
import dev.chi.tui.watchdog.spawn.CommandEnvironment;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 子进程执行环境：变量展开统一走 CommandEnvironment，不在各调用点直接读 System.getenv。
 */
@Configuration
public class WatchdogRuntimeConfig {

    @Bean
    public CommandEnvironment watchdogCommandEnvironment(WatchdogProperties props) {
        return new CommandEnvironment(System::getenv,
                props.getAppBinEnv(),
                props.getDefaultAppBin(),
                props.getMarkerEnv(),
                props.getMarkerValue());
    }

    @Bean
    public WatchdogCollaborators watchdogCollaborators(CommandEnvironment env, WatchdogProperties props) {
        return WatchdogCollaborators.local(env,
                Duration.ofSeconds(Math.max(1, props.getQuietCommandTimeoutSeconds())));
    }
}
