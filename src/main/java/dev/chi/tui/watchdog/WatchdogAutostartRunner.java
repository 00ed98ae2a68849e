package dev.chi.tui.watchdog;

import dev.chi.tui.service.WatchdogJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时拉起 autostart=true 的预定义任务。
 */
@Component
public class WatchdogAutostartRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WatchdogAutostartRunner.class);

    private final WatchdogJobService jobService;

    public WatchdogAutostartRunner(WatchdogJobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("watchdog autostart: begin");
        jobService.autostart();
    }
}
