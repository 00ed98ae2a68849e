package dev.chi.tui;

import dev.chi.tui.watchdog.WatchdogProperties;
import dev.chi.tui.watchdog.WatchdogRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ChiWatchdogApplicationTest {

    @Autowired
    private WatchdogProperties props;

    @Autowired
    private WatchdogRegistry registry;

    @Test
    void testJobsBoundFromConfiguration() {
        assertTrue(props.getJobs().containsKey("ticker"));
        assertTrue(props.getJobs().get("pipeline").isSequential());
        assertTrue(props.getJobs().get("pipeline").isStopOnFailure());
        assertEquals(2, props.getJobs().get("ticker").getStats().size());
        assertNotNull(props.getJobs().get("app").getExternalCheckCmd());
        // 没有 autostart 任务
        assertTrue(registry.snapshot().isEmpty());
    }
}
