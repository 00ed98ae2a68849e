package dev.chi.tui.watchdog.spawn;

import dev.chi.tui.watchdog.WatchdogConfig;
import dev.chi.tui.watchdog.output.RingBufferLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 使用真实的 sh 子进程验证重试 / 退避 / 取消。
 */
class LocalSpawnerTest {

    private LocalSpawner spawner;

    @BeforeEach
    void setUp() {
        spawner = new LocalSpawner(CommandEnvironment.of(Map.of()));
    }

    private static long count(List<String> lines, String exact) {
        return lines.stream().filter(exact::equals).count();
    }

    @Test
    void testSuccessOnFirstAttempt() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().allowedExitCode(0).build();

        boolean ok = spawner.runWithRetries(out, "sh -c 'echo hello'", cfg, new AtomicBoolean(false));

        assertTrue(ok);
        assertEquals(List.of("hello", "[done]"), out.snapshot());
    }

    @Test
    void testRetriesThenExhausted() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder()
                .autoRestart(true)
                .maxRetries(2)
                .restartDelayMs(10)
                .allowedExitCode(0)
                .build();

        boolean ok = spawner.runWithRetries(out, "sh -c 'echo attempt; exit 1'", cfg, new AtomicBoolean(false));

        assertFalse(ok);
        List<String> lines = out.snapshot();
        assertEquals(3, count(lines, "attempt"));
        int r1 = lines.indexOf("[retry 1/2 in 10ms]");
        int r2 = lines.indexOf("[retry 2/2 in 10ms]");
        int panic = lines.indexOf("[panic: retries exhausted]");
        assertTrue(r1 >= 0 && r2 > r1 && panic > r2, lines.toString());
        assertEquals("[panic: retries exhausted]", lines.get(lines.size() - 1));
    }

    @Test
    void testNoAutoRestartGivesUpAfterOneAttempt() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().maxRetries(5).allowedExitCode(0).build();

        assertFalse(spawner.runWithRetries(out, "sh -c 'echo attempt; exit 2'", cfg, new AtomicBoolean(false)));
        assertEquals(1, count(out.snapshot(), "attempt"));
    }

    @Test
    void testEmptyAllowedCodesAcceptsAnyExit() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().autoRestart(true).maxRetries(3).restartDelayMs(10).build();

        assertTrue(spawner.runWithRetries(out, "sh -c 'echo attempt; exit 7'", cfg, new AtomicBoolean(false)));
        assertEquals(1, count(out.snapshot(), "attempt"));
        assertEquals("[done]", out.snapshot().get(out.size() - 1));
    }

    @Test
    void testStderrPrefixed() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().build();

        spawner.runWithRetries(out, "sh -c 'echo oops >&2'", cfg, new AtomicBoolean(false));

        assertTrue(out.snapshot().contains("[stderr] oops"), out.snapshot().toString());
    }

    @Test
    void testStopDuringBackoffReturnsQuickly() throws Exception {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder()
                .autoRestart(true)
                .maxRetries(3)
                .restartDelayMs(60_000)
                .allowedExitCode(0)
                .build();
        AtomicBoolean stop = new AtomicBoolean(false);

        CompletableFuture<Boolean> run = CompletableFuture.supplyAsync(
                () -> spawner.runWithRetries(out, "sh -c 'exit 1'", cfg, stop));
        long deadline = System.currentTimeMillis() + 5000;
        while (!out.snapshot().contains("[retry 1/3 in 60000ms]") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(out.snapshot().contains("[retry 1/3 in 60000ms]"));

        long t0 = System.nanoTime();
        stop.set(true);
        assertFalse(run.get(2, TimeUnit.SECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(elapsedMs < 1000, "stop took " + elapsedMs + "ms");
        assertEquals("[stopped]", out.snapshot().get(out.size() - 1));
    }

    @Test
    void testStopKillsRunningChild() throws Exception {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().allowedExitCode(0).build();
        AtomicBoolean stop = new AtomicBoolean(false);

        CompletableFuture<Boolean> run = CompletableFuture.supplyAsync(
                () -> spawner.runWithRetries(out, "sh -c 'echo up; sleep 30'", cfg, stop));
        long deadline = System.currentTimeMillis() + 5000;
        while (!out.snapshot().contains("up") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        stop.set(true);

        assertFalse(run.get(5, TimeUnit.SECONDS));
        assertEquals("[stopped]", out.snapshot().get(out.size() - 1));
    }

    @Test
    void testStoppedChildIsNotSuccessEvenWhenAnyExitAllowed() throws Exception {
        RingBufferLog out = new RingBufferLog(100);
        // 空集合 = 任何退出码都算成功；被 kill 的子进程仍然不能算成功
        WatchdogConfig cfg = WatchdogConfig.builder().build();
        AtomicBoolean stop = new AtomicBoolean(false);

        CompletableFuture<Boolean> run = CompletableFuture.supplyAsync(
                () -> spawner.runWithRetries(out, "sh -c 'echo up; sleep 30'", cfg, stop));
        long deadline = System.currentTimeMillis() + 5000;
        while (!out.snapshot().contains("up") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        stop.set(true);

        assertFalse(run.get(5, TimeUnit.SECONDS));
        assertFalse(out.snapshot().contains("[done]"), out.snapshot().toString());
        assertEquals("[stopped]", out.snapshot().get(out.size() - 1));
    }

    @Test
    void testPanicHookKilledOnStop() throws Exception {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().allowedExitCode(0).panicExitCmd("sleep 30").build();
        AtomicBoolean stop = new AtomicBoolean(false);

        CompletableFuture<Boolean> run = CompletableFuture.supplyAsync(
                () -> spawner.runWithRetries(out, "sh -c 'exit 1'", cfg, stop));
        long deadline = System.currentTimeMillis() + 5000;
        while (!out.snapshot().contains("[panic hook] running: sleep 30") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        long t0 = System.nanoTime();
        stop.set(true);
        assertFalse(run.get(5, TimeUnit.SECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(elapsedMs < 1000, "hook stop took " + elapsedMs + "ms");
    }

    @Test
    void testPanicHookRuns(@TempDir Path dir) throws Exception {
        Path marker = dir.resolve("panicked");
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder()
                .allowedExitCode(0)
                .panicExitCmd("touch " + marker)
                .build();

        assertFalse(spawner.runWithRetries(out, "sh -c 'exit 4'", cfg, new AtomicBoolean(false)));

        assertTrue(out.snapshot().contains("[panic hook] running: touch " + marker));
        assertTrue(Files.exists(marker));
    }

    @Test
    void testSpawnErrorLogged() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().allowedExitCode(0).build();

        assertFalse(spawner.runWithRetries(out, "/definitely/not/a/binary-xyz", cfg, new AtomicBoolean(false)));

        assertTrue(out.snapshot().get(0).startsWith("[spawn error] "), out.snapshot().toString());
        assertEquals("[panic: retries exhausted]", out.snapshot().get(out.size() - 1));
    }

    @Test
    void testEmptyCommandLogged() {
        RingBufferLog out = new RingBufferLog(100);
        WatchdogConfig cfg = WatchdogConfig.builder().build();

        assertFalse(spawner.runWithRetries(out, "   ", cfg, new AtomicBoolean(false)));
        assertEquals("[error] empty command", out.snapshot().get(0));
    }

    @Test
    void testVariablesExpandedBeforeSpawn() {
        LocalSpawner withApp = new LocalSpawner(CommandEnvironment.of(Map.of("CHI_APP_BIN", "demo-bin")));
        RingBufferLog out = new RingBufferLog(100);

        withApp.runWithRetries(out, "echo ${APP_BIN}", WatchdogConfig.builder().build(), new AtomicBoolean(false));

        assertEquals("demo-bin", out.snapshot().get(0));
    }

    @Test
    void testMarkerVisibleToChild() {
        RingBufferLog out = new RingBufferLog(100);

        spawner.runWithRetries(out, "sh -c 'echo marker=$CHI_TUI_JSON'", WatchdogConfig.builder().build(),
                new AtomicBoolean(false));

        assertEquals("marker=1", out.snapshot().get(0));
    }

    @Test
    void testSleepUnlessStopped() {
        assertTrue(LocalSpawner.sleepUnlessStopped(20, new AtomicBoolean(false)));
        assertFalse(LocalSpawner.sleepUnlessStopped(10_000, new AtomicBoolean(true)));
    }
}
