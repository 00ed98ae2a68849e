package dev.chi.tui.watchdog;

import dev.chi.tui.watchdog.output.RingBufferLog;
import dev.chi.tui.watchdog.output.StatPattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Watchdog 策略（不可变）。
 * <p>
 * externalCheckCmd 非空时整个 supervisor 进入 external 模式：不再 spawn，重试/退避相关字段全部忽略。
 */
@Value
@Builder(toBuilder = true)
public class WatchdogConfig {

    boolean sequential;

    boolean autoRestart;

    int maxRetries;

    @Builder.Default
    long restartDelayMs = 1000L;

    /**
     * 允许的退出码；为空表示接受任意退出码
     */
    @Singular
    Set<Integer> allowedExitCodes;

    /**
     * 仅 sequential 模式有意义：某条命令最终失败后放弃后续命令
     */
    boolean stopOnFailure;

    String panicExitCmd;

    @Singular
    List<StatPattern> statPatterns;

    String externalCheckCmd;

    String externalKillCmd;

    @Builder.Default
    long externalPollIntervalMs = 1000L;

    @Builder.Default
    int maxLinesPerCommand = RingBufferLog.DEFAULT_CAPACITY;

    public boolean isExternalMode() {
        return externalCheckCmd != null && !externalCheckCmd.isBlank();
    }

    public boolean hasPanicExitCmd() {
        return panicExitCmd != null && !panicExitCmd.isBlank();
    }

    public boolean hasExternalKillCmd() {
        return externalKillCmd != null && !externalKillCmd.isBlank();
    }

    public boolean isExitCodeAllowed(int code) {
        return allowedExitCodes.isEmpty() || allowedExitCodes.contains(code);
    }
}
