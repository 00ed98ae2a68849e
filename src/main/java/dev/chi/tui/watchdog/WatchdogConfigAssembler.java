package dev.chi.tui.watchdog;

import dev.chi.tui.watchdog.output.StatPattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 任务定义 -> WatchdogConfig，并做加载期校验：
 * - 非 external 模式必须有至少一条命令
 * - maxRetries 不能超过上限
 * - stats 条目的 label/regexp 为空时忽略（正则本身非法由 StatsAggregator 静默丢弃）
 */
@Component
public class WatchdogConfigAssembler {

    private final WatchdogProperties props;

    public WatchdogConfigAssembler(WatchdogProperties props) {
        this.props = props;
    }

    public WatchdogConfig assemble(String jobId, WatchdogProperties.JobProperties job) {
        if (!StringUtils.hasText(jobId)) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        if (job == null) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' is not defined");
        }
        boolean external = StringUtils.hasText(job.getExternalCheckCmd());
        List<String> commands = job.getCommands() == null ? List.of() : job.getCommands();
        if (!external && commands.stream().noneMatch(StringUtils::hasText)) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' requires non-empty 'commands'");
        }
        if (job.getMaxRetries() < 0) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' max_retries must not be negative");
        }
        if (job.getMaxRetries() > props.getMaxRetriesLimit()) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' max_retries too large");
        }
        if (job.getRestartDelayMs() < 0) {
            throw new IllegalArgumentException("watchdog job '" + jobId + "' restart_delay_ms must not be negative");
        }

        WatchdogConfig.WatchdogConfigBuilder b = WatchdogConfig.builder()
                .sequential(job.isSequential())
                .autoRestart(job.isAutoRestart())
                .maxRetries(job.getMaxRetries())
                .restartDelayMs(job.getRestartDelayMs())
                .stopOnFailure(job.isStopOnFailure())
                .panicExitCmd(trimToNull(job.getOnPanicExitCmd()))
                .externalCheckCmd(trimToNull(job.getExternalCheckCmd()))
                .externalKillCmd(trimToNull(job.getExternalKillCmd()))
                .externalPollIntervalMs(Math.max(50L, props.getExternalPollIntervalMs()))
                .maxLinesPerCommand(Math.max(1, props.getMaxLinesPerCommand()));
        if (job.getAllowedExitCodes() != null) {
            b.allowedExitCodes(job.getAllowedExitCodes());
        }
        if (job.getStats() != null) {
            for (WatchdogProperties.StatProperties s : job.getStats()) {
                if (s == null || !StringUtils.hasText(s.getLabel()) || !StringUtils.hasText(s.getRegexp())) continue;
                b.statPattern(new StatPattern(s.getLabel(), s.getRegexp()));
            }
        }
        return b.build();
    }

    /**
     * Command lines of a job with blank entries dropped.
     */
    public List<String> commandsOf(WatchdogProperties.JobProperties job) {
        if (job == null || job.getCommands() == null) return List.of();
        return job.getCommands().stream().filter(StringUtils::hasText).toList();
    }

    private static String trimToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }
}
