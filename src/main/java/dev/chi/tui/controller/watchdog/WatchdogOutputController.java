package dev.chi.tui.controller.watchdog;

import dev.chi.tui.common.Result;
import dev.chi.tui.entity.response.WatchdogLogResponse;
import dev.chi.tui.entity.response.WatchdogStatsResponse;
import dev.chi.tui.service.WatchdogJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 只读：每条命令的输出缓冲与正则统计
 */
@RestController
@RequestMapping("/api/chi/watchdog/jobs")
@Tag(name = "Chi Watchdog 输出", description = "命令输出（环形缓冲）与统计计数")
public class WatchdogOutputController {
    private static final Logger log = LoggerFactory.getLogger(WatchdogOutputController.class);

    private final WatchdogJobService jobService;

    public WatchdogOutputController(WatchdogJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping("/{jobId}/logs")
    @Operation(summary = "命令输出", description = "tail<=0 返回整个缓冲")
    public Result<WatchdogLogResponse> logs(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId,
            @Parameter(description = "每条命令返回末尾 N 行") @RequestParam(defaultValue = "200") int tail
    ) {
        try {
            return Result.success(jobService.getLogs(jobId, tail));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("get watchdog logs failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("get watchdog logs failed: " + e.getMessage());
        }
    }

    @GetMapping("/{jobId}/stats")
    @Operation(summary = "统计计数", description = "按配置的 label/regexp 统计所有命令输出中的匹配次数（增量计算）")
    public Result<WatchdogStatsResponse> stats(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.getStats(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("get watchdog stats failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("get watchdog stats failed: " + e.getMessage());
        }
    }
}
