package dev.chi.tui.controller.watchdog;

import dev.chi.tui.common.Result;
import dev.chi.tui.entity.request.WatchdogJobCreateRequest;
import dev.chi.tui.entity.response.WatchdogJobStatusResponse;
import dev.chi.tui.entity.response.WatchdogJobSummaryResponse;
import dev.chi.tui.service.WatchdogJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Watchdog 任务生命周期：open/start/stop/toggle/restart/kill
 */
@RestController
@RequestMapping("/api/chi/watchdog/jobs")
@Tag(name = "Chi Watchdog 任务控制", description = "进程守护：按任务定义启动命令组，支持重试、顺序执行与 external 模式")
public class WatchdogJobController {
    private static final Logger log = LoggerFactory.getLogger(WatchdogJobController.class);

    private final WatchdogJobService jobService;

    public WatchdogJobController(WatchdogJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    @Operation(summary = "任务列表", description = "配置文件中的预定义任务 + API 创建的临时任务，附带存活状态")
    public Result<List<WatchdogJobSummaryResponse>> list() {
        try {
            return Result.success(jobService.listJobs());
        } catch (Exception e) {
            log.error("list watchdog jobs failed: error={}", e.getMessage(), e);
            return Result.error("list watchdog jobs failed: " + e.getMessage());
        }
    }

    @PostMapping
    @Operation(summary = "创建临时任务", description = "创建并立即启动；同名任务仍在运行时仅重新挂载")
    public Result<WatchdogJobStatusResponse> create(@Valid @RequestBody WatchdogJobCreateRequest request) {
        try {
            return Result.success(jobService.create(request));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("create watchdog job failed: jobId={}, error={}", request.getJobId(), e.getMessage(), e);
            return Result.error("create watchdog job failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/open")
    @Operation(summary = "打开任务", description = "已有存活 supervisor 时重新挂载，不会重启进程；否则创建并启动")
    public Result<WatchdogJobStatusResponse> open(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.open(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("open watchdog job failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("open watchdog job failed: " + e.getMessage());
        }
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "任务状态")
    public Result<WatchdogJobStatusResponse> status(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.getStatus(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("get watchdog status failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("get watchdog status failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/start")
    @Operation(summary = "启动", description = "幂等：已在运行时返回 ALREADY_STARTED")
    public Result<WatchdogJobStatusResponse> start(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.start(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("start watchdog failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("start watchdog failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/stop")
    @Operation(summary = "停止", description = "向所有命令发出停止信号并等待 worker 退出（含退避等待中的 worker）")
    public Result<WatchdogJobStatusResponse> stop(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.stop(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("stop watchdog failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("stop watchdog failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/toggle")
    @Operation(summary = "切换", description = "external 模式执行 kill；运行中则 stop；否则 start")
    public Result<WatchdogJobStatusResponse> toggle(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.toggle(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("toggle watchdog failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("toggle watchdog failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/restart")
    @Operation(summary = "重启", description = "stop + start；clear=true 时先清空输出缓冲。external 模式不支持")
    public Result<WatchdogJobStatusResponse> restart(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId,
            @Parameter(description = "是否清空输出") @RequestParam(defaultValue = "false") boolean clear
    ) {
        try {
            return Result.success(jobService.restart(jobId, clear));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("restart watchdog failed: jobId={}, clear={}, error={}", jobId, clear, e.getMessage(), e);
            return Result.error("restart watchdog failed: " + e.getMessage());
        }
    }

    @PostMapping("/{jobId}/kill")
    @Operation(summary = "external kill", description = "仅 external 模式：执行配置的 kill 命令")
    public Result<WatchdogJobStatusResponse> kill(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            return Result.success(jobService.kill(jobId));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("kill watchdog failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("kill watchdog failed: " + e.getMessage());
        }
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "移除", description = "停止并回收 supervisor；临时任务定义一并删除")
    public Result<String> remove(
            @Parameter(description = "任务ID", required = true) @PathVariable String jobId
    ) {
        try {
            jobService.remove(jobId);
            return Result.success("removed", jobId);
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("remove watchdog failed: jobId={}, error={}", jobId, e.getMessage(), e);
            return Result.error("remove watchdog failed: " + e.getMessage());
        }
    }
}
