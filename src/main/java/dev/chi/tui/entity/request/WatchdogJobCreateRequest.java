package dev.chi.tui.entity.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

/**
 * 临时创建一个 watchdog 任务（不在配置文件中预定义）
 */
@Data
public class WatchdogJobCreateRequest {
    @NotBlank(message = "jobId 不能为空")
    private String jobId;
    private String title;
    private List<String> commands;
    private Boolean sequential;
    private Boolean autoRestart;
    private Integer maxRetries;
    private Long restartDelayMs;
    /**
     * 不传默认 [0]；传空数组表示接受任意退出码
     */
    private List<Integer> allowedExitCodes;
    private Boolean stopOnFailure;
    private String onPanicExitCmd;
    @Valid
    private List<WatchdogStatRequest> stats;
    private String externalCheckCmd;
    private String externalKillCmd;
}
