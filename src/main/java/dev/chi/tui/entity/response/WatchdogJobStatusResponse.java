package dev.chi.tui.entity.response;

import lombok.Data;

import java.util.List;

/**
 * watchdog 任务运行态
 */
@Data
public class WatchdogJobStatusResponse {
    private String jobId;
    private String title;
    /**
     * PARALLEL / SEQUENTIAL / EXTERNAL
     */
    private String mode;
    private Boolean started;
    private Boolean external;
    /**
     * 仅 external 模式有意义：最近一次探测结果
     */
    private Boolean externalRunning;
    /**
     * 仍存活的工作线程数（含编排线程/轮询线程）
     */
    private Integer activeWorkers;
    private List<String> commands;
    /**
     * 本次控制操作的结果（STARTED / STOPPED / RESTARTED / KILL_INVOKED / UNSUPPORTED ...），查询时为空
     */
    private String outcome;
    /**
     * 提示信息（例如 external 模式不支持 restart）
     */
    private String message;
}
