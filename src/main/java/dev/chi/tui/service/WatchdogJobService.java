package dev.chi.tui.service;

import dev.chi.tui.entity.request.WatchdogJobCreateRequest;
import dev.chi.tui.entity.response.WatchdogJobStatusResponse;
import dev.chi.tui.entity.response.WatchdogJobSummaryResponse;
import dev.chi.tui.entity.response.WatchdogLogResponse;
import dev.chi.tui.entity.response.WatchdogStatsResponse;

import java.util.List;

public interface WatchdogJobService {

    /**
     * 预定义任务 + 临时任务，附带是否已有存活 supervisor
     */
    List<WatchdogJobSummaryResponse> listJobs();

    /**
     * 打开任务视图：已有存活 supervisor 则重新挂载（不重启进程），否则按定义创建并启动
     */
    WatchdogJobStatusResponse open(String jobId);

    /**
     * 临时创建任务（不能覆盖配置文件中的预定义任务）
     */
    WatchdogJobStatusResponse create(WatchdogJobCreateRequest request);

    WatchdogJobStatusResponse start(String jobId);

    WatchdogJobStatusResponse stop(String jobId);

    /**
     * 与终端里的 's' 键一致：external 模式 -> kill；运行中 -> stop；否则 -> start
     */
    WatchdogJobStatusResponse toggle(String jobId);

    WatchdogJobStatusResponse restart(String jobId, boolean clear);

    WatchdogJobStatusResponse kill(String jobId);

    WatchdogJobStatusResponse getStatus(String jobId);

    /**
     * @param tail 每条命令仅返回末尾 N 行；<=0 返回全部缓冲
     */
    WatchdogLogResponse getLogs(String jobId, int tail);

    WatchdogStatsResponse getStats(String jobId);

    /**
     * 停止并回收 supervisor；临时任务的定义一并删除
     */
    void remove(String jobId);

    /**
     * 创建并启动所有 autostart=true 的预定义任务
     */
    void autostart();
}
