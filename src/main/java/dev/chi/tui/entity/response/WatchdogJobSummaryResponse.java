package dev.chi.tui.entity.response;

import lombok.Data;

@Data
public class WatchdogJobSummaryResponse {
    private String jobId;
    private String title;
    /**
     * 是否在配置文件中预定义
     */
    private Boolean defined;
    /**
     * 是否已有存活的 supervisor
     */
    private Boolean live;
    private String mode;
    private Boolean started;
}
