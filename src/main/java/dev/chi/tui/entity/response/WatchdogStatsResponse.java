package dev.chi.tui.entity.response;

import lombok.Data;

import java.util.List;

/**
 * stat pattern 计数（label 与 count 一一对应，顺序同配置）
 */
@Data
public class WatchdogStatsResponse {
    private String jobId;
    private List<String> labels;
    private List<Long> counts;
}
