package dev.chi.tui.entity.response;

import lombok.Data;

import java.util.List;

/**
 * 单条命令的输出快照
 */
@Data
public class WatchdogCommandLogView {
    private Integer index;
    private String cmdline;
    /**
     * 缓冲中的总行数（lines 可能只是末尾 N 行）
     */
    private Integer totalLines;
    private List<String> lines;
}
