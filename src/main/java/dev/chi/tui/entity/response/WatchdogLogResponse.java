package dev.chi.tui.entity.response;

import lombok.Data;

import java.util.List;

@Data
public class WatchdogLogResponse {
    private String jobId;
    private List<WatchdogCommandLogView> commands;
}
