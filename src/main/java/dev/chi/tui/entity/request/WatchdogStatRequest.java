package dev.chi.tui.entity.request;

import lombok.Data;

@Data
public class WatchdogStatRequest {
    private String label;
    private String regexp;
}
