package dev.chi.tui.watchdog.output;

import lombok.Value;

/**
 * 统计规则：label + 正则（未编译）。
 */
@Value
public class StatPattern {
    String label;
    String regex;
}
