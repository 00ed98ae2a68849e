package dev.chi.tui.watchdog.spawn;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令执行环境：变量查找、${APP_BIN} 间接解析、注入给子进程的标记变量。
 * <p>
 * 查找函数在每次展开时调用，默认读取当前进程环境（System::getenv），测试中可替换为固定 Map。
 */
public class CommandEnvironment {

    public static final String DEFAULT_APP_BIN_ENV = "CHI_APP_BIN";
    public static final String DEFAULT_APP_BIN = "example-app";
    public static final String DEFAULT_MARKER_ENV = "CHI_TUI_JSON";
    public static final String DEFAULT_MARKER_VALUE = "1";

    private static final Pattern VAR = Pattern.compile("\\$\\{([A-Z0-9_]+)}");
    private static final String APP_BIN = "APP_BIN";

    private final Function<String, String> lookup;
    private final String appBinEnv;
    private final String defaultAppBin;
    private final String markerEnv;
    private final String markerValue;

    public CommandEnvironment(Function<String, String> lookup,
                              String appBinEnv,
                              String defaultAppBin,
                              String markerEnv,
                              String markerValue) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.appBinEnv = appBinEnv;
        this.defaultAppBin = defaultAppBin;
        this.markerEnv = markerEnv;
        this.markerValue = markerValue;
    }

    public static CommandEnvironment system() {
        return new CommandEnvironment(System::getenv, DEFAULT_APP_BIN_ENV, DEFAULT_APP_BIN,
                DEFAULT_MARKER_ENV, DEFAULT_MARKER_VALUE);
    }

    public static CommandEnvironment of(Map<String, String> vars) {
        Map<String, String> copy = Map.copyOf(vars);
        return new CommandEnvironment(copy::get, DEFAULT_APP_BIN_ENV, DEFAULT_APP_BIN,
                DEFAULT_MARKER_ENV, DEFAULT_MARKER_VALUE);
    }

    /**
     * Replaces every {@code ${VAR}} with its current value; unknown variables become empty.
     */
    public String expand(String template) {
        if (template == null || template.isEmpty()) return "";
        Matcher m = VAR.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            String value = APP_BIN.equals(key) ? resolveAppBin() : lookup.apply(key);
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public String resolveAppBin() {
        String override = appBinEnv == null ? null : lookup.apply(appBinEnv);
        if (override != null && !override.isBlank()) {
            return override;
        }
        return defaultAppBin == null ? DEFAULT_APP_BIN : defaultAppBin;
    }

    /**
     * Injects the marker variable into a child process environment.
     */
    public void applyMarker(ProcessBuilder pb) {
        if (markerEnv != null && !markerEnv.isBlank()) {
            pb.environment().put(markerEnv, markerValue == null ? "" : markerValue);
        }
    }

    public String getMarkerEnv() {
        return markerEnv;
    }
}
