package dev.chi.tui.watchdog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Watchdog 配置（prefix: chi.watchdog）
 */
@Component
@ConfigurationProperties(prefix = "chi.watchdog")
public class WatchdogProperties {

    /**
     * 是否启用 watchdog 功能
     */
    private boolean enabled = true;

    /**
     * ${APP_BIN} 的覆盖变量名：该环境变量有值时优先使用
     */
    private String appBinEnv = "CHI_APP_BIN";

    /**
     * ${APP_BIN} 的默认值
     */
    private String defaultAppBin = "example-app";

    /**
     * 注入给所有子进程的标记变量（子进程据此输出 JSON）
     */
    private String markerEnv = "CHI_TUI_JSON";

    private String markerValue = "1";

    /**
     * 每条命令保留的最大行数（超出后淘汰最旧的行）
     */
    private int maxLinesPerCommand = 5000;

    /**
     * external 模式探测命令的轮询间隔（毫秒）
     */
    private long externalPollIntervalMs = 1000L;

    /**
     * max-retries 上限，超过则拒绝该任务定义
     */
    private int maxRetriesLimit = 1000;

    /**
     * panic hook / external 探测 / kill 命令的超时秒数
     */
    private int quietCommandTimeoutSeconds = 30;

    /**
     * 预定义任务：key 为稳定的任务 ID（例如菜单项 id）
     */
    private Map<String, JobProperties> jobs = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAppBinEnv() {
        return appBinEnv;
    }

    public void setAppBinEnv(String appBinEnv) {
        this.appBinEnv = appBinEnv;
    }

    public String getDefaultAppBin() {
        return defaultAppBin;
    }

    public void setDefaultAppBin(String defaultAppBin) {
        this.defaultAppBin = defaultAppBin;
    }

    public String getMarkerEnv() {
        return markerEnv;
    }

    public void setMarkerEnv(String markerEnv) {
        this.markerEnv = markerEnv;
    }

    public String getMarkerValue() {
        return markerValue;
    }

    public void setMarkerValue(String markerValue) {
        this.markerValue = markerValue;
    }

    public int getMaxLinesPerCommand() {
        return maxLinesPerCommand;
    }

    public void setMaxLinesPerCommand(int maxLinesPerCommand) {
        this.maxLinesPerCommand = maxLinesPerCommand;
    }

    public long getExternalPollIntervalMs() {
        return externalPollIntervalMs;
    }

    public void setExternalPollIntervalMs(long externalPollIntervalMs) {
        this.externalPollIntervalMs = externalPollIntervalMs;
    }

    public int getMaxRetriesLimit() {
        return maxRetriesLimit;
    }

    public void setMaxRetriesLimit(int maxRetriesLimit) {
        this.maxRetriesLimit = maxRetriesLimit;
    }

    public int getQuietCommandTimeoutSeconds() {
        return quietCommandTimeoutSeconds;
    }

    public void setQuietCommandTimeoutSeconds(int quietCommandTimeoutSeconds) {
        this.quietCommandTimeoutSeconds = quietCommandTimeoutSeconds;
    }

    public Map<String, JobProperties> getJobs() {
        return jobs;
    }

    public void setJobs(Map<String, JobProperties> jobs) {
        this.jobs = jobs;
    }

    /**
     * 单个 watchdog 任务定义
     */
    public static class JobProperties {
        private String title;
        private List<String> commands = new ArrayList<>();
        private boolean sequential = false;
        private boolean autoRestart = false;
        private int maxRetries = 0;
        private long restartDelayMs = 1000L;
        /**
         * 未配置时默认只接受 0；显式配置为空列表表示接受任意退出码
         */
        private List<Integer> allowedExitCodes = new ArrayList<>(List.of(0));
        private boolean stopOnFailure = false;
        private String onPanicExitCmd;
        private List<StatProperties> stats = new ArrayList<>();
        private String externalCheckCmd;
        private String externalKillCmd;
        /**
         * 应用启动时即创建并运行（否则首次打开时创建）
         */
        private boolean autostart = false;

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public List<String> getCommands() {
            return commands;
        }

        public void setCommands(List<String> commands) {
            this.commands = commands;
        }

        public boolean isSequential() {
            return sequential;
        }

        public void setSequential(boolean sequential) {
            this.sequential = sequential;
        }

        public boolean isAutoRestart() {
            return autoRestart;
        }

        public void setAutoRestart(boolean autoRestart) {
            this.autoRestart = autoRestart;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRestartDelayMs() {
            return restartDelayMs;
        }

        public void setRestartDelayMs(long restartDelayMs) {
            this.restartDelayMs = restartDelayMs;
        }

        public List<Integer> getAllowedExitCodes() {
            return allowedExitCodes;
        }

        public void setAllowedExitCodes(List<Integer> allowedExitCodes) {
            this.allowedExitCodes = allowedExitCodes;
        }

        public boolean isStopOnFailure() {
            return stopOnFailure;
        }

        public void setStopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
        }

        public String getOnPanicExitCmd() {
            return onPanicExitCmd;
        }

        public void setOnPanicExitCmd(String onPanicExitCmd) {
            this.onPanicExitCmd = onPanicExitCmd;
        }

        public List<StatProperties> getStats() {
            return stats;
        }

        public void setStats(List<StatProperties> stats) {
            this.stats = stats;
        }

        public String getExternalCheckCmd() {
            return externalCheckCmd;
        }

        public void setExternalCheckCmd(String externalCheckCmd) {
            this.externalCheckCmd = externalCheckCmd;
        }

        public String getExternalKillCmd() {
            return externalKillCmd;
        }

        public void setExternalKillCmd(String externalKillCmd) {
            this.externalKillCmd = externalKillCmd;
        }

        public boolean isAutostart() {
            return autostart;
        }

        public void setAutostart(boolean autostart) {
            this.autostart = autostart;
        }
    }

    public static class StatProperties {
        private String label;
        private String regexp;

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getRegexp() {
            return regexp;
        }

        public void setRegexp(String regexp) {
            this.regexp = regexp;
        }
    }
}
