package dev.chi.tui.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 控制接口（start/stop/restart/kill 等会改变进程状态的请求）鉴权配置：
 * - 仅允许来自指定来源 IP（以及本机 loopback）的请求
 * - 可选共享 token（Header: X-Chi-Token）
 */
@Component
@ConfigurationProperties(prefix = "chi.watchdog.control")
public class WatchdogControlAuthProperties {
    /**
     * 允许的来源 IP（单个值或逗号分隔列表）。loopback 永远允许。
     */
    private String allowedSourceIp;

    /**
     * 共享 token；为空表示不校验
     */
    private String token;

    public String getAllowedSourceIp() {
        return allowedSourceIp;
    }

    public void setAllowedSourceIp(String allowedSourceIp) {
        this.allowedSourceIp = allowedSourceIp;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    /**
     * 解析允许 IP 列表（不包含 loopback；loopback 在 filter 内固定允许）。
     */
    public List<String> allowedIpList() {
        List<String> out = new ArrayList<>();
        if (allowedSourceIp == null) return out;
        String s = allowedSourceIp.trim();
        if (s.isEmpty()) return out;
        for (String part : s.split(",")) {
            String ip = part == null ? "" : part.trim();
            if (!ip.isEmpty()) out.add(ip);
        }
        return out;
    }
}
