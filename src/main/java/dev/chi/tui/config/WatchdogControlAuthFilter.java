package dev.chi.tui.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 控制接口鉴权：
 * - 只拦截会改变进程状态的请求（非 GET）；日志/状态读取不受限
 * - 允许：本机 loopback + 配置允许 IP
 * - 配置了 token 时还需携带 X-Chi-Token
 */
public class WatchdogControlAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(WatchdogControlAuthFilter.class);

    static final String HDR_TOKEN = "X-Chi-Token";
    static final String PATH_PREFIX = "/api/chi/watchdog/";

    private final WatchdogControlAuthProperties props;

    public WatchdogControlAuthFilter(WatchdogControlAuthProperties props) {
        this.props = props;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) return true;
        String uri = request.getRequestURI();
        if (uri == null || !uri.startsWith(PATH_PREFIX)) return true;
        return "GET".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String remote = request.getRemoteAddr();
        if (!isAllowedIp(remote, props == null ? List.of() : props.allowedIpList())) {
            log.warn("watchdog control denied: remote={}, uri={}", remote, request.getRequestURI());
            deny(response, 403, "forbidden");
            return;
        }
        String expect = props == null ? null : props.getToken();
        if (expect != null && !expect.isBlank() && !constantTimeEquals(expect, request.getHeader(HDR_TOKEN))) {
            deny(response, 401, "unauthorized");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private boolean isAllowedIp(String remoteAddr, List<String> allow) {
        if (remoteAddr == null || remoteAddr.isBlank()) return false;
        if ("127.0.0.1".equals(remoteAddr) || "::1".equals(remoteAddr) || "0:0:0:0:0:0:0:1".equals(remoteAddr)) {
            return true;
        }
        if (allow == null || allow.isEmpty()) return false;
        return allow.contains(remoteAddr);
    }

    private boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        byte[] x = a.getBytes(StandardCharsets.UTF_8);
        byte[] y = b.trim().getBytes(StandardCharsets.UTF_8);
        if (x.length != y.length) return false;
        int r = 0;
        for (int i = 0; i < x.length; i++) r |= (x[i] ^ y[i]);
        return r == 0;
    }

    private void deny(HttpServletResponse resp, int code, String msg) throws IOException {
        resp.setStatus(code);
        resp.setContentType(MediaType.TEXT_PLAIN_VALUE);
        resp.getWriter().write(msg);
    }
}
