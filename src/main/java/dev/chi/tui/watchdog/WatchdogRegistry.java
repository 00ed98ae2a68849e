package dev.chi.tui.watchdog;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按稳定任务 ID 保存 supervisor：离开再进入同一视图时复用正在运行的进程，而不是重启。
 * <p>
 * 句柄默认与应用同生命周期；{@link #remove(String)} 显式停止并回收，应用关闭时全部停止。
 */
@Component
public class WatchdogRegistry {
    private static final Logger log = LoggerFactory.getLogger(WatchdogRegistry.class);

    private final ConcurrentHashMap<String, WatchdogSupervisor> supervisors = new ConcurrentHashMap<>();

    public WatchdogSupervisor get(String jobId) {
        return jobId == null ? null : supervisors.get(jobId);
    }

    /**
     * Returns the live supervisor for {@code jobId}, creating it with {@code factory} only when
     * none is registered.
     * <p>
     * The factory runs outside the map (it starts threads and may touch the registry); when two
     * callers race, the loser's supervisor is stopped and the registered one is returned.
     */
    public WatchdogSupervisor getOrCreate(String jobId, Supplier<WatchdogSupervisor> factory) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        WatchdogSupervisor existing = supervisors.get(jobId);
        if (existing != null) {
            return existing;
        }
        WatchdogSupervisor created = factory.get();
        WatchdogSupervisor raced = supervisors.putIfAbsent(jobId, created);
        if (raced != null) {
            created.stopAll();
            log.info("watchdog supervisor discarded after concurrent create: jobId={}", jobId);
            return raced;
        }
        return created;
    }

    public WatchdogSupervisor remove(String jobId) {
        if (jobId == null) return null;
        WatchdogSupervisor s = supervisors.remove(jobId);
        if (s != null) {
            s.stopAll();
            log.info("watchdog supervisor removed: jobId={}", jobId);
        }
        return s;
    }

    public Map<String, WatchdogSupervisor> snapshot() {
        return new LinkedHashMap<>(supervisors);
    }

    @PreDestroy
    public void shutdown() {
        for (var e : supervisors.entrySet()) {
            try {
                e.getValue().stopAll();
            } catch (Exception ex) {
                log.warn("stop watchdog on shutdown failed: jobId={}, error={}", e.getKey(), ex.getMessage());
            }
        }
        supervisors.clear();
    }
}
