package com.imperium.cocounsel.policy;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 对话接口限流：按 userId + IP 固定窗口计数，默认 20 req / 10 min。
 */
@Component
public class RateLimitPolicy {

    /** 默认时间窗口（毫秒）：10 分钟 */
    public static final long DEFAULT_WINDOW_MS = 10 * 60 * 1000L;

    /** 默认窗口内最大请求数 */
    public static final int DEFAULT_MAX_REQUESTS = 20;

    private final Map<String, Window> keyToWindow = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long windowMs;
    private final int maxRequests;

    @Autowired
    public RateLimitPolicy(Clock clock,
            @Value("${app.rate-limit.window-ms:" + DEFAULT_WINDOW_MS + "}") long windowMs,
            @Value("${app.rate-limit.max-requests:" + DEFAULT_MAX_REQUESTS + "}") int maxRequests) {
        this.clock = clock;
        this.windowMs = windowMs;
        this.maxRequests = maxRequests;
    }

    public RateLimitPolicy(Clock clock) {
        this(clock, DEFAULT_WINDOW_MS, DEFAULT_MAX_REQUESTS);
    }

    /**
     * 检查是否允许请求；若允许则记录一次。
     *
     * @param userId   X-User-Id
     * @param clientIp 客户端 IP（request.getRemoteAddr()）
     * @return true 允许，false 应返回 429
     */
    public boolean allow(String userId, String clientIp) {
        String key = (userId != null ? userId : "") + "|" + (clientIp != null ? clientIp : "");
        long now = clock.millis();
        Window w = keyToWindow.compute(key, (k, old) -> {
            if (old == null || now - old.startMs > windowMs) {
                return new Window(now, 1);
            }
            if (old.count > maxRequests) {
                return old;
            }
            return new Window(old.startMs, old.count + 1);
        });
        return w.count <= maxRequests;
    }

    private record Window(long startMs, int count) {}
}
