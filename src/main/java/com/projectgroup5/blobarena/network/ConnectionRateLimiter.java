package com.projectgroup5.blobarena.network;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 按来源地址的滑动窗口限流：窗口内最多 maxAttempts 次新连接
 */
public class ConnectionRateLimiter {
    private final int maxAttempts;
    private final long windowMillis;
    private final Map<String, Deque<Long>> attempts = new HashMap<>();

    public ConnectionRateLimiter(int maxAttempts, long windowMillis) {
        this.maxAttempts = maxAttempts;
        this.windowMillis = windowMillis;
    }

    /**
     * 记录一次连接尝试；超过限制返回 false（被拒绝的尝试不计入窗口）
     */
    public synchronized boolean tryAcquire(String source, long now) {
        purge(now);
        Deque<Long> window = attempts.computeIfAbsent(source, k -> new ArrayDeque<>());
        if (window.size() >= maxAttempts) {
            return false;
        }
        window.addLast(now);
        return true;
    }

    public synchronized int trackedSources() {
        return attempts.size();
    }

    private void purge(long now) {
        Iterator<Map.Entry<String, Deque<Long>>> it = attempts.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Long> window = it.next().getValue();
            while (!window.isEmpty() && now - window.peekFirst() >= windowMillis) {
                window.pollFirst();
            }
            if (window.isEmpty()) {
                it.remove();
            }
        }
    }
}
