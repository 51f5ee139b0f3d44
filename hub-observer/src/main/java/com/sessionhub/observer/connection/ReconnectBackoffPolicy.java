package com.sessionhub.observer.connection;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 指数退避：第 n 次重试等待 base * 2^(n-1)，不超过 maxDelay，最多 maxAttempts 次。
 */
@Getter
@ToString
public class ReconnectBackoffPolicy {

    private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    private static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ReconnectBackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectBackoffPolicy defaults() {
        return new ReconnectBackoffPolicy(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param attempt 从 1 开始的重试序号
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt <= 1) {
            return baseDelay;
        }
        int shift = Math.min(attempt - 1, 30);
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        if (baseMillis > (maxMillis >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, maxMillis));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
