package world.willfrog.review.mcp;

import world.willfrog.review.config.McpProperties;

import java.time.Duration;

/**
 * 指数退避：第 1 次尝试不等待，之后按 initial * multiplier^(n-2) 递增，封顶 max。
 */
public record BackoffPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public BackoffPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
    }

    public static BackoffPolicy from(McpProperties.Retry retry) {
        return new BackoffPolicy(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getMultiplier());
    }

    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
