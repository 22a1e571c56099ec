package com.github.salilvnair.j1ql.engine.transport;

import com.github.salilvnair.j1ql.config.J1qlClientConfig;

import java.util.Set;

public record RetryPolicy(
        int maxAttempts,
        long initialBackoffMs,
        long maxBackoffMs,
        double backoffMultiplier,
        Set<Integer> retryStatusCodes,
        boolean retryOnIOException
) {

    public static RetryPolicy fromConfig(J1qlClientConfig.Retry retry) {
        return new RetryPolicy(
                Math.max(retry.getMaxAttempts(), 1),
                Math.max(retry.getInitialBackoffMs(), 0),
                Math.max(retry.getMaxBackoffMs(), 0),
                Math.max(retry.getBackoffMultiplier(), 1.0d),
                retry.getRetryStatusCodes() == null ? Set.of() : Set.copyOf(retry.getRetryStatusCodes()),
                retry.isRetryOnIOException());
    }

    public boolean isRetryable(int status) {
        return retryStatusCodes.contains(status);
    }

    public long nextBackoffMs(long currentBackoffMs) {
        return (long) Math.min(maxBackoffMs, Math.max(1L, Math.round(currentBackoffMs * backoffMultiplier)));
    }
}
