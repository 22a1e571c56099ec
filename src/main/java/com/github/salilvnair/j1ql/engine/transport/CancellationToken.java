package com.github.salilvnair.j1ql.engine.transport;

import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned cancellation signal spanning one whole execution. Cancels either explicitly through
 * {@link #cancel()} or implicitly once the optional deadline has passed.
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final long deadlineNanos;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken create() {
        return new CancellationToken(NO_DEADLINE);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || remainingNanos() <= 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new J1qlEngineException(J1qlErrorCode.EXECUTION_CANCELLED, cancellationMessage());
        }
    }

    /**
     * Waits for {@code millis}, returning early with an exception when cancelled meanwhile.
     */
    public void sleep(long millis) {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        long waitNanos = Math.min(TimeUnit.MILLISECONDS.toNanos(millis), remainingNanos());
        try {
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new J1qlEngineException(J1qlErrorCode.EXECUTION_CANCELLED, "J1QL execution was interrupted", e);
        }
        throwIfCancelled();
    }

    private long remainingNanos() {
        if (deadlineNanos == NO_DEADLINE) {
            return Long.MAX_VALUE;
        }
        return deadlineNanos - System.nanoTime();
    }

    private String cancellationMessage() {
        return cancelled.getCount() == 0
                ? J1qlErrorCode.EXECUTION_CANCELLED.defaultMessage()
                : "J1QL execution deadline exceeded";
    }
}
