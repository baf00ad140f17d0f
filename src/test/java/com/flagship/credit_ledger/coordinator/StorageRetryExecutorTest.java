package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.support.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StorageRetryExecutorTest {

    private final List<Duration> pauses = new ArrayList<>();
    private final LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        StorageRetryExecutor executor = new StorageRetryExecutor(RetryPolicy.unbounded(10, 40), pauses::add, metrics);
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("deposit_credit", "abc", () -> {
            if (calls.incrementAndGet() < 4) {
                throw new CannotAcquireLockException("lock timeout");
            }
            return "credited";
        });

        assertEquals("credited", result);
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)), pauses);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        StorageRetryExecutor executor = new StorageRetryExecutor(RetryPolicy.unbounded(10, 40), pauses::add, metrics);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> executor.execute("voucher_credit", "CODE", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void boundedPolicyGivesUp() {
        StorageRetryExecutor executor = new StorageRetryExecutor(RetryPolicy.of(3, 1, 1), pauses::add, metrics);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(QueryTimeoutException.class, () -> executor.execute("conversion_release", "req", () -> {
            calls.incrementAndGet();
            throw new QueryTimeoutException("timeout");
        }));
        assertEquals(3, calls.get());
    }

    @Test
    void interruptStopsRetrying() {
        StorageRetryExecutor executor = new StorageRetryExecutor(RetryPolicy.unbounded(10, 40),
                duration -> { throw new InterruptedException(); }, metrics);

        assertThrows(CannotAcquireLockException.class, () -> executor.execute("deposit_credit", "abc", () -> {
            throw new CannotAcquireLockException("lock timeout");
        }));
        assertTrue(Thread.currentThread().isInterrupted());
    }
}
