package com.flagship.credit_ledger.support;

import java.time.Duration;

/**
 * Pause between retry attempts. Interruptible, so a caller can cancel a retry loop.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
