package com.hookrelay.common.resilience;

import java.time.Duration;

/**
 * Blocking pause between attempts. Replaced in tests to observe delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
