package com.phillippitts.champ.util;

import java.time.Duration;

/**
 * Blocking pause used by backoff loops. Swapped for a recording fake in tests so retry and
 * reconnect schedules can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /**
     * @param duration how long to pause
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
