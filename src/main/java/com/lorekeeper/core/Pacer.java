package com.lorekeeper.core;

import java.time.Duration;

/** Waits between bulk journal calls so providers are not flooded. */
@FunctionalInterface
public interface Pacer {

    Pacer NONE = delay -> { };

    void pause(Duration delay) throws InterruptedException;

    static Pacer sleeping() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
