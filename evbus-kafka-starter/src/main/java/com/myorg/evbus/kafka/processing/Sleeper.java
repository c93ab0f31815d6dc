package com.myorg.evbus.kafka.processing;

/**
 * Waits out the backoff between attempts. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
