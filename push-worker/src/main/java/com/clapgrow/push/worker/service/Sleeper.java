package com.clapgrow.push.worker.service;

/**
 * Blocks the current thread between retry rounds.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
