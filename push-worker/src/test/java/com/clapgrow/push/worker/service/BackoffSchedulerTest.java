package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.retry.BackoffPolicy;
import com.clapgrow.push.worker.config.PushRetryProperties;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffSchedulerTest {

    private final List<Long> sleeps = new ArrayList<>();

    @Test
    void testPause_SleepsWithinJitterWindowAndDoubles() throws Exception {
        List<Long> bounds = new ArrayList<>();
        BackoffScheduler scheduler = new BackoffScheduler(BackoffPolicy.standard(), bound -> {
            bounds.add(bound);
            return bound - 1;
        }, sleeps::add);

        BackoffScheduler.Backoff backoff = scheduler.start();
        long first = backoff.pause();
        long second = backoff.pause();

        assertEquals(999L, first);
        assertEquals(1999L, second);
        assertEquals(List.of(500L, 1000L), bounds);
        assertEquals(List.of(999L, 1999L), sleeps);
        assertEquals(4000L, backoff.getCurrentDelayMs());
    }

    @Test
    void testPause_DelayIsCapped() throws Exception {
        BackoffScheduler scheduler = new BackoffScheduler(new BackoffPolicy(1000, 3000, 50), bound -> 0L, sleeps::add);

        BackoffScheduler.Backoff backoff = scheduler.start();
        for (int i = 0; i < 4; i++) {
            backoff.pause();
        }

        assertEquals(List.of(500L, 1000L, 1500L, 1500L), sleeps);
        assertEquals(3000L, backoff.getCurrentDelayMs());
    }

    @Test
    void testPause_NoJitter_SleepsFullDelayWithoutDrawing() throws Exception {
        BackoffScheduler scheduler = new BackoffScheduler(new BackoffPolicy(200, 1000, 0), bound -> {
            throw new AssertionError("no random draw expected");
        }, sleeps::add);

        scheduler.start().pause();

        assertEquals(List.of(200L), sleeps);
    }

    @Test
    void testStart_EachCallGetsItsOwnSequence() throws Exception {
        BackoffScheduler scheduler = new BackoffScheduler(BackoffPolicy.standard(), bound -> 0L, sleeps::add);

        BackoffScheduler.Backoff first = scheduler.start();
        first.pause();
        first.pause();
        BackoffScheduler.Backoff second = scheduler.start();

        assertEquals(4000L, first.getCurrentDelayMs());
        assertEquals(1000L, second.getCurrentDelayMs());
    }

    @Test
    void testConstructor_FromProperties_UsesConfiguredPolicy() {
        PushRetryProperties properties = new PushRetryProperties();
        properties.setInitialDelayMs(250);
        properties.setMaxDelayMs(8000);
        properties.setJitterPercent(20);

        BackoffScheduler scheduler = new BackoffScheduler(properties);

        assertEquals(new BackoffPolicy(250, 8000, 20), scheduler.getPolicy());
        assertEquals(250L, scheduler.start().getCurrentDelayMs());
    }
}
