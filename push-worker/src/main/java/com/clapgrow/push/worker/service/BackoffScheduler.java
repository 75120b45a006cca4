package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.retry.BackoffPolicy;
import com.clapgrow.push.worker.config.PushRetryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Computes and waits out jittered exponential delays between retry rounds.
 * 
 * The scheduler itself is stateless; every send call takes its own
 * {@link Backoff} from {@link #start()}, which holds the current delay.
 */
@Service
@Slf4j
public class BackoffScheduler {

    private final BackoffPolicy policy;
    private final LongUnaryOperator random;
    private final Sleeper sleeper;

    @Autowired
    public BackoffScheduler(PushRetryProperties retryProperties) {
        this(retryProperties.toBackoffPolicy(),
            bound -> ThreadLocalRandom.current().nextLong(bound),
            Sleeper.THREAD_SLEEP);
    }

    /**
     * @param random returns a value in {@code [0, bound)} for a positive bound
     */
    public BackoffScheduler(BackoffPolicy policy, LongUnaryOperator random, Sleeper sleeper) {
        this.policy = policy;
        this.random = random;
        this.sleeper = sleeper;
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * Begin a new backoff sequence at the policy's initial delay.
     */
    public Backoff start() {
        return new Backoff(policy.initialDelayMs());
    }

    /**
     * Backoff state of one send call. Not thread-safe.
     */
    public final class Backoff {

        private long currentDelayMs;

        private Backoff(long initialDelayMs) {
            this.currentDelayMs = initialDelayMs;
        }

        public long getCurrentDelayMs() {
            return currentDelayMs;
        }

        /**
         * Sleep for the jittered current delay, then double the delay up to the cap.
         * 
         * @return milliseconds slept
         * @throws InterruptedException if the thread was interrupted while sleeping
         */
        public long pause() throws InterruptedException {
            long sleepMs = nextSleepMs();
            currentDelayMs = Math.min(currentDelayMs * 2, policy.maxDelayMs());
            log.debug("Backing off {}ms before next retry round (next delay {}ms)", sleepMs, currentDelayMs);
            sleeper.sleep(sleepMs);
            return sleepMs;
        }

        long nextSleepMs() {
            int jitter = policy.jitterPercent();
            long fixed = currentDelayMs * (100 - jitter) / 100;
            long jitterBound = currentDelayMs * jitter / 100;
            return fixed + (jitterBound > 0 ? random.applyAsLong(jitterBound) : 0);
        }
    }
}
