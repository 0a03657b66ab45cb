package io.github.goodees.evsource.core;

/*-
 * #%L
 * evsource-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.time.Duration;

/**
 * Strategy for retrying a failed handler invocation.
 */
@FunctionalInterface
public interface RetryStrategy {
    long DO_NOT_RETRY = -1;
    long RETRY_NOW = 0;

    /**
     * Decide whether and when to retry.
     * @param event the event that failed
     * @param t the failure
     * @param completedAttempts number of attempts made so far, at least 1
     * @return delay in milliseconds before next attempt, {@link #RETRY_NOW} or {@link #DO_NOT_RETRY}
     */
    long retryDelay(Event event, Throwable t, int completedAttempts);

    /**
     * Run an attempt until it succeeds or this strategy gives up.
     * @param event the event the attempt processes
     * @param attempt the attempt
     * @return null on success, failure of the last attempt otherwise
     * @throws InterruptedException when interrupted while waiting for a retry, or when the attempt is interrupted
     */
    default Exception execute(Event event, Attempt attempt) throws InterruptedException {
        int completedAttempts = 0;
        while (true) {
            try {
                attempt.run();
                return null;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                completedAttempts++;
                long delay = retryDelay(event, e, completedAttempts);
                if (delay < 0) {
                    return e;
                }
                if (delay > RETRY_NOW) {
                    Thread.sleep(delay);
                }
            }
        }
    }

    @FunctionalInterface
    interface Attempt {
        void run() throws Exception;
    }

    RetryStrategy NO_RETRIES = (event, t, attempts) -> DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failure.
     * @return a retry strategy
     */
    static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fixed number of additional attempts with defined retry delay.
     * @param retries number of retries after the first attempt
     * @param delay delay before retrying
     * @return a retry strategy
     */
    static RetryStrategy fixedRetries(int retries, Duration delay) {
        return new FixedRepeat(retries, delay.toMillis());
    }

    final class FixedRepeat implements RetryStrategy {
        final int retries;
        final long delay;

        FixedRepeat(int retries, long delay) {
            this.retries = retries;
            this.delay = delay;
        }

        @Override
        public long retryDelay(Event event, Throwable t, int completedAttempts) {
            return completedAttempts <= retries ? delay : DO_NOT_RETRY;
        }
    }
}
