/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.retry;

import java.time.Duration;
import java.util.StringJoiner;

/**
 * Information about the attempt that failed, handed to error listeners registered with {@link RetryStrategy.Retry#onError(java.util.function.BiConsumer)}.
 */
public final class RetryInfo {
    private final int attemptNumber;
    private final MaxAttempts maxAttempts;
    private final Duration backoff;
    private final boolean retryable;

    public RetryInfo(int attemptNumber, MaxAttempts maxAttempts, Duration backoff, boolean retryable) {
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.retryable = retryable;
    }

    /**
     * @return The number of the failed attempt, {@code 1} if first attempt.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    public MaxAttempts getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @return The time that is waited before the next attempt, {@link Duration#ZERO} if no retry will be made.
     */
    public Duration getBackoff() {
        return backoff;
    }

    /**
     * @return {@code true} if the action will be attempted again, {@code false} if the error will be rethrown.
     */
    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryInfo.class.getSimpleName() + "[", "]")
                .add("attemptNumber=" + attemptNumber)
                .add("maxAttempts=" + maxAttempts)
                .add("backoff=" + backoff)
                .add("retryable=" + retryable)
                .toString();
    }
}
