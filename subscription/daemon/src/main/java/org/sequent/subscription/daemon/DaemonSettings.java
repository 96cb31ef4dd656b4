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

package org.sequent.subscription.daemon;

import org.sequent.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link ProjectionDaemon}.
 * <pre>
 * DaemonSettings settings = DaemonSettings.defaults()
 *         .batchSize(100)
 *         .staleSequenceThreshold(Duration.ofSeconds(1));
 * </pre>
 */
public class DaemonSettings {
    private int batchSize = 500;
    private Duration pollingInterval = Duration.ofMillis(250);
    private Duration highWaterPollingInterval = Duration.ofMillis(250);
    private Duration staleSequenceThreshold = Duration.ofSeconds(3);
    private Duration catchUpPollingInterval = Duration.ofMillis(50);
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private RetryStrategy retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0).maxAttempts(5);
    private boolean skipSerializationErrors = true;

    public static DaemonSettings defaults() {
        return new DaemonSettings();
    }

    /**
     * The maximum number of events a shard applies in one transaction.
     */
    public DaemonSettings batchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than zero");
        }
        this.batchSize = batchSize;
        return this;
    }

    /**
     * How long a shard waits for new events before it checks the high water mark again.
     */
    public DaemonSettings pollingInterval(Duration pollingInterval) {
        this.pollingInterval = requirePositive(pollingInterval, "Polling interval");
        return this;
    }

    public DaemonSettings highWaterPollingInterval(Duration highWaterPollingInterval) {
        this.highWaterPollingInterval = requirePositive(highWaterPollingInterval, "High water polling interval");
        return this;
    }

    /**
     * How long a gap in the event sequence may stay unfilled before the high water mark skips it.
     */
    public DaemonSettings staleSequenceThreshold(Duration staleSequenceThreshold) {
        this.staleSequenceThreshold = requirePositive(staleSequenceThreshold, "Stale sequence threshold");
        return this;
    }

    public DaemonSettings catchUpPollingInterval(Duration catchUpPollingInterval) {
        this.catchUpPollingInterval = requirePositive(catchUpPollingInterval, "Catch up polling interval");
        return this;
    }

    public DaemonSettings shutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = requirePositive(shutdownTimeout, "Shutdown timeout");
        return this;
    }

    /**
     * The retry strategy used when a shard fails to apply a page. The shard is paused once it's exhausted.
     */
    public DaemonSettings retryStrategy(RetryStrategy retryStrategy) {
        this.retryStrategy = Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        return this;
    }

    public DaemonSettings skipSerializationErrors(boolean skipSerializationErrors) {
        this.skipSerializationErrors = skipSerializationErrors;
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public Duration getHighWaterPollingInterval() {
        return highWaterPollingInterval;
    }

    public Duration getStaleSequenceThreshold() {
        return staleSequenceThreshold;
    }

    public Duration getCatchUpPollingInterval() {
        return catchUpPollingInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public RetryStrategy getRetryStrategy() {
        return retryStrategy;
    }

    public boolean isSkipSerializationErrors() {
        return skipSerializationErrors;
    }

    private static Duration requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " cannot be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }

    @Override
    public String toString() {
        return "DaemonSettings{" +
                "batchSize=" + batchSize +
                ", pollingInterval=" + pollingInterval +
                ", highWaterPollingInterval=" + highWaterPollingInterval +
                ", staleSequenceThreshold=" + staleSequenceThreshold +
                ", catchUpPollingInterval=" + catchUpPollingInterval +
                ", shutdownTimeout=" + shutdownTimeout +
                ", retryStrategy=" + retryStrategy +
                ", skipSerializationErrors=" + skipSerializationErrors +
                '}';
    }
}
