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

import org.sequent.eventstore.jdbc.internal.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@link HighWaterDetector} in a loop and publishes every new mark to the shards waiting for it.
 */
public class HighWaterAgent implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(HighWaterAgent.class);

    private final HighWaterDetector detector;
    private final Duration pollingInterval;
    private final Object monitor = new Object();

    private final AtomicBoolean looping = new AtomicBoolean();
    private volatile boolean running;
    private volatile HighWaterStatistics current;

    public HighWaterAgent(HighWaterDetector detector, DaemonSettings settings, Clock clock) {
        this.detector = detector;
        this.pollingInterval = settings.getHighWaterPollingInterval();
        this.current = new HighWaterStatistics(0, 0, 0, false, Timestamps.now(clock));
    }

    @Override
    public void run() {
        // A previous loop that hasn't noticed the stop yet keeps going
        if (!looping.compareAndSet(false, true)) {
            return;
        }
        try {
            loop();
        } finally {
            looping.set(false);
        }
    }

    private void loop() {
        log.info("Started high water agent");
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                HighWaterStatistics statistics = detector.detect();
                if (statistics.hasGap()) {
                    statistics = detector.detectInSafeZone();
                }
                publish(statistics);
            } catch (RuntimeException e) {
                log.error("Failed to detect the high water mark, trying again in {}", pollingInterval, e);
            }

            synchronized (monitor) {
                try {
                    if (running) {
                        monitor.wait(pollingInterval.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            running = false;
        }
        log.info("Stopped high water agent");
    }

    /**
     * Make {@code statistics} the current mark if it's higher and wake up the shards that wait for it.
     */
    public void publish(HighWaterStatistics statistics) {
        synchronized (monitor) {
            if (statistics.currentMark() >= current.currentMark()) {
                current = statistics;
            }
            monitor.notifyAll();
        }
    }

    public long currentMark() {
        return current.currentMark();
    }

    public HighWaterStatistics currentStatistics() {
        return current;
    }

    /**
     * Wait for a mark beyond {@code sequence}. Returns when a mark is published, the agent is stopped or the timeout
     * passes, whichever comes first.
     *
     * @return The current mark
     */
    public long awaitMarkBeyond(long sequence, Duration timeout) throws InterruptedException {
        synchronized (monitor) {
            if (current.currentMark() <= sequence) {
                monitor.wait(timeout.toMillis());
            }
        }
        return current.currentMark();
    }

    /**
     * Mark the agent as running before it's handed to a thread, so that a stop can't be lost.
     */
    void prepareStart() {
        running = true;
    }

    public boolean isRunning() {
        return running;
    }

    public void stop() {
        synchronized (monitor) {
            running = false;
            monitor.notifyAll();
        }
    }
}
