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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
public class RetryStrategyTest {

    @Test
    void does_not_retry_when_retry_strategy_is_none() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.none();

        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            if (counter.incrementAndGet() == 1) {
                throw new IllegalArgumentException("expected");
            }
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected")
        );
    }

    @Test
    void retries_until_the_supplier_succeeds() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.fixed(1);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        String result = retryStrategy.execute(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new IllegalStateException("expected");
            }
            return "done";
        });

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo("done"),
                () -> assertThat(counter).hasValue(3)
        );
    }

    @Test
    void rethrows_the_last_error_when_max_attempts_are_exhausted() {
        // Given
        CopyOnWriteArrayList<RetryInfo> retryInfos = new CopyOnWriteArrayList<>();
        RetryStrategy retryStrategy = RetryStrategy.retry()
                .maxAttempts(4)
                .onError((info, __) -> retryInfos.add(info));

        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            counter.incrementAndGet();
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected"),
                () -> assertThat(counter).hasValue(4),
                () -> assertThat(retryInfos).extracting(RetryInfo::getAttemptNumber).containsExactly(1, 2, 3, 4),
                () -> assertThat(retryInfos).extracting(RetryInfo::isRetryable).containsExactly(true, true, true, false)
        );
    }

    @Test
    void does_not_retry_errors_that_are_not_matched_by_the_retry_predicate() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.retry().retryIf(IllegalStateException.class::isInstance);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            counter.incrementAndGet();
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class),
                () -> assertThat(counter).hasValue(1)
        );
    }

    @Nested
    @DisplayName("Backoff")
    class BackoffTest {

        @Test
        void exponential_backoff_grows_with_the_multiplier_until_max_is_reached() {
            // Given
            Backoff backoff = Backoff.exponential(Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

            // When
            Duration first = backoff.delayAfter(1);
            Duration second = backoff.delayAfter(2);
            Duration third = backoff.delayAfter(3);
            Duration fourth = backoff.delayAfter(4);

            // Then
            assertAll(
                    () -> assertThat(first).isEqualTo(Duration.ofMillis(100)),
                    () -> assertThat(second).isEqualTo(Duration.ofMillis(200)),
                    () -> assertThat(third).isEqualTo(Duration.ofMillis(400)),
                    () -> assertThat(fourth).isEqualTo(Duration.ofMillis(500))
            );
        }

        @Test
        void error_listener_receives_the_backoff_that_will_be_used_before_the_next_attempt() {
            // Given
            CopyOnWriteArrayList<Duration> backoffs = new CopyOnWriteArrayList<>();
            RetryStrategy retryStrategy = RetryStrategy.fixed(Duration.ofMillis(5))
                    .maxAttempts(3)
                    .onError((info, __) -> backoffs.add(info.getBackoff()));

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertThat(backoffs).containsExactly(Duration.ofMillis(5), Duration.ofMillis(5), Duration.ZERO);
        }
    }
}
