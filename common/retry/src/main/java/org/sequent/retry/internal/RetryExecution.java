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

package org.sequent.retry.internal;

import org.sequent.retry.RetryInfo;
import org.sequent.retry.RetryStrategy;
import org.sequent.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    public static <T> T executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier.get();
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        int attempt = 1;
        for (; ; ) {
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                boolean retryable = !retry.maxAttempts.isExhaustedAfter(attempt) && retry.retryPredicate.test(e);
                Duration backoff = retryable ? retry.backoff.delayAfter(attempt) : Duration.ZERO;
                retry.errorListener.accept(new RetryInfo(attempt, retry.maxAttempts, backoff, retryable), e);
                if (!retryable) {
                    throw e;
                }
                sleep(backoff, e);
                attempt++;
            }
        }
    }

    private static void sleep(Duration backoff, RuntimeException cause) {
        long millis = backoff.toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }
}
