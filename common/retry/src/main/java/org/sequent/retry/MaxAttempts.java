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

/**
 * The number of times an action is attempted before the {@link RetryStrategy} gives up.
 */
public sealed interface MaxAttempts {

    boolean isExhaustedAfter(int attemptNumber);

    record Limit(int limit) implements MaxAttempts {
        public Limit {
            if (limit < 1) {
                throw new IllegalArgumentException("Max attempts must be greater than zero");
            }
        }

        @Override
        public boolean isExhaustedAfter(int attemptNumber) {
            return attemptNumber >= limit;
        }
    }

    record Infinite() implements MaxAttempts {
        private static final Infinite INSTANCE = new Infinite();

        public static MaxAttempts infinite() {
            return INSTANCE;
        }

        @Override
        public boolean isExhaustedAfter(int attemptNumber) {
            return false;
        }
    }
}
