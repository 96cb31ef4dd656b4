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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown by {@link ProjectionDaemon#catchUp(Duration)} when the running shards didn't reach the high water mark in time.
 */
public class CatchUpTimeoutException extends RuntimeException {
    public final Duration timeout;

    public CatchUpTimeoutException(Duration timeout) {
        super("Projections didn't catch up within " + timeout);
        this.timeout = timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatchUpTimeoutException)) return false;
        CatchUpTimeoutException that = (CatchUpTimeoutException) o;
        return Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeout);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CatchUpTimeoutException.class.getSimpleName() + "[", "]")
                .add("timeout=" + timeout)
                .toString();
    }
}
