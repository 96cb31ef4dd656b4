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

import java.time.OffsetDateTime;

/**
 * The outcome of a high water detection.
 *
 * @param lastMark         The mark before the detection
 * @param currentMark      The mark after the detection, every event up to it is committed
 * @param highestSequence  The highest sequence in the events table
 * @param includesSkipping {@code true} if the mark was moved past a stale gap
 * @param timestamp        When the detection ran
 */
public record HighWaterStatistics(long lastMark, long currentMark, long highestSequence, boolean includesSkipping, OffsetDateTime timestamp) {

    public boolean hasChanged() {
        return currentMark != lastMark;
    }

    public boolean hasGap() {
        return currentMark < highestSequence;
    }
}
