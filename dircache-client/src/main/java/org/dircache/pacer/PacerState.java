/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.dircache.pacer;

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Snapshot of a {@link Pacer}'s retry bookkeeping, handed to its {@link Calculator}
 */
public final class PacerState {
    static final PacerState INITIAL = new PacerState(Duration.ZERO, 0, null);

    private final Duration sleepTime;
    private final int consecutiveRetries;
    private final Exception lastError;

    /**
     * @param sleepTime the last computed sleep time
     * @param consecutiveRetries retries since the last attempt that did not ask for a retry
     * @param lastError error of the last attempt or null
     */
    public PacerState(Duration sleepTime, int consecutiveRetries, Exception lastError) {
        this.sleepTime = Preconditions.checkNotNull(sleepTime, "sleepTime cannot be null");
        this.consecutiveRetries = consecutiveRetries;
        this.lastError = lastError;
    }

    public Duration getSleepTime() {
        return sleepTime;
    }

    public int getConsecutiveRetries() {
        return consecutiveRetries;
    }

    public Exception getLastError() {
        return lastError;
    }

    PacerState retried(Exception error) {
        return new PacerState(sleepTime, consecutiveRetries + 1, error);
    }

    PacerState withSleepTime(Duration newSleepTime) {
        return new PacerState(newSleepTime, consecutiveRetries, lastError);
    }

    PacerState reset() {
        return new PacerState(sleepTime, 0, null);
    }

    @Override
    public String toString() {
        return "PacerState{" + "sleepTime=" + sleepTime + ", consecutiveRetries=" + consecutiveRetries
                + ", lastError=" + lastError + '}';
    }
}
