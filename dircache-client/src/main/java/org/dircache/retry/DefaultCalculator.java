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

package org.dircache.retry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.time.Duration;
import org.dircache.pacer.Calculator;
import org.dircache.pacer.PacerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backoff that sleeps {@code minSleep} after the first retry and then shifts the previous sleep
 * left by the decay constant on every further consecutive retry, bounded by {@code minSleep}
 * and {@code maxSleep}. A zero {@code maxSleep} leaves the growth unbounded.
 */
public class DefaultCalculator implements Calculator {
    private static final Logger log = LoggerFactory.getLogger(DefaultCalculator.class);

    private static final int MAX_DECAY_CONSTANT = 62;

    private final Duration minSleep;
    private final Duration maxSleep;
    private final int decayConstant;

    /**
     * @param minSleep sleep after the first retry and lower bound of later sleeps
     * @param maxSleep upper bound of sleeps, zero for none
     * @param decayConstant bits to shift the previous sleep by
     */
    public DefaultCalculator(Duration minSleep, Duration maxSleep, int decayConstant) {
        Preconditions.checkNotNull(minSleep, "minSleep cannot be null");
        Preconditions.checkNotNull(maxSleep, "maxSleep cannot be null");
        Preconditions.checkArgument(!minSleep.isNegative(), "minSleep cannot be negative");
        Preconditions.checkArgument(!maxSleep.isNegative(), "maxSleep cannot be negative");
        Preconditions.checkArgument(decayConstant >= 0, "decayConstant cannot be negative");

        this.minSleep = minSleep;
        this.maxSleep = maxSleep;
        this.decayConstant = validateDecayConstant(decayConstant);
    }

    @Override
    public Duration calculate(PacerState state) {
        if (state.getConsecutiveRetries() == 0) {
            return Duration.ZERO;
        }
        if (state.getConsecutiveRetries() == 1) {
            return minSleep;
        }

        Duration sleepTime = shift(state.getSleepTime());
        if (sleepTime.compareTo(minSleep) < 0) {
            sleepTime = minSleep;
        }
        if (!maxSleep.isZero() && (sleepTime.compareTo(maxSleep) > 0)) {
            sleepTime = maxSleep;
        }
        return sleepTime;
    }

    @VisibleForTesting
    public Duration getMinSleep() {
        return minSleep;
    }

    @VisibleForTesting
    public Duration getMaxSleep() {
        return maxSleep;
    }

    @VisibleForTesting
    public int getDecayConstant() {
        return decayConstant;
    }

    private Duration shift(Duration previous) {
        long previousNanos = previous.toNanos();
        if (previousNanos > (Long.MAX_VALUE >> decayConstant)) {
            if (maxSleep.isZero()) {
                log.warn(String.format("Sleep extension too large (%s). Pinning to %d ns", previous, Long.MAX_VALUE));
            }
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(previousNanos << decayConstant);
    }

    private static int validateDecayConstant(int decayConstant) {
        if (decayConstant > MAX_DECAY_CONSTANT) {
            log.warn(String.format("decayConstant too large (%d). Pinning to %d", decayConstant, MAX_DECAY_CONSTANT));
            return MAX_DECAY_CONSTANT;
        }
        return decayConstant;
    }
}
