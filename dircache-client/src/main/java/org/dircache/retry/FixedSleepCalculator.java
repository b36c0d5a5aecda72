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

import com.google.common.base.Preconditions;
import java.time.Duration;
import org.dircache.pacer.Calculator;
import org.dircache.pacer.PacerState;

/**
 * Sleeps the same amount of time before every retry
 */
public class FixedSleepCalculator implements Calculator {
    private final Duration sleepTime;

    /**
     * @param sleepTime time to sleep between attempts
     */
    public FixedSleepCalculator(Duration sleepTime) {
        Preconditions.checkNotNull(sleepTime, "sleepTime cannot be null");
        Preconditions.checkArgument(!sleepTime.isNegative(), "sleepTime cannot be negative");
        this.sleepTime = sleepTime;
    }

    @Override
    public Duration calculate(PacerState state) {
        return (state.getConsecutiveRetries() == 0) ? Duration.ZERO : sleepTime;
    }
}
