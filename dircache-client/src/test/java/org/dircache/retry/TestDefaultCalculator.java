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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.time.Duration;
import org.dircache.pacer.PacerState;
import org.junit.jupiter.api.Test;

public class TestDefaultCalculator {
    private final DefaultCalculator calculator =
            new DefaultCalculator(Duration.ofMillis(10), Duration.ofSeconds(2), 2);

    @Test
    public void testNoRetries() {
        assertEquals(Duration.ZERO, calculator.calculate(new PacerState(Duration.ofSeconds(1), 0, null)));
    }

    @Test
    public void testFirstRetry() {
        assertEquals(Duration.ofMillis(10), calculator.calculate(new PacerState(Duration.ofSeconds(1), 1, null)));
    }

    @Test
    public void testGrowth() {
        Duration sleep = Duration.ZERO;
        Duration[] expected = {
            Duration.ofMillis(10), Duration.ofMillis(40), Duration.ofMillis(160), Duration.ofMillis(640),
            Duration.ofMillis(2000), Duration.ofMillis(2000)
        };
        for (int i = 0; i < expected.length; ++i) {
            sleep = calculator.calculate(new PacerState(sleep, i + 1, null));
            assertEquals(expected[i], sleep);
        }
    }

    @Test
    public void testLowerBound() {
        assertEquals(Duration.ofMillis(10), calculator.calculate(new PacerState(Duration.ZERO, 3, null)));
        assertEquals(Duration.ofMillis(10), calculator.calculate(new PacerState(Duration.ofMillis(1), 3, null)));
    }

    @Test
    public void testUnbounded() {
        DefaultCalculator unbounded = new DefaultCalculator(Duration.ofMillis(10), Duration.ZERO, 1);
        assertEquals(Duration.ofHours(2), unbounded.calculate(new PacerState(Duration.ofHours(1), 5, null)));
    }

    @Test
    public void testOverflowSaturates() {
        DefaultCalculator unbounded = new DefaultCalculator(Duration.ofMillis(10), Duration.ZERO, 2);
        Duration huge = Duration.ofNanos(Long.MAX_VALUE / 2);
        assertEquals(Duration.ofNanos(Long.MAX_VALUE), unbounded.calculate(new PacerState(huge, 10, null)));

        assertEquals(Duration.ofSeconds(2), calculator.calculate(new PacerState(huge, 10, null)));
    }

    @Test
    public void testDecayConstantPinned() {
        DefaultCalculator pinned = new DefaultCalculator(Duration.ofMillis(10), Duration.ofSeconds(2), 100);
        assertEquals(62, pinned.getDecayConstant());
    }

    @Test
    public void testBadArguments() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new DefaultCalculator(Duration.ofMillis(-1), Duration.ofSeconds(2), 2));
        assertThrows(
                IllegalArgumentException.class,
                () -> new DefaultCalculator(Duration.ofMillis(10), Duration.ofSeconds(-2), 2));
        assertThrows(
                IllegalArgumentException.class,
                () -> new DefaultCalculator(Duration.ofMillis(10), Duration.ofSeconds(2), -1));
        assertThrows(NullPointerException.class, () -> new DefaultCalculator(null, Duration.ofSeconds(2), 2));
    }
}
