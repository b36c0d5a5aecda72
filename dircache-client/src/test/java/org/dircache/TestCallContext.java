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

package org.dircache;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class TestCallContext {
    @Test
    public void testBackground() throws Exception {
        CallContext ctx = CallContext.background();
        assertFalse(ctx.isDone());
        assertNull(ctx.getReason());
        ctx.checkDone();
        assertThrows(IllegalStateException.class, ctx::cancel);
    }

    @Test
    public void testCancel() {
        CallContext ctx = CallContext.background().withCancel();
        assertFalse(ctx.isDone());

        ctx.cancel();
        assertTrue(ctx.isDone());
        CallCancelledException e = assertThrows(CallCancelledException.class, ctx::checkDone);
        assertEquals(CallCancelledException.Reason.CANCELLED, e.getReason());
        assertEquals("context canceled", e.getMessage());
        assertFalse(CallContext.background().isDone());
    }

    @Test
    public void testParentCancelled() {
        CallContext parent = CallContext.background().withCancel();
        CallContext child = parent.withTimeout(1, TimeUnit.HOURS);
        CallContext grandChild = child.withCancel();

        parent.cancel();
        assertEquals(CallCancelledException.Reason.CANCELLED, grandChild.getReason());
        assertTrue(child.isDone());
    }

    @Test
    public void testChildCancelDoesNotAffectParent() {
        CallContext parent = CallContext.background().withCancel();
        CallContext child = parent.withCancel();

        child.cancel();
        assertTrue(child.isDone());
        assertFalse(parent.isDone());
    }

    @Test
    public void testDeadline() {
        CallContext ctx = CallContext.background().withTimeout(50, TimeUnit.MILLISECONDS);
        await().atMost(Duration.ofSeconds(5)).until(ctx::isDone);
        assertEquals(CallCancelledException.Reason.DEADLINE_EXCEEDED, ctx.getReason());

        CallCancelledException e = assertThrows(CallCancelledException.class, ctx::checkDone);
        assertEquals("context deadline exceeded", e.getMessage());
    }

    @Test
    public void testNegativeTimeout() {
        assertThrows(IllegalArgumentException.class, () -> CallContext.background().withTimeout(-1, TimeUnit.SECONDS));
    }

    @Test
    public void testSleep() throws Exception {
        CallContext ctx = CallContext.background().withCancel();
        long start = System.nanoTime();
        ctx.sleep(30, TimeUnit.MILLISECONDS);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 30);
    }

    @Test
    public void testSleepInterruptedByCancel() {
        CallContext ctx = CallContext.background().withCancel();
        ScheduledExecutorService service = Executors.newSingleThreadScheduledExecutor();
        try {
            service.schedule(ctx::cancel, 100, TimeUnit.MILLISECONDS);

            long start = System.nanoTime();
            CallCancelledException e =
                    assertThrows(CallCancelledException.class, () -> ctx.sleep(1, TimeUnit.MINUTES));
            assertEquals(CallCancelledException.Reason.CANCELLED, e.getReason());
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 10);
        } finally {
            service.shutdownNow();
        }
    }

    @Test
    public void testSleepPastDeadline() {
        CallContext ctx = CallContext.background().withTimeout(100, TimeUnit.MILLISECONDS);
        CallCancelledException e = assertThrows(CallCancelledException.class, () -> ctx.sleep(1, TimeUnit.MINUTES));
        assertEquals(CallCancelledException.Reason.DEADLINE_EXCEEDED, e.getReason());
    }

    @Test
    public void testTryAcquire() throws Exception {
        Semaphore semaphore = new Semaphore(1);
        CallContext ctx = CallContext.background().withCancel();

        assertTrue(ctx.tryAcquire(semaphore));
        assertFalse(ctx.tryAcquire(semaphore));

        semaphore.release();
        ctx.cancel();
        assertThrows(CallCancelledException.class, () -> ctx.tryAcquire(semaphore));
        assertEquals(1, semaphore.availablePermits());
    }
}
