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

import com.google.common.base.Preconditions;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <p>
 * Carries cancellation and an optional deadline to the operations that may block:
 * acquiring pacer tokens, backoff sleeps and backend calls.
 * </p>
 *
 * <p>
 * Contexts form a tree. A derived context is done when it is cancelled, when its deadline
 * passes or when its parent is done. The {@link #background()} context is never done and
 * cannot be cancelled.
 * </p>
 *
 * <pre>
 * CallContext ctx = CallContext.background().withTimeout(30, TimeUnit.SECONDS);
 * String id = dirCache.findDir(ctx, "photos/2024");
 * </pre>
 */
public class CallContext {
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    private static final CallContext BACKGROUND = new CallContext(null, false, 0, false);

    private final CallContext parent;
    private final boolean cancellable;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final AtomicReference<CallCancelledException.Reason> reason = new AtomicReference<>();

    /**
     * Return the root context
     *
     * @return context that is never done
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    private CallContext(CallContext parent, boolean cancellable, long deadlineNanos, boolean hasDeadline) {
        this.parent = parent;
        this.cancellable = cancellable;
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    /**
     * Derive a context that can be cancelled with {@link #cancel()}
     *
     * @return new child context
     */
    public CallContext withCancel() {
        return new CallContext(this, true, 0, false);
    }

    /**
     * Derive a cancellable context whose deadline is the given time from now
     *
     * @param time max time
     * @param unit time unit
     * @return new child context
     */
    public CallContext withTimeout(long time, TimeUnit unit) {
        Preconditions.checkArgument(time >= 0, "time cannot be negative");
        return new CallContext(this, true, System.nanoTime() + unit.toNanos(time), true);
    }

    /**
     * Cancel this context and, implicitly, every context derived from it
     */
    public void cancel() {
        Preconditions.checkState(cancellable, "the background context cannot be cancelled");
        markDone(CallCancelledException.Reason.CANCELLED);
    }

    /**
     * @return true if this context is cancelled or past its deadline
     */
    public boolean isDone() {
        return getReason() != null;
    }

    /**
     * Return why this context is done
     *
     * @return the reason or null if the context is not done
     */
    public CallCancelledException.Reason getReason() {
        CallCancelledException.Reason localReason = reason.get();
        if (localReason != null) {
            return localReason;
        }

        if (hasDeadline && (System.nanoTime() - deadlineNanos) >= 0) {
            return markDone(CallCancelledException.Reason.DEADLINE_EXCEEDED);
        }
        if (parent != null) {
            CallCancelledException.Reason parentReason = parent.getReason();
            if (parentReason != null) {
                return markDone(parentReason);
            }
        }
        return null;
    }

    /**
     * @throws CallCancelledException if this context is done
     */
    public void checkDone() throws CallCancelledException {
        CallCancelledException.Reason localReason = getReason();
        if (localReason != null) {
            throw new CallCancelledException(localReason);
        }
    }

    /**
     * Sleep for the given time, returning early with an exception if the context becomes done
     *
     * @param time time to sleep
     * @param unit time unit
     * @throws CallCancelledException if the context is or becomes done
     * @throws InterruptedException thread interruption
     */
    public void sleep(long time, TimeUnit unit) throws CallCancelledException, InterruptedException {
        checkDone();
        long remainingNanos = unit.toNanos(time);
        long endNanos = System.nanoTime() + remainingNanos;
        while (remainingNanos > 0) {
            doneLatch.await(Math.min(remainingNanos, WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS);
            checkDone();
            remainingNanos = endNanos - System.nanoTime();
        }
    }

    /**
     * Wait a short slice of time for a permit. Callers loop until a permit is acquired so that
     * cancellation, deadlines and replaced semaphores are noticed promptly.
     *
     * @param semaphore the semaphore
     * @return true if a permit was acquired
     * @throws CallCancelledException if the context is done
     * @throws InterruptedException thread interruption
     */
    public boolean tryAcquire(Semaphore semaphore) throws CallCancelledException, InterruptedException {
        checkDone();
        return semaphore.tryAcquire(WAIT_SLICE_NANOS, TimeUnit.NANOSECONDS);
    }

    private CallCancelledException.Reason markDone(CallCancelledException.Reason newReason) {
        reason.compareAndSet(null, newReason);
        doneLatch.countDown();
        return reason.get();
    }

    @Override
    public String toString() {
        return "CallContext{" + "cancellable=" + cancellable + ", hasDeadline=" + hasDeadline + ", reason="
                + reason.get() + '}';
    }
}
