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
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.dircache.CallCancelledException;
import org.dircache.CallContext;
import org.dircache.drivers.TracerDriver;
import org.dircache.retry.DefaultCalculator;
import org.dircache.utils.DebugUtils;
import org.dircache.utils.DefaultTracerDriver;
import org.dircache.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Paces and retries calls to a remote service.
 * </p>
 *
 * <p>
 * Every attempt needs the single pacing token and then a connection token. The pacing token
 * is handed back as soon as the connection token is held, so up to {@code maxConnections}
 * attempts run at the same time. The connection token is returned when the attempt finishes.
 * When an attempt asks to be retried, the caller takes the pacing token again and keeps it for
 * the whole backoff sleep: no other caller can start an attempt until the retry has been made.
 * </p>
 *
 * Canonical usage:<br>
 * <pre>
 * Pacer pacer = Pacer.builder().maxConnections(4).retries(5).build();
 * pacer.call(ctx, () -&gt; {
 *     try {
 *         store.delete(id);
 *         return Attempt.done();
 *     } catch (RateLimitedException e) {
 *         return Attempt.retry(e);
 *     }
 * });
 * </pre>
 */
public class Pacer {
    private static final Logger log = LoggerFactory.getLogger(Pacer.class);

    private static final int DEFAULT_MAX_CONNECTIONS = Integer.getInteger("dircache-pacer-max-connections", 8);
    private static final int DEFAULT_RETRIES = Integer.getInteger("dircache-pacer-retries", 10);
    private static final long DEFAULT_MIN_SLEEP_MS = Long.getLong("dircache-pacer-min-sleep-ms", 10);
    private static final long DEFAULT_MAX_SLEEP_MS = Long.getLong("dircache-pacer-max-sleep-ms", 2000);
    private static final int DEFAULT_DECAY_CONSTANT = Integer.getInteger("dircache-pacer-decay-constant", 2);

    private final Semaphore pacingToken = new Semaphore(1, true);
    private final AtomicReference<Semaphore> connectionTokens = new AtomicReference<>();
    private final Object lock = new Object();
    private final Calculator calculator;
    private final Invoker invoker;
    private final RetrySleeper sleeper;
    private final AtomicReference<TracerDriver> tracer;
    private volatile int retries;
    private volatile int maxConnections;
    private PacerState state = PacerState.INITIAL; // guarded by lock

    /**
     * Return a new builder that builds a Pacer
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a pacer with the default settings
     *
     * @return new pacer
     */
    public static Pacer newPacer() {
        return builder().build();
    }

    public static class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int retries = DEFAULT_RETRIES;
        private Duration minSleep = Duration.ofMillis(DEFAULT_MIN_SLEEP_MS);
        private Duration maxSleep = Duration.ofMillis(DEFAULT_MAX_SLEEP_MS);
        private int decayConstant = DEFAULT_DECAY_CONSTANT;
        private Calculator calculator = null;
        private Invoker invoker = new StandardInvoker();
        private RetrySleeper sleeper = CallContext::sleep;
        private TracerDriver tracerDriver = new DefaultTracerDriver();

        /**
         * Apply the current values and build a new Pacer
         *
         * @return new Pacer
         */
        public Pacer build() {
            return new Pacer(this);
        }

        /**
         * @param maxConnections max attempts in flight at once, 0 for no limit
         * @return this
         */
        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * @param retries max number of retries per call
         * @return this
         */
        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        /**
         * Applies to the default calculator only
         *
         * @param minSleep sleep after the first retry and minimum of later sleeps
         * @return this
         */
        public Builder minSleep(Duration minSleep) {
            this.minSleep = minSleep;
            return this;
        }

        /**
         * Applies to the default calculator only
         *
         * @param maxSleep maximum sleep, zero for none
         * @return this
         */
        public Builder maxSleep(Duration maxSleep) {
            this.maxSleep = maxSleep;
            return this;
        }

        /**
         * Applies to the default calculator only
         *
         * @param decayConstant bits to shift the previous sleep by on consecutive retries
         * @return this
         */
        public Builder decayConstant(int decayConstant) {
            this.decayConstant = decayConstant;
            return this;
        }

        /**
         * Replace the default calculator. {@link #minSleep(Duration)}, {@link #maxSleep(Duration)}
         * and {@link #decayConstant(int)} are then ignored.
         *
         * @param calculator the backoff calculator
         * @return this
         */
        public Builder calculator(Calculator calculator) {
            this.calculator = calculator;
            return this;
        }

        /**
         * @param invoker wrapper for each attempt
         * @return this
         */
        public Builder invoker(Invoker invoker) {
            this.invoker = invoker;
            return this;
        }

        /**
         * @param sleeper performs backoff sleeps
         * @return this
         */
        public Builder sleeper(RetrySleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * @param tracerDriver receives call timings and retry counts
         * @return this
         */
        public Builder tracerDriver(TracerDriver tracerDriver) {
            this.tracerDriver = tracerDriver;
            return this;
        }

        private Builder() {}
    }

    private Pacer(Builder builder) {
        calculator = (builder.calculator != null)
                ? builder.calculator
                : new DefaultCalculator(builder.minSleep, builder.maxSleep, builder.decayConstant);
        invoker = Preconditions.checkNotNull(builder.invoker, "invoker cannot be null");
        sleeper = Preconditions.checkNotNull(builder.sleeper, "sleeper cannot be null");
        tracer = new AtomicReference<>(Preconditions.checkNotNull(builder.tracerDriver, "tracerDriver cannot be null"));
        setRetries(builder.retries);
        setMaxConnections(builder.maxConnections);
    }

    /**
     * Run the operation with the background context. See {@link #call(CallContext, Paced)}
     *
     * @param paced the operation
     * @throws Exception the error of the last attempt
     */
    public void call(Paced paced) throws Exception {
        call(CallContext.background(), paced);
    }

    /**
     * Run the operation, repeating it while it asks for a retry and the retry budget allows.
     * The error of the last attempt, if any, is thrown.
     *
     * @param ctx call context
     * @param paced the operation
     * @throws CallCancelledException if the context is done while waiting for a token or sleeping
     * @throws Exception the error of the last attempt
     */
    public void call(CallContext ctx, Paced paced) throws Exception {
        call(ctx, paced, retries);
    }

    /**
     * Run the operation exactly once, still subject to pacing and the connection limit
     *
     * @param ctx call context
     * @param paced the operation
     * @throws CallCancelledException if the context is done while waiting for a token
     * @throws Exception the error of the attempt
     */
    public void callNoRetry(CallContext ctx, Paced paced) throws Exception {
        call(ctx, paced, 0);
    }

    /**
     * Convenience: run a value returning operation, retrying the exceptions accepted by the
     * given predicate. Interruption is never retried.
     *
     * @param ctx call context
     * @param proc the operation
     * @param retryable decides which exceptions are transient
     * @param <T> return type
     * @return the operation's result
     * @throws Exception the last exception of the operation or a cancellation
     */
    public <T> T callWithRetry(CallContext ctx, Callable<T> proc, Predicate<? super Exception> retryable)
            throws Exception {
        Preconditions.checkNotNull(proc, "proc cannot be null");
        Preconditions.checkNotNull(retryable, "retryable cannot be null");

        AtomicReference<T> result = new AtomicReference<>();
        call(ctx, () -> {
            try {
                result.set(proc.call());
                return Attempt.done();
            } catch (Exception e) {
                if (ThreadUtils.checkInterrupted(e)) {
                    return Attempt.failed(e);
                }
                return retryable.test(e) ? Attempt.retry(e) : Attempt.failed(e);
            }
        });
        return result.get();
    }

    /**
     * Change the connection limit. Attempts already holding a token return it to the old pool;
     * waiting callers move to the new pool.
     *
     * @param maxConnections max attempts in flight at once, 0 for no limit
     */
    public void setMaxConnections(int maxConnections) {
        Preconditions.checkArgument(maxConnections >= 0, "maxConnections cannot be negative");
        this.maxConnections = maxConnections;
        connectionTokens.set((maxConnections > 0) ? new Semaphore(maxConnections, true) : null);
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * @param retries max number of retries for calls started from now on
     */
    public void setRetries(int retries) {
        Preconditions.checkArgument(retries >= 0, "retries cannot be negative");
        this.retries = retries;
    }

    public int getRetries() {
        return retries;
    }

    public Calculator getCalculator() {
        return calculator;
    }

    /**
     * @return snapshot of the retry bookkeeping
     */
    public PacerState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public TracerDriver getTracerDriver() {
        return tracer.get();
    }

    public void setTracerDriver(TracerDriver tracerDriver) {
        tracer.set(Preconditions.checkNotNull(tracerDriver, "tracerDriver cannot be null"));
    }

    private void call(CallContext ctx, Paced paced, int maxRetries) throws Exception {
        Preconditions.checkNotNull(ctx, "ctx cannot be null");
        Preconditions.checkNotNull(paced, "paced cannot be null");

        boolean holdingPacingToken = false;
        try {
            for (int retryCount = 0; ; ++retryCount) {
                if (!holdingPacingToken) {
                    acquire(ctx, pacingToken);
                    holdingPacingToken = true;
                }
                Semaphore connectionPool = acquireConnectionToken(ctx);
                pacingToken.release();
                holdingPacingToken = false;

                Attempt attempt = invoke(retryCount, maxRetries, paced, connectionPool);
                if (!attempt.shouldRetry() || (retryCount >= maxRetries)) {
                    finish(attempt, retryCount);
                    return;
                }

                tracer.get().addCount("pacer-retries-allowed", 1);
                if (!Boolean.getBoolean(DebugUtils.PROPERTY_DONT_LOG_RETRIES)) {
                    log.debug("Retry-able error received", attempt.getError());
                }

                acquire(ctx, pacingToken);
                holdingPacingToken = true;
                Duration sleepTime;
                synchronized (lock) {
                    state = state.retried(attempt.getError());
                    sleepTime = calculator.calculate(state);
                    state = state.withSleepTime(sleepTime);
                }
                sleeper.sleepFor(ctx, TimeUnit.NANOSECONDS.convert(sleepTime), TimeUnit.NANOSECONDS);
            }
        } finally {
            if (holdingPacingToken) {
                pacingToken.release();
            }
            // every exit, including cancellation during backoff, ends the retry streak
            synchronized (lock) {
                state = state.reset();
            }
        }
    }

    private Attempt invoke(int retryCount, int maxRetries, Paced paced, Semaphore connectionPool) {
        long startNanos = System.nanoTime();
        try {
            return Preconditions.checkNotNull(
                    invoker.invoke(retryCount, maxRetries, paced), "invoker returned a null Attempt");
        } catch (Exception e) {
            ThreadUtils.checkInterrupted(e);
            return Attempt.failed(e);
        } finally {
            if (connectionPool != null) {
                connectionPool.release();
            }
            tracer.get().addTrace("pacer-call", System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    private void finish(Attempt attempt, int retryCount) throws Exception {
        if (attempt.shouldRetry()) {
            tracer.get().addCount("pacer-retries-disallowed", 1);
            if (!Boolean.getBoolean(DebugUtils.PROPERTY_DONT_LOG_RETRIES)) {
                log.debug("Retry budget exhausted after {} retries", retryCount);
            }
        }

        if (attempt.getError() != null) {
            throw attempt.getError();
        }
    }

    private Semaphore acquireConnectionToken(CallContext ctx) throws CallCancelledException, InterruptedException {
        while (true) {
            Semaphore pool = connectionTokens.get();
            if (pool == null) {
                ctx.checkDone();
                return null;
            }
            if (ctx.tryAcquire(pool)) {
                return pool;
            }
        }
    }

    private static void acquire(CallContext ctx, Semaphore semaphore) throws CallCancelledException, InterruptedException {
        boolean acquired = false;
        while (!acquired) {
            acquired = ctx.tryAcquire(semaphore);
        }
    }
}
