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
import java.util.Optional;
import java.util.function.Predicate;
import org.dircache.pacer.Pacer;

/**
 * Routes every call of a {@link DirectoryBackend} through a {@link Pacer}. Exceptions accepted
 * by the retry predicate are retried with backoff, anything else fails the call at once.
 */
public class PacedDirectoryBackend implements DirectoryBackend {
    private final DirectoryBackend delegate;
    private final Pacer pacer;
    private final Predicate<? super Exception> retryable;

    /**
     * Retries {@link RetryableBackendException}s only
     *
     * @param delegate the backend to pace
     * @param pacer the pacer
     */
    public PacedDirectoryBackend(DirectoryBackend delegate, Pacer pacer) {
        this(delegate, pacer, PacedDirectoryBackend::isRetryException);
    }

    /**
     * @param delegate the backend to pace
     * @param pacer the pacer
     * @param retryable decides which backend exceptions are transient
     */
    public PacedDirectoryBackend(DirectoryBackend delegate, Pacer pacer, Predicate<? super Exception> retryable) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate cannot be null");
        this.pacer = Preconditions.checkNotNull(pacer, "pacer cannot be null");
        this.retryable = Preconditions.checkNotNull(retryable, "retryable cannot be null");
    }

    /**
     * Utility - return true if the given exception is a transient backend failure
     *
     * @param exception exception to check
     * @return true/false
     */
    public static boolean isRetryException(Throwable exception) {
        return exception instanceof RetryableBackendException;
    }

    @Override
    public Optional<String> findLeaf(CallContext ctx, String parentId, String leaf) throws Exception {
        return pacer.callWithRetry(ctx, () -> delegate.findLeaf(ctx, parentId, leaf), retryable);
    }

    @Override
    public String createDir(CallContext ctx, String parentId, String leaf) throws Exception {
        return pacer.callWithRetry(ctx, () -> delegate.createDir(ctx, parentId, leaf), retryable);
    }

    public Pacer getPacer() {
        return pacer;
    }
}
