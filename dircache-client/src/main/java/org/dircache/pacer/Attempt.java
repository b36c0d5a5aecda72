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

/**
 * The outcome of one attempt of a {@link Paced} operation: whether another attempt is wanted
 * and the error, if any, to report if no further attempt is made
 */
public final class Attempt {
    private static final Attempt DONE = new Attempt(false, null);
    private static final Attempt AGAIN = new Attempt(true, null);

    private final boolean retry;
    private final Exception error;

    private Attempt(boolean retry, Exception error) {
        this.retry = retry;
        this.error = error;
    }

    /**
     * @return successful attempt
     */
    public static Attempt done() {
        return DONE;
    }

    /**
     * Ask for another attempt without an error, e.g. when polling for a result
     *
     * @return attempt that should be repeated
     */
    public static Attempt again() {
        return AGAIN;
    }

    /**
     * @param error the error
     * @return failed attempt that must not be retried
     */
    public static Attempt failed(Exception error) {
        return new Attempt(false, Preconditions.checkNotNull(error, "error cannot be null"));
    }

    /**
     * @param error the error
     * @return failed attempt that should be retried
     */
    public static Attempt retry(Exception error) {
        return new Attempt(true, Preconditions.checkNotNull(error, "error cannot be null"));
    }

    /**
     * @param retry true if another attempt is wanted
     * @param error the error or null
     * @return attempt
     */
    public static Attempt of(boolean retry, Exception error) {
        if (error == null) {
            return retry ? AGAIN : DONE;
        }
        return new Attempt(retry, error);
    }

    public boolean shouldRetry() {
        return retry;
    }

    /**
     * @return the error or null
     */
    public Exception getError() {
        return error;
    }

    /**
     * @return this attempt with the retry request dropped
     */
    public Attempt withoutRetry() {
        return retry ? of(false, error) : this;
    }

    @Override
    public String toString() {
        return "Attempt{" + "retry=" + retry + ", error=" + error + '}';
    }
}
