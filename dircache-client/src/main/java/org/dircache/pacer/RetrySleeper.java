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

import java.util.concurrent.TimeUnit;
import org.dircache.CallCancelledException;
import org.dircache.CallContext;

/**
 * Abstraction for the pacer's backoff sleep - mainly useful for testing.
 */
@FunctionalInterface
public interface RetrySleeper {
    /**
     * Sleep for the given time, honouring the call context
     *
     * @param ctx call context
     * @param time time
     * @param unit time unit
     * @throws CallCancelledException if the context is done
     * @throws InterruptedException if the sleep is interrupted
     */
    void sleepFor(CallContext ctx, long time, TimeUnit unit) throws CallCancelledException, InterruptedException;
}
