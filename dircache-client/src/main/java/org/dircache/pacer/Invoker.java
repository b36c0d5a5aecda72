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

/**
 * Wraps each attempt of a {@link Paced} operation
 */
@FunctionalInterface
public interface Invoker {
    /**
     * @param retryCount number of attempts already retried in this call (0 the first time)
     * @param maxRetries the call's retry budget
     * @param paced the operation
     * @return the attempt's outcome
     * @throws Exception errors from the operation are treated as permanent failures
     */
    Attempt invoke(int retryCount, int maxRetries, Paced paced) throws Exception;
}
