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

import java.time.Duration;

/**
 * Computes the delay before the next attempt from the pacer's state. Called with the pacer's
 * lock held, so implementations should be pure and fast.
 */
@FunctionalInterface
public interface Calculator {
    /**
     * @param state the pacer state, already counting the retry about to be made
     * @return time to sleep before the next attempt
     */
    Duration calculate(PacerState state);
}
