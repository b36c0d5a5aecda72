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
import com.google.common.base.Strings;

/**
 * Maps directory IDs back to paths using only what earlier resolutions have cached
 */
public class PathIdLookup {
    private final RootResolver rootResolver;
    private final PathCache cache;

    public PathIdLookup(RootResolver rootResolver, PathCache cache) {
        this.rootResolver = Preconditions.checkNotNull(rootResolver, "rootResolver cannot be null");
        this.cache = Preconditions.checkNotNull(cache, "cache cannot be null");
    }

    /**
     * Return the path of the given directory ID, relative to the true root. The root IDs map to
     * the configured root path.
     *
     * @param id directory ID
     * @return the path
     * @throws NotFoundException if the ID has not been seen by this cache
     */
    public String findPath(String id) throws NotFoundException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "can't find path for empty ID");

        if (id.equals(rootResolver.getRootId()) || id.equals(rootResolver.getTrueRootId())) {
            return rootResolver.getRoot();
        }
        return cache.getInverse(id).orElseThrow(() -> NotFoundException.forId(id));
    }
}
