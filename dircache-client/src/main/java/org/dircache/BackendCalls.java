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

import com.google.common.base.Strings;
import java.util.Optional;

/**
 * Backend invocations shared by the resolvers. Backend failures are wrapped with the path
 * being resolved; the cache's own exceptions and interruption pass through unchanged.
 */
class BackendCalls {
    static Optional<String> findLeaf(
            DirectoryBackend backend, CallContext ctx, String parentId, String leaf, String path)
            throws DirCacheException, InterruptedException {
        ctx.checkDone();
        Optional<String> id;
        try {
            id = backend.findLeaf(ctx, parentId, leaf);
        } catch (DirCacheException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new BackendException(String.format("failed to find directory \"%s\"", path), path, e);
        }
        if (id == null) {
            return Optional.empty();
        }
        return id.filter(s -> !s.isEmpty());
    }

    static String createDir(DirectoryBackend backend, CallContext ctx, String parentId, String leaf, String path)
            throws DirCacheException, InterruptedException {
        ctx.checkDone();
        String id;
        try {
            id = backend.createDir(ctx, parentId, leaf);
        } catch (DirCacheException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new BackendException(String.format("failed to make directory \"%s\"", path), path, e);
        }
        if (Strings.isNullOrEmpty(id)) {
            throw new BackendException(String.format("no ID returned for new directory \"%s\"", path), path);
        }
        return id;
    }

    private BackendCalls() {}
}
