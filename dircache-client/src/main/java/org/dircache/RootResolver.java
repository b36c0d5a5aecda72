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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.dircache.utils.DirPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Resolves the configured root path to a directory ID, creating missing directories along
 * the way.
 * </p>
 *
 * <p>
 * The first call to {@link #findRoot(CallContext)} is synchronized and walks the root path.
 * Concurrent callers wait for it. Once it succeeds, calls return the resolved ID without
 * locking and without backend calls. If it fails, directories already created stay cached so
 * the next attempt resumes past them.
 * </p>
 */
public class RootResolver {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final String root;
    private final String trueRootId;
    private final PathCache cache;
    private final DirectoryBackend backend;
    private final AtomicReference<Helper> helper;
    private volatile String rootId = null;

    interface Helper {
        String findRoot(CallContext ctx) throws DirCacheException, InterruptedException;
    }

    /**
     * @param root the root path, relative to the true root ("" for the true root itself)
     * @param trueRootId ID of the store's absolute root
     * @param cache the path cache to use
     * @param backend backend used to create missing directories
     */
    public RootResolver(String root, String trueRootId, PathCache cache, DirectoryBackend backend) {
        this.root = DirPaths.normalize(root);
        this.trueRootId = Preconditions.checkNotNull(trueRootId, "trueRootId cannot be null");
        this.cache = Preconditions.checkNotNull(cache, "cache cannot be null");
        this.backend = Preconditions.checkNotNull(backend, "backend cannot be null");
        helper = new AtomicReference<>(new InitialHelper());
    }

    /**
     * First time, synchronizes and resolves the root, creating directories as needed.
     * Subsequent calls return the same ID.
     *
     * @param ctx call context
     * @return the root directory's ID
     * @throws DirCacheException backend errors or cancellation
     * @throws InterruptedException thread interruption
     */
    public String findRoot(CallContext ctx) throws DirCacheException, InterruptedException {
        return helper.get().findRoot(ctx);
    }

    /**
     * @return true once {@link #findRoot(CallContext)} has succeeded
     */
    public boolean isResolved() {
        return rootId != null;
    }

    /**
     * @return the resolved root ID, or the true root ID if the root has not been resolved yet
     */
    public String getRootId() {
        String localRootId = rootId;
        return (localRootId != null) ? localRootId : trueRootId;
    }

    public String getTrueRootId() {
        return trueRootId;
    }

    public String getRoot() {
        return root;
    }

    private class InitialHelper implements Helper {
        private boolean isSet = false; // guarded by synchronization

        @Override
        public synchronized String findRoot(CallContext ctx) throws DirCacheException, InterruptedException {
            if (!isSet) {
                String resolvedId = resolve(ctx);
                rootId = resolvedId;
                helper.set(c -> resolvedId);
                isSet = true;
            }
            return rootId;
        }
    }

    private String resolve(CallContext ctx) throws DirCacheException, InterruptedException {
        List<String> segments = DirPaths.split(root);
        if (segments.isEmpty()) {
            return trueRootId;
        }

        List<String> prefixes = DirPaths.prefixes(segments);
        String parentId = trueRootId;
        int cachedQty = 0;
        for (String prefix : prefixes) {
            Optional<String> id = cache.get(prefix);
            if (!id.isPresent()) {
                break;
            }
            parentId = id.get();
            ++cachedQty;
        }
        if (cachedQty == segments.size()) {
            return parentId;
        }

        for (int i = cachedQty; i < segments.size(); ++i) {
            String dirPath = prefixes.get(i);
            if (cache.get(dirPath).isPresent()) {
                continue;
            }

            String parentPath = (i == 0) ? "" : prefixes.get(i - 1);
            String localParentId = (i == 0) ? trueRootId : cache.get(parentPath)
                    .orElseThrow(() -> new IllegalStateException("couldn't find parent directory: " + parentPath));
            String id = BackendCalls.createDir(backend, ctx, localParentId, segments.get(i), dirPath);
            cache.put(dirPath, id);
            log.debug("Created root directory {} ({})", dirPath, id);
        }

        return cache.get(root)
                .orElseThrow(() -> new IllegalStateException("internal error: couldn't find root in the cache"));
    }
}
