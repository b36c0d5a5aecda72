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
import org.dircache.utils.DirPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves paths below the root to directory IDs. Cached prefixes are used where possible and
 * the remaining segments are looked up one at a time with
 * {@link DirectoryBackend#findLeaf(CallContext, String, String)}. Every discovered directory is
 * cached.
 */
public class DirectoryResolver {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final RootResolver rootResolver;
    private final PathCache cache;
    private final DirectoryBackend backend;
    private final Object createLock = new Object();

    public DirectoryResolver(RootResolver rootResolver, PathCache cache, DirectoryBackend backend) {
        this.rootResolver = Preconditions.checkNotNull(rootResolver, "rootResolver cannot be null");
        this.cache = Preconditions.checkNotNull(cache, "cache cannot be null");
        this.backend = Preconditions.checkNotNull(backend, "backend cannot be null");
    }

    /**
     * Return the ID of the directory at the given path. Never creates directories.
     *
     * @param ctx call context
     * @param path path relative to the root, "" for the root itself
     * @return directory ID
     * @throws NotFoundException if a segment of the path does not exist
     * @throws DirCacheException backend errors or cancellation
     * @throws InterruptedException thread interruption
     * @throws IllegalStateException if the root has not been resolved
     */
    public String findDir(CallContext ctx, String path) throws DirCacheException, InterruptedException {
        checkRootResolved();
        return resolve(ctx, path, false);
    }

    /**
     * Return the ID of the directory at the given path, creating any missing directories.
     * Creation is serialized per cache so that a directory is never created twice: the lock is
     * held across the backend calls, so concurrent {@code makeDirs} calls wait for each other
     * even for unrelated paths. {@link #findDir(CallContext, String)} never takes the lock.
     *
     * @param ctx call context
     * @param path path relative to the root, "" for the root itself
     * @return directory ID
     * @throws DirCacheException backend errors or cancellation
     * @throws InterruptedException thread interruption
     * @throws IllegalStateException if the root has not been resolved
     */
    public String makeDirs(CallContext ctx, String path) throws DirCacheException, InterruptedException {
        checkRootResolved();
        synchronized (createLock) {
            return resolve(ctx, path, true);
        }
    }

    /**
     * Split an object path into its parent directory and leaf and resolve the parent directory
     *
     * @param ctx call context
     * @param remote path of an object relative to the root
     * @param create if true, missing parent directories are created
     * @return parent directory ID and leaf name
     * @throws DirCacheException backend errors, cancellation or a missing parent
     * @throws InterruptedException thread interruption
     */
    public DirectoryAndLeaf findParent(CallContext ctx, String remote, boolean create)
            throws DirCacheException, InterruptedException {
        DirPaths.PathAndLeaf pathAndLeaf = DirPaths.getPathAndLeaf(remote);
        Preconditions.checkArgument(!pathAndLeaf.getLeaf().isEmpty(), "remote cannot be the root");

        String directoryId =
                create ? makeDirs(ctx, pathAndLeaf.getPath()) : findDir(ctx, pathAndLeaf.getPath());
        return new DirectoryAndLeaf(directoryId, pathAndLeaf.getLeaf());
    }

    private void checkRootResolved() {
        Preconditions.checkState(rootResolver.isResolved(), "internal error: findRoot() has not completed");
    }

    private String resolve(CallContext ctx, String path, boolean create)
            throws DirCacheException, InterruptedException {
        String relativePath = DirPaths.normalize(path);
        String parentId = rootResolver.getRootId();
        if (relativePath.isEmpty()) {
            return parentId;
        }

        List<String> segments = DirPaths.split(relativePath);
        List<String> relativePrefixes = DirPaths.prefixes(segments);
        String root = rootResolver.getRoot();

        int start = 0;
        for (int i = segments.size() - 1; i >= 0; --i) {
            Optional<String> id = cache.get(DirPaths.makePath(root, relativePrefixes.get(i)));
            if (id.isPresent()) {
                parentId = id.get();
                start = i + 1;
                break;
            }
        }

        for (int i = start; i < segments.size(); ++i) {
            String segment = segments.get(i);
            String relativePrefix = relativePrefixes.get(i);
            Optional<String> found = BackendCalls.findLeaf(backend, ctx, parentId, segment, relativePrefix);

            String id;
            if (found.isPresent()) {
                id = found.get();
            } else if (create) {
                id = BackendCalls.createDir(backend, ctx, parentId, segment, relativePrefix);
                log.debug("Created directory {} ({})", relativePrefix, id);
            } else {
                throw NotFoundException.forPath(relativePath);
            }

            cache.put(DirPaths.makePath(root, relativePrefix), id);
            parentId = id;
        }
        return parentId;
    }
}
