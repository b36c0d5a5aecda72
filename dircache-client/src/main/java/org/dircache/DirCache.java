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

import java.util.Optional;

/**
 * <p>
 * Caches directory paths to directory IDs and the inverse for one session with an ID addressed
 * store. Each client owns its own instance; nothing is shared between instances.
 * </p>
 *
 * <p>
 * {@link #findRoot(CallContext)} must succeed before directories can be resolved. It is not
 * called on construction as it may need to create the root's directories.
 * </p>
 *
 * <pre>
 * DirCache dirCache = new DirCache("backups/laptop", "root", backend);
 * dirCache.findRoot(ctx);
 * String id = dirCache.findDir(ctx, "photos/2024");
 * </pre>
 *
 * <p>
 * Cache keys are paths relative to the true root. Paths passed to {@link #findDir(CallContext, String)}
 * and {@link #makeDirs(CallContext, String)} are relative to the configured root and
 * {@link #findPath(String)} returns paths relative to the true root.
 * </p>
 */
public class DirCache {
    private final PathCache cache = new PathCache();
    private final RootResolver rootResolver;
    private final DirectoryResolver directoryResolver;
    private final PathIdLookup pathIdLookup;

    /**
     * @param root the path this cache is rooted on, relative to the true root
     * @param trueRootId ID of the store's absolute root
     * @param backend the backend, normally wrapped in a {@link PacedDirectoryBackend}
     */
    public DirCache(String root, String trueRootId, DirectoryBackend backend) {
        rootResolver = new RootResolver(root, trueRootId, cache, backend);
        directoryResolver = new DirectoryResolver(rootResolver, cache, backend);
        pathIdLookup = new PathIdLookup(rootResolver, cache);
    }

    /**
     * Return the ID of a cached path
     *
     * @param path path relative to the true root
     * @return ID or empty
     */
    public Optional<String> get(String path) {
        return cache.get(path);
    }

    /**
     * Return the cached path of an ID
     *
     * @param id directory ID
     * @return path relative to the true root or empty
     */
    public Optional<String> getInverse(String id) {
        return cache.getInverse(id);
    }

    /**
     * Record a path/ID pair, e.g. after the client has created or listed a directory itself
     *
     * @param path path relative to the true root
     * @param id directory ID
     */
    public void put(String path, String id) {
        cache.put(path, id);
    }

    /**
     * Resolve the root, creating its directories if needed. Idempotent.
     *
     * @param ctx call context
     * @return root directory ID
     * @throws DirCacheException backend errors or cancellation
     * @throws InterruptedException thread interruption
     */
    public String findRoot(CallContext ctx) throws DirCacheException, InterruptedException {
        return rootResolver.findRoot(ctx);
    }

    /**
     * Find an existing directory. See {@link DirectoryResolver#findDir(CallContext, String)}
     *
     * @param ctx call context
     * @param path path relative to the root
     * @return directory ID
     * @throws DirCacheException not found, backend errors or cancellation
     * @throws InterruptedException thread interruption
     */
    public String findDir(CallContext ctx, String path) throws DirCacheException, InterruptedException {
        return directoryResolver.findDir(ctx, path);
    }

    /**
     * Find a directory, creating it and any missing parents. See
     * {@link DirectoryResolver#makeDirs(CallContext, String)}
     *
     * @param ctx call context
     * @param path path relative to the root
     * @return directory ID
     * @throws DirCacheException backend errors or cancellation
     * @throws InterruptedException thread interruption
     */
    public String makeDirs(CallContext ctx, String path) throws DirCacheException, InterruptedException {
        return directoryResolver.makeDirs(ctx, path);
    }

    /**
     * Resolve the parent directory of an object. See
     * {@link DirectoryResolver#findParent(CallContext, String, boolean)}
     *
     * @param ctx call context
     * @param remote object path relative to the root
     * @param create true to create missing parent directories
     * @return parent directory ID and leaf
     * @throws DirCacheException not found, backend errors or cancellation
     * @throws InterruptedException thread interruption
     */
    public DirectoryAndLeaf findParent(CallContext ctx, String remote, boolean create)
            throws DirCacheException, InterruptedException {
        return directoryResolver.findParent(ctx, remote, create);
    }

    /**
     * Return the path of a directory ID from the cache. Never calls the backend.
     *
     * @param id directory ID
     * @return path relative to the true root
     * @throws NotFoundException if the ID is unknown
     */
    public String findPath(String id) throws NotFoundException {
        return pathIdLookup.findPath(id);
    }

    /**
     * @return true once the root has been resolved
     */
    public boolean isRootFound() {
        return rootResolver.isResolved();
    }

    /**
     * @return the root ID, or the true root ID before {@link #findRoot(CallContext)} succeeds
     */
    public String getRootId() {
        return rootResolver.getRootId();
    }

    public String getTrueRootId() {
        return rootResolver.getTrueRootId();
    }

    public String getRoot() {
        return rootResolver.getRoot();
    }
}
