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
import com.google.common.collect.Maps;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * <p>
 * Bidirectional map between directory paths and directory IDs. Reads proceed concurrently,
 * writes are exclusive. Entries are only ever added or overwritten.
 * </p>
 *
 * <p>
 * Note: {@link #put(String, String)} overwrites each direction independently. If a path is
 * re-pointed at a new ID, the inverse entry of the old ID still names the path until it is
 * itself overwritten.
 * </p>
 */
public class PathCache {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> pathToId = Maps.newHashMap(); // guarded by lock
    private final Map<String, String> idToPath = Maps.newHashMap(); // guarded by lock

    /**
     * Return the ID of the given path
     *
     * @param path directory path
     * @return the ID or empty
     */
    public Optional<String> get(String path) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(pathToId.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Return the path of the given ID
     *
     * @param id directory ID
     * @return the path or empty
     */
    public Optional<String> getInverse(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(idToPath.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Record the path/ID pair in both directions, replacing any previous values
     *
     * @param path directory path
     * @param id directory ID
     */
    public void put(String path, String id) {
        Preconditions.checkNotNull(path, "path cannot be null");
        Preconditions.checkNotNull(id, "id cannot be null");

        lock.writeLock().lock();
        try {
            pathToId.put(path, id);
            idToPath.put(id, path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return number of known paths
     */
    public int size() {
        lock.readLock().lock();
        try {
            return pathToId.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
