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

/**
 * A directory path could not be resolved, or a directory ID has no known path
 */
public class NotFoundException extends DirCacheException {
    private final String path;
    private final String id;

    private NotFoundException(String message, String path, String id) {
        super(message);
        this.path = path;
        this.id = id;
    }

    public static NotFoundException forPath(String path) {
        return new NotFoundException(String.format("couldn't find directory \"%s\"", path), path, null);
    }

    public static NotFoundException forId(String id) {
        return new NotFoundException(String.format("couldn't find path for ID \"%s\"", id), null, id);
    }

    /**
     * @return the path that could not be resolved or null
     */
    public String getPath() {
        return path;
    }

    /**
     * @return the ID that has no known path or null
     */
    public String getId() {
        return id;
    }
}
