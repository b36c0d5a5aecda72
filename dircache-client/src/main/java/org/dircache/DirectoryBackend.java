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
 * The low level directory operations of an ID addressed store. Implemented by the store's
 * client and called by {@link DirCache} when a path is not cached.
 */
public interface DirectoryBackend {
    /**
     * Look up a directory by name inside a parent directory. Must not create anything.
     *
     * @param ctx call context
     * @param parentId ID of the parent directory
     * @param leaf name of the directory to find
     * @return the directory's ID or empty if there is no such directory
     * @throws Exception backend errors
     */
    Optional<String> findLeaf(CallContext ctx, String parentId, String leaf) throws Exception;

    /**
     * Create a directory inside a parent directory. Below the root this is only called after
     * {@link #findLeaf(CallContext, String, String)} found nothing. The root's directories are
     * created without a lookup, so an existing directory should be returned rather than
     * duplicated.
     *
     * @param ctx call context
     * @param parentId ID of the parent directory
     * @param leaf name of the new directory
     * @return the new directory's ID
     * @throws Exception backend errors
     */
    String createDir(CallContext ctx, String parentId, String leaf) throws Exception;
}
