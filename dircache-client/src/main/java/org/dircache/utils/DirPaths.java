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

package org.dircache.utils;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Helpers for the relative paths used as cache keys: segments joined by {@code /} with no
 * leading or trailing separator. The empty string is the root.
 */
public class DirPaths {
    /**
     * Path separator character.
     */
    public static final String PATH_SEPARATOR = "/";

    private static final Splitter PATH_SPLITTER = Splitter.on(PATH_SEPARATOR).omitEmptyStrings();
    private static final Joiner PATH_JOINER = Joiner.on(PATH_SEPARATOR);

    public static class PathAndLeaf {
        private final String path;
        private final String leaf;

        public PathAndLeaf(String path, String leaf) {
            this.path = path;
            this.leaf = leaf;
        }

        public String getPath() {
            return path;
        }

        public String getLeaf() {
            return leaf;
        }
    }

    /**
     * Convert a user supplied path into its cache key form. i.e. "/one//two/./three/" will
     * return "one/two/three"
     *
     * @param path the path (null is treated as the root)
     * @return normalized path
     * @throws IllegalArgumentException if the path contains a ".." segment
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        return PATH_JOINER.join(split(path));
    }

    /**
     * Given a path, return the individual segments, without slashes or "." segments.
     * The root path will return an empty list.
     *
     * @param path the path
     * @return the segments
     * @throws IllegalArgumentException if the path contains a ".." segment
     */
    public static List<String> split(String path) {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String segment : PATH_SPLITTER.split(path)) {
            if (segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Path segments cannot be \"..\": " + path);
            }
            builder.add(segment);
        }
        return builder.build();
    }

    /**
     * Given path segments, return the path of each prefix. i.e. {"one", "two", "three"} will return
     * {"one", "one/two", "one/two/three"}
     *
     * @param segments the segments
     * @return prefix paths, one per segment
     */
    public static List<String> prefixes(List<String> segments) {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        StringBuilder path = new StringBuilder();
        for (String segment : segments) {
            if (path.length() > 0) {
                path.append(PATH_SEPARATOR);
            }
            path.append(segment);
            builder.add(path.toString());
        }
        return builder.build();
    }

    /**
     * Given a parent path and a child, return the joined path. Either may be empty.
     *
     * @param parent the parent
     * @param child  the child
     * @return joined path
     */
    public static String makePath(String parent, String child) {
        String normalizedParent = normalize(parent);
        String normalizedChild = normalize(child);
        if (normalizedParent.isEmpty()) {
            return normalizedChild;
        }
        if (normalizedChild.isEmpty()) {
            return normalizedParent;
        }
        return normalizedParent + PATH_SEPARATOR + normalizedChild;
    }

    /**
     * Given a path, return its parent path and leaf. i.e. "one/two/three" will return
     * {"one/two", "three"} and "one" will return {"", "one"}
     *
     * @param path the path
     * @return parent and leaf
     */
    public static PathAndLeaf getPathAndLeaf(String path) {
        String normalized = normalize(path);
        int i = normalized.lastIndexOf(PATH_SEPARATOR);
        if (i < 0) {
            return new PathAndLeaf("", normalized);
        }
        return new PathAndLeaf(normalized.substring(0, i), normalized.substring(i + 1));
    }

    private DirPaths() {}
}
