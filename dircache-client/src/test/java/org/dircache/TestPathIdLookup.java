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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestPathIdLookup {
    private InMemoryDirectoryBackend backend;
    private PathCache cache;
    private RootResolver rootResolver;
    private PathIdLookup lookup;

    @BeforeEach
    public void setup() {
        backend = new InMemoryDirectoryBackend();
        cache = new PathCache();
        rootResolver = new RootResolver("a/b", "root", cache, backend);
        lookup = new PathIdLookup(rootResolver, cache);
    }

    @Test
    public void testRootIds() throws Exception {
        assertEquals("a/b", lookup.findPath("root"));

        String rootId = rootResolver.findRoot(CallContext.background());
        assertEquals("a/b", lookup.findPath(rootId));
        assertEquals("a/b", lookup.findPath("root"));
    }

    @Test
    public void testCachedIds() throws Exception {
        rootResolver.findRoot(CallContext.background());
        String aId = backend.idOf("root", "a");
        assertEquals("a", lookup.findPath(aId));

        DirectoryResolver resolver = new DirectoryResolver(rootResolver, cache, backend);
        String xId = resolver.makeDirs(CallContext.background(), "x");
        assertEquals("a/b/x", lookup.findPath(xId));
        backend.clearCalls();
        lookup.findPath(xId);
        assertEquals(0, backend.getFindLeafCalls().size());
    }

    @Test
    public void testUnknownId() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> lookup.findPath("nope"));
        assertEquals("nope", e.getId());
        assertEquals("couldn't find path for ID \"nope\"", e.getMessage());
    }

    @Test
    public void testEmptyId() {
        assertThrows(IllegalArgumentException.class, () -> lookup.findPath(""));
        assertThrows(IllegalArgumentException.class, () -> lookup.findPath(null));
    }
}
