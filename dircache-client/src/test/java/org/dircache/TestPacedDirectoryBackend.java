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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.dircache.pacer.Pacer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestPacedDirectoryBackend {
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private DirectoryBackend backend;
    private Pacer pacer;

    @BeforeEach
    public void setup() {
        backend = mock(DirectoryBackend.class);
        pacer = Pacer.builder()
                .retries(2)
                .minSleep(Duration.ofMillis(10))
                .maxSleep(Duration.ofSeconds(1))
                .sleeper((ctx, time, unit) -> sleeps.add(Duration.ofNanos(unit.toNanos(time))))
                .build();
    }

    @Test
    public void testRetryableRetried() throws Exception {
        when(backend.findLeaf(any(), eq("parent"), eq("leaf")))
                .thenThrow(new RetryableBackendException("slow down"))
                .thenReturn(Optional.of("id"));

        PacedDirectoryBackend paced = new PacedDirectoryBackend(backend, pacer);
        assertEquals(Optional.of("id"), paced.findLeaf(CallContext.background(), "parent", "leaf"));
        verify(backend, times(2)).findLeaf(any(), eq("parent"), eq("leaf"));
        assertEquals(1, sleeps.size());
        assertSame(pacer, paced.getPacer());
    }

    @Test
    public void testOtherExceptionsNotRetried() throws Exception {
        IOException failure = new IOException("permission denied");
        when(backend.createDir(any(), eq("parent"), eq("leaf"))).thenThrow(failure);

        PacedDirectoryBackend paced = new PacedDirectoryBackend(backend, pacer);
        IOException e =
                assertThrows(IOException.class, () -> paced.createDir(CallContext.background(), "parent", "leaf"));
        assertSame(failure, e);
        verify(backend, times(1)).createDir(any(), eq("parent"), eq("leaf"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void testBudgetExhausted() throws Exception {
        when(backend.createDir(any(), eq("parent"), eq("leaf"))).thenThrow(new RetryableBackendException("busy"));

        PacedDirectoryBackend paced = new PacedDirectoryBackend(backend, pacer);
        assertThrows(
                RetryableBackendException.class, () -> paced.createDir(CallContext.background(), "parent", "leaf"));
        verify(backend, times(3)).createDir(any(), eq("parent"), eq("leaf"));
        assertEquals(2, sleeps.size());
    }

    @Test
    public void testCustomPredicate() throws Exception {
        when(backend.createDir(any(), eq("parent"), eq("leaf")))
                .thenThrow(new IOException("reset"))
                .thenReturn("new-id");

        PacedDirectoryBackend paced = new PacedDirectoryBackend(backend, pacer, e -> e instanceof IOException);
        assertEquals("new-id", paced.createDir(CallContext.background(), "parent", "leaf"));
        verify(backend, times(2)).createDir(any(), eq("parent"), eq("leaf"));
    }

    @Test
    public void testIsRetryException() {
        assertTrue(PacedDirectoryBackend.isRetryException(new RetryableBackendException("busy")));
        assertFalse(PacedDirectoryBackend.isRetryException(new BackendException("failed", "a")));
        assertFalse(PacedDirectoryBackend.isRetryException(new IOException()));
    }
}
