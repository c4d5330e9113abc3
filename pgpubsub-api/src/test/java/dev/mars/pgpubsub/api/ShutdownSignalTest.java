package dev.mars.pgpubsub.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class ShutdownSignalTest {

    @Test
    void testTriggerSetsFlagOnce() {
        ShutdownSignal signal = new ShutdownSignal();
        assertFalse(signal.isTriggered());

        assertTrue(signal.trigger());
        assertFalse(signal.trigger());
        assertTrue(signal.isTriggered());
    }

    @Test
    void testListenersRunExactlyOnce() {
        ShutdownSignal signal = new ShutdownSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onShutdown(calls::incrementAndGet);
        signal.onShutdown(calls::incrementAndGet);

        signal.trigger();
        signal.trigger();

        assertEquals(2, calls.get());
    }

    @Test
    void testListenerRegisteredAfterTriggerRunsImmediately() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();

        AtomicInteger calls = new AtomicInteger();
        signal.onShutdown(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testUnregisteredListenerDoesNotRun() {
        ShutdownSignal signal = new ShutdownSignal();
        AtomicInteger calls = new AtomicInteger();
        Runnable cancel = signal.onShutdown(calls::incrementAndGet);

        cancel.run();
        signal.trigger();

        assertEquals(0, calls.get());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        ShutdownSignal signal = new ShutdownSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onShutdown(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onShutdown(calls::incrementAndGet);

        signal.trigger();

        assertEquals(1, calls.get());
        assertTrue(signal.whenTriggered().isDone());
    }

    @Test
    void testWhenTriggeredCompletesOnTrigger() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        CompletableFuture<Void> future = signal.whenTriggered();
        assertFalse(future.isDone());

        signal.trigger();

        assertNull(future.get(1, TimeUnit.SECONDS));
    }

    @Test
    void testWhenTriggeredCannotBeCompletedByCaller() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.whenTriggered().complete(null);

        assertFalse(signal.isTriggered());
        assertFalse(signal.whenTriggered().isDone());
    }

    @Test
    void testConcurrentRegistrationAndTriggerLosesNoListener() throws Exception {
        for (int round = 0; round < 50; round++) {
            ShutdownSignal signal = new ShutdownSignal();
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                for (int i = 0; i < 3; i++) {
                    executor.submit(() -> {
                        start.await();
                        for (int j = 0; j < 20; j++) {
                            signal.onShutdown(calls::incrementAndGet);
                        }
                        return null;
                    });
                }
                executor.submit(() -> {
                    start.await();
                    signal.trigger();
                    return null;
                });
                start.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertEquals(60, calls.get());
        }
    }
}
