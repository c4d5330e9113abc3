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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. It can be set once and observed by any number of waiters.
 *
 * <p>The same instance may be shared by several handles; triggering it through any of them
 * is observed by all subscriptions that were given it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class ShutdownSignal {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownSignal.class);

    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    /**
     * Sets the flag and notifies listeners. Calls after the first are no-ops.
     *
     * @return true if this call set the flag
     */
    public boolean trigger() {
        if (!triggered.compareAndSet(false, true)) {
            return false;
        }
        logger.debug("Shutdown signal triggered, notifying {} listeners", listeners.size());
        // whoever removes a listener runs it, so a concurrent onShutdown cannot lose one
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
        completion.complete(null);
        return true;
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    /**
     * Registers a listener to run when the signal is triggered. If the signal is already set
     * the listener runs immediately on the calling thread.
     *
     * @param listener the action to run once
     * @return a handle that unregisters the listener when run
     */
    public Runnable onShutdown(Runnable listener) {
        listeners.add(listener);
        if (triggered.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * @return a future completed when the signal is triggered
     */
    public CompletableFuture<Void> whenTriggered() {
        return completion.thenApply(v -> null);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.warn("Shutdown listener failed: {}", e.getMessage(), e);
        }
    }
}
