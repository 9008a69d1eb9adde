/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.automation.concurrent;

import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Counting admission gate bounding how many nodes execute at once.
 * <p>
 * {@link #acquire()} completes immediately while permits remain, otherwise the subscriber is
 * queued. {@link #release()} hands the permit straight to the oldest waiter when there is one,
 * so waiters are admitted in FIFO order and the number of outstanding permits never exceeds the
 * limit. A waiter that cancels before being admitted leaves the queue without consuming a permit.
 */
public class PermitGate {

    private final int limit;
    private final Deque<MonoSink<Void>> waiters = new ArrayDeque<>();
    private int permits;

    public PermitGate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
        this.limit = limit;
        this.permits = limit;
    }

    /**
     * Returns a Mono that completes once a permit is held by the subscriber.
     */
    public Mono<Void> acquire() {
        return Mono.create(sink -> {
            boolean granted;
            synchronized (this) {
                granted = permits > 0;
                if (granted) {
                    permits--;
                } else {
                    waiters.addLast(sink);
                }
            }
            if (granted) {
                sink.success();
            } else {
                sink.onCancel(() -> {
                    synchronized (this) {
                        waiters.remove(sink);
                    }
                });
            }
        });
    }

    /**
     * Takes a permit without waiting. Fails while other subscribers are queued so that a
     * caller cannot overtake them.
     *
     * @return {@code true} if a permit was taken
     */
    public synchronized boolean tryAcquire() {
        if (permits > 0 && waiters.isEmpty()) {
            permits--;
            return true;
        }
        return false;
    }

    /**
     * Returns a permit, admitting the next waiter if one is queued.
     *
     * @throws IllegalStateException when more permits are released than were acquired
     */
    public void release() {
        MonoSink<Void> next;
        synchronized (this) {
            if (permits >= limit) {
                throw new IllegalStateException("Permit released more times than acquired");
            }
            permits++;
            next = waiters.pollFirst();
            if (next != null) {
                permits--;
            }
        }
        if (next != null) {
            next.success();
        }
    }

    public synchronized int availablePermits() {
        return permits;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    public int limit() {
        return limit;
    }
}
