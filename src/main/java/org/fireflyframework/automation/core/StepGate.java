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

package org.fireflyframework.automation.core;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Manual confirmation gate used in step-by-step mode.
 * <p>
 * Every node awaiting confirmation holds a one-shot signal; {@link #confirmNext()} fulfils the
 * oldest one exactly once.
 */
class StepGate {

    private final Deque<Sinks.One<Void>> pending = new ArrayDeque<>();

    Mono<Void> await() {
        return Mono.defer(() -> {
            Sinks.One<Void> signal = Sinks.one();
            synchronized (this) {
                pending.addLast(signal);
            }
            return signal.asMono().doOnCancel(() -> {
                synchronized (this) {
                    pending.remove(signal);
                }
            });
        });
    }

    /**
     * Releases the oldest waiting node.
     *
     * @return {@code false} when no node is waiting
     */
    boolean confirmNext() {
        Sinks.One<Void> signal;
        synchronized (this) {
            signal = pending.pollFirst();
        }
        if (signal == null) {
            return false;
        }
        signal.tryEmitEmpty();
        return true;
    }

    synchronized int waiting() {
        return pending.size();
    }
}
