/**
 * Copyright (c) 2025 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */


package io.magicbus.client.exchange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Tracks the outstanding results of operations invoked on an exchange.
 * <p>
 * Each completion is settled at most once and is removed from this tracker as soon as it
 * has been settled. Instances are not thread safe and are expected to be used from a single
 * vert.x context only.
 */
public final class DeferredCompletions {

    private static final long NO_TIMER = -1;

    private final Vertx vertx;
    private final List<DeferredCompletion> pending = new ArrayList<>();

    /**
     * Creates a new tracker.
     *
     * @param vertx The vert.x instance to use for running timers.
     * @throws NullPointerException if vertx is {@code null}.
     */
    public DeferredCompletions(final Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    /**
     * Registers a completion that does not time out.
     *
     * @return The completion.
     */
    public DeferredCompletion register() {
        return register(0, null);
    }

    /**
     * Registers a completion that is failed if it has not been settled within a given amount of time.
     *
     * @param timeoutMillis The number of milliseconds after which the completion is failed.
     *                      A value of 0 (or less) disables the timeout.
     * @param timeoutError The supplier of the error to fail the completion with when the timeout is reached.
     * @return The completion.
     * @throws NullPointerException if the timeout is &gt; 0 and the error supplier is {@code null}.
     */
    public DeferredCompletion register(final long timeoutMillis, final Supplier<Throwable> timeoutError) {
        final DeferredCompletion completion = new DeferredCompletion();
        pending.add(completion);
        if (timeoutMillis > 0) {
            Objects.requireNonNull(timeoutError);
            completion.timerId = vertx.setTimer(timeoutMillis, id -> {
                completion.timerId = NO_TIMER;
                completion.tryFail(timeoutError.get());
            });
        }
        return completion;
    }

    /**
     * Fails all completions that have not been settled yet.
     *
     * @param cause The error to fail the completions with.
     * @throws NullPointerException if cause is {@code null}.
     */
    public void failAll(final Throwable cause) {
        Objects.requireNonNull(cause);
        final List<DeferredCompletion> snapshot = new ArrayList<>(pending);
        pending.clear();
        snapshot.forEach(completion -> completion.tryFail(cause));
    }

    /**
     * Gets the number of completions that have not been settled yet.
     *
     * @return The number of completions.
     */
    public int size() {
        return pending.size();
    }

    /**
     * The result of an operation which is settled by the exchange.
     */
    public final class DeferredCompletion {

        private final Promise<Void> promise = Promise.promise();
        private long timerId = NO_TIMER;

        private DeferredCompletion() {
        }

        /**
         * Gets the future that is settled with this completion.
         *
         * @return The future.
         */
        public Future<Void> future() {
            return promise.future();
        }

        /**
         * Checks if this completion has already been settled.
         *
         * @return {@code true} if the completion has been settled.
         */
        public boolean isSettled() {
            return promise.future().isComplete();
        }

        /**
         * Succeeds this completion unless it has already been settled.
         *
         * @return {@code true} if this invocation has settled the completion.
         */
        public boolean tryComplete() {
            if (promise.tryComplete()) {
                settled();
                return true;
            }
            return false;
        }

        /**
         * Fails this completion unless it has already been settled.
         *
         * @param cause The error.
         * @return {@code true} if this invocation has settled the completion.
         */
        public boolean tryFail(final Throwable cause) {
            if (promise.tryFail(cause)) {
                settled();
                return true;
            }
            return false;
        }

        /**
         * Settles this completion with the outcome of another future, unless it has already been settled.
         *
         * @param outcome The future to take the outcome from.
         */
        public void settleWith(final Future<Void> outcome) {
            outcome.onComplete(ar -> {
                if (ar.succeeded()) {
                    tryComplete();
                } else {
                    tryFail(ar.cause());
                }
            });
        }

        private void settled() {
            if (timerId != NO_TIMER) {
                vertx.cancelTimer(timerId);
                timerId = NO_TIMER;
            }
            pending.remove(this);
        }
    }
}
