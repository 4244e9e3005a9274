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

package io.magicbus.util;

import java.util.Objects;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Helper class working with vert.x futures.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Interface representing blocking code to be executed.
     *
     * @param <T> The type of the result.
     */
    @FunctionalInterface
    public interface BlockingCode<T> {

        /**
         * Blocking method to run.
         *
         * @return The result of the method execution.
         * @throws Exception The exception.
         */
        T run() throws Exception;
    }

    /**
     * Use {@link Vertx#executeBlocking(Handler, Handler)} with Futures.
     * <p>
     * Invocations from the same context are executed in order.
     *
     * @param <T> The type of the result.
     * @param vertx The vertx context.
     * @param blocking The blocking code.
     * @return The future, reporting the result.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    @SuppressWarnings("deprecation")
    public static <T> Future<T> executeBlocking(final Vertx vertx, final BlockingCode<T> blocking) {
        Objects.requireNonNull(vertx);
        Objects.requireNonNull(blocking);

        final Promise<T> result = Promise.promise();

        vertx.<T>executeBlocking(promise -> {
            try {
                promise.complete(blocking.run());
            } catch (final Exception e) {
                promise.fail(e);
            }
        }, result);

        return result.future();
    }

    /**
     * Executes some code on a given context.
     * <p>
     * If invoked from the given context, the code is run directly. Otherwise it is
     * scheduled to be run asynchronously on the given context.
     *
     * @param <T> The type of the result that the code produces.
     * @param requiredContext The context to run the code on.
     * @param codeToRun The code to execute. The code is required to either complete or
     *                  fail the promise that is passed into the handler.
     * @return The future containing the result of the promise passed in to the handler for
     *         executing the code. The future thus indicates the outcome of executing the code.
     * @throws NullPointerException If any of the parameters is {@code null}.
     */
    public static <T> Future<T> executeOnContext(
            final Context requiredContext,
            final Handler<Promise<T>> codeToRun) {

        Objects.requireNonNull(requiredContext);
        Objects.requireNonNull(codeToRun);

        final Promise<T> result = Promise.promise();
        if (requiredContext == Vertx.currentContext()) {
            // already running on the correct Context, so just execute the code
            codeToRun.handle(result);
        } else {
            requiredContext.runOnContext(go -> codeToRun.handle(result));
        }
        return result.future();
    }

    /**
     * Applies the given result on the given promise using {@link Promise#tryComplete(Object)} or
     * {@link Promise#tryFail(Throwable)}.
     * <p>
     * Similar to {@link Promise#handle(AsyncResult)} but does nothing if the promise is already complete.
     *
     * @param promise The promise to complete or fail.
     * @param asyncResult The result to apply.
     * @param <T> The promise and result type.
     * @return {@code true} if the promise has been completed by this invocation.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static <T> boolean tryHandleResult(final Promise<T> promise, final AsyncResult<T> asyncResult) {
        Objects.requireNonNull(promise);
        Objects.requireNonNull(asyncResult);

        if (asyncResult.succeeded()) {
            return promise.tryComplete(asyncResult.result());
        } else {
            return promise.tryFail(asyncResult.cause());
        }
    }
}
