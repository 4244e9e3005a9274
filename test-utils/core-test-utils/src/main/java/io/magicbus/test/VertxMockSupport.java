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

package io.magicbus.test;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Argument matchers and mocks for the use with vert.x.
 */
public final class VertxMockSupport {

    private VertxMockSupport() {
    }

    /**
     * Creates a mocked vert.x Context which immediately invokes any handler that is passed to its runOnContext method.
     *
     * @param owner The vert.x instance that will be the owner of the created context.
     * @return The mocked context.
     */
    public static Context mockContext(final Vertx owner) {

        final Context context = mock(Context.class);

        when(context.owner()).thenReturn(owner);
        doAnswer(invocation -> {
            final Handler<Void> handler = invocation.getArgument(0);
            handler.handle(null);
            return null;
        }).when(context).runOnContext(VertxMockSupport.anyHandler());
        return context;
    }

    /**
     * Creates a mocked vert.x instance whose {@link Vertx#getOrCreateContext()} method returns
     * a context that immediately runs any handler passed to it.
     *
     * @return The mocked vert.x instance.
     */
    public static Vertx mockVertxWithImmediateContext() {
        final Vertx vertx = mock(Vertx.class);
        final Context context = mockContext(vertx);
        when(vertx.getOrCreateContext()).thenReturn(context);
        return vertx;
    }

    /**
     * Records the timers set on the given vert.x instance instead of running them.
     * <p>
     * Tests can fire a timer by removing its handler from the returned map and invoking it.
     * Cancelling a timer removes it from the map.
     *
     * @param vertx The mocked vert.x instance.
     * @return The pending timers, sorted by timer ID.
     */
    public static Map<Long, Handler<Long>> captureTimers(final Vertx vertx) {

        final Map<Long, Handler<Long>> timers = new TreeMap<>();
        final AtomicLong timerIds = new AtomicLong();
        when(vertx.setTimer(anyLong(), VertxMockSupport.anyHandler())).thenAnswer(invocation -> {
            final long timerId = timerIds.incrementAndGet();
            final Handler<Long> handler = invocation.getArgument(1);
            timers.put(timerId, handler);
            return timerId;
        });
        when(vertx.cancelTimer(anyLong())).thenAnswer(invocation -> {
            final Long timerId = invocation.getArgument(0);
            return timers.remove(timerId) != null;
        });
        return timers;
    }

    /**
     * Fires the timer with the given ID, if it is still pending.
     *
     * @param timers The timers recorded by {@link #captureTimers(Vertx)}.
     * @param timerId The timer to fire.
     * @return {@code true} if the timer has been fired.
     */
    public static boolean fireTimer(final Map<Long, Handler<Long>> timers, final long timerId) {
        final Handler<Long> handler = timers.remove(timerId);
        if (handler == null) {
            return false;
        }
        handler.handle(timerId);
        return true;
    }

    /**
     * Ensures that blocking code is executed immediately on the given vert.x instance.
     *
     * @param vertx The mocked vert.x instance.
     */
    @SuppressWarnings("deprecation")
    public static void executeBlockingCodeImmediately(final Vertx vertx) {

        doAnswer(VertxMockSupport::handleExecuteBlockingInvocation)
                .when(vertx).executeBlocking(anyHandler(), anyHandler());
    }

    private static Void handleExecuteBlockingInvocation(final InvocationOnMock invocation) {
        final Promise<Object> result = Promise.promise();
        final Handler<Promise<Object>> blockingCodeHandler = invocation.getArgument(0);
        final Handler<AsyncResult<Object>> resultHandler = invocation.getArgument(1);
        blockingCodeHandler.handle(result);
        if (resultHandler != null) {
            resultHandler.handle(result.future());
        }
        return null;
    }

    /**
     * Matches any handler of given type, excluding nulls.
     *
     * @param <T> The handler type.
     * @return The value returned by {@link ArgumentMatchers#any(Class)}.
     */
    public static <T> Handler<T> anyHandler() {
        @SuppressWarnings("unchecked")
        final Handler<T> result = ArgumentMatchers.any(Handler.class);
        return result;
    }

    /**
     * Creates mock object for a handler.
     *
     * @param <T> The handler type.
     * @return The value returned by {@link Mockito#mock(Class)}.
     */
    public static <T> Handler<T> mockHandler() {
        @SuppressWarnings("unchecked")
        final Handler<T> result = Mockito.mock(Handler.class);
        return result;
    }
}
