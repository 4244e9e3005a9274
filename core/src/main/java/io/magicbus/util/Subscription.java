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

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A handle for a registered listener.
 * <p>
 * Cancelling the subscription removes the listener from the component it
 * has been registered with.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Removes the listener.
     * <p>
     * Invoking this method more than once has no effect.
     */
    void cancel();

    /**
     * Adds a listener to a collection and gets a subscription which removes the listener again.
     *
     * @param <T> The type of listener.
     * @param listeners The collection to add the listener to.
     * @param listener The listener.
     * @return The subscription.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    static <T> Subscription register(final Collection<T> listeners, final T listener) {
        Objects.requireNonNull(listeners);
        Objects.requireNonNull(listener);

        listeners.add(listener);
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        return () -> {
            if (cancelled.compareAndSet(false, true)) {
                listeners.remove(listener);
            }
        };
    }
}
