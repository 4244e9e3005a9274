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

/**
 * A listener for life cycle events of an exchange.
 * <p>
 * All methods are invoked on the exchange's vert.x context.
 */
public interface ExchangeListener {

    /**
     * Invoked when the exchange has been (re-)defined on the broker.
     */
    default void onDefined() {
    }

    /**
     * Invoked when defining the exchange has failed or when a message is published while
     * the exchange is in a failed state.
     *
     * @param cause The error that defining the exchange has failed with.
     */
    default void onFailed(final Throwable cause) {
    }

    /**
     * Invoked when the exchange's channel has been closed.
     */
    default void onDestroyed() {
    }

    /**
     * Invoked when the exchange has changed its state.
     *
     * @param from The previous state.
     * @param to The new state.
     */
    default void onTransition(final ExchangeState from, final ExchangeState to) {
    }
}
