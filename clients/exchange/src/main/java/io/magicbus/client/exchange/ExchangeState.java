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
 * The states that an exchange goes through during its life time.
 */
public enum ExchangeState {

    /**
     * Listeners are being registered.
     */
    SETUP,
    /**
     * The exchange is being defined on a new channel.
     */
    INITIALIZING,
    /**
     * The exchange has been defined and messages can be published.
     */
    READY,
    /**
     * Defining the exchange has failed.
     */
    FAILED,
    /**
     * The exchange is being re-defined on a new channel after the connection has been re-established.
     */
    RECONNECTING,
    /**
     * The exchange has been re-defined and is waiting for the bindings to be re-established.
     */
    RECONNECTED,
    /**
     * The channel has been closed and all listeners have been removed.
     */
    DESTROYED;
}
