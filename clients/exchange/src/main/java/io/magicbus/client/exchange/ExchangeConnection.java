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

import io.magicbus.util.Subscription;

/**
 * The connection to the broker that exchanges are created on.
 */
public interface ExchangeConnection {

    /**
     * Gets the name of this connection.
     *
     * @return The name, used for logging.
     */
    String getName();

    /**
     * Gets the default time to wait for a message to be published.
     *
     * @return The timeout in milliseconds or 0 if publishing should not time out.
     */
    long getPublishTimeout();

    /**
     * Registers a listener to be notified after the connection has been re-established.
     *
     * @param listener The listener.
     * @return The subscription for removing the listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    Subscription addReconnectListener(ReconnectListener listener);
}
