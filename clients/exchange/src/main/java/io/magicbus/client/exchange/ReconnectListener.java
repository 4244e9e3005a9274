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
 * A listener to be notified when a connection has been re-established.
 */
@FunctionalInterface
public interface ReconnectListener {

    /**
     * Invoked after the connection has been re-established.
     *
     * @param connection The connection.
     */
    void onReconnect(ExchangeConnection connection);
}
