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
import io.vertx.core.Handler;

/**
 * The bindings between exchanges and queues.
 */
public interface Topology {

    /**
     * Registers a handler to be notified once all declared bindings have been (re-)established on the broker.
     *
     * @param handler The handler.
     * @return The subscription for removing the handler.
     * @throws NullPointerException if handler is {@code null}.
     */
    Subscription addBindingsCompletedListener(Handler<Void> handler);
}
