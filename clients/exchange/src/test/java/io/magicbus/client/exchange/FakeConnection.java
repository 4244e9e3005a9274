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

import io.magicbus.util.Subscription;
import io.vertx.core.Handler;

/**
 * A connection and topology whose notifications are triggered by tests.
 */
final class FakeConnection implements ExchangeConnection, Topology {

    final List<ReconnectListener> reconnectListeners = new ArrayList<>();
    final List<Handler<Void>> bindingsListeners = new ArrayList<>();
    long publishTimeout = 0;

    @Override
    public String getName() {
        return "test-connection";
    }

    @Override
    public long getPublishTimeout() {
        return publishTimeout;
    }

    @Override
    public Subscription addReconnectListener(final ReconnectListener listener) {
        return Subscription.register(reconnectListeners, listener);
    }

    @Override
    public Subscription addBindingsCompletedListener(final Handler<Void> handler) {
        return Subscription.register(bindingsListeners, handler);
    }

    void reconnect() {
        List.copyOf(reconnectListeners).forEach(l -> l.onReconnect(this));
    }

    void completeBindings() {
        List.copyOf(bindingsListeners).forEach(h -> h.handle(null));
    }
}
