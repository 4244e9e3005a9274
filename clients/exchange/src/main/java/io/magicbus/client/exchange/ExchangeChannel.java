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

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A live binding of an exchange definition to a single connection attempt.
 * <p>
 * A channel is never re-used: the exchange creates a new channel whenever the
 * exchange needs to be (re-)defined.
 */
public interface ExchangeChannel {

    /**
     * Declares the exchange on the broker.
     *
     * @return A future indicating the outcome of the declaration.
     *         The future will be failed with an {@link ExchangeDefinitionException}
     *         if the broker rejects the declaration.
     */
    Future<Void> define();

    /**
     * Sends a message to the exchange.
     * <p>
     * The message is added to the exchange's publish log once it has been handed to the broker
     * and is removed from the log again once the broker has confirmed the message.
     *
     * @param message The message to send.
     * @return A future indicating the outcome. The future will be succeeded once the broker
     *         has confirmed the message.
     * @throws NullPointerException if message is {@code null}.
     */
    Future<Void> publish(OutboundMessage message);

    /**
     * Closes this channel.
     * <p>
     * Messages that are still waiting for their confirmation are failed but are kept in the
     * publish log.
     *
     * @return A future indicating the outcome of closing the channel.
     */
    Future<Void> destroy();

    /**
     * Sets the handler to invoke when the broker revokes this channel.
     * <p>
     * The handler is invoked at most once.
     *
     * @param handler The handler.
     */
    void releasedHandler(Handler<Void> handler);
}
