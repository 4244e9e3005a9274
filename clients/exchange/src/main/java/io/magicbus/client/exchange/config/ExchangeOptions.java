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

package io.magicbus.client.exchange.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Options for defining an exchange on the broker.
 *
 */
@ConfigMapping(prefix = "magicbus.exchange", namingStrategy = NamingStrategy.VERBATIM)
public interface ExchangeOptions {

    /**
     * Gets the name of the exchange.
     *
     * @return The name.
     */
    String name();

    /**
     * Gets the kind of exchange.
     *
     * @return The type name, one of <em>direct</em>, <em>fanout</em>, <em>topic</em> or <em>headers</em>.
     */
    @WithDefault("topic")
    String type();

    /**
     * Checks if the exchange survives broker restarts.
     *
     * @return {@code true} if the exchange is durable.
     */
    @WithDefault("true")
    boolean durable();

    /**
     * Checks if messages cannot be published directly to the exchange.
     *
     * @return {@code true} if the exchange may only be the target of bindings.
     */
    @WithDefault("false")
    boolean internal();

    /**
     * Checks if the exchange is deleted once the last binding for which it is the source is removed.
     *
     * @return {@code true} if the exchange is auto-deleted.
     */
    @WithDefault("false")
    boolean autoDelete();

    /**
     * Gets the exchange to send messages to which cannot be routed to any queue.
     *
     * @return The name of the alternate exchange.
     */
    Optional<String> alternateExchange();

    /**
     * Gets additional broker specific arguments.
     *
     * @return The arguments.
     */
    Map<String, String> arguments();

    /**
     * Gets the time to wait for a publish to complete before giving up.
     *
     * @return The timeout in milliseconds. A value of 0 indicates an unbounded wait.
     */
    @WithDefault("0")
    long publishTimeout();
}
