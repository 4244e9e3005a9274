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

import java.util.Locale;

/**
 * The kinds of exchanges supported by the broker.
 */
public enum ExchangeType {
    /**
     * A direct exchange delivers messages to queues based on the message routing key.
     */
    DIRECT,
    /**
     * A fanout exchange routes messages to all of the queues that are bound to it and the routing key is ignored.
     */
    FANOUT,
    /**
     * A topic exchange routes messages to one or many queues based on matching between a message routing key and the
     * pattern that was used to bind a queue to an exchange.
     */
    TOPIC,
    /**
     * A headers exchange routes on multiple attributes that are more easily expressed as message
     * headers than a routing key.
     */
    HEADERS;

    /**
     * Gets the name of this type as used in an exchange declaration.
     *
     * @return The lower case name.
     */
    public String getBrokerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets the type for a name.
     *
     * @param name The name of the type, case is ignored.
     * @return The type.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalArgumentException if the name does not denote a known type.
     */
    public static ExchangeType from(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
