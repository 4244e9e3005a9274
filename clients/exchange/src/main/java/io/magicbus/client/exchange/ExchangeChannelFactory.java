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

import io.magicbus.client.exchange.config.ExchangeConfigProperties;

/**
 * A factory for creating channels.
 */
@FunctionalInterface
public interface ExchangeChannelFactory {

    /**
     * Creates a new channel for an exchange.
     *
     * @param config The exchange's properties.
     * @param topology The topology that the exchange is part of.
     * @param publishLog The log to record unconfirmed messages in.
     * @return The channel. The exchange has not been defined on the broker yet.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    ExchangeChannel create(ExchangeConfigProperties config, Topology topology, PublishLog publishLog);
}
