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


package io.magicbus.client.rabbitmq;

import java.util.Objects;

import io.magicbus.client.exchange.ExchangeChannel;
import io.magicbus.client.exchange.ExchangeChannelFactory;
import io.magicbus.client.exchange.PublishLog;
import io.magicbus.client.exchange.Topology;
import io.magicbus.client.exchange.config.ExchangeConfigProperties;

/**
 * A factory for channels on a RabbitMQ connection.
 */
public final class RabbitMqExchangeChannelFactory implements ExchangeChannelFactory {

    private final RabbitMqConnection connection;

    /**
     * Creates a new factory.
     *
     * @param connection The connection to create channels on.
     * @throws NullPointerException if connection is {@code null}.
     */
    public RabbitMqExchangeChannelFactory(final RabbitMqConnection connection) {
        this.connection = Objects.requireNonNull(connection);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The channel is opened on the broker connection that is current at the time
     * the exchange gets defined.
     */
    @Override
    public ExchangeChannel create(
            final ExchangeConfigProperties config,
            final Topology topology,
            final PublishLog publishLog) {

        Objects.requireNonNull(config);
        Objects.requireNonNull(topology);
        Objects.requireNonNull(publishLog);

        return new RabbitMqExchangeChannel(
                connection.getVertx(),
                connection.getBrokerConnection(),
                config,
                publishLog);
    }
}
