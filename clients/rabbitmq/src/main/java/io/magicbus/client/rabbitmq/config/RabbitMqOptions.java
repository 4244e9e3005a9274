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


package io.magicbus.client.rabbitmq.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the connection to a RabbitMQ broker.
 *
 */
@ConfigMapping(prefix = "magicbus.connection", namingStrategy = NamingStrategy.VERBATIM)
public interface RabbitMqOptions {

    /**
     * Gets the host name or IP address of the broker.
     *
     * @return The host.
     */
    @WithDefault("localhost")
    String host();

    /**
     * Gets the port of the broker.
     *
     * @return The port.
     */
    @WithDefault("5672")
    int port();

    /**
     * Gets the virtual host to connect to.
     *
     * @return The virtual host.
     */
    @WithDefault("/")
    String vhost();

    /**
     * Gets the user name to authenticate with.
     *
     * @return The user name.
     */
    @WithDefault("guest")
    String username();

    /**
     * Gets the password to authenticate with.
     *
     * @return The password.
     */
    @WithDefault("guest")
    String password();

    /**
     * Gets the requested heartbeat interval.
     *
     * @return The interval in seconds.
     */
    @WithDefault("30")
    int heartbeat();

    /**
     * Gets the name that the connection is registered with at the broker.
     *
     * @return The name.
     */
    Optional<String> name();

    /**
     * Gets the default time to wait for a message to be published.
     *
     * @return The timeout in milliseconds.
     */
    @WithDefault("0")
    long publishTimeout();

    /**
     * Gets the time to wait for the connection to be established.
     *
     * @return The timeout in milliseconds.
     */
    @WithDefault("5000")
    int connectTimeout();

    /**
     * Gets the time to wait between attempts to re-establish a lost connection.
     *
     * @return The interval in milliseconds.
     */
    @WithDefault("5000")
    long networkRecoveryInterval();
}
