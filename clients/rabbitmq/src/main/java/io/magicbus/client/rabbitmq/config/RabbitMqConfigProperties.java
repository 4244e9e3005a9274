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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Properties for connecting to a RabbitMQ broker.
 *
 */
public class RabbitMqConfigProperties {

    /**
     * The default port of the broker.
     */
    public static final int DEFAULT_PORT = 5672;
    /**
     * The default heartbeat interval in seconds.
     */
    public static final int DEFAULT_HEARTBEAT = 30;
    /**
     * The default time to wait for the connection to be established.
     */
    public static final int DEFAULT_CONNECT_TIMEOUT = 5000; // ms
    /**
     * The default time to wait between attempts to re-establish a lost connection.
     */
    public static final long DEFAULT_NETWORK_RECOVERY_INTERVAL = 5000L; // ms

    private String host = "localhost";
    private int port = DEFAULT_PORT;
    private String vhost = "/";
    private String username = "guest";
    private String password = "guest";
    private int heartbeat = DEFAULT_HEARTBEAT;
    private String name;
    private long publishTimeout = 0;
    private int connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private long networkRecoveryInterval = DEFAULT_NETWORK_RECOVERY_INTERVAL;

    /**
     * Creates properties using default values.
     */
    public RabbitMqConfigProperties() {
        super();
    }

    /**
     * Creates properties for existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     * @throws IllegalArgumentException if the options contain invalid values.
     */
    public RabbitMqConfigProperties(final RabbitMqOptions options) {
        super();
        Objects.requireNonNull(options);
        setHost(options.host());
        setPort(options.port());
        setVhost(options.vhost());
        setUsername(options.username());
        setPassword(options.password());
        setHeartbeat(options.heartbeat());
        options.name().ifPresent(this::setName);
        setPublishTimeout(options.publishTimeout());
        setConnectTimeout(options.connectTimeout());
        setNetworkRecoveryInterval(options.networkRecoveryInterval());
    }

    public final String getHost() {
        return host;
    }

    /**
     * Sets the host name or IP address of the broker.
     *
     * @param host The host.
     * @throws NullPointerException if host is {@code null}.
     */
    public final void setHost(final String host) {
        this.host = Objects.requireNonNull(host);
    }

    public final int getPort() {
        return port;
    }

    /**
     * Sets the port of the broker.
     *
     * @param port The port.
     * @throws IllegalArgumentException if the port is not a valid port number.
     */
    public final void setPort(final int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port number");
        }
        this.port = port;
    }

    public final String getVhost() {
        return vhost;
    }

    /**
     * Sets the virtual host to connect to.
     *
     * @param vhost The virtual host.
     * @throws NullPointerException if vhost is {@code null}.
     */
    public final void setVhost(final String vhost) {
        this.vhost = Objects.requireNonNull(vhost);
    }

    public final String getUsername() {
        return username;
    }

    /**
     * Sets the user name to authenticate with.
     *
     * @param username The user name.
     * @throws NullPointerException if username is {@code null}.
     */
    public final void setUsername(final String username) {
        this.username = Objects.requireNonNull(username);
    }

    public final String getPassword() {
        return password;
    }

    /**
     * Sets the password to authenticate with.
     *
     * @param password The password.
     * @throws NullPointerException if password is {@code null}.
     */
    public final void setPassword(final String password) {
        this.password = Objects.requireNonNull(password);
    }

    public final int getHeartbeat() {
        return heartbeat;
    }

    /**
     * Sets the heartbeat interval to request from the broker.
     * <p>
     * The default value of this property is {@value #DEFAULT_HEARTBEAT}.
     *
     * @param heartbeat The interval in seconds. A value of 0 disables heartbeats.
     * @throws IllegalArgumentException if the interval is negative.
     */
    public final void setHeartbeat(final int heartbeat) {
        if (heartbeat < 0) {
            throw new IllegalArgumentException("heartbeat must be >= 0");
        }
        this.heartbeat = heartbeat;
    }

    /**
     * Gets the name that the connection is registered with at the broker.
     *
     * @return The name or {@code null} if not set.
     */
    public final String getName() {
        return name;
    }

    public final void setName(final String name) {
        this.name = name;
    }

    public final long getPublishTimeout() {
        return publishTimeout;
    }

    /**
     * Sets the default time to wait for a message to be published.
     * <p>
     * Exchanges use this value if neither the message nor the exchange define a timeout.
     *
     * @param publishTimeout The timeout in milliseconds. A value of 0 indicates an unbounded wait.
     * @throws IllegalArgumentException if the timeout is negative.
     */
    public final void setPublishTimeout(final long publishTimeout) {
        if (publishTimeout < 0) {
            throw new IllegalArgumentException("publish timeout must be >= 0");
        }
        this.publishTimeout = publishTimeout;
    }

    public final int getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Sets the time to wait for the connection to be established.
     *
     * @param connectTimeout The timeout in milliseconds.
     * @throws IllegalArgumentException if the timeout is negative.
     */
    public final void setConnectTimeout(final int connectTimeout) {
        if (connectTimeout < 0) {
            throw new IllegalArgumentException("connect timeout must be >= 0");
        }
        this.connectTimeout = connectTimeout;
    }

    public final long getNetworkRecoveryInterval() {
        return networkRecoveryInterval;
    }

    /**
     * Sets the time to wait between attempts to re-establish a lost connection.
     *
     * @param networkRecoveryInterval The interval in milliseconds.
     * @throws IllegalArgumentException if the interval is not positive.
     */
    public final void setNetworkRecoveryInterval(final long networkRecoveryInterval) {
        if (networkRecoveryInterval <= 0) {
            throw new IllegalArgumentException("network recovery interval must be > 0");
        }
        this.networkRecoveryInterval = networkRecoveryInterval;
    }

    /**
     * Gets a name for the connection to be used in log messages.
     *
     * @return The configured name or the broker address if no name is set.
     */
    public final String getDisplayName() {
        return Objects.requireNonNullElseGet(name, () -> String.format("amqp://%s:%d%s", host, port, vhost));
    }

    @Override
    public String toString() {
        return MoreObjects
                .toStringHelper(this)
                .add("host", host)
                .add("port", port)
                .add("vhost", vhost)
                .add("username", username)
                .add("heartbeat", heartbeat)
                .add("name", name)
                .add("publishTimeout", publishTimeout)
                .add("connectTimeout", connectTimeout)
                .add("networkRecoveryInterval", networkRecoveryInterval)
                .toString();
    }
}
