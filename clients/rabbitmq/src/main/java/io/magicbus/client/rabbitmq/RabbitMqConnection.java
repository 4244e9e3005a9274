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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.impl.ForgivingExceptionHandler;

import io.magicbus.client.exchange.ExchangeConnection;
import io.magicbus.client.exchange.ExchangeMachine;
import io.magicbus.client.exchange.ExchangeState;
import io.magicbus.client.exchange.ReconnectListener;
import io.magicbus.client.exchange.Topology;
import io.magicbus.client.exchange.config.ExchangeConfigProperties;
import io.magicbus.client.rabbitmq.config.RabbitMqConfigProperties;
import io.magicbus.util.Futures;
import io.magicbus.util.Lifecycle;
import io.magicbus.util.Subscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * A connection to a RabbitMQ broker which re-establishes itself after it has been lost.
 * <p>
 * The RabbitMQ client's automatic connection recovery is used for re-establishing the
 * connection. Topology recovery is disabled because exchanges and bindings are re-declared
 * by the exchanges and topologies created from this connection.
 */
public class RabbitMqConnection implements ExchangeConnection, Lifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqConnection.class);

    private final Vertx vertx;
    private final Context context;
    private final RabbitMqConfigProperties config;
    private final ConnectionFactory connectionFactory;
    private final List<ReconnectListener> reconnectListeners = new CopyOnWriteArrayList<>();
    private final List<ReconnectListener> rebindListeners = new CopyOnWriteArrayList<>();
    private final List<ExchangeMachine> exchanges = new CopyOnWriteArrayList<>();
    private final RabbitMqExchangeChannelFactory channelFactory;

    private volatile Connection brokerConnection;

    /**
     * Creates a new connection.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The connection properties.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public RabbitMqConnection(final Vertx vertx, final RabbitMqConfigProperties config) {
        this(vertx, config, new ConnectionFactory());
    }

    /**
     * Creates a new connection.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The connection properties.
     * @param connectionFactory The factory to use for connecting to the broker.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public RabbitMqConnection(
            final Vertx vertx,
            final RabbitMqConfigProperties config,
            final ConnectionFactory connectionFactory) {

        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.connectionFactory = Objects.requireNonNull(connectionFactory);
        this.context = vertx.getOrCreateContext();
        this.channelFactory = new RabbitMqExchangeChannelFactory(this);
    }

    public final Vertx getVertx() {
        return vertx;
    }

    /**
     * Gets the vert.x context that this connection runs on.
     *
     * @return The context.
     */
    public final Context getContext() {
        return context;
    }

    /**
     * Gets the underlying connection to the broker.
     *
     * @return The connection or {@code null} if not connected.
     */
    public final Connection getBrokerConnection() {
        return brokerConnection;
    }

    @Override
    public String getName() {
        return config.getDisplayName();
    }

    @Override
    public long getPublishTimeout() {
        return config.getPublishTimeout();
    }

    @Override
    public Subscription addReconnectListener(final ReconnectListener listener) {
        return Subscription.register(reconnectListeners, listener);
    }

    /**
     * Registers a listener for re-applying bindings after the connection has been re-established.
     * <p>
     * These listeners are notified after all listeners registered using
     * {@link #addReconnectListener(ReconnectListener)}, so that exchanges are already
     * waiting for their bindings when the bindings are re-applied.
     *
     * @param listener The listener.
     * @return The subscription for removing the listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    Subscription addRebindListener(final ReconnectListener listener) {
        return Subscription.register(rebindListeners, listener);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Same as {@link #connect()}.
     */
    @Override
    public Future<Void> start() {
        return connect();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Same as {@link #shutdown()}.
     */
    @Override
    public Future<Void> stop() {
        return shutdown();
    }

    /**
     * Establishes the connection to the broker.
     *
     * @return A future indicating the outcome of the connection attempt.
     *         The future is succeeded immediately if this connection has been established already.
     */
    public Future<Void> connect() {
        if (brokerConnection != null) {
            return Future.succeededFuture();
        }
        configureFactory();
        LOG.debug("connecting to broker [{}]", getName());
        return Futures.executeBlocking(vertx, () -> {
            final Connection newConnection = config.getName() == null
                    ? connectionFactory.newConnection()
                    : connectionFactory.newConnection(config.getName());
            if (newConnection instanceof Recoverable) {
                ((Recoverable) newConnection).addRecoveryListener(new RecoveryListener() {

                    @Override
                    public void handleRecovery(final Recoverable recoverable) {
                        context.runOnContext(go -> handleReconnect());
                    }

                    @Override
                    public void handleRecoveryStarted(final Recoverable recoverable) {
                        LOG.info("connection [{}] to broker has been lost, trying to recover", getName());
                    }
                });
            }
            return newConnection;
        })
        .map(newConnection -> {
            brokerConnection = newConnection;
            LOG.info("connected to broker [{}]", getName());
            return (Void) null;
        })
        .onFailure(t -> LOG.warn("failed to connect to broker [{}]", getName(), t));
    }

    private void configureFactory() {
        connectionFactory.setHost(config.getHost());
        connectionFactory.setPort(config.getPort());
        connectionFactory.setVirtualHost(config.getVhost());
        connectionFactory.setUsername(config.getUsername());
        connectionFactory.setPassword(config.getPassword());
        connectionFactory.setRequestedHeartbeat(config.getHeartbeat());
        connectionFactory.setConnectionTimeout(config.getConnectTimeout());
        connectionFactory.setNetworkRecoveryInterval(config.getNetworkRecoveryInterval());
        connectionFactory.setAutomaticRecoveryEnabled(true);
        connectionFactory.setTopologyRecoveryEnabled(false);
        connectionFactory.setExceptionHandler(new ForgivingExceptionHandler() {
            @Override
            protected void log(final String message, final Throwable e) {
                LOG.warn("error on connection [{}]: {}", getName(), message, e);
            }
        });
    }

    private void handleReconnect() {
        LOG.info("connection [{}] to broker has been re-established", getName());
        notifyReconnectListeners(reconnectListeners);
        notifyReconnectListeners(rebindListeners);
    }

    private void notifyReconnectListeners(final List<ReconnectListener> listeners) {
        listeners.forEach(listener -> {
            try {
                listener.onReconnect(this);
            } catch (final RuntimeException e) {
                LOG.warn("error notifying listener about re-established connection [{}]", getName(), e);
            }
        });
    }

    /**
     * Creates a topology for binding queues to exchanges on this connection.
     *
     * @return The topology.
     */
    public RabbitMqTopology createTopology() {
        return new RabbitMqTopology(this);
    }

    /**
     * Creates and starts an exchange on this connection.
     * <p>
     * The exchange is created on this connection's vert.x context. It is returned even if
     * it could not be defined on the broker. In that case, the exchange will retry the definition
     * once the connection has been re-established.
     *
     * @param exchangeConfig The properties of the exchange.
     * @param topology The topology that the exchange is part of.
     * @return A future containing the exchange once it has been started.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<ExchangeMachine> createExchange(
            final ExchangeConfigProperties exchangeConfig,
            final Topology topology) {

        Objects.requireNonNull(exchangeConfig);
        Objects.requireNonNull(topology);

        return Futures.executeOnContext(context, promise -> {
            final ExchangeMachine exchange = new ExchangeMachine(vertx, exchangeConfig, this, topology, channelFactory);
            exchanges.add(exchange);
            exchange.start()
                .recover(t -> {
                    LOG.warn("failed to define exchange [{}] on connection [{}]", exchangeConfig.getName(), getName(), t);
                    return Future.succeededFuture();
                })
                .map(exchange)
                .onComplete(promise);
        });
    }

    /**
     * Destroys all exchanges created from this connection and closes the connection.
     * <p>
     * Exchanges that have failed to be defined are not destroyed.
     *
     * @return A future indicating the outcome of closing the connection.
     */
    public Future<Void> shutdown() {
        return Futures.executeOnContext(context, promise -> {
            final List<Future<Void>> destroyed = new ArrayList<>();
            for (final ExchangeMachine exchange : exchanges) {
                if (exchange.getState() != ExchangeState.FAILED) {
                    destroyed.add(exchange.destroy());
                }
            }
            exchanges.clear();
            LOG.debug("destroying {} exchange(s) of connection [{}]", destroyed.size(), getName());
            Future.join(destroyed)
                .transform(ar -> closeConnection())
                .onComplete(promise);
        });
    }

    private Future<Void> closeConnection() {
        final Connection toClose = brokerConnection;
        brokerConnection = null;
        if (toClose == null) {
            return Future.succeededFuture();
        }
        return Futures.executeBlocking(vertx, () -> {
            if (toClose.isOpen()) {
                toClose.close();
            }
            LOG.info("closed connection [{}] to broker", getName());
            return (Void) null;
        });
    }
}
