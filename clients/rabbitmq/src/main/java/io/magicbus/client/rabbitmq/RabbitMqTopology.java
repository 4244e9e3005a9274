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

import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

import io.magicbus.client.ServerErrorException;
import io.magicbus.client.exchange.Topology;
import io.magicbus.util.Futures;
import io.magicbus.util.Subscription;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * The bindings of queues to exchanges on a RabbitMQ connection.
 * <p>
 * All bindings are re-applied after the connection has been re-established.
 * Listeners are notified once all bindings have been (re-)applied, also if some of them failed.
 */
public class RabbitMqTopology implements Topology {

    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqTopology.class);

    private final RabbitMqConnection connection;
    private final List<Binding> bindings = new ArrayList<>();
    private final List<Handler<Void>> bindingsCompletedListeners = new CopyOnWriteArrayList<>();
    private final Subscription reconnectSubscription;

    /**
     * Creates a topology for a connection.
     *
     * @param connection The connection to bind queues on.
     * @throws NullPointerException if connection is {@code null}.
     */
    public RabbitMqTopology(final RabbitMqConnection connection) {
        this.connection = Objects.requireNonNull(connection);
        this.reconnectSubscription = connection.addRebindListener(con -> rebind());
    }

    @Override
    public Subscription addBindingsCompletedListener(final Handler<Void> handler) {
        return Subscription.register(bindingsCompletedListeners, handler);
    }

    /**
     * Binds a queue to an exchange.
     * <p>
     * The binding is recorded and re-applied after the connection has been re-established.
     *
     * @param exchangeName The name of the exchange.
     * @param queueName The name of the queue.
     * @param pattern The routing pattern.
     * @return A future indicating the outcome.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<Void> bind(final String exchangeName, final String queueName, final String pattern) {
        final Binding binding = new Binding(exchangeName, queueName, pattern);
        return Futures.<Void>executeOnContext(connection.getContext(), promise -> apply(binding)
                .onSuccess(ok -> {
                    if (!bindings.contains(binding)) {
                        bindings.add(binding);
                    }
                    notifyBindingsCompleted();
                })
                .onComplete(promise));
    }

    /**
     * Gets the number of recorded bindings.
     *
     * @return The number of bindings.
     */
    public int getBindingCount() {
        return bindings.size();
    }

    /**
     * Stops re-applying the bindings after a reconnect.
     */
    public void close() {
        reconnectSubscription.cancel();
    }

    private void rebind() {
        final List<Binding> toApply = List.copyOf(bindings);
        LOG.debug("re-applying {} binding(s) on connection [{}]", toApply.size(), connection.getName());
        final List<Future<Void>> results = new ArrayList<>(toApply.size());
        toApply.forEach(binding -> results.add(apply(binding)
                .onFailure(t -> LOG.warn("failed to re-apply {}", binding, t))));
        Future.join(results).onComplete(ar -> connection.getContext().runOnContext(go -> notifyBindingsCompleted()));
    }

    private Future<Void> apply(final Binding binding) {
        final Connection brokerConnection = connection.getBrokerConnection();
        if (brokerConnection == null) {
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE,
                    "not connected to broker"));
        }
        return Futures.executeBlocking(connection.getVertx(), () -> {
            final Channel channel = brokerConnection.createChannel();
            if (channel == null) {
                throw new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "no channel available");
            }
            try {
                channel.queueBind(binding.queueName, binding.exchangeName, binding.pattern);
                LOG.debug("applied {}", binding);
            } finally {
                closeChannel(channel);
            }
            return (Void) null;
        });
    }

    private void closeChannel(final Channel channel) {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (final IOException | TimeoutException | ShutdownSignalException e) {
            LOG.debug("error closing channel", e);
        }
    }

    private void notifyBindingsCompleted() {
        bindingsCompletedListeners.forEach(listener -> {
            try {
                listener.handle(null);
            } catch (final RuntimeException e) {
                LOG.warn("error notifying listener about completed bindings", e);
            }
        });
    }

    private static final class Binding {

        private final String exchangeName;
        private final String queueName;
        private final String pattern;

        Binding(final String exchangeName, final String queueName, final String pattern) {
            this.exchangeName = Objects.requireNonNull(exchangeName);
            this.queueName = Objects.requireNonNull(queueName);
            this.pattern = Objects.requireNonNull(pattern);
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Binding)) {
                return false;
            }
            final Binding other = (Binding) obj;
            return exchangeName.equals(other.exchangeName)
                    && queueName.equals(other.queueName)
                    && pattern.equals(other.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(exchangeName, queueName, pattern);
        }

        @Override
        public String toString() {
            return String.format("binding [exchange: %s, queue: %s, pattern: %s]", exchangeName, queueName, pattern);
        }
    }
}
