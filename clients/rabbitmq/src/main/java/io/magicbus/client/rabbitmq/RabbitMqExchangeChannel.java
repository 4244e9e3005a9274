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
import java.util.Date;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownSignalException;

import io.magicbus.client.ClientErrorException;
import io.magicbus.client.ServerErrorException;
import io.magicbus.client.exchange.ExchangeChannel;
import io.magicbus.client.exchange.ExchangeDefinitionException;
import io.magicbus.client.exchange.OutboundMessage;
import io.magicbus.client.exchange.PublishLog;
import io.magicbus.client.exchange.config.ExchangeConfigProperties;
import io.magicbus.util.Futures;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * A channel for publishing messages to a RabbitMQ exchange using publisher confirms.
 * <p>
 * All methods are expected to be invoked on the vert.x context that the channel has been
 * created on. Notifications from the RabbitMQ client are processed on that context as well.
 */
public final class RabbitMqExchangeChannel implements ExchangeChannel {

    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqExchangeChannel.class);
    private static final int DELIVERY_MODE_NON_PERSISTENT = 1;
    private static final int DELIVERY_MODE_PERSISTENT = 2;

    private final Vertx vertx;
    private final Context context;
    private final Connection brokerConnection;
    private final ExchangeConfigProperties config;
    private final PublishLog publishLog;
    private final NavigableMap<Long, UnconfirmedMessage> unconfirmed = new TreeMap<>();

    private Channel channel;
    private Handler<Void> releasedHandler;
    private boolean released = false;
    private volatile boolean destroyed = false;

    /**
     * Creates a new channel.
     *
     * @param vertx The vert.x instance to run blocking code on.
     * @param brokerConnection The connection to open the channel on or {@code null} if not connected.
     * @param config The properties of the exchange.
     * @param publishLog The log to record unconfirmed messages in.
     * @throws NullPointerException if any of vertx, config or publish log are {@code null}.
     */
    public RabbitMqExchangeChannel(
            final Vertx vertx,
            final Connection brokerConnection,
            final ExchangeConfigProperties config,
            final PublishLog publishLog) {

        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.publishLog = Objects.requireNonNull(publishLog);
        this.brokerConnection = brokerConnection;
        this.context = vertx.getOrCreateContext();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Opens a channel in confirm mode and declares the exchange on it.
     */
    @Override
    public Future<Void> define() {

        if (brokerConnection == null) {
            return Future.failedFuture(new ExchangeDefinitionException(
                    config.getName(),
                    new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "not connected to broker")));
        }

        return Futures.executeBlocking(vertx, () -> {
            final Channel newChannel = brokerConnection.createChannel();
            if (newChannel == null) {
                throw new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "no channel available");
            }
            try {
                newChannel.confirmSelect();
                newChannel.exchangeDeclare(
                        config.getName(),
                        config.getType().getBrokerName(),
                        config.isDurable(),
                        config.isAutoDelete(),
                        config.isInternal(),
                        config.getDeclareArguments());
            } catch (final IOException | RuntimeException e) {
                abort(newChannel);
                throw e;
            }
            return newChannel;
        })
        .map(newChannel -> {
            registerListeners(newChannel);
            this.channel = newChannel;
            LOG.debug("declared {} exchange [{}] on channel {}",
                    config.getType().getBrokerName(), config.getName(), newChannel.getChannelNumber());
            return (Void) null;
        })
        .recover(t -> {
            LOG.debug("failed to declare exchange [{}]", config.getName(), t);
            if (t instanceof ExchangeDefinitionException) {
                return Future.failedFuture(t);
            }
            return Future.failedFuture(new ExchangeDefinitionException(config.getName(), t));
        });
    }

    private void registerListeners(final Channel newChannel) {
        newChannel.addConfirmListener(new ConfirmListener() {

            @Override
            public void handleAck(final long deliveryTag, final boolean multiple) {
                context.runOnContext(go -> settle(deliveryTag, multiple, true));
            }

            @Override
            public void handleNack(final long deliveryTag, final boolean multiple) {
                context.runOnContext(go -> settle(deliveryTag, multiple, false));
            }
        });
        newChannel.addShutdownListener(cause -> context.runOnContext(go -> handleShutdown(cause)));
        if (newChannel instanceof Recoverable) {
            ((Recoverable) newChannel).addRecoveryListener(new RecoveryListener() {

                @Override
                public void handleRecovery(final Recoverable recoverable) {
                    if (destroyed) {
                        LOG.debug("aborting recovered channel of exchange [{}]", config.getName());
                        abort(newChannel);
                    }
                }

                @Override
                public void handleRecoveryStarted(final Recoverable recoverable) {
                    // nothing to do
                }
            });
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * The returned future is failed with a {@link ClientErrorException} if the exchange is
     * internal, or with a {@link ServerErrorException} if the channel is not open, the message
     * could not be sent or the broker has rejected the message.
     */
    @Override
    public Future<Void> publish(final OutboundMessage message) {
        Objects.requireNonNull(message);

        if (config.isInternal()) {
            return Future.failedFuture(new ClientErrorException(
                    HttpURLConnection.HTTP_FORBIDDEN,
                    String.format("cannot publish to internal exchange [%s]", config.getName())));
        }
        if (channel == null || destroyed) {
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE,
                    String.format("channel of exchange [%s] is not open", config.getName())));
        }

        final Promise<Void> result = Promise.promise();
        final long deliveryTag = channel.getNextPublishSeqNo();
        final long sequenceNo = publishLog.append(message);
        unconfirmed.put(deliveryTag, new UnconfirmedMessage(sequenceNo, result));
        try {
            LOG.trace("publishing message to exchange [{}] with delivery tag {}: {}",
                    config.getName(), deliveryTag, message);
            channel.basicPublish(
                    config.getName(),
                    message.getRoutingKey(),
                    getProperties(message),
                    message.getPayload().getBytes());
        } catch (final IOException | RuntimeException e) {
            LOG.debug("failed to publish message to exchange [{}]", config.getName(), e);
            unconfirmed.remove(deliveryTag);
            publishLog.confirm(sequenceNo);
            result.tryFail(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE,
                    "failed to publish message",
                    e));
        }
        return result.future();
    }

    static AMQP.BasicProperties getProperties(final OutboundMessage message) {
        final AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder()
                .contentType(message.getContentType())
                .contentEncoding(message.getContentEncoding())
                .messageId(message.getMessageId())
                .type(message.getType())
                .correlationId(message.getCorrelationId())
                .deliveryMode(message.isPersistent() ? DELIVERY_MODE_PERSISTENT : DELIVERY_MODE_NON_PERSISTENT)
                .timestamp(new Date());
        if (!message.getHeaders().isEmpty()) {
            props.headers(message.getHeaders());
        }
        return props.build();
    }

    private void settle(final long deliveryTag, final boolean multiple, final boolean ack) {
        final List<UnconfirmedMessage> settled = new ArrayList<>();
        if (multiple) {
            final NavigableMap<Long, UnconfirmedMessage> head = unconfirmed.headMap(deliveryTag, true);
            settled.addAll(head.values());
            head.clear();
        } else {
            final UnconfirmedMessage entry = unconfirmed.remove(deliveryTag);
            if (entry != null) {
                settled.add(entry);
            }
        }
        if (!ack && !settled.isEmpty()) {
            LOG.warn("broker has rejected {} message(s) published to exchange [{}]", settled.size(), config.getName());
        }
        for (final UnconfirmedMessage entry : settled) {
            publishLog.confirm(entry.sequenceNo);
            if (ack) {
                entry.result.tryComplete();
            } else {
                entry.result.tryFail(new ServerErrorException(
                        HttpURLConnection.HTTP_UNAVAILABLE,
                        "message has been rejected by broker"));
            }
        }
    }

    private void handleShutdown(final ShutdownSignalException cause) {
        failUnconfirmed(cause);
        if (!cause.isHardError() && !cause.isInitiatedByApplication() && !destroyed && !released) {
            released = true;
            LOG.warn("broker has closed channel of exchange [{}]: {}", config.getName(), cause.getMessage());
            if (releasedHandler != null) {
                releasedHandler.handle(null);
            }
        }
    }

    private void failUnconfirmed(final Throwable cause) {
        if (unconfirmed.isEmpty()) {
            return;
        }
        LOG.debug("failing {} unconfirmed message(s) of exchange [{}]", unconfirmed.size(), config.getName());
        final List<UnconfirmedMessage> entries = new ArrayList<>(unconfirmed.values());
        unconfirmed.clear();
        // entries stay in the publish log for being re-sent
        entries.forEach(entry -> entry.result.tryFail(new ServerErrorException(
                HttpURLConnection.HTTP_UNAVAILABLE,
                "channel has been closed",
                cause)));
    }

    /**
     * {@inheritDoc}
     * <p>
     * Closing a channel that has already been closed succeeds.
     */
    @Override
    public Future<Void> destroy() {
        destroyed = true;
        failUnconfirmed(null);
        final Channel current = channel;
        channel = null;
        if (current == null) {
            return Future.succeededFuture();
        }
        return Futures.executeBlocking(vertx, () -> {
            if (current.isOpen()) {
                current.close();
            }
            return (Void) null;
        })
        .recover(t -> {
            if (t instanceof AlreadyClosedException) {
                return Future.succeededFuture();
            }
            return Future.failedFuture(t);
        });
    }

    @Override
    public void releasedHandler(final Handler<Void> handler) {
        this.releasedHandler = handler;
    }

    private void abort(final Channel toAbort) {
        try {
            toAbort.abort();
        } catch (final IOException e) {
            LOG.debug("error aborting channel of exchange [{}]", config.getName(), e);
        }
    }

    private static final class UnconfirmedMessage {

        private final long sequenceNo;
        private final Promise<Void> result;

        UnconfirmedMessage(final long sequenceNo, final Promise<Void> result) {
            this.sequenceNo = sequenceNo;
            this.result = result;
        }
    }
}
