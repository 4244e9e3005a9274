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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.magicbus.client.exchange.DeferredCompletions.DeferredCompletion;
import io.magicbus.client.exchange.config.ExchangeConfigProperties;
import io.magicbus.client.exchange.config.ExchangeType;
import io.magicbus.util.Futures;
import io.magicbus.util.Lifecycle;
import io.magicbus.util.Subscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * An exchange which survives connection loss and broker restarts.
 * <p>
 * The exchange keeps track of its state and decides for each operation invoked on it whether
 * the operation is executed right away, deferred until the exchange has reached a particular
 * state or rejected. Deferred operations are executed in the order in which they have been
 * invoked once the exchange reaches the state they are waiting for.
 * <p>
 * After the connection has been re-established, the exchange is defined on a new channel and
 * all messages which have not been confirmed on the previous channel are re-sent once the
 * topology reports that all bindings have been re-established.
 * <p>
 * All state is accessed from the vert.x context that the exchange has been created on only.
 */
public final class ExchangeMachine implements Lifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(ExchangeMachine.class);

    private final Context context;
    private final ExchangeConfigProperties config;
    private final ExchangeConnection connection;
    private final Topology topology;
    private final ExchangeChannelFactory channelFactory;
    private final PublishLog publishLog = new PublishLog();
    private final DeferredCompletions completions;
    private final Map<ExchangeState, Deque<Runnable>> deferred = new EnumMap<>(ExchangeState.class);
    private final List<ExchangeListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    private volatile ExchangeState state = ExchangeState.SETUP;
    private ExchangeChannel channel;
    private Throwable failureCause;
    private Future<Void> teardown = Future.succeededFuture();
    private boolean started = false;
    private boolean bindingsPending = true;
    private ExchangeChannel replayingOn;

    /**
     * Creates a new exchange.
     * <p>
     * The exchange is bound to the vert.x context of the invoking thread, or a new
     * context if the invoking thread is not a vert.x thread.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The exchange's properties.
     * @param connection The connection to create the exchange on.
     * @param topology The topology that the exchange is part of.
     * @param channelFactory The factory for creating channels.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the properties do not contain a name.
     */
    public ExchangeMachine(
            final Vertx vertx,
            final ExchangeConfigProperties config,
            final ExchangeConnection connection,
            final Topology topology,
            final ExchangeChannelFactory channelFactory) {

        Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.connection = Objects.requireNonNull(connection);
        this.topology = Objects.requireNonNull(topology);
        this.channelFactory = Objects.requireNonNull(channelFactory);
        if (config.getName() == null) {
            throw new IllegalArgumentException("exchange name must be set");
        }
        this.context = vertx.getOrCreateContext();
        this.completions = new DeferredCompletions(vertx);
        for (final ExchangeState s : ExchangeState.values()) {
            deferred.put(s, new ArrayDeque<>());
        }
    }

    public String getName() {
        return config.getName();
    }

    public ExchangeType getType() {
        return config.getType();
    }

    /**
     * Gets the current state of this exchange.
     *
     * @return The state.
     */
    public ExchangeState getState() {
        return state;
    }

    /**
     * Gets the messages that have not been confirmed by the broker yet.
     * <p>
     * The log must only be accessed from this exchange's vert.x context.
     *
     * @return The log.
     */
    public PublishLog getPublishLog() {
        return publishLog;
    }

    /**
     * Registers a listener for life cycle events of this exchange.
     *
     * @param listener The listener.
     * @return The subscription for removing the listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    public Subscription addListener(final ExchangeListener listener) {
        return Subscription.register(listeners, listener);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Registers the connection and topology listeners and defines the exchange on a new channel.
     * Invoking this method more than once has no effect other than checking the exchange.
     *
     * @return A future indicating the outcome of {@link #check()}.
     */
    @Override
    public Future<Void> start() {
        Futures.executeOnContext(context, promise -> {
            if (!started) {
                started = true;
                subscribe();
                transition(ExchangeState.INITIALIZING);
            }
            promise.complete();
        });
        return check();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Same as {@link #destroy()}.
     */
    @Override
    public Future<Void> stop() {
        return destroy();
    }

    /**
     * Publishes a message to this exchange.
     * <p>
     * The time to wait for the outcome is taken from the message, the exchange's properties or
     * the connection, whichever is set first. If none is set, the returned future is not failed
     * because of a timeout.
     *
     * @param message The message.
     * @return A future indicating the outcome. The future will be failed with a
     *         {@link PublishTimeoutException} if the message could not be published in time,
     *         or with the cause of the failed definition if the exchange is in a failed state.
     * @throws NullPointerException if message is {@code null}.
     */
    public Future<Void> publish(final OutboundMessage message) {
        Objects.requireNonNull(message);
        return Futures.executeOnContext(context, promise -> {
            final long timeout = getPublishTimeout(message);
            final DeferredCompletion completion = completions.register(
                    timeout,
                    () -> new PublishTimeoutException(getName(), timeout));
            completion.future().onComplete(promise);
            handlePublish(message, completion);
        });
    }

    /**
     * Checks if this exchange is usable.
     *
     * @return A future which is succeeded once the exchange is ready or which is
     *         failed with the cause of the failed definition.
     */
    public Future<Void> check() {
        return Futures.executeOnContext(context, promise -> {
            final DeferredCompletion completion = completions.register();
            completion.future().onComplete(promise);
            handleCheck(completion);
        });
    }

    /**
     * Closes this exchange's channel and removes all connection and topology listeners.
     * <p>
     * Messages which have not been confirmed yet are considered lost. The exchange is
     * re-opened by publishing a message to it.
     *
     * @return A future which is succeeded once the channel has been closed.
     */
    public Future<Void> destroy() {
        return Futures.executeOnContext(context, promise -> {
            final DeferredCompletion completion = completions.register();
            completion.future().onComplete(promise);
            handleDestroy(completion);
        });
    }

    private long getPublishTimeout(final OutboundMessage message) {
        if (message.getTimeout() > 0) {
            return message.getTimeout();
        } else if (config.getPublishTimeout() > 0) {
            return config.getPublishTimeout();
        } else {
            return Math.max(0, connection.getPublishTimeout());
        }
    }

    private void handlePublish(final OutboundMessage message, final DeferredCompletion completion) {
        if (completion.isSettled()) {
            // timed out while waiting
            return;
        }
        switch (state) {
        case READY:
            LOG.trace("publishing message to exchange [{}]: {}", getName(), message);
            completion.settleWith(channel.publish(message));
            break;
        case FAILED:
            notifyListeners(l -> l.onFailed(failureCause));
            completion.tryFail(failureCause);
            break;
        case DESTROYED:
            reopen();
            // the channel may have been defined already
            handlePublish(message, completion);
            break;
        default:
            defer(ExchangeState.READY, () -> handlePublish(message, completion));
        }
    }

    private void handleCheck(final DeferredCompletion completion) {
        if (completion.isSettled()) {
            return;
        }
        switch (state) {
        case READY:
            completion.tryComplete();
            break;
        case FAILED:
            completion.tryFail(failureCause);
            break;
        default:
            defer(ExchangeState.READY, () -> handleCheck(completion));
        }
    }

    private void handleDestroy(final DeferredCompletion completion) {
        if (completion.isSettled()) {
            return;
        }
        switch (state) {
        case READY:
            LOG.debug("destroying exchange [{}] with {} unconfirmed message(s)", getName(), publishLog.count());
            defer(ExchangeState.DESTROYED, () -> handleDestroy(completion));
            transition(ExchangeState.DESTROYED);
            break;
        case DESTROYED:
            teardown.onComplete(ar -> completion.tryComplete());
            break;
        default:
            defer(ExchangeState.READY, () -> handleDestroy(completion));
        }
    }

    private void handleReconnect() {
        switch (state) {
        case SETUP:
        case DESTROYED:
            LOG.trace("ignoring reconnect of connection [{}] for exchange [{}] in state {}",
                    connection.getName(), getName(), state);
            break;
        default:
            bindingsPending = true;
            transition(ExchangeState.RECONNECTING);
        }
    }

    private void handleBindingsCompleted() {
        switch (state) {
        case RECONNECTING:
            defer(ExchangeState.RECONNECTED, this::handleBindingsCompleted);
            break;
        case RECONNECTED:
            bindingsPending = false;
            if (replayingOn != channel) {
                republish();
            }
            break;
        default:
            LOG.trace("ignoring completed bindings for exchange [{}] in state {}", getName(), state);
        }
    }

    private void handleReleased(final ExchangeChannel releasedChannel) {
        if (releasedChannel != channel) {
            LOG.debug("ignoring release of stale channel of exchange [{}]", getName());
            return;
        }
        LOG.warn("channel of exchange [{}] on connection [{}] has been released by the broker in state {}",
                getName(), connection.getName(), state);
        switch (state) {
        case INITIALIZING:
        case READY:
        case RECONNECTED:
            enter(ExchangeState.INITIALIZING);
            break;
        case RECONNECTING:
            enter(ExchangeState.RECONNECTING);
            break;
        default:
            // channel is about to be discarded anyway
        }
    }

    private void reopen() {
        LOG.debug("re-opening exchange [{}]", getName());
        subscribe();
        bindingsPending = false;
        transition(ExchangeState.RECONNECTING);
    }

    private void transition(final ExchangeState target) {
        if (state == target) {
            LOG.trace("exchange [{}] already in state {}", getName(), target);
            return;
        }
        enter(target);
    }

    private void enter(final ExchangeState target) {
        final ExchangeState from = state;
        state = target;
        LOG.debug("exchange [{}] on connection [{}]: {} -> {}", getName(), connection.getName(), from, target);
        notifyListeners(l -> l.onTransition(from, target));

        switch (target) {
        case INITIALIZING:
            // unconfirmed messages are kept for the next reconnect
            defineOnNewChannel(ExchangeState.READY);
            break;
        case READY:
            notifyListeners(ExchangeListener::onDefined);
            break;
        case FAILED:
            enterFailed();
            break;
        case RECONNECTING:
            if (from != ExchangeState.RECONNECTING) {
                // completed bindings of a previous reconnect
                deferred.get(ExchangeState.RECONNECTED).clear();
            }
            defineOnNewChannel(ExchangeState.RECONNECTED);
            break;
        case RECONNECTED:
            notifyListeners(ExchangeListener::onDefined);
            if (!bindingsPending) {
                republish();
            }
            break;
        case DESTROYED:
            enterDestroyed();
            break;
        default:
            throw new IllegalStateException("unsupported state " + target);
        }

        if (state == target) {
            drain(target);
        }
    }

    private void enterFailed() {
        LOG.debug("failed to define exchange [{}]", getName(), failureCause);
        notifyListeners(l -> l.onFailed(failureCause));
        retireChannel();
        LOG.debug("rejecting {} outstanding operation(s) on exchange [{}]", completions.size(), getName());
        completions.failAll(failureCause);
        deferred.values().forEach(Deque::clear);
    }

    private void enterDestroyed() {
        discardUnconfirmed("exchange has been destroyed");
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
        final ExchangeChannel current = channel;
        channel = null;
        if (current == null) {
            teardown = Future.succeededFuture();
        } else {
            teardown = current.destroy()
                    .recover(t -> {
                        LOG.debug("error closing channel of exchange [{}]", getName(), t);
                        return Future.succeededFuture();
                    });
        }
        teardown.onComplete(ar -> notifyListeners(ExchangeListener::onDestroyed));
    }

    private void discardUnconfirmed(final String reason) {
        final int unconfirmed = publishLog.count();
        if (unconfirmed > 0) {
            LOG.warn("discarding {} unconfirmed message(s) of exchange [{}]: {}", unconfirmed, getName(), reason);
            publishLog.reset();
        }
    }

    private void subscribe() {
        subscriptions.add(connection.addReconnectListener(con -> runOnContext(this::handleReconnect)));
        subscriptions.add(topology.addBindingsCompletedListener(v -> runOnContext(this::handleBindingsCompleted)));
    }

    private void defineOnNewChannel(final ExchangeState target) {
        retireChannel();
        final ExchangeChannel newChannel = channelFactory.create(config, topology, publishLog);
        channel = newChannel;
        LOG.debug("created new channel for exchange [{}] on connection [{}]", getName(), connection.getName());
        newChannel.releasedHandler(v -> runOnContext(() -> handleReleased(newChannel)));
        newChannel.define().onComplete(ar -> runOnContext(() -> {
            if (newChannel != channel) {
                LOG.debug("ignoring outcome of defining exchange [{}] on stale channel", getName());
            } else if (ar.succeeded()) {
                transition(target);
            } else {
                failureCause = ar.cause();
                transition(ExchangeState.FAILED);
            }
        }));
    }

    private void retireChannel() {
        final ExchangeChannel current = channel;
        channel = null;
        if (current != null) {
            current.destroy().onFailure(t -> LOG.debug("error closing stale channel of exchange [{}]", getName(), t));
        }
    }

    private void republish() {
        final ExchangeChannel current = channel;
        replayingOn = current;
        final List<OutboundMessage> messages = publishLog.reset();
        LOG.debug("re-publishing {} unconfirmed message(s) to exchange [{}]", messages.size(), getName());
        final List<Future<Void>> results = new ArrayList<>(messages.size());
        messages.forEach(message -> results.add(current.publish(message)));
        Future.all(results).onComplete(ar -> runOnContext(() -> {
            if (replayingOn == current) {
                replayingOn = null;
            }
            if (ar.failed()) {
                LOG.error("failed to re-publish {} message(s) to exchange [{}], messages may have been lost",
                        messages.size(), getName(), ar.cause());
            }
            if (current == channel && state == ExchangeState.RECONNECTED) {
                transition(ExchangeState.READY);
            }
        }));
    }

    private void defer(final ExchangeState target, final Runnable operation) {
        deferred.get(target).add(operation);
    }

    private void drain(final ExchangeState target) {
        final Deque<Runnable> queue = deferred.get(target);
        if (queue.isEmpty()) {
            return;
        }
        final List<Runnable> operations = new ArrayList<>(queue);
        queue.clear();
        operations.forEach(Runnable::run);
    }

    private void runOnContext(final Runnable code) {
        if (context == Vertx.currentContext()) {
            code.run();
        } else {
            context.runOnContext(go -> code.run());
        }
    }

    private void notifyListeners(final Consumer<ExchangeListener> event) {
        for (final ExchangeListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (final RuntimeException e) {
                LOG.warn("error notifying listener of exchange [{}]", getName(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "ExchangeMachine [name=" + getName() + ", state=" + state + "]";
    }
}
