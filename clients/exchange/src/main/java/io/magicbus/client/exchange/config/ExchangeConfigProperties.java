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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Properties of an exchange to be defined on the broker.
 * <p>
 * The properties are used for declaring the exchange on every (re-)connect and
 * thus should not be changed once an exchange has been created from them.
 */
public class ExchangeConfigProperties {

    /**
     * The name of the broker argument holding the alternate exchange.
     */
    public static final String ARG_ALTERNATE_EXCHANGE = "alternate-exchange";
    /**
     * The default amount of time (milliseconds) to wait for a publish to complete.
     * A value of 0 indicates an unbounded wait.
     */
    public static final long DEFAULT_PUBLISH_TIMEOUT = 0L; // ms

    private String name;
    private ExchangeType type = ExchangeType.TOPIC;
    private boolean durable = true;
    private boolean internal = false;
    private boolean autoDelete = false;
    private String alternateExchange;
    private final Map<String, Object> arguments = new HashMap<>();
    private long publishTimeout = DEFAULT_PUBLISH_TIMEOUT;

    /**
     * Creates properties using default values.
     */
    public ExchangeConfigProperties() {
        super();
    }

    /**
     * Creates properties for an exchange name using default values for everything else.
     *
     * @param name The name of the exchange.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalArgumentException if name is empty.
     */
    public ExchangeConfigProperties(final String name) {
        super();
        setName(name);
    }

    /**
     * Creates properties for existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options is {@code null}.
     * @throws IllegalArgumentException if the options contain invalid values.
     */
    public ExchangeConfigProperties(final ExchangeOptions options) {
        super();
        Objects.requireNonNull(options);
        setName(options.name());
        setType(ExchangeType.from(options.type()));
        setDurable(options.durable());
        setInternal(options.internal());
        setAutoDelete(options.autoDelete());
        options.alternateExchange().ifPresent(this::setAlternateExchange);
        setArguments(options.arguments());
        setPublishTimeout(options.publishTimeout());
    }

    /**
     * Gets the name of the exchange.
     *
     * @return The name or {@code null} if not set.
     */
    public final String getName() {
        return name;
    }

    /**
     * Sets the name of the exchange.
     *
     * @param name The name.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalArgumentException if name is empty.
     */
    public final void setName(final String name) {
        Objects.requireNonNull(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("exchange name must not be empty");
        }
        this.name = name;
    }

    public final ExchangeType getType() {
        return type;
    }

    /**
     * Sets the kind of exchange.
     * <p>
     * The default value of this property is {@link ExchangeType#TOPIC}.
     *
     * @param type The type.
     * @throws NullPointerException if type is {@code null}.
     */
    public final void setType(final ExchangeType type) {
        this.type = Objects.requireNonNull(type);
    }

    public final boolean isDurable() {
        return durable;
    }

    /**
     * Sets whether the exchange survives broker restarts.
     * <p>
     * The default value of this property is {@code true}.
     *
     * @param durable {@code true} if the exchange should be durable.
     */
    public final void setDurable(final boolean durable) {
        this.durable = durable;
    }

    public final boolean isInternal() {
        return internal;
    }

    /**
     * Sets whether messages may be published directly to the exchange.
     * <p>
     * An internal exchange can only be the target of bindings.
     * The default value of this property is {@code false}.
     *
     * @param internal {@code true} if the exchange should be internal.
     */
    public final void setInternal(final boolean internal) {
        this.internal = internal;
    }

    public final boolean isAutoDelete() {
        return autoDelete;
    }

    /**
     * Sets whether the exchange is deleted once the last binding for which it is the source is removed.
     * <p>
     * The default value of this property is {@code false}.
     *
     * @param autoDelete {@code true} if the exchange should be deleted automatically.
     */
    public final void setAutoDelete(final boolean autoDelete) {
        this.autoDelete = autoDelete;
    }

    /**
     * Gets the exchange that messages are sent to which cannot be routed.
     *
     * @return The name or {@code null} if not set.
     */
    public final String getAlternateExchange() {
        return alternateExchange;
    }

    /**
     * Sets the exchange that messages are sent to which cannot be routed to any queue.
     *
     * @param alternateExchange The name or {@code null} to unset.
     */
    public final void setAlternateExchange(final String alternateExchange) {
        this.alternateExchange = alternateExchange;
    }

    /**
     * Alias for {@link #setAlternateExchange(String)}.
     *
     * @param alternate The name of the alternate exchange or {@code null} to unset.
     */
    public final void setAlternate(final String alternate) {
        setAlternateExchange(alternate);
    }

    /**
     * Gets the additional broker specific arguments.
     *
     * @return An unmodifiable view on the arguments.
     */
    public final Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * Sets additional broker specific arguments.
     * <p>
     * Any existing arguments are replaced.
     *
     * @param arguments The arguments (may be {@code null}).
     */
    public final void setArguments(final Map<String, ?> arguments) {
        this.arguments.clear();
        if (arguments != null) {
            this.arguments.putAll(arguments);
        }
    }

    /**
     * Gets the arguments to include in the exchange declaration.
     * <p>
     * The returned map contains the configured arguments and the alternate exchange, if set.
     *
     * @return A new map of arguments.
     */
    public final Map<String, Object> getDeclareArguments() {
        final Map<String, Object> result = new HashMap<>(arguments);
        if (alternateExchange != null) {
            result.put(ARG_ALTERNATE_EXCHANGE, alternateExchange);
        }
        return result;
    }

    public final long getPublishTimeout() {
        return publishTimeout;
    }

    /**
     * Sets the time to wait for a publish to complete before giving up.
     * <p>
     * The default value of this property is {@value #DEFAULT_PUBLISH_TIMEOUT}.
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

    @Override
    public String toString() {
        return MoreObjects
                .toStringHelper(this)
                .add("name", name)
                .add("type", type)
                .add("durable", durable)
                .add("internal", internal)
                .add("autoDelete", autoDelete)
                .add("alternateExchange", alternateExchange)
                .add("publishTimeout", publishTimeout)
                .toString();
    }
}
