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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;

/**
 * A message to be published to an exchange.
 * <p>
 * Instances are immutable. The publish log tracks messages by identity, so the same
 * instance is used when a message gets replayed.
 */
public final class OutboundMessage {

    private final String routingKey;
    private final Buffer payload;
    private final String contentType;
    private final String contentEncoding;
    private final String messageId;
    private final String type;
    private final String correlationId;
    private final Map<String, Object> headers;
    private final boolean persistent;
    private final long timeout;

    private OutboundMessage(final Builder builder) {
        this.routingKey = builder.routingKey;
        this.payload = builder.payload;
        this.contentType = builder.contentType;
        this.contentEncoding = builder.contentEncoding;
        this.messageId = builder.messageId;
        this.type = builder.type;
        this.correlationId = builder.correlationId;
        this.headers = Collections.unmodifiableMap(new HashMap<>(builder.headers));
        this.persistent = builder.persistent;
        this.timeout = builder.timeout;
    }

    /**
     * Creates a builder for a message.
     *
     * @param routingKey The key the broker uses for routing the message (may be empty).
     * @param payload The message body.
     * @return The builder.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static Builder builder(final String routingKey, final Buffer payload) {
        return new Builder(routingKey, payload);
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public Buffer getPayload() {
        return payload;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getType() {
        return type;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Gets the application headers.
     *
     * @return An unmodifiable map of headers.
     */
    public Map<String, Object> getHeaders() {
        return headers;
    }

    public boolean isPersistent() {
        return persistent;
    }

    /**
     * Gets the time to wait for this message to be published.
     *
     * @return The timeout in milliseconds or 0 if the exchange's default should be used.
     */
    public long getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("routingKey", routingKey)
                .add("messageId", messageId)
                .add("type", type)
                .add("contentType", contentType)
                .add("size", payload.length())
                .toString();
    }

    /**
     * A builder for messages.
     */
    public static final class Builder {

        private final String routingKey;
        private final Buffer payload;
        private final Map<String, Object> headers = new HashMap<>();
        private String contentType;
        private String contentEncoding;
        private String messageId;
        private String type;
        private String correlationId;
        private boolean persistent = true;
        private long timeout = 0;

        private Builder(final String routingKey, final Buffer payload) {
            this.routingKey = Objects.requireNonNull(routingKey);
            this.payload = Objects.requireNonNull(payload);
        }

        public Builder contentType(final String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder contentEncoding(final String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder messageId(final String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder type(final String type) {
            this.type = type;
            return this;
        }

        public Builder correlationId(final String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        /**
         * Adds an application header.
         *
         * @param name The header name.
         * @param value The header value.
         * @return This builder.
         * @throws NullPointerException if any of the parameters is {@code null}.
         */
        public Builder header(final String name, final Object value) {
            headers.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
            return this;
        }

        public Builder persistent(final boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        /**
         * Sets the time to wait for the message to be published.
         *
         * @param timeout The timeout in milliseconds. A value of 0 indicates that the exchange's
         *                default should be used.
         * @return This builder.
         * @throws IllegalArgumentException if the timeout is negative.
         */
        public Builder timeout(final long timeout) {
            if (timeout < 0) {
                throw new IllegalArgumentException("timeout must be >= 0");
            }
            this.timeout = timeout;
            return this;
        }

        public OutboundMessage build() {
            return new OutboundMessage(this);
        }
    }
}
