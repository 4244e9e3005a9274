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

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * A sender for publishing JSON documents to an exchange.
 */
public class ExchangeSender {

    /**
     * The content type of the messages published by this sender.
     */
    public static final String CONTENT_TYPE_JSON = "application/json";

    private final ExchangeMachine exchange;

    /**
     * Creates a sender for an exchange.
     *
     * @param exchange The exchange to publish to.
     * @throws NullPointerException if exchange is {@code null}.
     */
    public ExchangeSender(final ExchangeMachine exchange) {
        this.exchange = Objects.requireNonNull(exchange);
    }

    /**
     * Publishes a JSON document using the message type as routing key.
     *
     * @param payload The document.
     * @param messageType The type of message or {@code null} if the message has no type.
     * @return A future indicating the outcome of publishing the message.
     * @throws NullPointerException if payload is {@code null}.
     */
    public Future<Void> send(final JsonObject payload, final String messageType) {
        return send(payload, messageType, null);
    }

    /**
     * Publishes a JSON document.
     * <p>
     * The routing key is the message type prefixed by the given prefix and a dot, if both are set.
     * The message is assigned a random message ID.
     *
     * @param payload The document.
     * @param messageType The type of message or {@code null} if the message has no type.
     * @param routingKeyPrefix The prefix of the routing key or {@code null}.
     * @return A future indicating the outcome of publishing the message.
     * @throws NullPointerException if payload is {@code null}.
     */
    public Future<Void> send(final JsonObject payload, final String messageType, final String routingKeyPrefix) {
        Objects.requireNonNull(payload);

        final OutboundMessage message = OutboundMessage.builder(getRoutingKey(messageType, routingKeyPrefix), payload.toBuffer())
                .contentType(CONTENT_TYPE_JSON)
                .contentEncoding(StandardCharsets.UTF_8.name())
                .messageId(UUID.randomUUID().toString())
                .type(messageType)
                .build();
        return exchange.publish(message);
    }

    static String getRoutingKey(final String messageType, final String routingKeyPrefix) {
        final boolean hasType = messageType != null && !messageType.isEmpty();
        final boolean hasPrefix = routingKeyPrefix != null && !routingKeyPrefix.isEmpty();
        if (hasType && hasPrefix) {
            return routingKeyPrefix + "." + messageType;
        } else if (hasType) {
            return messageType;
        } else if (hasPrefix) {
            return routingKeyPrefix;
        } else {
            return "";
        }
    }
}
