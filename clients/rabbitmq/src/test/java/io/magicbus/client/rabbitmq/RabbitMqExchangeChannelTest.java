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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

import io.magicbus.client.ClientErrorException;
import io.magicbus.client.ServerErrorException;
import io.magicbus.client.ServiceInvocationException;
import io.magicbus.client.exchange.ExchangeDefinitionException;
import io.magicbus.client.exchange.OutboundMessage;
import io.magicbus.client.exchange.PublishLog;
import io.magicbus.client.exchange.config.ExchangeConfigProperties;
import io.magicbus.client.exchange.config.ExchangeType;
import io.magicbus.test.VertxMockSupport;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;

/**
 * Tests verifying behavior of {@link RabbitMqExchangeChannel}.
 *
 */
public class RabbitMqExchangeChannelTest {

    private Vertx vertx;
    private Connection brokerConnection;
    private Channel channel;
    private ExchangeConfigProperties config;
    private PublishLog publishLog;
    private RabbitMqExchangeChannel exchangeChannel;

    /**
     * Sets up the fixture.
     *
     * @throws IOException if the channel cannot be created.
     */
    @BeforeEach
    public void setUp() throws IOException {
        vertx = VertxMockSupport.mockVertxWithImmediateContext();
        VertxMockSupport.executeBlockingCodeImmediately(vertx);
        channel = mock(Channel.class, withSettings().extraInterfaces(Recoverable.class));
        brokerConnection = mock(Connection.class);
        when(brokerConnection.createChannel()).thenReturn(channel);
        config = new ExchangeConfigProperties("events");
        publishLog = new PublishLog();
        exchangeChannel = new RabbitMqExchangeChannel(vertx, brokerConnection, config, publishLog);
    }

    private static OutboundMessage message() {
        return OutboundMessage.builder("events.created", Buffer.buffer("hello"))
                .contentType("text/plain")
                .messageId("msg-1")
                .header("origin", "test")
                .build();
    }

    private ConfirmListener confirmListener() {
        final ArgumentCaptor<ConfirmListener> listener = ArgumentCaptor.forClass(ConfirmListener.class);
        verify(channel).addConfirmListener(listener.capture());
        return listener.getValue();
    }

    private ShutdownListener shutdownListener() {
        final ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(channel).addShutdownListener(listener.capture());
        return listener.getValue();
    }

    /**
     * Verifies that the exchange is declared with its configured properties on a channel in confirm mode.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testDefineDeclaresExchange() throws IOException {

        // GIVEN an exchange with an alternate exchange
        config.setType(ExchangeType.FANOUT);
        config.setAutoDelete(true);
        config.setAlternateExchange("unrouted");

        // WHEN defining the exchange
        final Future<Void> result = exchangeChannel.define();

        // THEN the exchange has been declared
        assertThat(result.succeeded()).isTrue();
        verify(channel).confirmSelect();
        verify(channel).exchangeDeclare("events", "fanout", true, true, false, Map.of("alternate-exchange", "unrouted"));
        verify(channel).addConfirmListener(any(ConfirmListener.class));
        verify(channel).addShutdownListener(any(ShutdownListener.class));
    }

    /**
     * Verifies that a rejected declaration fails with an exchange definition error.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testDefineFailsForRejectedDeclaration() throws IOException {

        // GIVEN a broker that rejects the declaration
        final IOException error = new IOException("inequivalent arg 'type'");
        when(channel.exchangeDeclare(anyString(), anyString(), anyBoolean(), anyBoolean(), anyBoolean(), anyMap()))
            .thenThrow(error);

        // WHEN defining the exchange
        final Future<Void> result = exchangeChannel.define();

        // THEN the definition has failed
        assertThat(result.cause()).isInstanceOf(ExchangeDefinitionException.class);
        assertThat(result.cause()).hasCauseThat().isSameInstanceAs(error);
        // and the channel has been discarded without being released
        verify(channel).abort();
        verify(channel, never()).addShutdownListener(any(ShutdownListener.class));
    }

    /**
     * Verifies that defining the exchange fails if there is no connection to the broker.
     */
    @Test
    public void testDefineFailsIfNotConnected() {

        final RabbitMqExchangeChannel disconnected = new RabbitMqExchangeChannel(vertx, null, config, publishLog);

        final Future<Void> result = disconnected.define();

        assertThat(result.cause()).isInstanceOf(ExchangeDefinitionException.class);
        assertThat(ServiceInvocationException.extractStatusCode(result.cause()))
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
    }

    /**
     * Verifies that a published message is logged until the broker acknowledges it.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testPublishSucceedsOnAck() throws IOException {

        // GIVEN a defined exchange
        exchangeChannel.define();
        when(channel.getNextPublishSeqNo()).thenReturn(7L);

        // WHEN publishing a message
        final Future<Void> result = exchangeChannel.publish(message());

        // THEN the message has been sent with the message's properties
        final ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("events"), eq("events.created"), props.capture(), eq("hello".getBytes()));
        assertThat(props.getValue().getContentType()).isEqualTo("text/plain");
        assertThat(props.getValue().getMessageId()).isEqualTo("msg-1");
        assertThat(props.getValue().getDeliveryMode()).isEqualTo(2);
        assertThat(props.getValue().getHeaders()).containsEntry("origin", "test");
        assertThat(props.getValue().getTimestamp()).isNotNull();
        // and has been logged
        assertThat(publishLog.count()).isEqualTo(1);
        assertThat(result.isComplete()).isFalse();

        // and WHEN the broker acknowledges the message
        confirmListener().handleAck(7L, false);

        // THEN the publish has succeeded
        assertThat(result.succeeded()).isTrue();
        assertThat(publishLog.count()).isEqualTo(0);
    }

    /**
     * Verifies that an acknowledgement of multiple messages settles all messages up to the delivery tag.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testMultipleAckSettlesAllPreviousMessages() throws IOException {

        exchangeChannel.define();
        when(channel.getNextPublishSeqNo()).thenReturn(1L, 2L, 3L);
        final Future<Void> first = exchangeChannel.publish(message());
        final Future<Void> second = exchangeChannel.publish(message());
        final Future<Void> third = exchangeChannel.publish(message());

        confirmListener().handleAck(2L, true);

        assertThat(first.succeeded()).isTrue();
        assertThat(second.succeeded()).isTrue();
        assertThat(third.isComplete()).isFalse();
        assertThat(publishLog.count()).isEqualTo(1);
    }

    /**
     * Verifies that a message rejected by the broker fails the publish and is removed from the log.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testPublishFailsOnNack() throws IOException {

        exchangeChannel.define();
        when(channel.getNextPublishSeqNo()).thenReturn(1L);
        final Future<Void> result = exchangeChannel.publish(message());

        confirmListener().handleNack(1L, false);

        assertThat(result.cause()).isInstanceOf(ServerErrorException.class);
        assertThat(publishLog.count()).isEqualTo(0);
    }

    /**
     * Verifies that a message that cannot be sent is not kept in the log.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testPublishFailsIfMessageCannotBeSent() throws IOException {

        exchangeChannel.define();
        doThrow(new IOException("connection reset"))
            .when(channel).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

        final Future<Void> result = exchangeChannel.publish(message());

        assertThat(result.cause()).isInstanceOf(ServerErrorException.class);
        assertThat(result.cause()).hasCauseThat().isInstanceOf(IOException.class);
        assertThat(publishLog.count()).isEqualTo(0);
    }

    /**
     * Verifies that messages cannot be published to an internal exchange.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testPublishToInternalExchangeFails() throws IOException {

        config.setInternal(true);
        exchangeChannel.define();

        final Future<Void> result = exchangeChannel.publish(message());

        assertThat(result.cause()).isInstanceOf(ClientErrorException.class);
        assertThat(((ClientErrorException) result.cause()).getErrorCode()).isEqualTo(HttpURLConnection.HTTP_FORBIDDEN);
        verify(channel, never()).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
        assertThat(publishLog.count()).isEqualTo(0);
    }

    /**
     * Verifies that publishing fails if the exchange has not been defined.
     */
    @Test
    public void testPublishFailsBeforeDefinition() {

        final Future<Void> result = exchangeChannel.publish(message());

        assertThat(result.cause()).isInstanceOf(ServerErrorException.class);
        assertThat(publishLog.count()).isEqualTo(0);
    }

    /**
     * Verifies that the released handler is invoked once when the broker closes the channel
     * and that unconfirmed messages stay in the log.
     */
    @Test
    public void testChannelClosedByBrokerIsReleased() {

        // GIVEN a defined exchange with an unconfirmed message
        exchangeChannel.define();
        final Handler<Void> releasedHandler = VertxMockSupport.mockHandler();
        exchangeChannel.releasedHandler(releasedHandler);
        final Future<Void> result = exchangeChannel.publish(message());

        // WHEN the broker closes the channel because of a channel error
        final ShutdownSignalException signal = new ShutdownSignalException(false, false, null, channel);
        shutdownListener().shutdownCompleted(signal);
        shutdownListener().shutdownCompleted(signal);

        // THEN the channel has been released once
        verify(releasedHandler).handle(null);
        // and the outstanding publish has failed
        assertThat(result.cause()).isInstanceOf(ServerErrorException.class);
        // but the message is kept for being re-sent
        assertThat(publishLog.count()).isEqualTo(1);
    }

    /**
     * Verifies that the channel is not released when the connection is lost or the
     * channel has been closed by the application.
     */
    @Test
    public void testChannelIsNotReleasedOnConnectionOrApplicationShutdown() {

        exchangeChannel.define();
        final Handler<Void> releasedHandler = VertxMockSupport.mockHandler();
        exchangeChannel.releasedHandler(releasedHandler);

        shutdownListener().shutdownCompleted(new ShutdownSignalException(true, false, null, brokerConnection));
        shutdownListener().shutdownCompleted(new ShutdownSignalException(false, true, null, channel));

        verify(releasedHandler, never()).handle(null);
    }

    /**
     * Verifies that destroying the channel closes it and fails outstanding publishes
     * without removing them from the log.
     *
     * @throws Exception if the channel cannot be closed.
     */
    @Test
    public void testDestroyClosesChannel() throws Exception {

        exchangeChannel.define();
        when(channel.isOpen()).thenReturn(true);
        final Future<Void> publish = exchangeChannel.publish(message());

        final Future<Void> result = exchangeChannel.destroy();

        assertThat(result.succeeded()).isTrue();
        verify(channel).close();
        assertThat(publish.cause()).isInstanceOf(ServerErrorException.class);
        assertThat(publishLog.count()).isEqualTo(1);
    }

    /**
     * Verifies that destroying a channel which has already been closed succeeds.
     *
     * @throws Exception if the channel cannot be closed.
     */
    @Test
    public void testDestroySucceedsForClosedChannel() throws Exception {

        exchangeChannel.define();
        when(channel.isOpen()).thenReturn(true);
        doThrow(new AlreadyClosedException(new ShutdownSignalException(true, false, null, brokerConnection)))
            .when(channel).close();

        assertThat(exchangeChannel.destroy().succeeded()).isTrue();
    }

    /**
     * Verifies that a channel which is recovered by the client after it has been destroyed is aborted.
     *
     * @throws IOException if the channel cannot be used.
     */
    @Test
    public void testRecoveredChannelIsAbortedAfterDestroy() throws IOException {

        exchangeChannel.define();
        final ArgumentCaptor<RecoveryListener> recoveryListener = ArgumentCaptor.forClass(RecoveryListener.class);
        verify((Recoverable) channel).addRecoveryListener(recoveryListener.capture());

        // a channel that is still in use is kept
        recoveryListener.getValue().handleRecovery((Recoverable) channel);
        verify(channel, never()).abort();

        exchangeChannel.destroy();
        recoveryListener.getValue().handleRecovery((Recoverable) channel);
        verify(channel).abort();
    }
}
