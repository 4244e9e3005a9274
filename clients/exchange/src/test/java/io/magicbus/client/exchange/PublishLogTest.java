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

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.buffer.Buffer;

/**
 * Tests verifying behavior of {@link PublishLog}.
 *
 */
public class PublishLogTest {

    private PublishLog log;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        log = new PublishLog();
    }

    private static OutboundMessage message(final String body) {
        return OutboundMessage.builder("key", Buffer.buffer(body)).build();
    }

    /**
     * Verifies that resetting the log returns the messages in the order in which they
     * have been appended and leaves the log empty.
     */
    @Test
    public void testResetReturnsMessagesInOrder() {
        final OutboundMessage first = message("one");
        final OutboundMessage second = message("two");
        log.append(first);
        log.append(second);
        log.append(first);

        assertThat(log.reset()).containsExactly(first, second, first).inOrder();
        assertThat(log.count()).isEqualTo(0);
        assertThat(log.reset()).isEmpty();
    }

    /**
     * Verifies that confirming a message removes its oldest entry only.
     */
    @Test
    public void testConfirmRemovesOldestEntryOfMessage() {
        final OutboundMessage first = message("one");
        final OutboundMessage second = message("two");
        log.append(first);
        log.append(second);
        log.append(first);

        assertThat(log.confirm(first)).isTrue();
        assertThat(log.count()).isEqualTo(2);
        assertThat(log.reset()).containsExactly(second, first).inOrder();
    }

    /**
     * Verifies that confirming an entry by its sequence number removes exactly that entry.
     */
    @Test
    public void testConfirmBySequenceNumber() {
        final OutboundMessage msg = message("one");
        final long firstSequenceNo = log.append(msg);
        final long secondSequenceNo = log.append(msg);
        assertThat(secondSequenceNo).isGreaterThan(firstSequenceNo);

        assertThat(log.confirm(secondSequenceNo)).isTrue();
        assertThat(log.confirm(secondSequenceNo)).isFalse();
        assertThat(log.count()).isEqualTo(1);
    }

    /**
     * Verifies that confirming a message which is not logged has no effect.
     */
    @Test
    public void testConfirmOfUnknownMessageIsNoOp() {
        log.append(message("one"));

        assertThat(log.confirm(message("one"))).isFalse();
        assertThat(log.confirm(42L)).isFalse();
        assertThat(log.count()).isEqualTo(1);
    }

    /**
     * Verifies that sequence numbers are not reused after the log has been reset.
     */
    @Test
    public void testLateConfirmationAfterResetIsNoOp() {
        final OutboundMessage msg = message("one");
        final long sequenceNo = log.append(msg);
        log.reset();
        log.append(msg);

        assertThat(log.confirm(sequenceNo)).isFalse();
        assertThat(log.count()).isEqualTo(1);
    }
}
