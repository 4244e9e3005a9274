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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * The messages that have been sent on the current channel but have not been confirmed by the broker yet.
 * <p>
 * Entries are kept in the order in which they have been appended. Instances are not thread safe
 * and are expected to be used from a single vert.x context only.
 */
public final class PublishLog {

    private final List<Entry> entries = new LinkedList<>();
    private long nextSequenceNo = 0;

    /**
     * Records a message that has been handed to the broker.
     * <p>
     * The same message may be appended more than once.
     *
     * @param message The message.
     * @return The sequence number of the entry, which can be used for confirming it.
     * @throws NullPointerException if message is {@code null}.
     */
    public long append(final OutboundMessage message) {
        Objects.requireNonNull(message);
        final long sequenceNo = ++nextSequenceNo;
        entries.add(new Entry(sequenceNo, message));
        return sequenceNo;
    }

    /**
     * Removes the entry with a given sequence number.
     *
     * @param sequenceNo The sequence number returned by {@link #append(OutboundMessage)}.
     * @return {@code true} if the entry has been removed, {@code false} if there is no such entry.
     */
    public boolean confirm(final long sequenceNo) {
        final Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next().sequenceNo == sequenceNo) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Removes the oldest entry for a message.
     *
     * @param message The message.
     * @return {@code true} if an entry has been removed, {@code false} if the message is not logged.
     * @throws NullPointerException if message is {@code null}.
     */
    public boolean confirm(final OutboundMessage message) {
        Objects.requireNonNull(message);
        final Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next().message == message) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Removes all entries.
     *
     * @return The messages that have been logged, in the order they have been appended.
     */
    public List<OutboundMessage> reset() {
        final List<OutboundMessage> result = new ArrayList<>(entries.size());
        entries.forEach(entry -> result.add(entry.message));
        entries.clear();
        return result;
    }

    /**
     * Gets the number of unconfirmed messages.
     *
     * @return The number of entries.
     */
    public int count() {
        return entries.size();
    }

    private static final class Entry {

        private final long sequenceNo;
        private final OutboundMessage message;

        Entry(final long sequenceNo, final OutboundMessage message) {
            this.sequenceNo = sequenceNo;
            this.message = message;
        }
    }
}
