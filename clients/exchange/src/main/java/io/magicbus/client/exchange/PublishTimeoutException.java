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

import java.net.HttpURLConnection;

import io.magicbus.client.ServerErrorException;

/**
 * Indicates that a message could not be published within the configured time.
 */
public class PublishTimeoutException extends ServerErrorException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param exchangeName The name of the exchange that the message has been published to.
     * @param timeoutMillis The timeout that has been exceeded.
     */
    public PublishTimeoutException(final String exchangeName, final long timeoutMillis) {
        super(HttpURLConnection.HTTP_UNAVAILABLE,
                String.format("publishing to exchange [%s] timed out after %dms", exchangeName, timeoutMillis));
    }
}
