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
 * Indicates that the broker has rejected the declaration of an exchange.
 */
public class ExchangeDefinitionException extends ServerErrorException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a root cause.
     *
     * @param exchangeName The name of the exchange.
     * @param cause The root cause.
     */
    public ExchangeDefinitionException(final String exchangeName, final Throwable cause) {
        this(HttpURLConnection.HTTP_UNAVAILABLE, exchangeName, cause);
    }

    /**
     * Creates a new exception for an error code and a root cause.
     *
     * @param errorCode The code representing the error that occurred.
     * @param exchangeName The name of the exchange.
     * @param cause The root cause.
     * @throws IllegalArgumentException if the code is not &ge; 500 and &lt; 600.
     */
    public ExchangeDefinitionException(final int errorCode, final String exchangeName, final Throwable cause) {
        super(errorCode, String.format("failed to define exchange [%s]", exchangeName), cause);
    }
}
