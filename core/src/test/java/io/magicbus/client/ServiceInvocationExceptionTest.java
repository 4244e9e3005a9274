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

package io.magicbus.client;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static com.google.common.truth.Truth.assertThat;

import java.net.HttpURLConnection;

import org.junit.jupiter.api.Test;

/**
 * Tests verifying behavior of {@link ServiceInvocationException} and its subclasses.
 *
 */
class ServiceInvocationExceptionTest {

    /**
     * Verifies that error codes outside of the range of the exception type are rejected.
     */
    @Test
    public void testConstructorsRejectIllegalErrorCodes() {
        assertThrows(IllegalArgumentException.class, () -> new ServerErrorException(HttpURLConnection.HTTP_BAD_REQUEST));
        assertThrows(IllegalArgumentException.class, () -> new ClientErrorException(HttpURLConnection.HTTP_UNAVAILABLE));
        assertThrows(IllegalArgumentException.class, () -> new ServerErrorException(200, "ok"));
    }

    /**
     * Verifies that a default message is derived from the error code.
     */
    @Test
    public void testDefaultMessageContainsErrorCode() {
        final var e = new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE);
        assertThat(e.getMessage()).isEqualTo("Error Code: 503");
        assertThat(e.getErrorCode()).isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
    }

    /**
     * Verifies that the status code is extracted from service invocation exceptions only.
     */
    @Test
    public void testExtractStatusCode() {
        assertThat(ServiceInvocationException.extractStatusCode(
                new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN, "internal exchange")))
            .isEqualTo(HttpURLConnection.HTTP_FORBIDDEN);
        assertThat(ServiceInvocationException.extractStatusCode(new IllegalStateException()))
            .isEqualTo(HttpURLConnection.HTTP_INTERNAL_ERROR);
        assertThat(ServiceInvocationException.extractStatusCode(null))
            .isEqualTo(HttpURLConnection.HTTP_INTERNAL_ERROR);
    }
}
