// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.serde;

/**
 * Renders responses and their payloads as JSON for logging.
 *
 * <p>Implementations return null for null input and wrap failures in
 * {@link software.amazon.mturk.resilience.exception.SerDesException}.
 */
@FunctionalInterface
public interface SerDes {

    /**
     * @param value a {@link software.amazon.mturk.resilience.model.Response} or any plain payload value
     * @return the JSON text, or null if value is null
     */
    String serialize(Object value);
}
