// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.relay;

import java.util.List;
import software.amazon.mturk.resilience.model.Response;

/**
 * Performs the actual remote call. How arguments are encoded and responses decoded is entirely up to the
 * implementation.
 *
 * <p>Failures are reported by throwing. Implementations should throw a
 * {@link software.amazon.mturk.resilience.exception.RelayException} subclass when the failure's shape is known, so it
 * can be classified without guessing; any other {@link RuntimeException} is treated as opaque.
 */
@FunctionalInterface
public interface Relay {

    /**
     * @param operationName the remote operation
     * @param args the ordered arguments, unmodifiable
     * @return the decoded response
     */
    Response invoke(String operationName, List<Object> args);
}
