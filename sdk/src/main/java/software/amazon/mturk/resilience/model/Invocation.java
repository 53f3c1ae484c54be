// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One attempt at a remote operation. Attempts are numbered from 1 and only ever grow within a single dispatch.
 *
 * @param operationName the remote operation
 * @param args the ordered arguments, unmodifiable
 * @param attempt the attempt number, starting at 1
 */
public record Invocation(String operationName, List<Object> args, int attempt) {

    public Invocation {
        Objects.requireNonNull(operationName, "operationName cannot be null");
        Objects.requireNonNull(args, "args cannot be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1, got: " + attempt);
        }
    }

    /**
     * Creates the first attempt of a call. Arguments are copied; null elements are allowed.
     *
     * @param operationName the remote operation
     * @param args the arguments
     * @return attempt 1 of the call
     */
    public static Invocation first(String operationName, List<?> args) {
        return new Invocation(operationName, Collections.unmodifiableList(new ArrayList<>(args)), 1);
    }

    /** @return the same call with the attempt counter advanced by one */
    public Invocation nextAttempt() {
        return new Invocation(operationName, args, attempt + 1);
    }
}
