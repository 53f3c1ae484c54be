// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of a call could not be determined, for example a non-idempotent operation timed out. The remote side may
 * or may not have applied it, so the original failure is wrapped together with the call that produced it.
 */
public class UnknownOutcomeException extends DispatchException {
    private final String operationName;
    private final List<Object> args;

    public UnknownOutcomeException(Throwable cause, String operationName, List<Object> args) {
        super(formatMessage(cause, operationName, args), cause);
        this.operationName = operationName;
        this.args = args;
    }

    public String getOperationName() {
        return operationName;
    }

    public List<Object> getArgs() {
        return args;
    }

    private static String formatMessage(Throwable cause, String operationName, List<Object> args) {
        var renderedArgs = args.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return String.format("Unrecognized outcome for %s(%s): %s", operationName, renderedArgs, cause);
    }
}
