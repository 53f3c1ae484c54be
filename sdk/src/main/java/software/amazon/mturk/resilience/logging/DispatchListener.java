// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.logging;

import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.model.Invocation;
import software.amazon.mturk.resilience.model.Response;

/**
 * Receives structured events from a dispatch. Listeners observe only; they cannot change how a dispatch proceeds. An
 * exception thrown by a listener is logged by the dispatcher and otherwise ignored. All methods default to doing
 * nothing.
 */
public interface DispatchListener {

    /** Listener that ignores every event. */
    DispatchListener NOOP = new DispatchListener() {};

    /**
     * Called before each call to the relay.
     *
     * @param invocation the call about to be made
     */
    default void onAttempt(Invocation invocation) {}

    /**
     * Called once a failed attempt has been classified.
     *
     * @param invocation the failed call
     * @param error the failure from the relay or from validation
     * @param classification the chosen action, null if the classifier returned none
     */
    default void onClassified(Invocation invocation, Throwable error, Classification classification) {}

    /**
     * Called after a response returned by the relay has been validated.
     *
     * @param invocation the call that produced the response
     * @param response the response, may be null if the relay returned none
     * @param failure the validation failure, or null if the response is valid
     */
    default void onValidated(Invocation invocation, Response response, RuntimeException failure) {}
}
