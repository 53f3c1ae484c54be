// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience;

import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.classify.ErrorClassifier;
import software.amazon.mturk.resilience.exception.DispatchInterruptedException;
import software.amazon.mturk.resilience.exception.InternalClassifierException;
import software.amazon.mturk.resilience.exception.UnknownOutcomeException;
import software.amazon.mturk.resilience.logging.DispatchListener;
import software.amazon.mturk.resilience.model.Invocation;
import software.amazon.mturk.resilience.model.Response;
import software.amazon.mturk.resilience.relay.Relay;
import software.amazon.mturk.resilience.retry.BackoffPolicy;
import software.amazon.mturk.resilience.validation.ResponseValidator;

/**
 * Invokes operations on a {@link Relay} and applies a uniform retry and error contract to the outcome.
 *
 * <p>Each response is validated; a validation failure is classified like any relay failure, so a throttling signal
 * embedded in an otherwise successful response still leads to a backoff retry. Depending on the classification the
 * dispatcher retries (with or without backoff), returns an ignored result, rethrows the original failure, or throws
 * {@link UnknownOutcomeException}. When retries run out the original failure is rethrown unchanged.
 *
 * <p>A dispatch runs entirely on the calling thread and sleeps on it during backoff. The dispatcher keeps no state
 * between calls and can be shared by many threads, provided the relay can.
 */
public class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final Relay relay;
    private final ErrorClassifier errorClassifier;
    private final ResponseValidator responseValidator;
    private final BackoffPolicy backoffPolicy;
    private final DispatchListener listener;
    private final Sleeper sleeper;

    public Dispatcher(DispatchConfig config) {
        this.relay = config.getRelay();
        this.errorClassifier = config.getErrorClassifier();
        this.responseValidator = config.getResponseValidator();
        this.backoffPolicy = new BackoffPolicy(config.getRetryBudget());
        this.listener = config.getDispatchListener();
        this.sleeper = config.getSleeper();
    }

    /**
     * Creates a dispatcher with default settings around the given relay.
     *
     * @param relay the relay performing remote calls
     * @return the dispatcher
     */
    public static Dispatcher create(Relay relay) {
        return new Dispatcher(DispatchConfig.defaultConfig(relay));
    }

    /** @see #dispatch(String, List) */
    public DispatchResult dispatch(String operationName, Object... args) {
        return dispatch(operationName, Arrays.asList(args));
    }

    /**
     * Invokes an operation until it succeeds or a terminal classification is reached.
     *
     * @param operationName the remote operation
     * @param args the ordered arguments
     * @return a validated response, or an ignored result
     * @throws UnknownOutcomeException if the failure was classified as unknown
     * @throws InternalClassifierException if the classifier returned no classification
     * @throws DispatchInterruptedException if the thread was interrupted during backoff
     * @throws RuntimeException the original failure, if classified as fail or if retries ran out
     */
    public DispatchResult dispatch(String operationName, List<?> args) {
        var invocation = Invocation.first(operationName, args);
        while (true) {
            var current = invocation;
            notifyListener("onAttempt", () -> listener.onAttempt(current));
            var outcome = attempt(invocation);
            if (outcome.error() == null) {
                return DispatchResult.success(outcome.response());
            }

            var error = outcome.error();
            var classification = errorClassifier.classify(error, operationName);
            notifyListener("onClassified", () -> listener.onClassified(current, error, classification));
            if (classification == null) {
                throw new InternalClassifierException("Classifier returned no classification for " + error, error);
            }

            switch (classification) {
                case RETRY_WITH_BACKOFF -> {
                    if (!backoffPolicy.canRetry(invocation.attempt())) {
                        throw exhausted(invocation, error);
                    }
                    backoff(invocation, error);
                }
                case RETRY_IMMEDIATE -> {
                    if (!backoffPolicy.canRetry(invocation.attempt())) {
                        throw exhausted(invocation, error);
                    }
                }
                case IGNORE -> {
                    return DispatchResult.ignored(error);
                }
                case UNKNOWN -> throw new UnknownOutcomeException(error, operationName, invocation.args());
                case FAIL -> throw error;
                default -> throw new InternalClassifierException(
                        "Unknown error handling method: " + classification, error);
            }
            invocation = invocation.nextAttempt();
        }
    }

    private Outcome attempt(Invocation invocation) {
        Response response;
        try {
            response = relay.invoke(invocation.operationName(), invocation.args());
        } catch (RuntimeException e) {
            return Outcome.failed(e);
        }

        Outcome outcome;
        try {
            outcome = Outcome.succeeded(responseValidator.validate(response));
        } catch (RuntimeException e) {
            outcome = Outcome.failed(e);
        }
        var error = outcome.error();
        notifyListener("onValidated", () -> listener.onValidated(invocation, response, error));
        return outcome;
    }

    private void notifyListener(String event, Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.warn("Dispatch listener failed on {}", event, e);
        }
    }

    private void backoff(Invocation invocation, RuntimeException error) {
        var delay = backoffPolicy.delay(invocation.attempt());
        logger.debug("Backing off {} for {} after try {}", invocation.operationName(), delay, invocation.attempt());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new DispatchInterruptedException(invocation.operationName(), error);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }

    private static RuntimeException exhausted(Invocation invocation, RuntimeException error) {
        logger.debug("Retries exhausted for {} after {} tries", invocation.operationName(), invocation.attempt());
        return error;
    }

    /** Result of a single attempt: a validated response or the failure to classify. */
    private record Outcome(Response response, RuntimeException error) {
        static Outcome succeeded(Response response) {
            return new Outcome(response, null);
        }

        static Outcome failed(RuntimeException error) {
            return new Outcome(null, error);
        }
    }
}
