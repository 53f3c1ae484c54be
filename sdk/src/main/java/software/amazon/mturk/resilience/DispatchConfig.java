// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience;

import java.util.Objects;
import software.amazon.mturk.resilience.classify.DefaultErrorClassifier;
import software.amazon.mturk.resilience.classify.ErrorClassifier;
import software.amazon.mturk.resilience.logging.DispatchListener;
import software.amazon.mturk.resilience.logging.LoggingDispatchListener;
import software.amazon.mturk.resilience.relay.Relay;
import software.amazon.mturk.resilience.retry.RetryBudget;
import software.amazon.mturk.resilience.validation.ParameterValidator;
import software.amazon.mturk.resilience.validation.ResponseValidator;

/**
 * Configuration for a {@link Dispatcher}. Only the relay is required; every other collaborator has a default.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * DispatchConfig config = DispatchConfig.builder()
 *     .withRelay(relay)
 *     .withRetryBudget(new RetryBudget(3, Duration.ofMillis(250), 2.0))
 *     .build();
 * Dispatcher dispatcher = new Dispatcher(config);
 * }</pre>
 */
public final class DispatchConfig {
    private final Relay relay;
    private final RetryBudget retryBudget;
    private final ErrorClassifier errorClassifier;
    private final ResponseValidator responseValidator;
    private final DispatchListener dispatchListener;
    private final Sleeper sleeper;

    private DispatchConfig(Builder builder) {
        this.relay = builder.relay;
        this.retryBudget = builder.retryBudget != null ? builder.retryBudget : RetryBudget.defaults();
        this.errorClassifier = builder.errorClassifier != null
                ? builder.errorClassifier
                : DefaultErrorClassifier.builder().throttledMessage(builder.throttledMessage).build();
        this.responseValidator = builder.responseValidator != null
                ? builder.responseValidator
                : ResponseValidator.builder().throttledMessage(builder.throttledMessage).build();
        this.dispatchListener =
                builder.dispatchListener != null ? builder.dispatchListener : new LoggingDispatchListener();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
    }

    /**
     * Creates a configuration with default settings around the given relay.
     *
     * @param relay the relay performing remote calls
     * @return DispatchConfig with default collaborators
     */
    public static DispatchConfig defaultConfig(Relay relay) {
        return builder().withRelay(relay).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Relay getRelay() {
        return relay;
    }

    public RetryBudget getRetryBudget() {
        return retryBudget;
    }

    public ErrorClassifier getErrorClassifier() {
        return errorClassifier;
    }

    public ResponseValidator getResponseValidator() {
        return responseValidator;
    }

    public DispatchListener getDispatchListener() {
        return dispatchListener;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    /** Builder for DispatchConfig. */
    public static final class Builder {
        private Relay relay;
        private RetryBudget retryBudget;
        private ErrorClassifier errorClassifier;
        private ResponseValidator responseValidator;
        private DispatchListener dispatchListener;
        private Sleeper sleeper;
        private String throttledMessage = DefaultErrorClassifier.DEFAULT_THROTTLED_MESSAGE;

        private Builder() {}

        /**
         * Sets the relay performing remote calls. Required.
         *
         * @param relay the relay
         * @return This builder
         * @throws NullPointerException if relay is null
         */
        public Builder withRelay(Relay relay) {
            this.relay = Objects.requireNonNull(relay, "Relay cannot be null");
            return this;
        }

        /**
         * Sets the retry limits and backoff parameters.
         *
         * @param retryBudget the budget
         * @return This builder
         * @throws NullPointerException if retryBudget is null
         */
        public Builder withRetryBudget(RetryBudget retryBudget) {
            this.retryBudget = Objects.requireNonNull(retryBudget, "RetryBudget cannot be null");
            return this;
        }

        /**
         * Sets the classifier deciding what to do with failures.
         *
         * @param errorClassifier the classifier
         * @return This builder
         * @throws NullPointerException if errorClassifier is null
         */
        public Builder withErrorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = Objects.requireNonNull(errorClassifier, "ErrorClassifier cannot be null");
            return this;
        }

        /**
         * Sets the validator applied to every response.
         *
         * @param responseValidator the validator
         * @return This builder
         * @throws NullPointerException if responseValidator is null
         */
        public Builder withResponseValidator(ResponseValidator responseValidator) {
            this.responseValidator = Objects.requireNonNull(responseValidator, "ResponseValidator cannot be null");
            return this;
        }

        /**
         * Sets the listener receiving dispatch events. Use {@link DispatchListener#NOOP} to silence them.
         *
         * @param dispatchListener the listener
         * @return This builder
         * @throws NullPointerException if dispatchListener is null
         */
        public Builder withDispatchListener(DispatchListener dispatchListener) {
            this.dispatchListener = Objects.requireNonNull(dispatchListener, "DispatchListener cannot be null");
            return this;
        }

        /**
         * Sets how the dispatcher waits between backoff retries.
         *
         * @param sleeper the sleeper
         * @return This builder
         * @throws NullPointerException if sleeper is null
         */
        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "Sleeper cannot be null");
            return this;
        }

        /**
         * Sets the message that marks a failure as throttling. Applies to the default classifier and the default
         * validator, so a throttled response is raised and recognized with the same message. Has no effect on a
         * classifier or validator set explicitly.
         *
         * @param throttledMessage the throttled message
         * @return This builder
         * @throws IllegalArgumentException if throttledMessage is null or blank
         */
        public Builder withThrottledMessage(String throttledMessage) {
            ParameterValidator.validateNotBlank(throttledMessage, "throttledMessage");
            this.throttledMessage = throttledMessage;
            return this;
        }

        /**
         * Builds the DispatchConfig instance.
         *
         * @return Immutable DispatchConfig instance
         * @throws IllegalArgumentException if no relay was set
         */
        public DispatchConfig build() {
            if (relay == null) {
                throw new IllegalArgumentException("Missing parameters: relay");
            }
            return new DispatchConfig(this);
        }
    }
}
