// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.relay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkPojo;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.mturk.resilience.model.Response;
import software.amazon.mturk.resilience.validation.ParameterValidator;

/**
 * A {@link Relay} backed by an AWS SDK v2 client.
 *
 * <p>Each supported operation is registered by name with the client call that performs it. SDK exceptions are
 * translated by a {@link SdkExceptionTranslator}; SDK responses are converted by a {@link SdkResponseConverter}.
 *
 * <pre>{@code
 * Relay relay = SdkClientRelay.builder()
 *     .operation("getAccountBalance", GetAccountBalanceRequest.class, mturk::getAccountBalance)
 *     .operation("getHIT", GetHitRequest.class, mturk::getHIT)
 *     .build();
 * }</pre>
 *
 * An unregistered operation, or arguments that do not fit the registered call, raise {@link IllegalArgumentException}.
 */
public class SdkClientRelay implements Relay {
    private static final Logger logger = LoggerFactory.getLogger(SdkClientRelay.class);

    private final Map<String, Function<List<Object>, ? extends SdkPojo>> operations;
    private final SdkExceptionTranslator exceptionTranslator;
    private final SdkResponseConverter responseConverter;

    private SdkClientRelay(Builder builder) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.operations));
        this.exceptionTranslator =
                builder.exceptionTranslator != null ? builder.exceptionTranslator : new SdkExceptionTranslator();
        this.responseConverter =
                builder.responseConverter != null ? builder.responseConverter : new SdkResponseConverter();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Response invoke(String operationName, List<Object> args) {
        var call = operations.get(operationName);
        if (call == null) {
            throw new IllegalArgumentException("Unsupported operation: " + operationName);
        }

        SdkPojo result;
        try {
            result = call.apply(args);
        } catch (SdkException e) {
            var translated = exceptionTranslator.translate(e);
            logger.debug("{} failed: {}", operationName, translated.toString());
            throw translated;
        }
        return responseConverter.toResponse(operationName, result);
    }

    /** @return the names of the registered operations */
    public List<String> operationNames() {
        return List.copyOf(operations.keySet());
    }

    /** Builder for SdkClientRelay. */
    public static final class Builder {
        private final Map<String, Function<List<Object>, ? extends SdkPojo>> operations = new LinkedHashMap<>();
        private SdkExceptionTranslator exceptionTranslator;
        private SdkResponseConverter responseConverter;

        private Builder() {}

        /**
         * Registers an operation taking the raw argument list.
         *
         * @param operationName the name callers dispatch
         * @param call performs the SDK call
         * @return this builder
         */
        public Builder operation(String operationName, Function<List<Object>, ? extends SdkPojo> call) {
            ParameterValidator.validateNotBlank(operationName, "operationName");
            operations.put(operationName, Objects.requireNonNull(call, "call cannot be null"));
            return this;
        }

        /**
         * Registers an operation taking exactly one request object of the given type.
         *
         * @param operationName the name callers dispatch
         * @param requestType the SDK request class
         * @param call performs the SDK call
         * @param <R> the request type
         * @return this builder
         */
        public <R> Builder operation(String operationName, Class<R> requestType, Function<R, ? extends SdkPojo> call) {
            Objects.requireNonNull(requestType, "requestType cannot be null");
            Objects.requireNonNull(call, "call cannot be null");
            return operation(operationName, args -> {
                if (args.size() != 1 || !requestType.isInstance(args.get(0))) {
                    throw new IllegalArgumentException(String.format(
                            "%s expects a single %s argument, got: %s",
                            operationName, requestType.getSimpleName(), args));
                }
                return call.apply(requestType.cast(args.get(0)));
            });
        }

        public Builder exceptionTranslator(SdkExceptionTranslator exceptionTranslator) {
            this.exceptionTranslator =
                    Objects.requireNonNull(exceptionTranslator, "SdkExceptionTranslator cannot be null");
            return this;
        }

        public Builder responseConverter(SdkResponseConverter responseConverter) {
            this.responseConverter = Objects.requireNonNull(responseConverter, "SdkResponseConverter cannot be null");
            return this;
        }

        public SdkClientRelay build() {
            return new SdkClientRelay(this);
        }
    }
}
