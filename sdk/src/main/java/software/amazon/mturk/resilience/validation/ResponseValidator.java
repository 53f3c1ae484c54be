// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.mturk.resilience.classify.DefaultErrorClassifier;
import software.amazon.mturk.resilience.exception.ResponseValidationException;
import software.amazon.mturk.resilience.exception.ThrottledException;
import software.amazon.mturk.resilience.model.Response;

/**
 * Checks a successfully decoded response for embedded errors and for a recognizable result payload.
 *
 * <p>Responses follow the Mechanical Turk layout:
 *
 * <pre>{@code
 * {
 *   "OperationRequest": { "RequestId": "...", "Errors": ... },
 *   "GetAccountBalanceResult": { "Request": { "IsValid": "True", "Errors": ... }, ... }
 * }
 * }</pre>
 *
 * <p>Checks run in order: a throttling error raises {@link ThrottledException} carrying the throttled message so it
 * is retried with backoff; operation-level errors, a missing result tag, or per-item errors in the result raise
 * {@link ResponseValidationException}.
 */
public class ResponseValidator {
    private static final Logger logger = LoggerFactory.getLogger(ResponseValidator.class);

    static final String ERRORS = "Errors";
    static final String ERROR = "Error";
    static final String CODE = "Code";
    static final String OPERATION_REQUEST = "OperationRequest";
    static final String REQUEST = "Request";

    public static final String DEFAULT_THROTTLING_ERROR_CODE = "ServiceUnavailable";
    public static final String DEFAULT_RESULT_TAG_MARKER = "Result";
    public static final Set<String> DEFAULT_LEGACY_RESULT_TAGS =
            Set.of("HIT", "Qualification", "QualificationType", "QualificationRequest", "Information");

    private final String throttlingErrorCode;
    private final String throttledMessage;
    private final String resultTagMarker;
    private final Set<String> legacyResultTags;

    private ResponseValidator(Builder builder) {
        this.throttlingErrorCode =
                builder.throttlingErrorCode != null ? builder.throttlingErrorCode : DEFAULT_THROTTLING_ERROR_CODE;
        this.throttledMessage = builder.throttledMessage != null
                ? builder.throttledMessage
                : DefaultErrorClassifier.DEFAULT_THROTTLED_MESSAGE;
        this.resultTagMarker = builder.resultTagMarker != null ? builder.resultTagMarker : DEFAULT_RESULT_TAG_MARKER;
        this.legacyResultTags = builder.legacyResultTags != null ? builder.legacyResultTags : DEFAULT_LEGACY_RESULT_TAGS;
    }

    public static ResponseValidator defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates a response.
     *
     * @param response the decoded response
     * @return the same response, unchanged
     * @throws ThrottledException if the response signals throttling
     * @throws ResponseValidationException if the response carries errors or no result tag
     */
    public Response validate(Response response) {
        if (response == null) {
            throw new ResponseValidationException(null, "relay returned no response");
        }
        if (isThrottled(response)) {
            throw new ThrottledException(throttledMessage);
        }
        if (isPresent(response.find(OPERATION_REQUEST, ERRORS))) {
            throw new ResponseValidationException(response);
        }

        var resultTag = response.tags().stream()
                .filter(this::isResultTag)
                .findFirst()
                .orElseThrow(() -> new ResponseValidationException(
                        response, "no acceptable result tag among: " + String.join(",", response.tags())));
        logger.debug("using result tag <{}>", resultTag);

        if (isPresent(response.find(resultTag, REQUEST, ERRORS))) {
            throw new ResponseValidationException(response);
        }
        return response;
    }

    /**
     * @param tag a top-level response key
     * @return true if the key names a result payload
     */
    public boolean isResultTag(String tag) {
        return tag != null && (tag.contains(resultTagMarker) || legacyResultTags.contains(tag));
    }

    private boolean isThrottled(Response response) {
        var errors = response.get(ERRORS);
        Collection<?> entries;
        if (errors instanceof Map) {
            var error = ((Map<?, ?>) errors).get(ERROR);
            entries = error instanceof Collection ? (Collection<?>) error : Collections.singletonList(error);
        } else if (errors instanceof Collection) {
            entries = (Collection<?>) errors;
        } else {
            return false;
        }
        return entries.stream()
                .filter(Map.class::isInstance)
                .map(entry -> ((Map<?, ?>) entry).get(CODE))
                .anyMatch(throttlingErrorCode::equals);
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    /** Builder for {@link ResponseValidator}. Unset values fall back to the defaults. */
    public static final class Builder {
        private String throttlingErrorCode;
        private String throttledMessage;
        private String resultTagMarker;
        private Set<String> legacyResultTags;

        private Builder() {}

        /**
         * Sets the error code that marks a response as throttled.
         *
         * @param code the error code, e.g. {@code ServiceUnavailable}
         * @return this builder
         */
        public Builder throttlingErrorCode(String code) {
            ParameterValidator.validateNotBlank(code, "throttlingErrorCode");
            this.throttlingErrorCode = code;
            return this;
        }

        /**
         * Sets the message of the failure raised for a throttled response.
         *
         * @param message the throttled message
         * @return this builder
         */
        public Builder throttledMessage(String message) {
            ParameterValidator.validateNotBlank(message, "throttledMessage");
            this.throttledMessage = message;
            return this;
        }

        /**
         * Sets the substring that identifies a result tag.
         *
         * @param marker the substring, e.g. {@code Result}
         * @return this builder
         */
        public Builder resultTagMarker(String marker) {
            ParameterValidator.validateNotBlank(marker, "resultTagMarker");
            this.resultTagMarker = marker;
            return this;
        }

        /**
         * Sets result tags accepted by exact name even though they lack the marker.
         *
         * @param tags the accepted tag names
         * @return this builder
         * @throws NullPointerException if tags is null
         */
        public Builder legacyResultTags(Collection<String> tags) {
            Objects.requireNonNull(tags, "legacyResultTags cannot be null");
            this.legacyResultTags = Set.copyOf(tags);
            return this;
        }

        public ResponseValidator build() {
            return new ResponseValidator(this);
        }
    }
}
