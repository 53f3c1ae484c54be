// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.validation;

import java.time.Duration;
import java.util.Collection;

/**
 * Utility class for validating configuration parameters.
 *
 * <p>Provides common validation methods to ensure consistent error messages across builders.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is strictly positive.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null, zero or negative
     */
    public static void validatePositiveDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is not positive
     */
    public static void validatePositiveInteger(int value, String parameterName) {
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a floating point value is positive and finite.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is NaN, infinite or not positive
     */
    public static void validatePositiveDouble(double value, String parameterName) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a string is present and not blank.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or blank
     */
    public static void validateNotBlank(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(parameterName + " cannot be blank");
        }
    }

    /**
     * Validates that a collection is present and has at least one element.
     *
     * @param values the collection to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if values is null or empty
     */
    public static void validateNotEmpty(Collection<?> values, String parameterName) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(parameterName + " cannot be empty");
        }
    }
}
