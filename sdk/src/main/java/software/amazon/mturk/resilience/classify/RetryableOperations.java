// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.classify;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import software.amazon.mturk.resilience.validation.ParameterValidator;

/**
 * Factory for predicates deciding whether an operation is safe to repeat after a transport failure.
 *
 * <p>The default infers this from the operation name, treating read-style and set-style operations as idempotent.
 * Callers that know exactly which operations are idempotent should prefer {@link #named(Collection)}.
 */
public final class RetryableOperations {

    /** Name prefixes presumed idempotent by default. */
    public static final List<String> DEFAULT_PREFIXES =
            List.of("search", "get", "register", "update", "disable", "assign", "set", "dispose");

    private RetryableOperations() {}

    /** @return a case-insensitive prefix match against {@link #DEFAULT_PREFIXES} */
    public static Predicate<String> defaults() {
        return byPrefix(DEFAULT_PREFIXES);
    }

    /**
     * Matches operation names starting with any of the given prefixes, ignoring case.
     *
     * @param prefixes the prefixes, at least one
     * @return the predicate
     */
    public static Predicate<String> byPrefix(Collection<String> prefixes) {
        ParameterValidator.validateNotEmpty(prefixes, "prefixes");
        var lowered = prefixes.stream().map(p -> p.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableList());
        return operationName -> {
            if (operationName == null) {
                return false;
            }
            var name = operationName.toLowerCase(Locale.ROOT);
            return lowered.stream().anyMatch(name::startsWith);
        };
    }

    /**
     * Matches exactly the given operation names.
     *
     * @param operationNames the idempotent operations
     * @return the predicate
     */
    public static Predicate<String> named(Collection<String> operationNames) {
        ParameterValidator.validateNotEmpty(operationNames, "operationNames");
        Set<String> names = Set.copyOf(operationNames);
        return operationName -> operationName != null && names.contains(operationName);
    }

    /** @return a predicate rejecting every operation, so transport failures always classify as unknown */
    public static Predicate<String> none() {
        return operationName -> false;
    }
}
