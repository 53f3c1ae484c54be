// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.classify;

/** What the dispatcher does with a failed attempt. Exactly one is chosen per failure. */
public enum Classification {
    /** Sleep for the backoff delay, then try again while the retry budget lasts. */
    RETRY_WITH_BACKOFF,

    /** Try again straight away while the retry budget lasts. */
    RETRY_IMMEDIATE,

    /** Return the failure to the caller as an ignored result instead of throwing. */
    IGNORE,

    /** Rethrow the original failure unchanged. */
    FAIL,

    /** The outcome is undetermined; wrap the failure with the call that produced it. */
    UNKNOWN
}
