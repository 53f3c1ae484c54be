// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import software.amazon.mturk.resilience.classify.Classification;
import software.amazon.mturk.resilience.model.Invocation;
import software.amazon.mturk.resilience.model.Response;
import software.amazon.mturk.resilience.serde.JacksonSerDes;
import software.amazon.mturk.resilience.serde.SerDes;

/** Writes dispatch events to SLF4J, with the operation name and attempt number in the MDC. */
public class LoggingDispatchListener implements DispatchListener {
    static final String MDC_OPERATION_NAME = "operationName";
    static final String MDC_ATTEMPT = "attempt";

    private final Logger delegate;
    private final SerDes serDes;

    public LoggingDispatchListener() {
        this(LoggerFactory.getLogger(LoggingDispatchListener.class), new JacksonSerDes());
    }

    public LoggingDispatchListener(Logger delegate, SerDes serDes) {
        this.delegate = delegate;
        this.serDes = serDes;
    }

    @Override
    public void onAttempt(Invocation invocation) {
        log(invocation, () -> delegate.debug(
                "Dispatching call to {} (try {})", invocation.operationName(), invocation.attempt()));
    }

    @Override
    public void onClassified(Invocation invocation, Throwable error, Classification classification) {
        log(invocation, () -> {
            if (classification == Classification.UNKNOWN || classification == null) {
                delegate.warn("Handling error: {} classified as {}", error, classification);
            } else {
                delegate.debug("Handling error: {} classified as {}", error, classification);
            }
        });
    }

    @Override
    public void onValidated(Invocation invocation, Response response, RuntimeException failure) {
        if (!delegate.isDebugEnabled()) {
            return;
        }
        log(invocation, () -> {
            var rendered = render(response);
            if (failure == null) {
                delegate.debug("Validated response: {}", rendered);
            } else {
                delegate.debug("Rejected response: {} ({})", rendered, failure.getMessage());
            }
        });
    }

    private String render(Response response) {
        if (response == null) {
            return null;
        }
        try {
            return serDes.serialize(response);
        } catch (RuntimeException e) {
            delegate.debug("Could not render response as JSON: {}", e.getMessage());
            return String.valueOf(response);
        }
    }

    private void log(Invocation invocation, Runnable logAction) {
        try {
            MDC.put(MDC_OPERATION_NAME, invocation.operationName());
            MDC.put(MDC_ATTEMPT, String.valueOf(invocation.attempt()));
            logAction.run();
        } finally {
            MDC.remove(MDC_OPERATION_NAME);
            MDC.remove(MDC_ATTEMPT);
        }
    }
}
