// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.exception;

import java.util.Objects;

/**
 * A structured fault returned by the remote service.
 *
 * <p>Fault codes may arrive namespace-qualified (for example {@code aws:Server.ServiceUnavailable}). The qualified form
 * is kept for diagnostics; {@link #getFaultCode()} returns the local part that classifiers compare against.
 */
public class FaultException extends RelayException {
    private final String qualifiedFaultCode;
    private final String faultCode;

    public FaultException(String qualifiedFaultCode, String message, Throwable cause) {
        super(formatMessage(qualifiedFaultCode, message), cause);
        this.qualifiedFaultCode = Objects.requireNonNull(qualifiedFaultCode, "faultCode cannot be null");
        this.faultCode = localPart(qualifiedFaultCode);
    }

    public FaultException(String qualifiedFaultCode, String message) {
        this(qualifiedFaultCode, message, null);
    }

    public FaultException(String qualifiedFaultCode) {
        this(qualifiedFaultCode, null, null);
    }

    /** @return the fault code without its namespace prefix */
    public String getFaultCode() {
        return faultCode;
    }

    /** @return the fault code exactly as the relay reported it */
    public String getQualifiedFaultCode() {
        return qualifiedFaultCode;
    }

    @Override
    public RelayErrorKind kind() {
        return RelayErrorKind.FAULT;
    }

    private static String localPart(String code) {
        var separator = code.indexOf(':');
        return separator >= 0 ? code.substring(separator + 1) : code;
    }

    private static String formatMessage(String code, String message) {
        return message == null ? "Fault " + code : "Fault " + code + ": " + message;
    }
}
