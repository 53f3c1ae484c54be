// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.relay;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.awssdk.awscore.AwsResponse;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.SdkField;
import software.amazon.awssdk.core.SdkPojo;
import software.amazon.awssdk.core.util.SdkAutoConstructList;
import software.amazon.awssdk.core.util.SdkAutoConstructMap;
import software.amazon.mturk.resilience.model.Response;

/**
 * Converts AWS SDK v2 response objects into {@link Response}s laid out the way Mechanical Turk responses always have
 * been:
 *
 * <pre>{@code
 * {
 *   "OperationRequest": { "RequestId": "..." },
 *   "GetAccountBalanceResult": { "Request": { "IsValid": "True" }, "AvailableBalance": "10000.00" }
 * }
 * }</pre>
 *
 * Members are read through the SDK's own field metadata and keyed by their service member names. Unset members and
 * auto-constructed empty collections are left out.
 */
public class SdkResponseConverter {
    static final String OPERATION_REQUEST = "OperationRequest";
    static final String REQUEST_ID = "RequestId";
    static final String REQUEST = "Request";
    static final String IS_VALID = "IsValid";
    static final String RESULT_SUFFIX = "Result";

    /**
     * @param operationName the operation that produced the result, e.g. {@code getAccountBalance}
     * @param result the SDK response, may be null
     * @return the converted response
     */
    public Response toResponse(String operationName, SdkPojo result) {
        var operationRequest = new LinkedHashMap<String, Object>();
        if (result instanceof AwsResponse) {
            var metadata = ((AwsResponse) result).responseMetadata();
            if (metadata != null) {
                operationRequest.put(REQUEST_ID, metadata.requestId());
            }
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put(REQUEST, Map.of(IS_VALID, "True"));
        if (result != null) {
            payload.putAll(toMap(result));
        }

        var entries = new LinkedHashMap<String, Object>();
        entries.put(OPERATION_REQUEST, operationRequest);
        entries.put(resultTag(operationName), payload);
        return Response.of(entries);
    }

    /**
     * @param operationName an operation name in either camel or Pascal case
     * @return the result tag for that operation, e.g. {@code GetHITResult} for {@code getHIT}
     */
    public static String resultTag(String operationName) {
        return Character.toUpperCase(operationName.charAt(0)) + operationName.substring(1) + RESULT_SUFFIX;
    }

    Map<String, Object> toMap(SdkPojo pojo) {
        var map = new LinkedHashMap<String, Object>();
        for (SdkField<?> field : pojo.sdkFields()) {
            var value = field.getValueOrDefault(pojo);
            if (value == null || value instanceof SdkAutoConstructList || value instanceof SdkAutoConstructMap) {
                continue;
            }
            map.put(field.memberName(), toPlain(value));
        }
        return map;
    }

    private Object toPlain(Object value) {
        if (value instanceof SdkPojo) {
            return toMap((SdkPojo) value);
        }
        if (value instanceof SdkBytes) {
            return ((SdkBytes) value).asByteArray();
        }
        if (value instanceof Map) {
            var map = new LinkedHashMap<String, Object>();
            ((Map<?, ?>) value).forEach((k, v) -> map.put(String.valueOf(k), toPlain(v)));
            return map;
        }
        if (value instanceof Collection) {
            var list = new ArrayList<>();
            ((Collection<?>) value).forEach(v -> list.add(toPlain(v)));
            return list;
        }
        return value;
    }
}
