// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import software.amazon.mturk.resilience.exception.SerDesException;

/**
 * Jackson-backed {@link SerDes}. Responses converted from AWS SDK clients carry {@code java.time} values, so the
 * JSR-310 module is registered and dates are written as ISO-8601 strings.
 */
public class JacksonSerDes implements SerDes {
    private final ObjectWriter writer;

    public JacksonSerDes() {
        this(JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build()
                .writer());
    }

    public JacksonSerDes(ObjectWriter writer) {
        this.writer = writer;
    }

    @Override
    public String serialize(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerDesException("Serialization failed", e);
        }
    }
}
