// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseTest {

    @Test
    void tagsKeepRelayOrder() {
        var entries = new LinkedHashMap<String, Object>();
        entries.put("OperationRequest", Map.of());
        entries.put("SearchHITsResult", Map.of());
        entries.put("Errors", List.of());

        var response = Response.of(entries);

        assertEquals(List.of("OperationRequest", "SearchHITsResult", "Errors"), response.tags());
        assertTrue(response.hasTag("Errors"));
        assertFalse(response.hasTag("HIT"));
    }

    @Test
    void entriesAreCopied() {
        var entries = new HashMap<String, Object>();
        entries.put("Result", "a");
        var response = Response.of(entries);

        entries.put("Other", "b");

        assertEquals(List.of("Result"), response.tags());
        assertThrows(UnsupportedOperationException.class, () -> response.asMap().put("x", "y"));
    }

    @Test
    void findWalksNestedMaps() {
        var response = Response.of(Map.of(
                "GetHITResult", Map.of("Request", Map.of("IsValid", "True"), "HIT", List.of("h1"))));

        assertEquals("True", response.find("GetHITResult", "Request", "IsValid"));
        assertEquals(List.of("h1"), response.find("GetHITResult", "HIT"));
        assertNull(response.find("GetHITResult", "Request", "Errors"));
        assertNull(response.find("GetHITResult", "HIT", "Anything"));
        assertNull(response.find("Missing", "Request"));
        assertEquals(response.asMap(), response.find());
    }

    @Test
    void nullValuesAreAllowed() {
        var entries = new HashMap<String, Object>();
        entries.put("Result", null);

        var response = Response.of(entries);

        assertTrue(response.hasTag("Result"));
        assertNull(response.get("Result"));
    }

    @Test
    void equalityFollowsEntries() {
        assertEquals(Response.of(Map.of("Result", 1)), Response.of(Map.of("Result", 1)));
        assertEquals(Response.of(Map.of("Result", 1)).hashCode(), Response.of(Map.of("Result", 1)).hashCode());
        assertEquals("Response{Result=1}", Response.of(Map.of("Result", 1)).toString());
        assertThrows(NullPointerException.class, () -> Response.of(null));
    }

    @Test
    void nullTagsAreRejected() {
        var entries = new HashMap<String, Object>();
        entries.put(null, "orphan");
        entries.put("Result", "ok");

        var exception = assertThrows(NullPointerException.class, () -> Response.of(entries));

        assertEquals("Response tags cannot be null", exception.getMessage());
    }
}
