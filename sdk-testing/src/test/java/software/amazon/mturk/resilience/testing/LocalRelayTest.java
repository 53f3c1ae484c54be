// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.testing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.mturk.resilience.exception.GenericRelayException;

class LocalRelayTest {

    @Test
    void testScriptedOutcomesAreConsumedInOrder() {
        var relay = new LocalRelay();
        var failure = new GenericRelayException("Throttled");
        var first = Responses.result("getHIT");
        relay.respond("getHIT", first).fail("getHIT", failure);

        assertSame(first, relay.invoke("getHIT", List.of()));
        assertSame(failure, assertThrows(GenericRelayException.class, () -> relay.invoke("getHIT", List.of())));
        var exhausted = assertThrows(IllegalStateException.class, () -> relay.invoke("getHIT", List.of()));
        assertEquals("No scripted outcome for getHIT", exhausted.getMessage());
    }

    @Test
    void testFallbackAppliesAfterQueue() {
        var relay = new LocalRelay();
        var fallback = Responses.result("getAccountBalance");
        relay.fail("getAccountBalance", new GenericRelayException("Oops")).alwaysRespond("getAccountBalance", fallback);

        assertThrows(GenericRelayException.class, () -> relay.invoke("getAccountBalance", List.of()));
        assertSame(fallback, relay.invoke("getAccountBalance", List.of()));
        assertSame(fallback, relay.invoke("getAccountBalance", List.of()));
    }

    @Test
    void testCallsAreRecorded() {
        var relay = new LocalRelay();
        relay.alwaysRespond("getHIT", Responses.result("getHIT"))
                .alwaysRespond("searchHITs", Responses.result("searchHITs"));

        relay.invoke("getHIT", Arrays.asList("HIT-1", null));
        relay.invoke("searchHITs", List.of());

        assertEquals(2, relay.getCalls().size());
        assertEquals(new LocalRelay.RelayCall("getHIT", Arrays.asList("HIT-1", null)), relay.getCalls("getHIT").get(0));
        assertEquals(1, relay.getCallCount("searchHITs"));

        relay.reset();

        assertTrue(relay.getCalls().isEmpty());
        assertThrows(IllegalStateException.class, () -> relay.invoke("getHIT", List.of()));
    }
}
