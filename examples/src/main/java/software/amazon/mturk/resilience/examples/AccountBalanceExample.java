// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.mturk.model.GetAccountBalanceRequest;
import software.amazon.mturk.resilience.Dispatcher;

/**
 * Example reading the requester's balance. A read is safe to repeat, so timeouts are retried immediately and
 * throttling is retried with backoff without any caller involvement.
 */
public class AccountBalanceExample {
    private static final Logger logger = LoggerFactory.getLogger(AccountBalanceExample.class);

    private final Dispatcher dispatcher;

    public AccountBalanceExample(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public String availableBalance() {
        var response = dispatcher
                .dispatch("getAccountBalance", GetAccountBalanceRequest.builder().build())
                .getResponse();
        var balance = (String) response.find("GetAccountBalanceResult", "AvailableBalance");
        logger.info("Available balance: {}", balance);
        return balance;
    }

    public static void main(String[] args) {
        try (var mturk = MTurkRelays.sandboxClient()) {
            var example = new AccountBalanceExample(Dispatcher.create(MTurkRelays.forClient(mturk)));
            example.availableBalance();
        }
    }
}
