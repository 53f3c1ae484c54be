// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.mturk.resilience.examples;

import java.net.URI;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.SdkSystemSetting;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.mturk.MTurkClient;
import software.amazon.awssdk.services.mturk.model.ApproveAssignmentRequest;
import software.amazon.awssdk.services.mturk.model.CreateHitRequest;
import software.amazon.awssdk.services.mturk.model.GetAccountBalanceRequest;
import software.amazon.awssdk.services.mturk.model.GetHitRequest;
import software.amazon.mturk.resilience.relay.SdkClientRelay;

/** Builds relays over the Mechanical Turk requester API. */
public final class MTurkRelays {
    static final String SANDBOX_ENDPOINT = "https://mturk-requester-sandbox.us-east-1.amazonaws.com";

    private MTurkRelays() {}

    /**
     * Registers the operations used by the examples. Operation names follow the service's own method names.
     *
     * @param mturk the client performing the calls
     * @return the relay
     */
    public static SdkClientRelay forClient(MTurkClient mturk) {
        return SdkClientRelay.builder()
                .operation("getAccountBalance", GetAccountBalanceRequest.class, mturk::getAccountBalance)
                .operation("getHIT", GetHitRequest.class, mturk::getHIT)
                .operation("createHIT", CreateHitRequest.class, mturk::createHIT)
                .operation("approveAssignment", ApproveAssignmentRequest.class, mturk::approveAssignment)
                .build();
    }

    /**
     * Creates a client for the requester sandbox. The region defaults to us-east-1 when AWS_REGION is not set, the only
     * region Mechanical Turk is offered in.
     */
    public static MTurkClient sandboxClient() {
        var region = System.getenv(SdkSystemSetting.AWS_REGION.environmentVariable());
        if (region == null || region.isEmpty()) {
            region = "us-east-1";
        }
        return MTurkClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .endpointOverride(URI.create(SANDBOX_ENDPOINT))
                .build();
    }
}
