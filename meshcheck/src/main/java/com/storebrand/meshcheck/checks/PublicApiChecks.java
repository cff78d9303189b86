/*
 * Copyright 2022 Storebrand ASA
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.storebrand.meshcheck.checks;

import java.util.List;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.DiscoveryContext.NotDiscoveredException;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.rpc.PublicApiClient;
import com.storebrand.meshcheck.rpc.PublicApiClientFactory;
import com.storebrand.meshcheck.rpc.SelfCheckResult;

/**
 * The control plane's public API, and its own view of its health through the remote self check.
 */
class PublicApiChecks {
    private final PublicApiClientFactory _publicApiClientFactory;

    PublicApiChecks(PublicApiClientFactory publicApiClientFactory) {
        _publicApiClientFactory = publicApiClientFactory;
    }

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.PUBLIC_API,
                Checker.builder("can initialize the client")
                        .hintAnchor("l5d-api-control-api")
                        .fatal()
                        .check(this::initializeClient),
                Checker.builder("can query the control plane API")
                        .hintAnchor("l5d-api-control-api")
                        .fatal()
                        .retryDeadline(options.getRetryDeadline().orElse(null))
                        .selfCheck(this::selfCheck));
    }

    CheckOutcome initializeClient(CheckContext context) {
        PublicApiClient client = _publicApiClientFactory.create(context.getDiscovery().cluster().requireClient(),
                context.getOptions().getControlPlaneNamespace());
        context.getDiscovery().cluster().setPublicApiClient(client);
        return CheckOutcome.ok();
    }

    List<SelfCheckResult> selfCheck(CheckContext context) {
        PublicApiClient client = context.getDiscovery().cluster().getPublicApiClient()
                .orElseThrow(() -> new NotDiscoveredException("Public API client", CategoryId.PUBLIC_API));
        return client.selfCheck(context.getAttemptTimeout());
    }
}
