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

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ClusterClientFactory;
import com.storebrand.meshcheck.cluster.ServerVersion;

/**
 * Can we talk to the cluster at all. Both checks are fatal, nothing else can run without a client.
 */
class KubernetesApiChecks {
    private final ClusterClientFactory _clusterClientFactory;

    KubernetesApiChecks(ClusterClientFactory clusterClientFactory) {
        _clusterClientFactory = clusterClientFactory;
    }

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.KUBERNETES_API,
                Checker.builder("can initialize the client")
                        .hintAnchor("k8s-api")
                        .fatal()
                        .check(this::initializeClient),
                Checker.builder("can query the Kubernetes API")
                        .hintAnchor("k8s-api")
                        .fatal()
                        .check(this::queryApi));
    }

    CheckOutcome initializeClient(CheckContext context) {
        ClusterClient client = _clusterClientFactory.create();
        context.getDiscovery().cluster().setClient(client);
        return CheckOutcome.ok();
    }

    CheckOutcome queryApi(CheckContext context) {
        ServerVersion version = context.getDiscovery().cluster().requireClient().getServerVersion();
        context.getDiscovery().cluster().setServerVersion(version);
        return CheckOutcome.ok();
    }
}
