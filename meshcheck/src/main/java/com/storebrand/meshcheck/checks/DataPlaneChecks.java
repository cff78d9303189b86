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
import java.util.Optional;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.Pod;

/**
 * The meshed pods, in the data plane namespace if one is given, otherwise in all namespaces.
 */
class DataPlaneChecks {
    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.DATA_PLANE,
                Checker.builder("data plane namespace exists")
                        .hintAnchor("l5d-data-plane-exists")
                        .fatal()
                        .check(this::namespaceExists),
                Checker.builder("data plane proxies are ready")
                        .hintAnchor("l5d-data-plane-ready")
                        .fatal()
                        .retryDeadline(options.getRetryDeadline().orElse(null))
                        .check(this::proxiesReady));
    }

    CheckOutcome namespaceExists(CheckContext context) {
        Optional<String> namespace = context.getOptions().getDataPlaneNamespace();
        // ?: Are we looking at a single namespace?
        if (!namespace.isPresent()) {
            // -> No, all namespaces always exist.
            return CheckOutcome.ok();
        }
        if (!context.getDiscovery().cluster().requireClient().namespaceExists(namespace.get())) {
            return CheckOutcome.fail("data plane namespace does not exist: " + namespace.get());
        }
        return CheckOutcome.ok();
    }

    CheckOutcome proxiesReady(CheckContext context) {
        String namespace = context.getOptions().getDataPlaneNamespace().orElse(null);
        List<Pod> pods = context.getDiscovery().cluster().requireClient()
                .listPods(namespace, ProxyPods.meshedBy(context.getOptions().getControlPlaneNamespace()));
        return ProxyPods.checkRunning(pods, namespace);
    }
}
