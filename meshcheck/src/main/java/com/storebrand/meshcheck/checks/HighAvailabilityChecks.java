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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.Deployment;

class HighAvailabilityChecks {
    static final String NOT_HA = "not run for non HA installs";

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.HIGH_AVAILABILITY,
                Checker.builder("multiple replicas of control plane pods")
                        .hintAnchor("l5d-control-plane-replicas")
                        .warning()
                        .retryDeadline(options.getRetryDeadline().orElse(null))
                        .surfaceErrorOnRetry()
                        .check(this::multipleReplicas));
    }

    CheckOutcome multipleReplicas(CheckContext context) {
        if (!context.getDiscovery().cluster().requireControlPlaneConfig().isHighAvailability()) {
            return CheckOutcome.skip(NOT_HA);
        }
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        String namespace = context.getOptions().getControlPlaneNamespace();
        List<String> underProvisioned = new ArrayList<>();
        for (String component : ControlPlaneExistenceChecks.CORE_COMPONENTS) {
            String name = "linkerd-" + component;
            Optional<Deployment> deployment = client.getDeployment(namespace, name);
            if (!deployment.isPresent() || deployment.get().availableReplicas <= 1) {
                underProvisioned.add(name);
            }
        }
        if (!underProvisioned.isEmpty()) {
            return CheckOutcome.fail("not enough replicas available for " + underProvisioned);
        }
        return CheckOutcome.ok();
    }
}
