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
import com.storebrand.meshcheck.DiscoveryContext.NotDiscoveredException;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ServerVersion;

class KubernetesVersionChecks {
    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.KUBERNETES_VERSION,
                Checker.builder("is running the minimum Kubernetes API version")
                        .hintAnchor("k8s-version")
                        .fatal()
                        .check(this::minimumVersion));
    }

    CheckOutcome minimumVersion(CheckContext context) {
        ServerVersion serverVersion = context.getDiscovery().cluster().getServerVersion()
                .orElseThrow(() -> new NotDiscoveredException("Kubernetes server version", CategoryId.KUBERNETES_API));
        String minimum = context.getOptions().getMinimumKubernetesVersion();
        int[] actual = serverVersion.toSemanticVersion();
        int[] required = ServerVersion.parse(minimum);
        for (int i = 0; i < required.length; i++) {
            if (actual[i] > required[i]) {
                return CheckOutcome.ok();
            }
            if (actual[i] < required[i]) {
                return CheckOutcome.fail("Kubernetes is on version [" + serverVersion.gitVersion
                        + "], but version [" + minimum + "] or more recent is required");
            }
        }
        return CheckOutcome.ok();
    }
}
