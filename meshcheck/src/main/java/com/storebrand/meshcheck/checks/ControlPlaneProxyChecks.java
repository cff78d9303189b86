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

import java.util.Collections;
import java.util.List;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.Pod;

/**
 * The proxies of the control plane pods.
 */
class ControlPlaneProxyChecks {
    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.CONTROL_PLANE_PROXY,
                Checker.builder("control plane proxies are healthy")
                        .hintAnchor("l5d-cp-proxy-healthy")
                        .fatal()
                        .retryDeadline(options.getRetryDeadline().orElse(null))
                        .surfaceErrorOnRetry()
                        .check(this::proxiesHealthy));
    }

    CheckOutcome proxiesHealthy(CheckContext context) {
        String namespace = context.getOptions().getControlPlaneNamespace();
        // List again, the pods change while we retry.
        List<Pod> pods = context.getDiscovery().cluster().requireClient()
                .listPods(namespace, Collections.emptyMap());
        return ProxyPods.checkRunning(pods, namespace);
    }
}
