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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.ErrorMessages;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.ControlPlaneConfigFetcher;
import com.storebrand.meshcheck.cluster.Pod;
import com.storebrand.meshcheck.cluster.Pod.Condition;
import com.storebrand.meshcheck.cluster.Pod.ContainerStatus;

/**
 * Is the control plane installed: namespace, configuration and pods. Loads the configuration all later categories
 * rely on.
 */
class ControlPlaneExistenceChecks {
    static final String COMPONENT_LABEL = "linkerd.io/control-plane-component";

    /**
     * Components that must have a ready pod, and that need replicas in an HA install.
     */
    static final List<String> CORE_COMPONENTS = Collections.unmodifiableList(
            Arrays.asList("destination", "identity", "proxy-injector"));

    private final ControlPlaneConfigFetcher _configFetcher;

    ControlPlaneExistenceChecks(ControlPlaneConfigFetcher configFetcher) {
        _configFetcher = configFetcher;
    }

    Category category(HealthCheckOptions options) {
        Instant retryDeadline = options.getRetryDeadline().orElse(null);
        return Category.of(CategoryId.CONTROL_PLANE_EXISTENCE,
                Checker.builder("control plane namespace exists")
                        .hintAnchor("l5d-existence-ns")
                        .fatal()
                        .check(this::namespaceExists),
                Checker.builder("'linkerd-config' config map exists")
                        .hintAnchor("l5d-existence-linkerd-config")
                        .fatal()
                        .check(this::configExists),
                Checker.builder("control plane pods are ready")
                        .hintAnchor("l5d-api-control-ready")
                        .fatal()
                        .retryDeadline(retryDeadline)
                        .surfaceErrorOnRetry()
                        .check(this::podsReady),
                Checker.builder("no unschedulable pods")
                        .hintAnchor("l5d-existence-unschedulable-pods")
                        .warning()
                        .retryDeadline(retryDeadline)
                        .surfaceErrorOnRetry()
                        .check(this::noUnschedulablePods));
    }

    CheckOutcome namespaceExists(CheckContext context) {
        String namespace = context.getOptions().getControlPlaneNamespace();
        if (!context.getDiscovery().cluster().requireClient().namespaceExists(namespace)) {
            return CheckOutcome.fail("control plane namespace does not exist: " + namespace);
        }
        return CheckOutcome.ok();
    }

    CheckOutcome configExists(CheckContext context) {
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        ControlPlaneConfig config = _configFetcher.fetch(client, context.getOptions().getControlPlaneNamespace());
        context.getDiscovery().cluster().setControlPlaneConfig(config);
        return CheckOutcome.ok();
    }

    CheckOutcome podsReady(CheckContext context) {
        List<Pod> pods = context.getDiscovery().cluster().requireClient()
                .listPods(context.getOptions().getControlPlaneNamespace(), Collections.emptyMap());
        context.getDiscovery().cluster().setControlPlanePods(pods);

        for (String component : CORE_COMPONENTS) {
            List<Pod> componentPods = new ArrayList<>();
            for (Pod pod : pods) {
                if (component.equals(pod.getLabel(COMPONENT_LABEL))) {
                    componentPods.add(pod);
                }
            }
            if (componentPods.isEmpty()) {
                return CheckOutcome.fail("No running pods for \"linkerd-" + component + "\"");
            }
            String problem = null;
            for (Pod pod : componentPods) {
                problem = podProblem(pod);
                if (problem == null) {
                    break;
                }
            }
            // ?: Did every pod of this component have a problem?
            if (problem != null) {
                // -> Yes, report the last one.
                return CheckOutcome.fail("No running pods for \"linkerd-" + component + "\": " + problem);
            }
        }
        return CheckOutcome.ok();
    }

    CheckOutcome noUnschedulablePods(CheckContext context) {
        List<Pod> pods = context.getDiscovery().cluster().getControlPlanePods()
                .orElseGet(() -> context.getDiscovery().cluster().requireClient()
                        .listPods(context.getOptions().getControlPlaneNamespace(), Collections.emptyMap()));
        List<String> problems = new ArrayList<>();
        for (Pod pod : pods) {
            if (!Pod.PHASE_PENDING.equals(pod.phase)) {
                continue;
            }
            for (Condition condition : pod.conditions) {
                if (Condition.REASON_UNSCHEDULABLE.equals(condition.reason)) {
                    problems.add(pod.name + ": " + condition.message);
                }
            }
        }
        if (!problems.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(problems));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    /**
     * @return null if the pod is running with all containers ready, otherwise what is wrong with it.
     */
    private static String podProblem(Pod pod) {
        if (!pod.isRunning()) {
            return pod + " status is " + pod.phase;
        }
        for (ContainerStatus container : pod.containerStatuses) {
            if (!container.ready) {
                return pod + " container " + container.name + " is not ready";
            }
        }
        return null;
    }
}
