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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.ErrorMessages;
import com.storebrand.meshcheck.cluster.Pod;

/**
 * Pods carrying a mesh proxy, shared by the control plane and data plane categories.
 */
final class ProxyPods {
    /**
     * Set by the proxy injector on every meshed pod, naming the namespace of the control plane it belongs to.
     */
    static final String CONTROL_PLANE_NS_LABEL = "linkerd.io/control-plane-ns";

    private ProxyPods() {
        // Utility class - hiding constructor
    }

    /**
     * @return the label selector for pods meshed by the control plane in the given namespace.
     */
    static Map<String, String> meshedBy(String controlPlaneNamespace) {
        return Collections.singletonMap(CONTROL_PLANE_NS_LABEL, controlPlaneNamespace);
    }

    /**
     * Every pod must be running with a ready proxy. Pods that have completed are ignored.
     *
     * @param namespace
     *            where the pods were listed, used in the message when there are none. {@code null} for all namespaces.
     */
    static CheckOutcome checkRunning(List<Pod> pods, String namespace) {
        if (pods.isEmpty()) {
            return CheckOutcome.fail("no \"" + Pod.PROXY_CONTAINER_NAME + "\" containers found"
                    + (namespace == null ? "" : " in the \"" + namespace + "\" namespace"));
        }
        List<String> problems = new ArrayList<>();
        for (Pod pod : pods) {
            if (Pod.PHASE_SUCCEEDED.equals(pod.phase)) {
                continue;
            }
            if (!pod.isRunning()) {
                problems.add("pod \"" + pod.name + "\" status is " + pod.phase);
            }
            else if (!pod.isProxyReady()) {
                problems.add("container \"" + Pod.PROXY_CONTAINER_NAME + "\" in pod \"" + pod.name
                        + "\" is not ready");
            }
        }
        if (!problems.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(problems));
        }
        return CheckOutcome.ok();
    }
}
