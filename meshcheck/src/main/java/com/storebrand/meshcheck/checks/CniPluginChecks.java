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
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.DaemonSet;

/**
 * The CNI plugin, if the mesh uses it. Enabled by option, or by the control plane configuration.
 */
class CniPluginChecks {
    static final String CNI_DAEMON_SET = "linkerd-cni";
    static final String NOT_USING_CNI = "not using cni";

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.CNI_PLUGIN,
                Checker.builder("cni plugin DaemonSet exists")
                        .hintAnchor("cni-plugin-ds-exists")
                        .fatal()
                        .check(this::daemonSetExists),
                Checker.builder("cni plugin pod is running on all nodes")
                        .hintAnchor("cni-plugin-ready")
                        .fatal()
                        .retryDeadline(options.getRetryDeadline().orElse(null))
                        .surfaceErrorOnRetry()
                        .check(this::podsRunning));
    }

    CheckOutcome daemonSetExists(CheckContext context) {
        if (!isCniEnabled(context)) {
            return CheckOutcome.skip(NOT_USING_CNI);
        }
        String namespace = context.getOptions().getCniNamespace();
        DaemonSet daemonSet = context.getDiscovery().cluster().requireClient()
                .getDaemonSet(namespace, CNI_DAEMON_SET)
                .orElse(null);
        if (daemonSet == null) {
            return CheckOutcome.fail("DaemonSet " + CNI_DAEMON_SET + " does not exist in namespace " + namespace);
        }
        context.getDiscovery().cluster().setCniDaemonSet(daemonSet);
        return CheckOutcome.ok();
    }

    CheckOutcome podsRunning(CheckContext context) {
        if (!isCniEnabled(context)) {
            return CheckOutcome.skip(NOT_USING_CNI);
        }
        // Fetch again, the status changes while we retry.
        DaemonSet daemonSet = context.getDiscovery().cluster().requireClient()
                .getDaemonSet(context.getOptions().getCniNamespace(), CNI_DAEMON_SET)
                .orElseGet(() -> context.getDiscovery().cluster().getCniDaemonSet()
                        .orElseThrow(() -> new IllegalStateException("DaemonSet " + CNI_DAEMON_SET
                                + " disappeared")));
        if (daemonSet.currentNumberScheduled != daemonSet.desiredNumberScheduled) {
            return CheckOutcome.fail("desired: " + daemonSet.desiredNumberScheduled
                    + ", scheduled: " + daemonSet.currentNumberScheduled);
        }
        if (daemonSet.numberReady != daemonSet.currentNumberScheduled) {
            return CheckOutcome.fail("number ready: " + daemonSet.numberReady
                    + ", number scheduled: " + daemonSet.currentNumberScheduled);
        }
        return CheckOutcome.ok();
    }

    private static boolean isCniEnabled(CheckContext context) {
        return context.getOptions().isCniEnabled()
                || context.getDiscovery().cluster().getControlPlaneConfig()
                .map(ControlPlaneConfig::isCniEnabled)
                .orElse(false);
    }
}
