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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.TreeSet;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.CustomResourceDefinition;
import com.storebrand.meshcheck.cluster.ResourceKind;

/**
 * The cluster scoped resources and service accounts an install creates. Resources are found by the control plane
 * namespace label the install puts on them.
 */
class LinkerdConfigChecks {
    static final List<String> SERVICE_ACCOUNTS = Collections.unmodifiableList(
            Arrays.asList("linkerd-destination", "linkerd-identity", "linkerd-proxy-injector"));

    /**
     * Components with a cluster role and binding named {@code linkerd-<namespace>-<component>}.
     */
    static final List<String> CLUSTER_ROLE_COMPONENTS = Collections.unmodifiableList(
            Arrays.asList("identity", "proxy-injector"));

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.CONFIG,
                Checker.builder("control plane ClusterRoles exist")
                        .hintAnchor("l5d-existence-cr")
                        .fatal()
                        .check(context -> checkResources(context, ResourceKind.CLUSTER_ROLE,
                                clusterRoleNames(context))),
                Checker.builder("control plane ClusterRoleBindings exist")
                        .hintAnchor("l5d-existence-crb")
                        .fatal()
                        .check(context -> checkResources(context, ResourceKind.CLUSTER_ROLE_BINDING,
                                clusterRoleNames(context))),
                Checker.builder("control plane ServiceAccounts exist")
                        .hintAnchor("l5d-existence-sa")
                        .fatal()
                        .check(context -> checkResources(context, ResourceKind.SERVICE_ACCOUNT,
                                SERVICE_ACCOUNTS)),
                Checker.builder("control plane CustomResourceDefinitions exist")
                        .hintAnchor("l5d-existence-crd")
                        .fatal()
                        .check(this::customResourceDefinitionsExist),
                Checker.builder("control plane MutatingWebhookConfigurations exist")
                        .hintAnchor("l5d-existence-mwc")
                        .fatal()
                        .check(context -> checkResources(context, ResourceKind.MUTATING_WEBHOOK_CONFIGURATION,
                                Collections.singletonList(WebhookTlsChecks.PROXY_INJECTOR.configurationName()))),
                Checker.builder("control plane ValidatingWebhookConfigurations exist")
                        .hintAnchor("l5d-existence-vwc")
                        .fatal()
                        .check(context -> checkResources(context, ResourceKind.VALIDATING_WEBHOOK_CONFIGURATION,
                                Collections.singletonList(WebhookTlsChecks.SP_VALIDATOR.configurationName()))));
    }

    CheckOutcome checkResources(CheckContext context, ResourceKind kind, List<String> expected) {
        String namespace = context.getOptions().getControlPlaneNamespace();
        List<String> found = context.getDiscovery().cluster().requireClient()
                .listResourceNames(kind, namespace, ProxyPods.meshedBy(namespace));
        TreeSet<String> missing = new TreeSet<>(expected);
        missing.removeAll(found);
        if (!missing.isEmpty()) {
            return CheckOutcome.fail("missing " + kind.getPluralName() + ": " + String.join(", ", missing));
        }
        return CheckOutcome.ok();
    }

    CheckOutcome customResourceDefinitionsExist(CheckContext context) {
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        List<String> problems = new ArrayList<>();
        for (Entry<String, String> expected : context.getOptions().getCustomResourceDefinitions().entrySet()) {
            CustomResourceDefinition crd = client.getCustomResourceDefinition(expected.getKey()).orElse(null);
            // ?: Is the definition installed?
            if (crd == null) {
                // -> No, so we can not look at its versions.
                problems.add("missing " + expected.getKey());
            }
            else if (!crd.hasVersion(expected.getValue())) {
                problems.add("CRD " + expected.getKey() + " is missing version " + expected.getValue());
            }
        }
        if (!problems.isEmpty()) {
            return CheckOutcome.fail(String.join(", ", problems));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static List<String> clusterRoleNames(CheckContext context) {
        String namespace = context.getOptions().getControlPlaneNamespace();
        List<String> names = new ArrayList<>();
        for (String component : CLUSTER_ROLE_COMPONENTS) {
            names.add("linkerd-" + namespace + "-" + component);
        }
        return names;
    }
}
