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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.ErrorMessages;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.AccessReview;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ConfigMap;
import com.storebrand.meshcheck.cluster.Node;

/**
 * Can the control plane be installed: the namespace is free, we are allowed to create what an install creates, and
 * the nodes agree with us on the time. Run before an install, so not among the default categories.
 */
class PreKubernetesSetupChecks {
    private static final Logger log = LoggerFactory.getLogger(PreKubernetesSetupChecks.class);

    static final String AUTHENTICATION_NAMESPACE = "kube-system";
    static final String AUTHENTICATION_CONFIG_MAP = "extension-apiserver-authentication";
    static final String CLIENT_CA_FILE_KEY = "requestheader-client-ca-file";

    /**
     * Cluster scoped resources an install creates.
     */
    static final List<AccessReview> NON_NAMESPACED_RESOURCES = Collections.unmodifiableList(Arrays.asList(
            create("", "v1", "namespaces"),
            create("rbac.authorization.k8s.io", "v1", "clusterroles"),
            create("rbac.authorization.k8s.io", "v1", "clusterrolebindings"),
            create("apiextensions.k8s.io", "v1", "customresourcedefinitions"),
            create("admissionregistration.k8s.io", "v1", "mutatingwebhookconfigurations"),
            create("admissionregistration.k8s.io", "v1", "validatingwebhookconfigurations")));

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.PRE_KUBERNETES_SETUP,
                Checker.builder("control plane namespace does not already exist")
                        .hintAnchor("pre-ns")
                        .check(this::namespaceIsFree),
                Checker.builder("can create non-namespaced resources")
                        .hintAnchor("pre-k8s-cluster-k8s")
                        .check(this::canCreateNonNamespacedResources),
                canCreate("ServiceAccounts", "", "v1", "serviceaccounts"),
                canCreate("Services", "", "v1", "services"),
                canCreate("Deployments", "apps", "v1", "deployments"),
                canCreate("CronJobs", "batch", "v1", "cronjobs"),
                canCreate("ConfigMaps", "", "v1", "configmaps"),
                canCreate("Secrets", "", "v1", "secrets"),
                Checker.builder("can read Secrets")
                        .hintAnchor("pre-k8s")
                        .check(context -> checkAllowed(context,
                                new AccessReview("get", namespace(context), "", "v1", "secrets"))),
                Checker.builder("can read extension-apiserver-authentication configmap")
                        .hintAnchor("pre-k8s")
                        .check(this::authenticationConfigReadable),
                Checker.builder("no clock skew detected")
                        .hintAnchor("pre-k8s-clock-skew")
                        .warning()
                        .check(this::noClockSkew));
    }

    CheckOutcome namespaceIsFree(CheckContext context) {
        String namespace = namespace(context);
        if (context.getDiscovery().cluster().requireClient().namespaceExists(namespace)) {
            return CheckOutcome.fail("The \"" + namespace + "\" namespace already exists");
        }
        return CheckOutcome.ok();
    }

    CheckOutcome canCreateNonNamespacedResources(CheckContext context) {
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        List<String> problems = new ArrayList<>();
        for (AccessReview review : NON_NAMESPACED_RESOURCES) {
            if (!client.isAllowed(review)) {
                problems.add(notAuthorized(review));
            }
        }
        if (!problems.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(problems));
        }
        return CheckOutcome.ok();
    }

    CheckOutcome authenticationConfigReadable(CheckContext context) {
        ConfigMap configMap = context.getDiscovery().cluster().requireClient()
                .getConfigMap(AUTHENTICATION_NAMESPACE, AUTHENTICATION_CONFIG_MAP)
                .orElse(null);
        if (configMap == null) {
            return CheckOutcome.fail("config map " + AUTHENTICATION_CONFIG_MAP + " does not exist in namespace "
                    + AUTHENTICATION_NAMESPACE);
        }
        if (!configMap.get(CLIENT_CA_FILE_KEY).isPresent()) {
            return CheckOutcome.fail("--" + CLIENT_CA_FILE_KEY + " is not configured");
        }
        return CheckOutcome.ok();
    }

    CheckOutcome noClockSkew(CheckContext context) {
        Instant now = context.getClock().instant();
        Duration allowed = context.getOptions().getAllowedClockSkew();
        List<String> skewed = new ArrayList<>();
        for (Node node : context.getDiscovery().cluster().requireClient().listNodes()) {
            for (Node.Condition condition : node.conditions) {
                // Nodes that are not ready may have stale heartbeats.
                if (!condition.isReady() || condition.lastHeartbeatTime == null) {
                    continue;
                }
                Duration skew = Duration.between(condition.lastHeartbeatTime, now).abs();
                if (skew.compareTo(allowed) > 0) {
                    log.debug("Node [" + node.name + "] heartbeat is [" + skew + "] away from our clock.");
                    skewed.add(node.name);
                }
            }
        }
        if (!skewed.isEmpty()) {
            return CheckOutcome.fail("clock skew detected for node(s): " + String.join(", ", skewed));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private Checker canCreate(String kind, String group, String version, String resource) {
        return Checker.builder("can create " + kind)
                .hintAnchor("pre-k8s")
                .check(context -> checkAllowed(context,
                        new AccessReview("create", namespace(context), group, version, resource)));
    }

    private static CheckOutcome checkAllowed(CheckContext context, AccessReview review) {
        if (!context.getDiscovery().cluster().requireClient().isAllowed(review)) {
            return CheckOutcome.fail(notAuthorized(review));
        }
        return CheckOutcome.ok();
    }

    private static String notAuthorized(AccessReview review) {
        return "not authorized to access " + (review.group.isEmpty() ? "" : review.group + "/") + review.resource;
    }

    private static String namespace(CheckContext context) {
        return context.getOptions().getControlPlaneNamespace();
    }

    private static AccessReview create(String group, String version, String resource) {
        return new AccessReview("create", "", group, version, resource);
    }
}
