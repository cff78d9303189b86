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


package com.storebrand.meshcheck.cluster;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to a cluster API, as needed by the checks. Implementations receive all construction policy (timeouts,
 * credentials, impersonation) from outside, and are handed to the checks already configured.
 * <p>
 * A {@code null} namespace means all namespaces. A label selector is a set of labels that must all be present with
 * the given values; an empty selector matches everything. Objects that do not exist are reported with
 * {@link Optional#empty()}. All other failures are reported with {@link ClusterApiException}.
 */
public interface ClusterClient extends AutoCloseable {
    ServerVersion getServerVersion();

    boolean namespaceExists(String namespace);

    List<Pod> listPods(String namespace, Map<String, String> labelSelector);

    List<Deployment> listDeployments(String namespace, Map<String, String> labelSelector);

    Optional<Deployment> getDeployment(String namespace, String name);

    Optional<DaemonSet> getDaemonSet(String namespace, String name);

    List<Service> listServices(String namespace, Map<String, String> labelSelector);

    Optional<Service> getService(String namespace, String name);

    Optional<Endpoints> getEndpoints(String namespace, String name);

    List<TrafficSplit> listTrafficSplits(String namespace);

    Optional<RbacRole> getClusterRole(String name);

    Optional<RbacRole> getRole(String namespace, String name);

    Optional<Secret> getSecret(String namespace, String name);

    List<Secret> listSecrets(String namespace, String type);

    Optional<WebhookConfiguration> getWebhookConfiguration(WebhookConfiguration.Kind kind, String name);

    Optional<ConfigMap> getConfigMap(String namespace, String name);

    List<Node> listNodes();

    Optional<CustomResourceDefinition> getCustomResourceDefinition(String name);

    /**
     * Lists the names of resources of the given kind. The namespace is ignored for kinds that are not namespaced.
     */
    List<String> listResourceNames(ResourceKind kind, String namespace, Map<String, String> labelSelector);

    /**
     * Authorization dry-run: asks the API whether the current identity may perform the given access, without
     * performing it.
     */
    boolean isAllowed(AccessReview review);

    /**
     * Releases resources held by this client. Short-lived clients to remote clusters are closed after use.
     */
    @Override
    default void close() {
        // Nothing to release by default
    }
}
