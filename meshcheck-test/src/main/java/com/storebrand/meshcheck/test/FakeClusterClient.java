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


package com.storebrand.meshcheck.test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import com.storebrand.meshcheck.cluster.AccessReview;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ConfigMap;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.CustomResourceDefinition;
import com.storebrand.meshcheck.cluster.DaemonSet;
import com.storebrand.meshcheck.cluster.Deployment;
import com.storebrand.meshcheck.cluster.Endpoints;
import com.storebrand.meshcheck.cluster.Node;
import com.storebrand.meshcheck.cluster.Pod;
import com.storebrand.meshcheck.cluster.RbacRole;
import com.storebrand.meshcheck.cluster.ResourceKind;
import com.storebrand.meshcheck.cluster.Secret;
import com.storebrand.meshcheck.cluster.ServerVersion;
import com.storebrand.meshcheck.cluster.Service;
import com.storebrand.meshcheck.cluster.TrafficSplit;
import com.storebrand.meshcheck.cluster.WebhookConfiguration;
import com.storebrand.meshcheck.cluster.WebhookConfiguration.Kind;

/**
 * In-memory {@link ClusterClient}. Resources are added with the {@code with...} methods, and can be changed while a
 * check is retrying. A null namespace in a list call means all namespaces.
 * <p>
 * The client also holds the control plane configuration per namespace, which {@link MeshCheckFakes#configFetcher()}
 * hands out.
 */
public class FakeClusterClient implements ClusterClient {
    private ServerVersion _serverVersion = new ServerVersion("v1.28.3");
    private RuntimeException _failure;
    private final Set<String> _namespaces = new HashSet<>();
    private final List<Pod> _pods = new ArrayList<>();
    private final List<Deployment> _deployments = new ArrayList<>();
    private final List<DaemonSet> _daemonSets = new ArrayList<>();
    private final List<Service> _services = new ArrayList<>();
    private final List<Endpoints> _endpoints = new ArrayList<>();
    private final List<TrafficSplit> _trafficSplits = new ArrayList<>();
    private final Map<String, RbacRole> _clusterRoles = new HashMap<>();
    private final List<RbacRole> _roles = new ArrayList<>();
    private final List<Secret> _secrets = new ArrayList<>();
    private final Map<String, WebhookConfiguration> _webhookConfigurations = new HashMap<>();
    private final Set<AccessReview> _allowed = new HashSet<>();
    private final List<ConfigMap> _configMaps = new ArrayList<>();
    private final List<Node> _nodes = new ArrayList<>();
    private final Map<String, CustomResourceDefinition> _crds = new HashMap<>();
    private final Map<ResourceKind, List<NamedResource>> _namedResources = new EnumMap<>(ResourceKind.class);
    private final Map<String, ControlPlaneConfig> _controlPlaneConfigs = new HashMap<>();
    private final AtomicBoolean _closed = new AtomicBoolean();

    // ===== Setup =====================================================================================================

    public synchronized FakeClusterClient withServerVersion(String gitVersion) {
        _serverVersion = new ServerVersion(gitVersion);
        return this;
    }

    /**
     * Every call to the client throws the given exception, until set to null.
     */
    public synchronized FakeClusterClient failingWith(RuntimeException failure) {
        _failure = failure;
        return this;
    }

    public synchronized FakeClusterClient withNamespace(String namespace) {
        _namespaces.add(namespace);
        return this;
    }

    public synchronized FakeClusterClient withPod(Pod pod) {
        _pods.removeIf(p -> p.namespace.equals(pod.namespace) && p.name.equals(pod.name));
        _pods.add(pod);
        return this;
    }

    public synchronized FakeClusterClient withDeployment(Deployment deployment) {
        _deployments.removeIf(d -> d.namespace.equals(deployment.namespace) && d.name.equals(deployment.name));
        _deployments.add(deployment);
        return this;
    }

    public synchronized FakeClusterClient withDaemonSet(DaemonSet daemonSet) {
        _daemonSets.removeIf(d -> d.namespace.equals(daemonSet.namespace) && d.name.equals(daemonSet.name));
        _daemonSets.add(daemonSet);
        return this;
    }

    public synchronized FakeClusterClient withService(Service service) {
        _services.add(service);
        return this;
    }

    public synchronized FakeClusterClient withEndpoints(Endpoints endpoints) {
        _endpoints.add(endpoints);
        return this;
    }

    public synchronized FakeClusterClient withTrafficSplit(TrafficSplit trafficSplit) {
        _trafficSplits.add(trafficSplit);
        return this;
    }

    public synchronized FakeClusterClient withClusterRole(RbacRole clusterRole) {
        _clusterRoles.put(clusterRole.name, clusterRole);
        return this;
    }

    public synchronized FakeClusterClient withRole(RbacRole role) {
        _roles.add(role);
        return this;
    }

    public synchronized FakeClusterClient withSecret(Secret secret) {
        _secrets.removeIf(s -> s.namespace.equals(secret.namespace) && s.name.equals(secret.name));
        _secrets.add(secret);
        return this;
    }

    /**
     * Adds a secret with the given string values.
     */
    public FakeClusterClient withSecret(String namespace, String name, String type, Map<String, String> values) {
        Map<String, byte[]> data = new LinkedHashMap<>();
        for (Entry<String, String> entry : values.entrySet()) {
            data.put(entry.getKey(), entry.getValue().getBytes(StandardCharsets.UTF_8));
        }
        return withSecret(new Secret(name, namespace, type, data));
    }

    public synchronized FakeClusterClient withWebhookConfiguration(Kind kind, String name, String caBundlePem) {
        _webhookConfigurations.put(kind + "/" + name, new WebhookConfiguration(name, kind,
                caBundlePem.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public synchronized FakeClusterClient allowing(AccessReview review) {
        _allowed.add(review);
        return this;
    }

    public synchronized FakeClusterClient withConfigMap(ConfigMap configMap) {
        _configMaps.removeIf(c -> c.namespace.equals(configMap.namespace) && c.name.equals(configMap.name));
        _configMaps.add(configMap);
        return this;
    }

    public synchronized FakeClusterClient withNode(Node node) {
        _nodes.add(node);
        return this;
    }

    public synchronized FakeClusterClient withCustomResourceDefinition(String name, String... versions) {
        _crds.put(name, new CustomResourceDefinition(name, Arrays.asList(versions)));
        return this;
    }

    /**
     * Adds a resource that is only listed by name. The namespace is null for resources that are not namespaced.
     */
    public synchronized FakeClusterClient withResource(ResourceKind kind, String namespace, String name,
            Map<String, String> labels) {
        _namedResources.computeIfAbsent(kind, k -> new ArrayList<>())
                .add(new NamedResource(namespace, name, labels == null ? Collections.emptyMap() : labels));
        return this;
    }

    public synchronized FakeClusterClient withControlPlaneConfig(String namespace, ControlPlaneConfig config) {
        _controlPlaneConfigs.put(namespace, config);
        return this;
    }

    public synchronized Optional<ControlPlaneConfig> getControlPlaneConfig(String namespace) {
        throwIfFailing();
        return Optional.ofNullable(_controlPlaneConfigs.get(namespace));
    }

    public boolean isClosed() {
        return _closed.get();
    }

    // ===== ClusterClient =============================================================================================

    @Override
    public synchronized ServerVersion getServerVersion() {
        throwIfFailing();
        return _serverVersion;
    }

    @Override
    public synchronized boolean namespaceExists(String namespace) {
        throwIfFailing();
        return _namespaces.contains(namespace);
    }

    @Override
    public synchronized List<Pod> listPods(String namespace, Map<String, String> labelSelector) {
        throwIfFailing();
        return filter(_pods, p -> inNamespace(namespace, p.namespace) && matches(labelSelector, p.labels));
    }

    @Override
    public synchronized List<Deployment> listDeployments(String namespace, Map<String, String> labelSelector) {
        throwIfFailing();
        return filter(_deployments, d -> inNamespace(namespace, d.namespace) && matches(labelSelector, d.labels));
    }

    @Override
    public synchronized Optional<Deployment> getDeployment(String namespace, String name) {
        throwIfFailing();
        return first(_deployments, d -> d.namespace.equals(namespace) && d.name.equals(name));
    }

    @Override
    public synchronized Optional<DaemonSet> getDaemonSet(String namespace, String name) {
        throwIfFailing();
        return first(_daemonSets, d -> d.namespace.equals(namespace) && d.name.equals(name));
    }

    @Override
    public synchronized List<Service> listServices(String namespace, Map<String, String> labelSelector) {
        throwIfFailing();
        return filter(_services, s -> inNamespace(namespace, s.namespace) && matches(labelSelector, s.labels));
    }

    @Override
    public synchronized Optional<Service> getService(String namespace, String name) {
        throwIfFailing();
        return first(_services, s -> s.namespace.equals(namespace) && s.name.equals(name));
    }

    @Override
    public synchronized Optional<Endpoints> getEndpoints(String namespace, String name) {
        throwIfFailing();
        return first(_endpoints, e -> e.namespace.equals(namespace) && e.name.equals(name));
    }

    @Override
    public synchronized List<TrafficSplit> listTrafficSplits(String namespace) {
        throwIfFailing();
        return filter(_trafficSplits, t -> inNamespace(namespace, t.namespace));
    }

    @Override
    public synchronized Optional<RbacRole> getClusterRole(String name) {
        throwIfFailing();
        return Optional.ofNullable(_clusterRoles.get(name));
    }

    @Override
    public synchronized Optional<RbacRole> getRole(String namespace, String name) {
        throwIfFailing();
        return first(_roles, r -> namespace.equals(r.namespace) && r.name.equals(name));
    }

    @Override
    public synchronized Optional<Secret> getSecret(String namespace, String name) {
        throwIfFailing();
        return first(_secrets, s -> s.namespace.equals(namespace) && s.name.equals(name));
    }

    @Override
    public synchronized List<Secret> listSecrets(String namespace, String type) {
        throwIfFailing();
        return filter(_secrets, s -> inNamespace(namespace, s.namespace) && (type == null || type.equals(s.type)));
    }

    @Override
    public synchronized Optional<WebhookConfiguration> getWebhookConfiguration(Kind kind, String name) {
        throwIfFailing();
        return Optional.ofNullable(_webhookConfigurations.get(kind + "/" + name));
    }

    @Override
    public synchronized Optional<ConfigMap> getConfigMap(String namespace, String name) {
        throwIfFailing();
        return first(_configMaps, c -> c.namespace.equals(namespace) && c.name.equals(name));
    }

    @Override
    public synchronized List<Node> listNodes() {
        throwIfFailing();
        return Collections.unmodifiableList(new ArrayList<>(_nodes));
    }

    @Override
    public synchronized Optional<CustomResourceDefinition> getCustomResourceDefinition(String name) {
        throwIfFailing();
        return Optional.ofNullable(_crds.get(name));
    }

    @Override
    public synchronized List<String> listResourceNames(ResourceKind kind, String namespace,
            Map<String, String> labelSelector) {
        throwIfFailing();
        List<String> names = new ArrayList<>();
        for (NamedResource resource : _namedResources.getOrDefault(kind, Collections.emptyList())) {
            boolean inNamespace = !kind.isNamespaced() || inNamespace(namespace, resource._namespace);
            if (inNamespace && matches(labelSelector, resource._labels)) {
                names.add(resource._name);
            }
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public synchronized boolean isAllowed(AccessReview review) {
        throwIfFailing();
        return _allowed.contains(review);
    }

    @Override
    public void close() {
        _closed.set(true);
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private void throwIfFailing() {
        if (_failure != null) {
            throw _failure;
        }
    }

    private static boolean inNamespace(String wanted, String actual) {
        return wanted == null || wanted.equals(actual);
    }

    private static boolean matches(Map<String, String> selector, Map<String, String> labels) {
        if (selector == null) {
            return true;
        }
        for (Entry<String, String> entry : selector.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static <T> List<T> filter(List<T> items, Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T item : items) {
            if (predicate.test(item)) {
                result.add(item);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static final class NamedResource {
        private final String _namespace;
        private final String _name;
        private final Map<String, String> _labels;

        private NamedResource(String namespace, String name, Map<String, String> labels) {
            _namespace = namespace;
            _name = name;
            _labels = labels;
        }
    }

    private static <T> Optional<T> first(List<T> items, Predicate<T> predicate) {
        for (T item : items) {
            if (predicate.test(item)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }
}
