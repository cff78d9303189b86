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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A pod, with the container and condition detail the checks look at.
 */
@SuppressWarnings("VisibilityModifier")
public final class Pod {
    public static final String PHASE_RUNNING = "Running";
    public static final String PHASE_PENDING = "Pending";
    public static final String PHASE_SUCCEEDED = "Succeeded";
    public static final String PROXY_CONTAINER_NAME = "linkerd-proxy";

    public final String name;
    public final String namespace;
    public final String phase;
    public final Map<String, String> labels;
    public final List<ContainerStatus> containerStatuses;
    public final List<Condition> conditions;
    public final List<Container> containers;

    public Pod(String name, String namespace, String phase, Map<String, String> labels,
            List<ContainerStatus> containerStatuses, List<Condition> conditions) {
        this(name, namespace, phase, labels, containerStatuses, conditions, null);
    }

    public Pod(String name, String namespace, String phase, Map<String, String> labels,
            List<ContainerStatus> containerStatuses, List<Condition> conditions, List<Container> containers) {
        this.name = name;
        this.namespace = namespace;
        this.phase = phase;
        this.labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(labels);
        this.containerStatuses = containerStatuses == null ? Collections.emptyList()
                : Collections.unmodifiableList(containerStatuses);
        this.conditions = conditions == null ? Collections.emptyList() : Collections.unmodifiableList(conditions);
        this.containers = containers == null ? Collections.emptyList() : Collections.unmodifiableList(containers);
    }

    public String getLabel(String key) {
        return labels.get(key);
    }

    public boolean isRunning() {
        return PHASE_RUNNING.equals(phase);
    }

    /**
     * @return true if the proxy container has a ready status.
     */
    public boolean isProxyReady() {
        return containerStatuses.stream().anyMatch(status -> PROXY_CONTAINER_NAME.equals(status.name) && status.ready);
    }

    /**
     * @return the value of an environment variable of the proxy container, if the pod has a proxy and it sets it.
     */
    public Optional<String> getProxyEnv(String variable) {
        return containers.stream()
                .filter(container -> PROXY_CONTAINER_NAME.equals(container.name))
                .map(container -> container.env.get(variable))
                .filter(Objects::nonNull)
                .findFirst();
    }

    public static class ContainerStatus {
        public final String name;
        public final boolean ready;

        public ContainerStatus(String name, boolean ready) {
            this.name = name;
            this.ready = ready;
        }
    }

    public static class Container {
        public final String name;
        public final Map<String, String> env;

        public Container(String name, Map<String, String> env) {
            this.name = name;
            this.env = env == null ? Collections.emptyMap() : Collections.unmodifiableMap(env);
        }
    }

    public static class Condition {
        public static final String REASON_UNSCHEDULABLE = "Unschedulable";

        public final String type;
        public final String status;
        public final String reason;
        public final String message;

        public Condition(String type, String status, String reason, String message) {
            this.type = type;
            this.status = status;
            this.reason = reason;
            this.message = message;
        }
    }

    @Override
    public String toString() {
        return "pod/" + name;
    }
}
