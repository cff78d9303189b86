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
import java.util.Map;

@SuppressWarnings("VisibilityModifier")
public final class Deployment {
    public final String name;
    public final String namespace;
    public final Map<String, String> labels;
    public final int replicas;
    public final int availableReplicas;

    public Deployment(String name, String namespace, Map<String, String> labels, int replicas,
            int availableReplicas) {
        this.name = name;
        this.namespace = namespace;
        this.labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(labels);
        this.replicas = replicas;
        this.availableReplicas = availableReplicas;
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
