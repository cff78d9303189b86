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

import java.util.Objects;

/**
 * How to reach a remote cluster: its name, the namespace of its control plane, and opaque connection material that
 * only the {@link RemoteClusterConnector} understands.
 */
@SuppressWarnings("VisibilityModifier")
public final class RemoteClusterDescriptor {
    public final String clusterName;
    public final String namespace;
    public final byte[] apiConnectionMaterial;

    public RemoteClusterDescriptor(String clusterName, String namespace, byte[] apiConnectionMaterial) {
        this.clusterName = Objects.requireNonNull(clusterName, "clusterName");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.apiConnectionMaterial = apiConnectionMaterial;
    }

    @Override
    public String toString() {
        return "RemoteCluster[" + clusterName + "]";
    }
}
