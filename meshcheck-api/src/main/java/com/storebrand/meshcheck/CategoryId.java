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


package com.storebrand.meshcheck;

import java.util.Objects;

/**
 * Stable symbolic name of a check category. The standard categories are available as constants, and extension
 * categories can be created with {@link #of(String)}.
 */
public final class CategoryId implements Comparable<CategoryId> {
    public static final CategoryId KUBERNETES_API = new CategoryId("kubernetes-api");
    public static final CategoryId KUBERNETES_VERSION = new CategoryId("kubernetes-version");
    public static final CategoryId PRE_KUBERNETES_SETUP = new CategoryId("pre-kubernetes-setup");
    public static final CategoryId CONTROL_PLANE_EXISTENCE = new CategoryId("linkerd-existence");
    public static final CategoryId CONFIG = new CategoryId("linkerd-config");
    public static final CategoryId CNI_PLUGIN = new CategoryId("linkerd-cni-plugin");
    public static final CategoryId IDENTITY = new CategoryId("linkerd-identity");
    public static final CategoryId WEBHOOKS_AND_APISVC_TLS = new CategoryId("linkerd-webhooks-and-apisvc-tls");
    public static final CategoryId IDENTITY_DATA_PLANE = new CategoryId("linkerd-identity-data-plane");
    public static final CategoryId PUBLIC_API = new CategoryId("linkerd-api");
    public static final CategoryId CONTROL_PLANE_PROXY = new CategoryId("linkerd-control-plane-proxy");
    public static final CategoryId DATA_PLANE = new CategoryId("linkerd-data-plane");
    public static final CategoryId HIGH_AVAILABILITY = new CategoryId("linkerd-ha-checks");
    public static final CategoryId MULTICLUSTER = new CategoryId("linkerd-multicluster");

    private final String _name;

    private CategoryId(String name) {
        _name = name;
    }

    public static CategoryId of(String name) {
        Objects.requireNonNull(name, "name");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("CategoryId can not be blank.");
        }
        return new CategoryId(name);
    }

    public String getName() {
        return _name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoryId)) {
            return false;
        }
        return _name.equals(((CategoryId) o)._name);
    }

    @Override
    public int hashCode() {
        return _name.hashCode();
    }

    @Override
    public int compareTo(CategoryId o) {
        return _name.compareTo(o._name);
    }

    @Override
    public String toString() {
        return _name;
    }
}
