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

/**
 * Kinds of control plane resources that are only checked for existence, by name.
 */
public enum ResourceKind {
    CLUSTER_ROLE("ClusterRoles", false),
    CLUSTER_ROLE_BINDING("ClusterRoleBindings", false),
    SERVICE_ACCOUNT("ServiceAccounts", true),
    MUTATING_WEBHOOK_CONFIGURATION("MutatingWebhookConfigurations", false),
    VALIDATING_WEBHOOK_CONFIGURATION("ValidatingWebhookConfigurations", false);

    private final String _pluralName;
    private final boolean _namespaced;

    ResourceKind(String pluralName, boolean namespaced) {
        _pluralName = pluralName;
        _namespaced = namespaced;
    }

    /**
     * @return the plural kind name, as used in messages, e.g. {@code ClusterRoles}.
     */
    public String getPluralName() {
        return _pluralName;
    }

    public boolean isNamespaced() {
        return _namespaced;
    }
}
