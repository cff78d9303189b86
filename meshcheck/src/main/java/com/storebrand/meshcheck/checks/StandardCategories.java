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

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.MeshCheckCollaborators;

/**
 * The standard categories, in the order they must run. Later categories depend on what earlier ones discovered.
 */
public final class StandardCategories {
    private StandardCategories() {
        // Utility class - hiding constructor
    }

    public static List<Category> create(MeshCheckCollaborators collaborators, HealthCheckOptions options) {
        return Collections.unmodifiableList(Arrays.asList(
                new KubernetesApiChecks(collaborators.getClusterClientFactory()).category(options),
                new KubernetesVersionChecks().category(options),
                new PreKubernetesSetupChecks().category(options),
                new ControlPlaneExistenceChecks(collaborators.getControlPlaneConfigFetcher()).category(options),
                new LinkerdConfigChecks().category(options),
                new CniPluginChecks().category(options),
                new IdentityChecks().category(options),
                new WebhookTlsChecks().category(options),
                new IdentityDataPlaneChecks().category(options),
                new PublicApiChecks(collaborators.getPublicApiClientFactory()).category(options),
                new ControlPlaneProxyChecks().category(options),
                new DataPlaneChecks().category(options),
                new HighAvailabilityChecks().category(options),
                new MulticlusterChecks(collaborators.getRemoteClusterSecretParser(),
                        collaborators.getRemoteClusterConnector(),
                        collaborators.getControlPlaneConfigFetcher()).category(options)));
    }

    /**
     * @return the ids of all standard categories, in run order.
     */
    public static List<CategoryId> allIds() {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(
                CategoryId.KUBERNETES_API,
                CategoryId.KUBERNETES_VERSION,
                CategoryId.PRE_KUBERNETES_SETUP,
                CategoryId.CONTROL_PLANE_EXISTENCE,
                CategoryId.CONFIG,
                CategoryId.CNI_PLUGIN,
                CategoryId.IDENTITY,
                CategoryId.WEBHOOKS_AND_APISVC_TLS,
                CategoryId.IDENTITY_DATA_PLANE,
                CategoryId.PUBLIC_API,
                CategoryId.CONTROL_PLANE_PROXY,
                CategoryId.DATA_PLANE,
                CategoryId.HIGH_AVAILABILITY,
                CategoryId.MULTICLUSTER)));
    }

    /**
     * @return the ids of the categories that check an installed mesh, in run order. This is all standard categories
     *         except {@link CategoryId#PRE_KUBERNETES_SETUP}, which fails once the control plane is installed.
     */
    public static List<CategoryId> installedMeshIds() {
        List<CategoryId> ids = new ArrayList<>(allIds());
        ids.remove(CategoryId.PRE_KUBERNETES_SETUP);
        return Collections.unmodifiableList(ids);
    }
}
