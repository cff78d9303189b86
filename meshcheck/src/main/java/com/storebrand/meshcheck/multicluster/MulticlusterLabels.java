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


package com.storebrand.meshcheck.multicluster;

/**
 * Labels, annotations and names the multicluster components are recognized by.
 */
public final class MulticlusterLabels {
    public static final String CONTROL_PLANE_COMPONENT_LABEL = "linkerd.io/control-plane-component";
    public static final String SERVICE_MIRROR_COMPONENT = "linkerd-service-mirror";

    public static final String MIRRORED_SERVICE_LABEL = "mirror.linkerd.io/mirrored-service";
    public static final String REMOTE_CLUSTER_NAME_LABEL = "mirror.linkerd.io/cluster-name";
    public static final String GATEWAY_NAME_ANNOTATION = "mirror.linkerd.io/gateway-name";
    public static final String GATEWAY_NAMESPACE_ANNOTATION = "mirror.linkerd.io/gateway-ns";

    public static final String REMOTE_KUBECONFIG_SECRET_TYPE = "mirror.linkerd.io/remote-kubeconfig";

    public static final String LOCAL_ACCESS_CLUSTER_ROLE = "linkerd-service-mirror-access-local-resources";
    public static final String READ_REMOTE_CREDENTIALS_ROLE = "linkerd-service-mirror-read-remote-creds";

    private MulticlusterLabels() {
        // Utility class - hiding constructor
    }
}
