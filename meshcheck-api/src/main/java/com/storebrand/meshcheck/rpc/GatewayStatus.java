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


package com.storebrand.meshcheck.rpc;

/**
 * Status of a gateway to a remote cluster, as seen from this cluster.
 */
@SuppressWarnings("VisibilityModifier")
public final class GatewayStatus {
    public final String clusterName;
    public final String name;
    public final String namespace;
    public final boolean alive;
    public final int pairedServices;
    public final long latencyMsP50;

    public GatewayStatus(String clusterName, String name, String namespace, boolean alive, int pairedServices,
            long latencyMsP50) {
        this.clusterName = clusterName;
        this.name = name;
        this.namespace = namespace;
        this.alive = alive;
        this.pairedServices = pairedServices;
        this.latencyMsP50 = latencyMsP50;
    }
}
