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

import com.storebrand.meshcheck.cluster.ClusterClientFactory;
import com.storebrand.meshcheck.cluster.ControlPlaneConfigFetcher;
import com.storebrand.meshcheck.cluster.RemoteClusterConnector;
import com.storebrand.meshcheck.cluster.RemoteClusterSecretParser;
import com.storebrand.meshcheck.rpc.PublicApiClientFactory;

/**
 * The external collaborators the standard categories are built on. All of them are required.
 */
public final class MeshCheckCollaborators {
    private final ClusterClientFactory _clusterClientFactory;
    private final ControlPlaneConfigFetcher _controlPlaneConfigFetcher;
    private final PublicApiClientFactory _publicApiClientFactory;
    private final RemoteClusterSecretParser _remoteClusterSecretParser;
    private final RemoteClusterConnector _remoteClusterConnector;

    private MeshCheckCollaborators(MeshCheckCollaboratorsBuilder builder) {
        _clusterClientFactory = Objects.requireNonNull(builder._clusterClientFactory, "clusterClientFactory");
        _controlPlaneConfigFetcher = Objects.requireNonNull(builder._controlPlaneConfigFetcher,
                "controlPlaneConfigFetcher");
        _publicApiClientFactory = Objects.requireNonNull(builder._publicApiClientFactory, "publicApiClientFactory");
        _remoteClusterSecretParser = Objects.requireNonNull(builder._remoteClusterSecretParser,
                "remoteClusterSecretParser");
        _remoteClusterConnector = Objects.requireNonNull(builder._remoteClusterConnector, "remoteClusterConnector");
    }

    public static MeshCheckCollaboratorsBuilder builder() {
        return new MeshCheckCollaboratorsBuilder();
    }

    public ClusterClientFactory getClusterClientFactory() {
        return _clusterClientFactory;
    }

    public ControlPlaneConfigFetcher getControlPlaneConfigFetcher() {
        return _controlPlaneConfigFetcher;
    }

    public PublicApiClientFactory getPublicApiClientFactory() {
        return _publicApiClientFactory;
    }

    public RemoteClusterSecretParser getRemoteClusterSecretParser() {
        return _remoteClusterSecretParser;
    }

    public RemoteClusterConnector getRemoteClusterConnector() {
        return _remoteClusterConnector;
    }

    public static class MeshCheckCollaboratorsBuilder {
        private ClusterClientFactory _clusterClientFactory;
        private ControlPlaneConfigFetcher _controlPlaneConfigFetcher;
        private PublicApiClientFactory _publicApiClientFactory;
        private RemoteClusterSecretParser _remoteClusterSecretParser;
        private RemoteClusterConnector _remoteClusterConnector;

        public MeshCheckCollaboratorsBuilder clusterClientFactory(ClusterClientFactory clusterClientFactory) {
            _clusterClientFactory = clusterClientFactory;
            return this;
        }

        public MeshCheckCollaboratorsBuilder controlPlaneConfigFetcher(
                ControlPlaneConfigFetcher controlPlaneConfigFetcher) {
            _controlPlaneConfigFetcher = controlPlaneConfigFetcher;
            return this;
        }

        public MeshCheckCollaboratorsBuilder publicApiClientFactory(PublicApiClientFactory publicApiClientFactory) {
            _publicApiClientFactory = publicApiClientFactory;
            return this;
        }

        public MeshCheckCollaboratorsBuilder remoteClusterSecretParser(
                RemoteClusterSecretParser remoteClusterSecretParser) {
            _remoteClusterSecretParser = remoteClusterSecretParser;
            return this;
        }

        public MeshCheckCollaboratorsBuilder remoteClusterConnector(RemoteClusterConnector remoteClusterConnector) {
            _remoteClusterConnector = remoteClusterConnector;
            return this;
        }

        public MeshCheckCollaborators build() {
            return new MeshCheckCollaborators(this);
        }
    }
}
