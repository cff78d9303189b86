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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of the control plane's stored configuration that the checks use. Create with {@link #builder()}.
 */
public final class ControlPlaneConfig {
    public static final String DEFAULT_CLUSTER_DOMAIN = "cluster.local";

    private final String _namespace;
    private final String _clusterDomain;
    private final String _identityTrustDomain;
    private final String _identityIssuerScheme;
    private final String _identityTrustAnchorsPem;
    private final boolean _highAvailability;
    private final boolean _cniEnabled;
    private final Map<String, Boolean> _addOns;

    private ControlPlaneConfig(ControlPlaneConfigBuilder builder) {
        _namespace = builder._namespace;
        _clusterDomain = builder._clusterDomain;
        _identityTrustDomain = builder._identityTrustDomain;
        _identityIssuerScheme = builder._identityIssuerScheme;
        _identityTrustAnchorsPem = builder._identityTrustAnchorsPem;
        _highAvailability = builder._highAvailability;
        _cniEnabled = builder._cniEnabled;
        _addOns = Collections.unmodifiableMap(new LinkedHashMap<>(builder._addOns));
    }

    public static ControlPlaneConfigBuilder builder() {
        return new ControlPlaneConfigBuilder();
    }

    public String getNamespace() {
        return _namespace;
    }

    public String getClusterDomain() {
        return _clusterDomain;
    }

    /**
     * @return the identity trust domain, defaulting to the cluster domain.
     */
    public String getIdentityTrustDomain() {
        return _identityTrustDomain != null ? _identityTrustDomain : _clusterDomain;
    }

    public String getIdentityIssuerScheme() {
        return _identityIssuerScheme;
    }

    /**
     * @return the PEM encoded trust anchors, or empty if the anchors are not part of the configuration.
     */
    public Optional<String> getIdentityTrustAnchorsPem() {
        return Optional.ofNullable(_identityTrustAnchorsPem)
                .filter(pem -> !pem.trim().isEmpty());
    }

    public boolean isHighAvailability() {
        return _highAvailability;
    }

    public boolean isCniEnabled() {
        return _cniEnabled;
    }

    public Map<String, Boolean> getAddOns() {
        return _addOns;
    }

    public boolean isAddOnEnabled(String name) {
        return Boolean.TRUE.equals(_addOns.get(name));
    }

    public static class ControlPlaneConfigBuilder {
        private String _namespace = "linkerd";
        private String _clusterDomain = DEFAULT_CLUSTER_DOMAIN;
        private String _identityTrustDomain;
        private String _identityIssuerScheme = "linkerd.io/tls";
        private String _identityTrustAnchorsPem;
        private boolean _highAvailability;
        private boolean _cniEnabled;
        private final Map<String, Boolean> _addOns = new LinkedHashMap<>();

        public ControlPlaneConfigBuilder namespace(String namespace) {
            _namespace = namespace;
            return this;
        }

        public ControlPlaneConfigBuilder clusterDomain(String clusterDomain) {
            _clusterDomain = clusterDomain;
            return this;
        }

        public ControlPlaneConfigBuilder identityTrustDomain(String identityTrustDomain) {
            _identityTrustDomain = identityTrustDomain;
            return this;
        }

        public ControlPlaneConfigBuilder identityIssuerScheme(String identityIssuerScheme) {
            _identityIssuerScheme = identityIssuerScheme;
            return this;
        }

        public ControlPlaneConfigBuilder identityTrustAnchorsPem(String identityTrustAnchorsPem) {
            _identityTrustAnchorsPem = identityTrustAnchorsPem;
            return this;
        }

        public ControlPlaneConfigBuilder highAvailability(boolean highAvailability) {
            _highAvailability = highAvailability;
            return this;
        }

        public ControlPlaneConfigBuilder cniEnabled(boolean cniEnabled) {
            _cniEnabled = cniEnabled;
            return this;
        }

        public ControlPlaneConfigBuilder addOn(String name, boolean enabled) {
            _addOns.put(name, enabled);
            return this;
        }

        public ControlPlaneConfig build() {
            return new ControlPlaneConfig(this);
        }
    }
}
