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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for a run of the health checker. Create with {@link #builder()}.
 */
public final class HealthCheckOptions {
    public static final String DEFAULT_CONTROL_PLANE_NAMESPACE = "linkerd";
    public static final String DEFAULT_CNI_NAMESPACE = "linkerd-cni";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RETRY_WAIT_WINDOW = Duration.ofSeconds(5);
    public static final String DEFAULT_HINT_BASE_URL = "https://linkerd.io/2/checks/#";
    public static final String DEFAULT_MINIMUM_KUBERNETES_VERSION = "1.21.0";
    public static final String DEFAULT_GATEWAY_TIME_WINDOW = "1m";
    public static final Duration DEFAULT_EXPIRY_SOON_THRESHOLD = Duration.ofDays(60);
    /**
     * Node heartbeats further than this from our clock are reported as clock skew: five minutes, plus the ten seconds
     * allowed when validating certificates.
     */
    public static final Duration DEFAULT_ALLOWED_CLOCK_SKEW = Duration.ofMinutes(5).plusSeconds(10);
    /**
     * The control plane's custom resource definitions, with the version each must serve.
     */
    public static final Map<String, String> DEFAULT_CUSTOM_RESOURCE_DEFINITIONS;

    static {
        Map<String, String> crds = new LinkedHashMap<>();
        crds.put("authorizationpolicies.policy.linkerd.io", "v1alpha1");
        crds.put("httproutes.policy.linkerd.io", "v1alpha1");
        crds.put("meshtlsauthentications.policy.linkerd.io", "v1alpha1");
        crds.put("networkauthentications.policy.linkerd.io", "v1alpha1");
        crds.put("serverauthorizations.policy.linkerd.io", "v1beta1");
        crds.put("servers.policy.linkerd.io", "v1beta1");
        crds.put("serviceprofiles.linkerd.io", "v1alpha2");
        DEFAULT_CUSTOM_RESOURCE_DEFINITIONS = Collections.unmodifiableMap(crds);
    }

    private final String _controlPlaneNamespace;
    private final String _cniNamespace;
    private final String _dataPlaneNamespace;
    private final boolean _cniEnabled;
    private final boolean _multicluster;
    private final Instant _retryDeadline;
    private final Duration _requestTimeout;
    private final Duration _retryWaitWindow;
    private final String _hintBaseUrl;
    private final String _minimumKubernetesVersion;
    private final String _gatewayTimeWindow;
    private final Duration _expirySoonThreshold;
    private final Duration _allowedClockSkew;
    private final Map<String, String> _customResourceDefinitions;

    private HealthCheckOptions(HealthCheckOptionsBuilder builder) {
        _controlPlaneNamespace = builder._controlPlaneNamespace;
        _cniNamespace = builder._cniNamespace;
        _dataPlaneNamespace = builder._dataPlaneNamespace;
        _cniEnabled = builder._cniEnabled;
        _multicluster = builder._multicluster;
        _retryDeadline = builder._retryDeadline;
        _requestTimeout = builder._requestTimeout;
        _retryWaitWindow = builder._retryWaitWindow;
        _hintBaseUrl = builder._hintBaseUrl;
        _minimumKubernetesVersion = builder._minimumKubernetesVersion;
        _gatewayTimeWindow = builder._gatewayTimeWindow;
        _expirySoonThreshold = builder._expirySoonThreshold;
        _allowedClockSkew = builder._allowedClockSkew;
        _customResourceDefinitions = builder._customResourceDefinitions;
    }

    public static HealthCheckOptions defaults() {
        return builder().build();
    }

    public String getControlPlaneNamespace() {
        return _controlPlaneNamespace;
    }

    public String getCniNamespace() {
        return _cniNamespace;
    }

    public Optional<String> getDataPlaneNamespace() {
        return Optional.ofNullable(_dataPlaneNamespace);
    }

    public boolean isCniEnabled() {
        return _cniEnabled;
    }

    /**
     * @return true if the operator explicitly asked for multicluster checks. When false, a missing service mirror
     *         controller makes the multicluster checks skip instead of fail.
     */
    public boolean isMulticluster() {
        return _multicluster;
    }

    public Optional<Instant> getRetryDeadline() {
        return Optional.ofNullable(_retryDeadline);
    }

    public Duration getRequestTimeout() {
        return _requestTimeout;
    }

    public Duration getRetryWaitWindow() {
        return _retryWaitWindow;
    }

    public String getHintBaseUrl() {
        return _hintBaseUrl;
    }

    public String getMinimumKubernetesVersion() {
        return _minimumKubernetesVersion;
    }

    public String getGatewayTimeWindow() {
        return _gatewayTimeWindow;
    }

    public Duration getExpirySoonThreshold() {
        return _expirySoonThreshold;
    }

    public Duration getAllowedClockSkew() {
        return _allowedClockSkew;
    }

    /**
     * @return custom resource definition names, with the version each must serve.
     */
    public Map<String, String> getCustomResourceDefinitions() {
        return _customResourceDefinitions;
    }

    /**
     * @return the hint url for an anchor, or an empty string if there is no anchor.
     */
    public String hintUrl(String hintAnchor) {
        if (hintAnchor == null || hintAnchor.isEmpty()) {
            return "";
        }
        return _hintBaseUrl + hintAnchor;
    }

    // ===== BUILDER CLASS =============================================================================================

    public static HealthCheckOptionsBuilder builder() {
        return new HealthCheckOptionsBuilder();
    }

    public static HealthCheckOptionsBuilder builder(HealthCheckOptions options) {
        return new HealthCheckOptionsBuilder()
                .controlPlaneNamespace(options._controlPlaneNamespace)
                .cniNamespace(options._cniNamespace)
                .dataPlaneNamespace(options._dataPlaneNamespace)
                .cniEnabled(options._cniEnabled)
                .multicluster(options._multicluster)
                .retryDeadline(options._retryDeadline)
                .requestTimeout(options._requestTimeout)
                .retryWaitWindow(options._retryWaitWindow)
                .hintBaseUrl(options._hintBaseUrl)
                .minimumKubernetesVersion(options._minimumKubernetesVersion)
                .gatewayTimeWindow(options._gatewayTimeWindow)
                .expirySoonThreshold(options._expirySoonThreshold)
                .allowedClockSkew(options._allowedClockSkew)
                .customResourceDefinitions(options._customResourceDefinitions);
    }

    /**
     * Builder for {@link HealthCheckOptions}. All values have defaults.
     */
    public static class HealthCheckOptionsBuilder {
        private String _controlPlaneNamespace = DEFAULT_CONTROL_PLANE_NAMESPACE;
        private String _cniNamespace = DEFAULT_CNI_NAMESPACE;
        private String _dataPlaneNamespace;
        private boolean _cniEnabled;
        private boolean _multicluster;
        private Instant _retryDeadline;
        private Duration _requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration _retryWaitWindow = DEFAULT_RETRY_WAIT_WINDOW;
        private String _hintBaseUrl = DEFAULT_HINT_BASE_URL;
        private String _minimumKubernetesVersion = DEFAULT_MINIMUM_KUBERNETES_VERSION;
        private String _gatewayTimeWindow = DEFAULT_GATEWAY_TIME_WINDOW;
        private Duration _expirySoonThreshold = DEFAULT_EXPIRY_SOON_THRESHOLD;
        private Duration _allowedClockSkew = DEFAULT_ALLOWED_CLOCK_SKEW;
        private Map<String, String> _customResourceDefinitions = DEFAULT_CUSTOM_RESOURCE_DEFINITIONS;

        public HealthCheckOptionsBuilder controlPlaneNamespace(String controlPlaneNamespace) {
            _controlPlaneNamespace = Objects.requireNonNull(controlPlaneNamespace, "controlPlaneNamespace");
            return this;
        }

        public HealthCheckOptionsBuilder cniNamespace(String cniNamespace) {
            _cniNamespace = Objects.requireNonNull(cniNamespace, "cniNamespace");
            return this;
        }

        public HealthCheckOptionsBuilder dataPlaneNamespace(String dataPlaneNamespace) {
            _dataPlaneNamespace = dataPlaneNamespace;
            return this;
        }

        public HealthCheckOptionsBuilder cniEnabled(boolean cniEnabled) {
            _cniEnabled = cniEnabled;
            return this;
        }

        public HealthCheckOptionsBuilder multicluster(boolean multicluster) {
            _multicluster = multicluster;
            return this;
        }

        public HealthCheckOptionsBuilder retryDeadline(Instant retryDeadline) {
            _retryDeadline = retryDeadline;
            return this;
        }

        public HealthCheckOptionsBuilder requestTimeout(Duration requestTimeout) {
            _requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
            return this;
        }

        public HealthCheckOptionsBuilder retryWaitWindow(Duration retryWaitWindow) {
            _retryWaitWindow = Objects.requireNonNull(retryWaitWindow, "retryWaitWindow");
            return this;
        }

        public HealthCheckOptionsBuilder hintBaseUrl(String hintBaseUrl) {
            _hintBaseUrl = Objects.requireNonNull(hintBaseUrl, "hintBaseUrl");
            return this;
        }

        public HealthCheckOptionsBuilder minimumKubernetesVersion(String minimumKubernetesVersion) {
            _minimumKubernetesVersion = Objects.requireNonNull(minimumKubernetesVersion, "minimumKubernetesVersion");
            return this;
        }

        public HealthCheckOptionsBuilder gatewayTimeWindow(String gatewayTimeWindow) {
            _gatewayTimeWindow = Objects.requireNonNull(gatewayTimeWindow, "gatewayTimeWindow");
            return this;
        }

        public HealthCheckOptionsBuilder expirySoonThreshold(Duration expirySoonThreshold) {
            _expirySoonThreshold = Objects.requireNonNull(expirySoonThreshold, "expirySoonThreshold");
            return this;
        }

        public HealthCheckOptionsBuilder allowedClockSkew(Duration allowedClockSkew) {
            _allowedClockSkew = Objects.requireNonNull(allowedClockSkew, "allowedClockSkew");
            return this;
        }

        public HealthCheckOptionsBuilder customResourceDefinitions(Map<String, String> customResourceDefinitions) {
            _customResourceDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(
                    Objects.requireNonNull(customResourceDefinitions, "customResourceDefinitions")));
            return this;
        }

        public HealthCheckOptions build() {
            return new HealthCheckOptions(this);
        }
    }
}
