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

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.DaemonSet;
import com.storebrand.meshcheck.cluster.Pod;
import com.storebrand.meshcheck.cluster.RemoteClusterDescriptor;
import com.storebrand.meshcheck.cluster.ServerVersion;
import com.storebrand.meshcheck.rpc.PublicApiClient;
import com.storebrand.meshcheck.tls.Credentials;

/**
 * State discovered during a run, populated check by check. Later checks read what earlier checks wrote, so the state
 * is split into one sub-context per phase:
 * <ul>
 *     <li>{@link ClusterDiscovery} - written by the Kubernetes API, existence, CNI and public API categories.</li>
 *     <li>{@link IdentityDiscovery} - written by the identity category.</li>
 *     <li>{@link MulticlusterDiscovery} - written by the multicluster category.</li>
 * </ul>
 * A run is sequential, and exactly one check attempt writes at a time. An attempt that is abandoned after a timeout
 * may still be running, so writes made inside an {@link AttemptScope} are dropped once that scope is abandoned.
 */
public class DiscoveryContext {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryContext.class);

    private final ClusterDiscovery _cluster = new ClusterDiscovery();
    private final IdentityDiscovery _identity = new IdentityDiscovery();
    private final MulticlusterDiscovery _multicluster = new MulticlusterDiscovery();

    public ClusterDiscovery cluster() {
        return _cluster;
    }

    public IdentityDiscovery identity() {
        return _identity;
    }

    public MulticlusterDiscovery multicluster() {
        return _multicluster;
    }

    /**
     * Thrown when a check needs state that an earlier check should have discovered.
     */
    public static class NotDiscoveredException extends IllegalStateException {
        public NotDiscoveredException(String what, CategoryId producer) {
            super(what + " has not been discovered: checks in category [" + producer + "] must run first");
        }
    }

    /**
     * Scope of a single check attempt, entered on the thread running the attempt. Once {@link #abandon()} has been
     * called, writes to any {@link DiscoveryContext} from within the scope are dropped.
     */
    public static final class AttemptScope {
        private static final ThreadLocal<AttemptScope> CURRENT = new ThreadLocal<>();

        // Synchronized on "this"
        private boolean _abandoned;

        /**
         * Runs the callable within this scope, on the calling thread.
         */
        public <T> T call(Callable<T> callable) throws Exception {
            CURRENT.set(this);
            try {
                return callable.call();
            }
            finally {
                CURRENT.remove();
            }
        }

        /**
         * Marks the attempt as abandoned. Writes already made are kept, later writes are dropped.
         */
        public synchronized void abandon() {
            _abandoned = true;
        }

        public synchronized boolean isAbandoned() {
            return _abandoned;
        }
    }

    private static void write(String what, Runnable setter) {
        AttemptScope scope = AttemptScope.CURRENT.get();
        // ?: Are we outside an attempt?
        if (scope == null) {
            // -> Yes, the caller owns the context.
            setter.run();
            return;
        }
        synchronized (scope) {
            if (scope._abandoned) {
                log.warn("Dropping write of [" + what + "] from a check attempt that was abandoned after timing out.");
                return;
            }
            setter.run();
        }
    }

    // ===== Sub contexts ==============================================================================================

    public static class ClusterDiscovery {
        private ClusterClient _client;
        private ServerVersion _serverVersion;
        private List<Pod> _controlPlanePods;
        private ControlPlaneConfig _controlPlaneConfig;
        private DaemonSet _cniDaemonSet;
        private PublicApiClient _publicApiClient;

        public Optional<ClusterClient> getClient() {
            return Optional.ofNullable(_client);
        }

        public ClusterClient requireClient() {
            return getClient().orElseThrow(
                    () -> new NotDiscoveredException("Cluster client", CategoryId.KUBERNETES_API));
        }

        public void setClient(ClusterClient client) {
            write("setClient", () -> _client = client);
        }

        public Optional<ServerVersion> getServerVersion() {
            return Optional.ofNullable(_serverVersion);
        }

        public void setServerVersion(ServerVersion serverVersion) {
            write("setServerVersion", () -> _serverVersion = serverVersion);
        }

        public Optional<List<Pod>> getControlPlanePods() {
            return Optional.ofNullable(_controlPlanePods);
        }

        public void setControlPlanePods(List<Pod> controlPlanePods) {
            List<Pod> pods = Collections.unmodifiableList(new ArrayList<>(controlPlanePods));
            write("setControlPlanePods", () -> _controlPlanePods = pods);
        }

        public Optional<ControlPlaneConfig> getControlPlaneConfig() {
            return Optional.ofNullable(_controlPlaneConfig);
        }

        public ControlPlaneConfig requireControlPlaneConfig() {
            return getControlPlaneConfig().orElseThrow(
                    () -> new NotDiscoveredException("Control plane configuration",
                            CategoryId.CONTROL_PLANE_EXISTENCE));
        }

        public void setControlPlaneConfig(ControlPlaneConfig controlPlaneConfig) {
            write("setControlPlaneConfig", () -> _controlPlaneConfig = controlPlaneConfig);
        }

        public Optional<DaemonSet> getCniDaemonSet() {
            return Optional.ofNullable(_cniDaemonSet);
        }

        public void setCniDaemonSet(DaemonSet cniDaemonSet) {
            write("setCniDaemonSet", () -> _cniDaemonSet = cniDaemonSet);
        }

        public Optional<PublicApiClient> getPublicApiClient() {
            return Optional.ofNullable(_publicApiClient);
        }

        public void setPublicApiClient(PublicApiClient publicApiClient) {
            write("setPublicApiClient", () -> _publicApiClient = publicApiClient);
        }
    }

    public static class IdentityDiscovery {
        private Credentials _issuerCredentials;
        private List<X509Certificate> _trustAnchors;

        public Optional<Credentials> getIssuerCredentials() {
            return Optional.ofNullable(_issuerCredentials);
        }

        public Credentials requireIssuerCredentials() {
            return getIssuerCredentials().orElseThrow(
                    () -> new NotDiscoveredException("Issuer credentials", CategoryId.IDENTITY));
        }

        public void setIssuerCredentials(Credentials issuerCredentials) {
            write("setIssuerCredentials", () -> _issuerCredentials = issuerCredentials);
        }

        public Optional<List<X509Certificate>> getTrustAnchors() {
            return Optional.ofNullable(_trustAnchors);
        }

        public List<X509Certificate> requireTrustAnchors() {
            return getTrustAnchors().orElseThrow(
                    () -> new NotDiscoveredException("Trust anchors", CategoryId.IDENTITY));
        }

        public void setTrustAnchors(List<X509Certificate> trustAnchors) {
            List<X509Certificate> anchors = Collections.unmodifiableList(new ArrayList<>(trustAnchors));
            write("setTrustAnchors", () -> _trustAnchors = anchors);
        }
    }

    public static class MulticlusterDiscovery {
        private boolean _sourceCluster;
        private String _serviceMirrorNamespace;
        private final List<RemoteClusterDescriptor> _remoteClusters = new ArrayList<>();

        /**
         * @return true if a service mirror controller was found, which means this cluster mirrors services from
         *         remote clusters.
         */
        public boolean isSourceCluster() {
            return _sourceCluster;
        }

        public void setSourceCluster(boolean sourceCluster) {
            write("setSourceCluster", () -> _sourceCluster = sourceCluster);
        }

        public Optional<String> getServiceMirrorNamespace() {
            return Optional.ofNullable(_serviceMirrorNamespace);
        }

        public void setServiceMirrorNamespace(String serviceMirrorNamespace) {
            write("setServiceMirrorNamespace", () -> _serviceMirrorNamespace = serviceMirrorNamespace);
        }

        public List<RemoteClusterDescriptor> getRemoteClusters() {
            return Collections.unmodifiableList(_remoteClusters);
        }

        public void addRemoteCluster(RemoteClusterDescriptor descriptor) {
            write("addRemoteCluster", () -> _remoteClusters.add(descriptor));
        }

        public void clearRemoteClusters() {
            write("clearRemoteClusters", () -> _remoteClusters.clear());
        }
    }
}
