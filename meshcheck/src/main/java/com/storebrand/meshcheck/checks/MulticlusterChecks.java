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

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.DiscoveryContext.MulticlusterDiscovery;
import com.storebrand.meshcheck.DiscoveryContext.NotDiscoveredException;
import com.storebrand.meshcheck.ErrorMessages;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.ControlPlaneConfigFetcher;
import com.storebrand.meshcheck.cluster.Deployment;
import com.storebrand.meshcheck.cluster.Endpoints;
import com.storebrand.meshcheck.cluster.RbacRole;
import com.storebrand.meshcheck.cluster.RemoteClusterConnector;
import com.storebrand.meshcheck.cluster.RemoteClusterDescriptor;
import com.storebrand.meshcheck.cluster.RemoteClusterSecretParser;
import com.storebrand.meshcheck.cluster.Secret;
import com.storebrand.meshcheck.cluster.Service;
import com.storebrand.meshcheck.multicluster.DaisyChainDetector;
import com.storebrand.meshcheck.multicluster.GatewayLiveness;
import com.storebrand.meshcheck.multicluster.MulticlusterLabels;
import com.storebrand.meshcheck.multicluster.RbacVerifier;
import com.storebrand.meshcheck.multicluster.RemoteClusterProbe;
import com.storebrand.meshcheck.multicluster.RemoteClusterProbe.ProbeReport;
import com.storebrand.meshcheck.rpc.PublicApiClient;
import com.storebrand.meshcheck.tls.PemCertificates;
import com.storebrand.meshcheck.trust.TrustChainVerifier;

/**
 * Multicluster is opt-in by discovery: the first check looks for the service mirror controller, and if there is none
 * (and multicluster was not explicitly requested) every other check in the category is skipped.
 */
class MulticlusterChecks {
    private static final Logger log = LoggerFactory.getLogger(MulticlusterChecks.class);

    static final String NOT_CHECKING_MULTICLUSTER = "not checking muticluster";
    static final String NO_REMOTE_CLUSTERS = "no remote clusters configured";
    static final String NO_TARGET_CLUSTERS = "no target clusters";
    static final String NO_MIRROR_SERVICES = "no mirror services";

    private final RemoteClusterProbe _probe;
    private final RemoteClusterConnector _connector;
    private final ControlPlaneConfigFetcher _configFetcher;

    MulticlusterChecks(RemoteClusterSecretParser secretParser, RemoteClusterConnector connector,
            ControlPlaneConfigFetcher configFetcher) {
        _probe = new RemoteClusterProbe(secretParser, connector);
        _connector = connector;
        _configFetcher = configFetcher;
    }

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.MULTICLUSTER,
                Checker.builder("service mirror controller is running")
                        .hintAnchor("l5d-multicluster-service-mirror-running")
                        .fatal()
                        .check(this::serviceMirrorRunning),
                Checker.builder("service mirror controller has required permissions")
                        .hintAnchor("l5d-multicluster-source-rbac-correct")
                        .fatal()
                        .check(this::requiredPermissions),
                Checker.builder("service mirror controller can access target clusters")
                        .hintAnchor("l5d-smc-target-clusters-access")
                        .check(this::targetClustersAccess),
                Checker.builder("all target cluster gateways are alive")
                        .hintAnchor("l5d-multicluster-gateways-endpoints")
                        .check(this::gatewaysAlive),
                Checker.builder("clusters share trust anchors")
                        .hintAnchor("l5d-multicluster-clusters-share-anchors")
                        .check(this::clustersShareAnchors),
                Checker.builder("all mirror services have endpoints")
                        .hintAnchor("l5d-multicluster-services-endpoints")
                        .check(this::mirrorServicesHaveEndpoints),
                Checker.builder("multicluster daisy chaining is avoided")
                        .hintAnchor("l5d-multicluster-daisy-chaining")
                        .warning()
                        .check(this::daisyChainingAvoided));
    }

    CheckOutcome serviceMirrorRunning(CheckContext context) {
        MulticlusterDiscovery multicluster = context.getDiscovery().multicluster();
        multicluster.setSourceCluster(false);
        List<Deployment> controllers = context.getDiscovery().cluster().requireClient().listDeployments(null,
                Collections.singletonMap(MulticlusterLabels.CONTROL_PLANE_COMPONENT_LABEL,
                        MulticlusterLabels.SERVICE_MIRROR_COMPONENT));
        if (controllers.size() > 1) {
            return CheckOutcome.fail("there are more than one service mirror controllers");
        }
        if (controllers.isEmpty()) {
            // ?: Did the operator ask for multicluster?
            if (context.getOptions().isMulticluster()) {
                // -> Yes, so it is missing.
                return CheckOutcome.fail("service mirror controller is not present");
            }
            // E-> No, so this is not a multicluster install.
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        Deployment controller = controllers.get(0);
        if (controller.availableReplicas < 1) {
            return CheckOutcome.fail("service mirror controller is not available: " + controller);
        }
        multicluster.setSourceCluster(true);
        multicluster.setServiceMirrorNamespace(controller.namespace);
        log.debug("Found service mirror controller [" + controller + "], checking multicluster.");
        return CheckOutcome.ok();
    }

    CheckOutcome requiredPermissions(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        String namespace = serviceMirrorNamespace(context);
        List<String> problems = new ArrayList<>();

        Optional<RbacRole> clusterRole = client.getClusterRole(MulticlusterLabels.LOCAL_ACCESS_CLUSTER_ROLE);
        if (clusterRole.isPresent()) {
            problems.addAll(RbacVerifier.verify(clusterRole.get(), RbacVerifier.LOCAL_ACCESS_POLICIES));
        }
        else {
            problems.add("could not find ClusterRole " + MulticlusterLabels.LOCAL_ACCESS_CLUSTER_ROLE);
        }

        Optional<RbacRole> role = client.getRole(namespace, MulticlusterLabels.READ_REMOTE_CREDENTIALS_ROLE);
        if (role.isPresent()) {
            problems.addAll(RbacVerifier.verify(role.get(), RbacVerifier.READ_REMOTE_CREDENTIALS_POLICIES));
        }
        else {
            problems.add("could not find Role " + MulticlusterLabels.READ_REMOTE_CREDENTIALS_ROLE);
        }

        if (!problems.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(problems));
        }
        return CheckOutcome.ok();
    }

    CheckOutcome targetClustersAccess(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        MulticlusterDiscovery multicluster = context.getDiscovery().multicluster();
        multicluster.clearRemoteClusters();
        List<Secret> secrets = context.getDiscovery().cluster().requireClient()
                .listSecrets(null, MulticlusterLabels.REMOTE_KUBECONFIG_SECRET_TYPE);
        if (secrets.isEmpty()) {
            return CheckOutcome.skip(NO_REMOTE_CLUSTERS);
        }

        ProbeReport report = _probe.probe(secrets);
        report.getValidated().forEach(multicluster::addRemoteCluster);
        if (!report.getErrors().isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(report.getErrors()));
        }
        List<String> validated = new ArrayList<>();
        for (RemoteClusterDescriptor descriptor : report.getValidated()) {
            validated.add("\t* " + descriptor.clusterName);
        }
        return CheckOutcome.okVerbose("Validated access to:\n" + String.join("\n", validated));
    }

    CheckOutcome gatewaysAlive(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        PublicApiClient client = context.getDiscovery().cluster().getPublicApiClient()
                .orElseThrow(() -> new NotDiscoveredException("Public API client", CategoryId.PUBLIC_API));
        return GatewayLiveness.evaluate(client.gateways(context.getOptions().getGatewayTimeWindow(),
                context.getAttemptTimeout()));
    }

    CheckOutcome clustersShareAnchors(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        List<RemoteClusterDescriptor> remotes = context.getDiscovery().multicluster().getRemoteClusters();
        if (remotes.isEmpty()) {
            return CheckOutcome.skip(NO_TARGET_CLUSTERS);
        }
        List<X509Certificate> localAnchors = localAnchors(context);

        List<String> problematic = new ArrayList<>();
        for (RemoteClusterDescriptor remote : remotes) {
            try (ClusterClient remoteClient = _connector.connect(remote)) {
                ControlPlaneConfig remoteConfig = _configFetcher.fetch(remoteClient, remote.namespace);
                String remotePem = remoteConfig.getIdentityTrustAnchorsPem()
                        .orElseThrow(() -> new IllegalStateException("no trust anchors in control plane config"));
                if (!TrustChainVerifier.anchorsAgree(localAnchors, PemCertificates.decodeCertificates(remotePem))) {
                    problematic.add("* " + remote.clusterName);
                }
            }
            // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - A failing remote is reported, the others still run.
            catch (Exception e) {
                problematic.add("* " + remote.clusterName + ": " + e.getMessage());
            }
        }
        if (!problematic.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.joinUnder("Problematic clusters:", problematic));
        }
        return CheckOutcome.ok();
    }

    CheckOutcome mirrorServicesHaveEndpoints(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        List<Service> mirrors = client.listServices(null,
                Collections.singletonMap(MulticlusterLabels.MIRRORED_SERVICE_LABEL, "true"));
        if (mirrors.isEmpty()) {
            return CheckOutcome.skip(NO_MIRROR_SERVICES);
        }
        List<String> withoutEndpoints = new ArrayList<>();
        for (Service mirror : mirrors) {
            Optional<Endpoints> endpoints = client.getEndpoints(mirror.namespace, mirror.name);
            if (!endpoints.isPresent() || endpoints.get().readyAddresses == 0) {
                withoutEndpoints.add(mirror.qualifiedName() + " mirrored from cluster ["
                        + mirror.labels.get(MulticlusterLabels.REMOTE_CLUSTER_NAME_LABEL) + "]");
            }
        }
        if (!withoutEndpoints.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.joinUnder("Some mirror services do not have endpoints:",
                    withoutEndpoints));
        }
        return CheckOutcome.ok();
    }

    CheckOutcome daisyChainingAvoided(CheckContext context) {
        if (!isSourceCluster(context)) {
            return CheckOutcome.skip(NOT_CHECKING_MULTICLUSTER);
        }
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        List<String> chains = DaisyChainDetector.detect(client.listServices(null, Collections.emptyMap()),
                client.listTrafficSplits(null));
        if (!chains.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.join(chains));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static boolean isSourceCluster(CheckContext context) {
        return context.getDiscovery().multicluster().isSourceCluster();
    }

    private static String serviceMirrorNamespace(CheckContext context) {
        return context.getDiscovery().multicluster().getServiceMirrorNamespace()
                .orElseThrow(() -> new NotDiscoveredException("Service mirror namespace", CategoryId.MULTICLUSTER));
    }

    /**
     * The anchors found by the identity checks, or parsed from the local configuration if those did not run.
     */
    private static List<X509Certificate> localAnchors(CheckContext context) {
        Optional<List<X509Certificate>> discovered = context.getDiscovery().identity().getTrustAnchors();
        if (discovered.isPresent()) {
            return discovered.get();
        }
        String pem = context.getDiscovery().cluster().requireControlPlaneConfig().getIdentityTrustAnchorsPem()
                .orElseThrow(() -> new IllegalStateException("no trust anchors in local control plane config"));
        return PemCertificates.decodeCertificates(pem);
    }
}
