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
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.Pod;
import com.storebrand.meshcheck.tls.InvalidCredentialsException;
import com.storebrand.meshcheck.tls.PemCertificates;
import com.storebrand.meshcheck.trust.TrustChainVerifier;

/**
 * Do the meshed pods trust the current anchors. A proxy gets its anchors when it starts, so pods started before the
 * anchors were rotated must be restarted.
 */
class IdentityDataPlaneChecks {
    private static final Logger log = LoggerFactory.getLogger(IdentityDataPlaneChecks.class);

    static final String TRUST_ANCHORS_ENV = "LINKERD2_PROXY_IDENTITY_TRUST_ANCHORS";

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.IDENTITY_DATA_PLANE,
                Checker.builder("data plane proxies certificate match CA")
                        .hintAnchor("l5d-identity-data-plane-proxies-certs-match-ca")
                        .warning()
                        .check(this::proxiesTrustCurrentAnchors));
    }

    CheckOutcome proxiesTrustCurrentAnchors(CheckContext context) {
        String controlPlaneNamespace = context.getOptions().getControlPlaneNamespace();
        Optional<String> dataPlaneNamespace = context.getOptions().getDataPlaneNamespace();
        List<X509Certificate> anchors = context.getDiscovery().identity().requireTrustAnchors();

        List<Pod> pods = context.getDiscovery().cluster().requireClient()
                .listPods(dataPlaneNamespace.orElse(null), ProxyPods.meshedBy(controlPlaneNamespace));
        List<String> outdated = new ArrayList<>();
        for (Pod pod : pods) {
            // Control plane proxies are restarted with the control plane.
            if (controlPlaneNamespace.equals(pod.namespace)) {
                continue;
            }
            Optional<String> podAnchors = pod.getProxyEnv(TRUST_ANCHORS_ENV);
            if (!podAnchors.isPresent()) {
                continue;
            }
            if (!trustsAnchors(pod, podAnchors.get(), anchors)) {
                outdated.add(dataPlaneNamespace.isPresent() ? pod.name : pod.namespace + "/" + pod.name);
            }
        }
        if (!outdated.isEmpty()) {
            return CheckOutcome.fail("Some pods do not have the current trust bundle and must be restarted:\n\t* "
                    + String.join("\n\t* ", outdated));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static boolean trustsAnchors(Pod pod, String podAnchorsPem, List<X509Certificate> anchors) {
        try {
            return TrustChainVerifier.anchorsAgree(anchors, PemCertificates.decodeCertificates(podAnchorsPem));
        }
        catch (InvalidCredentialsException e) {
            log.debug("Trust anchors of " + pod + " in [" + pod.namespace + "] can not be decoded, treating them as"
                    + " outdated.", e);
            return false;
        }
    }
}
