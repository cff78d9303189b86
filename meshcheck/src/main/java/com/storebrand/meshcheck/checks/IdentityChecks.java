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
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.Secret;
import com.storebrand.meshcheck.tls.Credentials;
import com.storebrand.meshcheck.tls.InvalidCredentialsException;
import com.storebrand.meshcheck.tls.PemCertificates;
import com.storebrand.meshcheck.trust.CertificateRequirementException;
import com.storebrand.meshcheck.trust.TrustChainVerifier;

/**
 * The identity issuer and the trust anchors it chains to. The first check loads the material into the discovery
 * context, the rest verify it.
 */
class IdentityChecks {
    private static final Logger log = LoggerFactory.getLogger(IdentityChecks.class);

    static final String ISSUER_SECRET = "linkerd-identity-issuer";
    static final String SCHEME_LINKERD = "linkerd.io/tls";
    static final String SCHEME_KUBERNETES = "kubernetes.io/tls";

    // linkerd.io/tls scheme
    static final String ISSUER_CERT_KEY = "crt.pem";
    static final String ISSUER_KEY_KEY = "key.pem";
    // kubernetes.io/tls scheme, with an external issuer
    static final String EXTERNAL_CA_KEY = "ca.crt";
    static final String EXTERNAL_CERT_KEY = "tls.crt";
    static final String EXTERNAL_KEY_KEY = "tls.key";

    Category category(HealthCheckOptions options) {
        return Category.of(CategoryId.IDENTITY,
                Checker.builder("certificate config is valid")
                        .hintAnchor("l5d-identity-cert-config-valid")
                        .fatal()
                        .check(this::certificateConfigValid),
                Checker.builder("trust anchors are using supported crypto algorithm")
                        .hintAnchor("l5d-identity-trustAnchors-use-supported-crypto")
                        .fatal()
                        .check(this::anchorsUseSupportedCrypto),
                Checker.builder("trust anchors are within their validity period")
                        .hintAnchor("l5d-identity-trustAnchors-are-time-valid")
                        .fatal()
                        .check(this::anchorsWithinValidity),
                Checker.builder("trust anchors are valid for at least 60 days")
                        .hintAnchor("l5d-identity-trustAnchors-not-expiring-soon")
                        .warning()
                        .check(this::anchorsNotExpiringSoon),
                Checker.builder("issuer cert is using supported crypto algorithm")
                        .hintAnchor("l5d-identity-issuer-cert-uses-supported-crypto")
                        .fatal()
                        .check(this::issuerUsesSupportedCrypto),
                Checker.builder("issuer cert is within its validity period")
                        .hintAnchor("l5d-identity-issuer-cert-is-time-valid")
                        .fatal()
                        .check(this::issuerWithinValidity),
                Checker.builder("issuer cert is valid for at least 60 days")
                        .hintAnchor("l5d-identity-issuer-cert-not-expiring-soon")
                        .warning()
                        .check(this::issuerNotExpiringSoon),
                Checker.builder("issuer cert is issued by the trust anchor")
                        .hintAnchor("l5d-identity-issuer-cert-issued-by-trust-anchor")
                        .fatal()
                        .check(this::issuerIssuedByTrustAnchor));
    }

    CheckOutcome certificateConfigValid(CheckContext context) {
        ControlPlaneConfig config = context.getDiscovery().cluster().requireControlPlaneConfig();
        String namespace = context.getOptions().getControlPlaneNamespace();
        String scheme = config.getIdentityIssuerScheme();
        boolean external;
        // ?: Is the scheme unset?
        if (scheme == null || scheme.isEmpty()) {
            // -> Yes, so the issuer is managed by the control plane itself.
            log.debug("No identity issuer scheme configured, using [" + SCHEME_LINKERD + "].");
            external = false;
        }
        else if (SCHEME_LINKERD.equals(scheme)) {
            external = false;
        }
        else if (SCHEME_KUBERNETES.equals(scheme)) {
            external = true;
        }
        else {
            return CheckOutcome.fail("not a valid issuer scheme: " + scheme);
        }

        Optional<Secret> secret = context.getDiscovery().cluster().requireClient()
                .getSecret(namespace, ISSUER_SECRET);
        if (!secret.isPresent()) {
            return CheckOutcome.fail("secret " + namespace + "/" + ISSUER_SECRET + " does not exist");
        }

        String certKey = external ? EXTERNAL_CERT_KEY : ISSUER_CERT_KEY;
        String keyKey = external ? EXTERNAL_KEY_KEY : ISSUER_KEY_KEY;
        Optional<String> certPem = secret.get().getString(certKey);
        if (!certPem.isPresent()) {
            return CheckOutcome.fail(keyMissing(certKey, "issuer certificate", external));
        }
        Optional<String> keyPem = secret.get().getString(keyKey);
        if (!keyPem.isPresent()) {
            return CheckOutcome.fail(keyMissing(keyKey, "issuer key", external));
        }

        // :: Anchors come from the configuration, or from the external issuer's CA.
        Optional<String> anchorsPem = config.getIdentityTrustAnchorsPem();
        if (!anchorsPem.isPresent() && external) {
            anchorsPem = secret.get().getString(EXTERNAL_CA_KEY);
            if (!anchorsPem.isPresent()) {
                return CheckOutcome.fail(keyMissing(EXTERNAL_CA_KEY, "trust anchors", true));
            }
        }
        if (!anchorsPem.isPresent()) {
            return CheckOutcome.fail("trust anchors are not present in the control plane configuration");
        }

        Credentials credentials = Credentials.fromPem(certPem.get(), keyPem.get());
        try {
            credentials.verifyKeyMatch();
        }
        catch (InvalidCredentialsException e) {
            return CheckOutcome.fail(new InvalidCredentialsException("issuer key does not match issuer certificate",
                    e));
        }
        List<X509Certificate> anchors = PemCertificates.decodeCertificates(anchorsPem.get());

        context.getDiscovery().identity().setIssuerCredentials(credentials);
        context.getDiscovery().identity().setTrustAnchors(anchors);
        return CheckOutcome.ok();
    }

    CheckOutcome anchorsUseSupportedCrypto(CheckContext context) {
        return checkEachAnchor(context, "Invalid trustAnchors:",
                verifier(context)::checkTrustAnchorAlgorithmRequirements);
    }

    CheckOutcome anchorsWithinValidity(CheckContext context) {
        return checkEachAnchor(context, "Invalid anchors:", verifier(context)::checkValidityPeriod);
    }

    CheckOutcome anchorsNotExpiringSoon(CheckContext context) {
        return checkEachAnchor(context, "Anchors expiring soon:", verifier(context)::checkExpiringSoon);
    }

    CheckOutcome issuerUsesSupportedCrypto(CheckContext context) {
        return checkIssuer(context, "issuer certificate ", verifier(context)::checkIssuerAlgorithmRequirements);
    }

    CheckOutcome issuerWithinValidity(CheckContext context) {
        return checkIssuer(context, "issuer certificate is ", verifier(context)::checkValidityPeriod);
    }

    CheckOutcome issuerNotExpiringSoon(CheckContext context) {
        return checkIssuer(context, "issuer certificate ", verifier(context)::checkExpiringSoon);
    }

    CheckOutcome issuerIssuedByTrustAnchor(CheckContext context) {
        Credentials issuer = context.getDiscovery().identity().requireIssuerCredentials();
        List<X509Certificate> anchors = context.getDiscovery().identity().requireTrustAnchors();
        try {
            verifier(context).verifyChain(issuer, anchors, null);
        }
        catch (CertificateRequirementException e) {
            return CheckOutcome.fail(new CertificateRequirementException(
                    "issuer certificate is not issued by the trust anchor: " + e.getMessage(), e));
        }
        return CheckOutcome.ok();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static TrustChainVerifier verifier(CheckContext context) {
        return new TrustChainVerifier(context.getClock(), context.getOptions().getExpirySoonThreshold());
    }

    private static CheckOutcome checkEachAnchor(CheckContext context, String heading,
            Consumer<X509Certificate> check) {
        List<String> invalid = new ArrayList<>();
        for (X509Certificate anchor : context.getDiscovery().identity().requireTrustAnchors()) {
            try {
                check.accept(anchor);
            }
            catch (CertificateRequirementException e) {
                invalid.add(TrustChainVerifier.describe(anchor) + " " + e.getMessage());
            }
        }
        if (!invalid.isEmpty()) {
            return CheckOutcome.fail(heading + "\n\t" + String.join("\n\t", invalid));
        }
        return CheckOutcome.ok();
    }

    private static CheckOutcome checkIssuer(CheckContext context, String prefix, Consumer<X509Certificate> check) {
        Credentials issuer = context.getDiscovery().identity().requireIssuerCredentials();
        try {
            check.accept(issuer.getCertificate());
        }
        catch (CertificateRequirementException e) {
            return CheckOutcome.fail(new CertificateRequirementException(prefix + e.getMessage(), e));
        }
        return CheckOutcome.ok();
    }

    private static String keyMissing(String key, String contents, boolean externalIssuer) {
        return "key " + key + " containing the " + contents + " needs to exist in secret " + ISSUER_SECRET
                + " if --identity-external-issuer=" + externalIssuer;
    }
}
