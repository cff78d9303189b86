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

import static com.storebrand.meshcheck.CertificateFixtures.certificate;
import static com.storebrand.meshcheck.CertificateFixtures.clockBeforeExpiry;
import static com.storebrand.meshcheck.CertificateFixtures.clockWithin;
import static com.storebrand.meshcheck.CertificateFixtures.pem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.test.FakeClusterClient;
import com.storebrand.meshcheck.test.TestCheckContext;
import com.storebrand.meshcheck.trust.TrustChainVerifier;

/**
 * Tests the identity checks against the issuer and anchor fixtures.
 */
public class IdentityChecksTest {
    private final IdentityChecks _checks = new IdentityChecks();
    private final FakeClusterClient _client = new FakeClusterClient();

    @Test
    public void validIssuer_passesAllChecks() {
        // :: Arrange
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem", "anchor-b.pem"));
        withIssuerSecret("issuer.pem", "issuer.key");

        // :: Act / Assert
        assertOk(_checks.certificateConfigValid(context));
        assertEquals(2, context.getDiscovery().identity().requireTrustAnchors().size());
        assertTrue(context.getDiscovery().identity().requireIssuerCredentials().getPrivateKey().isPresent());
        assertOk(_checks.anchorsUseSupportedCrypto(context));
        assertOk(_checks.anchorsWithinValidity(context));
        assertOk(_checks.anchorsNotExpiringSoon(context));
        assertOk(_checks.issuerUsesSupportedCrypto(context));
        assertOk(_checks.issuerWithinValidity(context));
        assertOk(_checks.issuerNotExpiringSoon(context));
        assertOk(_checks.issuerIssuedByTrustAnchor(context));
    }

    @Test
    public void unknownScheme_fails() {
        CheckContext context = context(clockWithin("issuer.pem"), ControlPlaneConfig.builder()
                .identityIssuerScheme("example.com/tls")
                .identityTrustAnchorsPem(pem("anchor-a.pem"))
                .build());

        assertFailure("not a valid issuer scheme: example.com/tls", _checks.certificateConfigValid(context));
    }

    @Test
    public void missingSecret_fails() {
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem"));

        assertFailure("secret linkerd/linkerd-identity-issuer does not exist", _checks.certificateConfigValid(context));
    }

    @Test
    public void missingKey_namesTheKeyAndScheme() {
        // :: Arrange
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem"));
        Map<String, String> values = new HashMap<>();
        values.put(IdentityChecks.ISSUER_CERT_KEY, pem("issuer.pem"));
        _client.withSecret("linkerd", IdentityChecks.ISSUER_SECRET, "Opaque", values);

        // :: Act
        CheckOutcome outcome = _checks.certificateConfigValid(context);

        // :: Assert
        assertFailure("key key.pem containing the issuer key needs to exist in secret linkerd-identity-issuer"
                + " if --identity-external-issuer=false", outcome);
    }

    @Test
    public void keyOfAnotherCertificate_fails() {
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem"));
        withIssuerSecret("issuer.pem", "issuer-other.key");

        assertFailure("issuer key does not match issuer certificate", _checks.certificateConfigValid(context));
    }

    @Test
    public void sec1Key_ofTheCertificate_isDecoded() {
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem"));
        withIssuerSecret("issuer.pem", "issuer-sec1.key");

        assertOk(_checks.certificateConfigValid(context));
        assertTrue(context.getDiscovery().identity().requireIssuerCredentials().getPrivateKey().isPresent());
    }

    @Test
    public void sec1KeyOfAnotherCertificate_fails() {
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-a.pem"));
        withIssuerSecret("issuer.pem", "issuer-other-sec1.key");

        assertFailure("issuer key does not match issuer certificate", _checks.certificateConfigValid(context));
        assertFalse(context.getDiscovery().identity().getIssuerCredentials().isPresent());
    }

    @Test
    public void pkcs1RsaKey_isDecodedAndMatched() {
        CheckContext context = context(clockWithin("issuer-rsa.pem"), anchors("anchor-a.pem"));
        withIssuerSecret("issuer-rsa.pem", "issuer-rsa-pkcs1.key");

        assertOk(_checks.certificateConfigValid(context));
        assertEquals("RSA", context.getDiscovery().identity().requireIssuerCredentials().getPrivateKey()
                .map(key -> key.getAlgorithm()).orElse(null));
    }

    @Test
    public void emptyScheme_isTheControlPlaneScheme() {
        CheckContext context = context(clockWithin("issuer.pem"), ControlPlaneConfig.builder()
                .identityIssuerScheme("")
                .identityTrustAnchorsPem(pem("anchor-a.pem"))
                .build());
        withIssuerSecret("issuer.pem", "issuer.key");

        assertOk(_checks.certificateConfigValid(context));
    }

    @Test
    public void externalIssuer_takesAnchorsFromTheSecret() {
        // :: Arrange
        CheckContext context = context(clockWithin("issuer.pem"), ControlPlaneConfig.builder()
                .identityIssuerScheme(IdentityChecks.SCHEME_KUBERNETES)
                .build());
        Map<String, String> values = new HashMap<>();
        values.put(IdentityChecks.EXTERNAL_CA_KEY, pem("anchor-a.pem"));
        values.put(IdentityChecks.EXTERNAL_CERT_KEY, pem("issuer.pem"));
        values.put(IdentityChecks.EXTERNAL_KEY_KEY, pem("issuer.key"));
        _client.withSecret("linkerd", IdentityChecks.ISSUER_SECRET, "kubernetes.io/tls", values);

        // :: Act
        CheckOutcome outcome = _checks.certificateConfigValid(context);

        // :: Assert
        assertOk(outcome);
        assertEquals(1, context.getDiscovery().identity().requireTrustAnchors().size());
        assertOk(_checks.issuerIssuedByTrustAnchor(context));
    }

    @Test
    public void unsupportedAnchors_areListed() {
        // :: Arrange
        CheckContext context = context(clockWithin("issuer.pem"),
                anchors("anchor-a.pem", "anchor-p384.pem", "anchor-rsa1024.pem"));
        withIssuerSecret("issuer.pem", "issuer.key");
        assertOk(_checks.certificateConfigValid(context));

        // :: Act
        CheckOutcome outcome = _checks.anchorsUseSupportedCrypto(context);

        // :: Assert
        assertFailure("Invalid trustAnchors:\n\t"
                + TrustChainVerifier.describe(certificate("anchor-p384.pem"))
                + " must use P-256 curve for public key, instead P-384 was used\n\t"
                + TrustChainVerifier.describe(certificate("anchor-rsa1024.pem"))
                + " RSA must use at least 2048 bit public key, instead 1024 bit public key was used", outcome);
    }

    @Test
    public void rsaIssuer_failsSupportedCrypto() {
        CheckContext context = context(clockWithin("issuer-rsa.pem"), anchors("anchor-a.pem"));
        withIssuerSecret("issuer-rsa.pem", "issuer-rsa.key");
        assertOk(_checks.certificateConfigValid(context));

        assertFailure("issuer certificate must use ECDSA for public key algorithm, instead RSA was used",
                _checks.issuerUsesSupportedCrypto(context));
    }

    @Test
    public void issuerCloseToExpiry_isReported() {
        CheckContext context = context(clockBeforeExpiry("issuer.pem", Duration.ofDays(30)), anchors("anchor-a.pem"));
        withIssuerSecret("issuer.pem", "issuer.key");
        assertOk(_checks.certificateConfigValid(context));

        assertOk(_checks.issuerWithinValidity(context));
        assertFailure("issuer certificate will expire on 2031-10-16T13:19:42Z",
                _checks.issuerNotExpiringSoon(context));
    }

    @Test
    public void issuerSignedByAnotherAnchor_fails() {
        // :: Arrange
        CheckContext context = context(clockWithin("issuer.pem"), anchors("anchor-rogue.pem"));
        withIssuerSecret("issuer.pem", "issuer.key");
        assertOk(_checks.certificateConfigValid(context));

        // :: Act
        CheckOutcome outcome = _checks.issuerIssuedByTrustAnchor(context);

        // :: Assert
        assertTrue(outcome.isFail());
        assertTrue(outcome.getMessage().orElse(""),
                outcome.getMessage().orElse("").startsWith("issuer certificate is not issued by the trust anchor: "));
    }

    // ===== Helpers ===================================================================================================

    private CheckContext context(Clock clock, ControlPlaneConfig config) {
        TestCheckContext context = new TestCheckContext(clock);
        context.getDiscovery().cluster().setClient(_client);
        context.getDiscovery().cluster().setControlPlaneConfig(config);
        return context;
    }

    private static ControlPlaneConfig anchors(String... names) {
        StringBuilder buf = new StringBuilder();
        for (String name : names) {
            buf.append(pem(name));
        }
        return ControlPlaneConfig.builder()
                .identityTrustAnchorsPem(buf.toString())
                .build();
    }

    private void withIssuerSecret(String certificate, String key) {
        Map<String, String> values = new HashMap<>();
        values.put(IdentityChecks.ISSUER_CERT_KEY, pem(certificate));
        values.put(IdentityChecks.ISSUER_KEY_KEY, pem(key));
        _client.withSecret("linkerd", IdentityChecks.ISSUER_SECRET, "Opaque", values);
    }

    static void assertOk(CheckOutcome outcome) {
        assertTrue("Expected success, got " + outcome, outcome.isOk());
    }

    static void assertFailure(String expectedMessage, CheckOutcome outcome) {
        assertTrue("Expected failure, got " + outcome, outcome.isFail());
        assertEquals(expectedMessage, outcome.getMessage().orElse(null));
    }
}
