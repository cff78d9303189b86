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


package com.storebrand.meshcheck.trust;

import java.security.InvalidAlgorithmParameterException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateParsingException;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;

import com.storebrand.meshcheck.tls.Credentials;

/**
 * Verification of already issued certificate material: key algorithm requirements, validity period, expiry and chain
 * of trust to a set of anchors. No network calls, and the current time comes from the given {@link Clock}.
 * <p>
 * Every check throws {@link CertificateRequirementException} with a message meant for the operator.
 */
public class TrustChainVerifier {
    private static final String SHA256_WITH_ECDSA = "SHA256withECDSA";
    private static final String SHA256_WITH_RSA = "SHA256withRSA";
    private static final int SUBJECT_ALT_NAME_DNS = 2;

    private final Clock _clock;
    private final Duration _expirySoonThreshold;

    public TrustChainVerifier(Clock clock, Duration expirySoonThreshold) {
        _clock = clock;
        _expirySoonThreshold = expirySoonThreshold;
    }

    /**
     * The issuer must have an ECDSA P-256 key.
     */
    public void checkIssuerAlgorithmRequirements(X509Certificate certificate) {
        PublicKey key = certificate.getPublicKey();
        if (!(key instanceof ECPublicKey)) {
            throw new CertificateRequirementException("must use ECDSA for public key algorithm, instead "
                    + algorithmName(key) + " was used");
        }
        checkP256((ECPublicKey) key);
        String signature = certificate.getSigAlgName();
        if (!SHA256_WITH_ECDSA.equalsIgnoreCase(signature) && !SHA256_WITH_RSA.equalsIgnoreCase(signature)) {
            throw new CertificateRequirementException("must be signed by an ECDSA P-256 key, instead "
                    + signature + " was used");
        }
    }

    /**
     * A trust anchor must have either an ECDSA P-256 key signed with SHA-256, or an RSA 2048 or 4096 bit key signed
     * with SHA-256.
     */
    public void checkTrustAnchorAlgorithmRequirements(X509Certificate certificate) {
        PublicKey key = certificate.getPublicKey();
        String signature = certificate.getSigAlgName();
        if (key instanceof ECPublicKey) {
            checkP256((ECPublicKey) key);
            if (!SHA256_WITH_ECDSA.equalsIgnoreCase(signature)) {
                throw new CertificateRequirementException("must be signed by an ECDSA P-256 key, instead "
                        + signature + " was used");
            }
        }
        else if (key instanceof RSAPublicKey) {
            int bits = ((RSAPublicKey) key).getModulus().bitLength();
            if (bits != 2048 && bits != 4096) {
                throw new CertificateRequirementException("RSA must use at least 2048 bit public key, instead "
                        + bits + " bit public key was used");
            }
            if (!SHA256_WITH_RSA.equalsIgnoreCase(signature)) {
                throw new CertificateRequirementException("must be signed by an RSA 2048/4096 bit key, instead "
                        + signature + " was used");
            }
        }
        else {
            throw new CertificateRequirementException("must use ECDSA or RSA for public key algorithm, instead "
                    + algorithmName(key) + " was used");
        }
    }

    public void checkValidityPeriod(X509Certificate certificate) {
        Instant now = _clock.instant();
        Instant notBefore = certificate.getNotBefore().toInstant();
        Instant notAfter = certificate.getNotAfter().toInstant();
        if (notBefore.isAfter(now)) {
            throw new CertificateRequirementException("not valid before: " + format(notBefore));
        }
        if (notAfter.isBefore(now)) {
            throw new CertificateRequirementException("not valid anymore. Expired on " + format(notAfter));
        }
    }

    public void checkExpiringSoon(X509Certificate certificate) {
        Instant notAfter = certificate.getNotAfter().toInstant();
        if (notAfter.isBefore(_clock.instant().plus(_expirySoonThreshold))) {
            throw new CertificateRequirementException("will expire on " + format(notAfter));
        }
    }

    /**
     * Verifies that the certificate of the credentials chains to one of the anchors, through the intermediates of the
     * credentials. Revocation is not checked. If an expected name is given, it must be among the DNS subject
     * alternative names of the certificate.
     *
     * @param expectedName
     *         the name the certificate must be valid for, or null to only verify the chain.
     */
    public void verifyChain(Credentials credentials, Collection<X509Certificate> anchors, String expectedName) {
        X509Certificate certificate = credentials.getCertificate();
        Set<TrustAnchor> trustAnchors = new HashSet<>();
        for (X509Certificate anchor : anchors) {
            trustAnchors.add(new TrustAnchor(anchor, null));
        }

        // :: Build the path, leaving out anything that is itself an anchor.
        List<X509Certificate> path = new ArrayList<>();
        if (!anchors.contains(certificate)) {
            path.add(certificate);
            for (X509Certificate intermediate : credentials.getChain()) {
                if (!anchors.contains(intermediate)) {
                    path.add(intermediate);
                }
            }
        }

        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            CertPath certPath = factory.generateCertPath(path);
            PKIXParameters parameters = new PKIXParameters(trustAnchors);
            parameters.setRevocationEnabled(false);
            parameters.setDate(Date.from(_clock.instant()));
            CertPathValidator.getInstance("PKIX").validate(certPath, parameters);
        }
        catch (CertPathValidatorException | InvalidAlgorithmParameterException e) {
            throw new CertificateRequirementException(e.getMessage(), e);
        }
        catch (CertificateException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("PKIX validation is not available", e);
        }

        if (expectedName != null) {
            checkName(certificate, expectedName);
        }
    }

    /**
     * The anchors must be within their validity period, as must the certificate, and the certificate must chain to one
     * of the anchors with the expected name.
     */
    public void checkCertAndAnchors(Credentials credentials, List<X509Certificate> anchors, String expectedName) {
        List<String> invalidAnchors = new ArrayList<>();
        for (X509Certificate anchor : anchors) {
            try {
                checkValidityPeriod(anchor);
            }
            catch (CertificateRequirementException e) {
                invalidAnchors.add(describe(anchor) + " " + e.getMessage());
            }
        }
        if (!invalidAnchors.isEmpty()) {
            throw new CertificateRequirementException("anchors not within their validity period:\n\t"
                    + String.join("\n\t", invalidAnchors));
        }

        try {
            checkValidityPeriod(credentials.getCertificate());
        }
        catch (CertificateRequirementException e) {
            throw new CertificateRequirementException("certificate is " + e.getMessage(), e);
        }

        try {
            verifyChain(credentials, anchors, expectedName);
        }
        catch (CertificateRequirementException e) {
            throw new CertificateRequirementException("cert is not issued by the trust anchor: " + e.getMessage(), e);
        }
    }

    /**
     * Neither the intermediates of the credentials nor the certificate itself may be close to expiry.
     */
    public void checkCertAndAnchorsExpiringSoon(Credentials credentials) {
        List<String> expiring = new ArrayList<>();
        for (X509Certificate intermediate : credentials.getChain()) {
            try {
                checkExpiringSoon(intermediate);
            }
            catch (CertificateRequirementException e) {
                expiring.add(describe(intermediate) + " " + e.getMessage());
            }
        }
        if (!expiring.isEmpty()) {
            throw new CertificateRequirementException("Anchors expiring soon:\n\t" + String.join("\n\t", expiring));
        }

        try {
            checkExpiringSoon(credentials.getCertificate());
        }
        catch (CertificateRequirementException e) {
            throw new CertificateRequirementException("certificate " + e.getMessage(), e);
        }
    }

    /**
     * @return "* serial commonName", as used when listing offending certificates.
     */
    public static String describe(X509Certificate certificate) {
        return "* " + certificate.getSerialNumber() + " " + commonName(certificate);
    }

    /**
     * @return the set of certificate signatures, which identifies the anchors independent of their PEM encoding.
     */
    public static Set<String> signatures(Collection<X509Certificate> certificates) {
        Set<String> signatures = new LinkedHashSet<>();
        Base64.Encoder encoder = Base64.getEncoder();
        for (X509Certificate certificate : certificates) {
            signatures.add(encoder.encodeToString(certificate.getSignature()));
        }
        return signatures;
    }

    /**
     * Two anchor sets agree when they have the same size, and every remote anchor's signature is among the local ones.
     */
    public static boolean anchorsAgree(List<X509Certificate> local, List<X509Certificate> remote) {
        if (local.size() != remote.size()) {
            return false;
        }
        return signatures(local).containsAll(signatures(remote));
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static void checkP256(ECPublicKey key) {
        int fieldSize = key.getParams().getCurve().getField().getFieldSize();
        if (fieldSize != 256) {
            throw new CertificateRequirementException("must use P-256 curve for public key, instead P-" + fieldSize
                    + " was used");
        }
    }

    private static void checkName(X509Certificate certificate, String expectedName) {
        List<String> dnsNames = new ArrayList<>();
        try {
            Collection<List<?>> alternativeNames = certificate.getSubjectAlternativeNames();
            if (alternativeNames != null) {
                for (List<?> alternativeName : alternativeNames) {
                    if (((Integer) alternativeName.get(0)) == SUBJECT_ALT_NAME_DNS) {
                        dnsNames.add((String) alternativeName.get(1));
                    }
                }
            }
        }
        catch (CertificateParsingException e) {
            throw new CertificateRequirementException("could not read subject alternative names: "
                    + e.getMessage(), e);
        }
        if (dnsNames.isEmpty()) {
            throw new CertificateRequirementException("certificate is not valid for any names, but wanted to match "
                    + expectedName);
        }
        for (String dnsName : dnsNames) {
            if (dnsName.equalsIgnoreCase(expectedName)) {
                return;
            }
        }
        throw new CertificateRequirementException("certificate is valid for " + String.join(", ", dnsNames)
                + ", not " + expectedName);
    }

    private static String commonName(X509Certificate certificate) {
        try {
            LdapName name = new LdapName(certificate.getSubjectX500Principal().getName());
            for (Rdn rdn : name.getRdns()) {
                if ("CN".equalsIgnoreCase(rdn.getType())) {
                    return String.valueOf(rdn.getValue());
                }
            }
        }
        catch (InvalidNameException e) {
            return certificate.getSubjectX500Principal().getName();
        }
        return "";
    }

    private static String algorithmName(PublicKey key) {
        return "EC".equals(key.getAlgorithm()) ? "ECDSA" : key.getAlgorithm();
    }

    private static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
