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


package com.storebrand.meshcheck.tls;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A certificate, the intermediate certificates that came with it, and optionally its private key.
 */
public final class Credentials {
    private static final byte[] CHALLENGE = "meshcheck key pair challenge".getBytes(StandardCharsets.UTF_8);

    private final X509Certificate _certificate;
    private final List<X509Certificate> _chain;
    private final PrivateKey _privateKey;

    public Credentials(X509Certificate certificate, List<X509Certificate> chain, PrivateKey privateKey) {
        _certificate = Objects.requireNonNull(certificate, "certificate");
        _chain = chain == null ? Collections.emptyList() : Collections.unmodifiableList(chain);
        _privateKey = privateKey;
    }

    /**
     * Decodes credentials from PEM. The first certificate is the leaf, the rest are intermediates.
     *
     * @param keyPem
     *         the private key, or null when the key is not available (e.g. with an external issuer).
     */
    public static Credentials fromPem(String certificatePem, String keyPem) {
        List<X509Certificate> certificates = PemCertificates.decodeCertificates(certificatePem);
        PrivateKey key = keyPem == null ? null : PemCertificates.decodePrivateKey(keyPem);
        return new Credentials(certificates.get(0), certificates.subList(1, certificates.size()), key);
    }

    public X509Certificate getCertificate() {
        return _certificate;
    }

    public List<X509Certificate> getChain() {
        return _chain;
    }

    public Optional<PrivateKey> getPrivateKey() {
        return Optional.ofNullable(_privateKey);
    }

    /**
     * Verifies that the private key belongs to the certificate, by signing with the key and verifying with the
     * certificate. Does nothing if there is no key.
     *
     * @throws InvalidCredentialsException
     *         if the key does not match.
     */
    public void verifyKeyMatch() {
        if (_privateKey == null) {
            return;
        }
        String algorithm = signatureAlgorithm(_privateKey);
        try {
            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(_privateKey);
            signer.update(CHALLENGE);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(_certificate.getPublicKey());
            verifier.update(CHALLENGE);
            if (!verifier.verify(signature)) {
                throw new InvalidCredentialsException("private key does not match certificate");
            }
        }
        catch (GeneralSecurityException e) {
            throw new InvalidCredentialsException("private key does not match certificate: " + e.getMessage(), e);
        }
    }

    private static String signatureAlgorithm(PrivateKey key) {
        switch (key.getAlgorithm()) {
            case "EC":
                return "SHA256withECDSA";
            case "RSA":
                return "SHA256withRSA";
            default:
                throw new InvalidCredentialsException("unsupported private key algorithm: " + key.getAlgorithm());
        }
    }
}
