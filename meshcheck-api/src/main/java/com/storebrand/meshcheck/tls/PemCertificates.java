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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoding and encoding of PEM certificate and key material. Certificates are decoded with
 * {@link java.security.cert}, private keys with Bouncy Castle's {@link PEMParser}.
 */
public final class PemCertificates {
    private static final Logger log = LoggerFactory.getLogger(PemCertificates.class);

    private static final Pattern PEM_BLOCK = Pattern.compile(
            "-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);
    private static final String CERTIFICATE = "CERTIFICATE";

    private PemCertificates() {
        // Utility class - hiding constructor
    }

    /**
     * Decodes every certificate in the PEM data, in order.
     *
     * @throws InvalidCredentialsException
     *         if there are no certificates, or one of them can not be decoded.
     */
    public static List<X509Certificate> decodeCertificates(String pem) {
        if (pem == null) {
            throw new InvalidCredentialsException("no certificates found in PEM data: data is missing");
        }
        CertificateFactory factory = certificateFactory();
        List<X509Certificate> certificates = new ArrayList<>();
        Matcher matcher = PEM_BLOCK.matcher(pem);
        while (matcher.find()) {
            if (!CERTIFICATE.equals(matcher.group(1))) {
                continue;
            }
            byte[] der = decodeBase64(matcher.group(2));
            try {
                certificates.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der)));
            }
            catch (CertificateException e) {
                throw new InvalidCredentialsException("failed to parse certificate: " + e.getMessage(), e);
            }
        }
        if (certificates.isEmpty()) {
            throw new InvalidCredentialsException("no certificates found in PEM data");
        }
        return certificates;
    }

    /**
     * @return the first certificate in the PEM data.
     */
    public static X509Certificate decodeCertificate(String pem) {
        return decodeCertificates(pem).get(0);
    }

    /**
     * Decodes the first private key in the PEM data. PKCS#8 ({@code BEGIN PRIVATE KEY}), SEC1
     * ({@code BEGIN EC PRIVATE KEY}) and PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) blocks are supported.
     *
     * @throws InvalidCredentialsException
     *         if there is no private key block, or the key can not be decoded.
     */
    public static PrivateKey decodePrivateKey(String pem) {
        if (pem == null) {
            throw new InvalidCredentialsException("no private key found in PEM data: data is missing");
        }
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                // ?: Is this a SEC1 or PKCS#1 key pair?
                if (object instanceof PEMKeyPair) {
                    // -> Yes, so take the private half.
                    return converter.getKeyPair((PEMKeyPair) object).getPrivate();
                }
                // ?: Is this a PKCS#8 key?
                if (object instanceof PrivateKeyInfo) {
                    return converter.getPrivateKey((PrivateKeyInfo) object);
                }
                // E-> Certificates and EC parameter blocks are skipped.
                log.trace("Skipping PEM object of type [" + object.getClass().getSimpleName() + "].");
            }
        }
        catch (IOException e) {
            throw new InvalidCredentialsException("failed to parse private key: " + e.getMessage(), e);
        }
        throw new InvalidCredentialsException("no private key found in PEM data");
    }

    /**
     * Encodes a certificate as PEM, with 64 characters per line.
     */
    public static String encodeCertificate(X509Certificate certificate) {
        try {
            Base64.Encoder encoder = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII));
            return "-----BEGIN CERTIFICATE-----\n"
                    + encoder.encodeToString(certificate.getEncoded())
                    + "\n-----END CERTIFICATE-----\n";
        }
        catch (CertificateException e) {
            throw new InvalidCredentialsException("failed to encode certificate: " + e.getMessage(), e);
        }
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static byte[] decodeBase64(String body) {
        try {
            return Base64.getMimeDecoder().decode(body);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidCredentialsException("failed to decode PEM block: " + e.getMessage(), e);
        }
    }

    private static CertificateFactory certificateFactory() {
        try {
            return CertificateFactory.getInstance("X.509");
        }
        catch (CertificateException e) {
            throw new IllegalStateException("X.509 certificate factory is not available", e);
        }
    }
}
