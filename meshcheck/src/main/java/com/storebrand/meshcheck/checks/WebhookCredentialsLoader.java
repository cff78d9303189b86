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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.Secret;
import com.storebrand.meshcheck.tls.Credentials;
import com.storebrand.meshcheck.tls.InvalidCredentialsException;

/**
 * Loads the serving credentials of a webhook component. The canonical secret is {@code linkerd-<component>-k8s-tls}
 * with {@code tls.crt}/{@code tls.key}. Older installs used {@code linkerd-<component>-tls} with
 * {@code crt.pem}/{@code key.pem}, which is tried when the canonical secret does not exist.
 */
final class WebhookCredentialsLoader {
    private static final Logger log = LoggerFactory.getLogger(WebhookCredentialsLoader.class);

    static final String CERT_KEY = "tls.crt";
    static final String KEY_KEY = "tls.key";
    static final String LEGACY_CERT_KEY = "crt.pem";
    static final String LEGACY_KEY_KEY = "key.pem";

    private WebhookCredentialsLoader() {
        // Utility class - hiding constructor
    }

    static String secretName(String component) {
        return "linkerd-" + component + "-k8s-tls";
    }

    static String legacySecretName(String component) {
        return "linkerd-" + component + "-tls";
    }

    /**
     * @return the credentials, or empty if neither secret exists (or only the legacy one, when it is not allowed).
     * @throws InvalidCredentialsException
     *         if a secret exists, but lacks a key or holds material that does not parse or match.
     */
    static Optional<Credentials> load(ClusterClient client, String namespace, String component,
            boolean legacyFallback) {
        Optional<Secret> secret = client.getSecret(namespace, secretName(component));
        if (secret.isPresent()) {
            return Optional.of(fromSecret(secret.get(), CERT_KEY, KEY_KEY));
        }
        if (!legacyFallback) {
            return Optional.empty();
        }
        Optional<Secret> legacy = client.getSecret(namespace, legacySecretName(component));
        if (legacy.isPresent()) {
            log.debug("Secret [" + namespace + "/" + secretName(component) + "] not found, using legacy secret ["
                    + legacy.get() + "].");
            return Optional.of(fromSecret(legacy.get(), LEGACY_CERT_KEY, LEGACY_KEY_KEY));
        }
        return Optional.empty();
    }

    private static Credentials fromSecret(Secret secret, String certKey, String keyKey) {
        String certPem = secret.getString(certKey)
                .orElseThrow(() -> new InvalidCredentialsException("key " + certKey + " needs to exist in secret "
                        + secret.name));
        String keyPem = secret.getString(keyKey)
                .orElseThrow(() -> new InvalidCredentialsException("key " + keyKey + " needs to exist in secret "
                        + secret.name));
        Credentials credentials = Credentials.fromPem(certPem, keyPem);
        credentials.verifyKeyMatch();
        return credentials;
    }
}
