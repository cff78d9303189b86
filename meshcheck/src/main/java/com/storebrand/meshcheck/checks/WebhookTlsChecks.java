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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.storebrand.meshcheck.Category;
import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.Checker;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.WebhookConfiguration;
import com.storebrand.meshcheck.cluster.WebhookConfiguration.Kind;
import com.storebrand.meshcheck.tls.Credentials;
import com.storebrand.meshcheck.tls.PemCertificates;
import com.storebrand.meshcheck.trust.CertificateRequirementException;
import com.storebrand.meshcheck.trust.TrustChainVerifier;

/**
 * Each admission webhook serves a certificate that must chain to the CA bundle published in its webhook
 * configuration, and be valid for the webhook's service name.
 */
class WebhookTlsChecks {
    static final String POLICY_VALIDATOR_NOT_INSTALLED = "policy validator not installed";

    static final Webhook PROXY_INJECTOR = new Webhook("proxy-injector", Kind.MUTATING, true, false);
    static final Webhook SP_VALIDATOR = new Webhook("sp-validator", Kind.VALIDATING, true, false);
    static final Webhook POLICY_VALIDATOR = new Webhook("policy-validator", Kind.VALIDATING, false, true);

    static final List<Webhook> WEBHOOKS = Collections.unmodifiableList(
            Arrays.asList(PROXY_INJECTOR, SP_VALIDATOR, POLICY_VALIDATOR));

    Category category(HealthCheckOptions options) {
        List<Checker> checkers = new ArrayList<>();
        for (Webhook webhook : WEBHOOKS) {
            checkers.add(Checker.builder(webhook.component + " webhook has valid cert")
                    .hintAnchor("l5d-" + webhook.component + "-webhook-cert-valid")
                    .fatal()
                    .check(context -> hasValidCert(context, webhook)));
            checkers.add(Checker.builder(webhook.component + " cert is valid for at least 60 days")
                    .hintAnchor("l5d-" + webhook.component + "-webhook-cert-not-expiring-soon")
                    .warning()
                    .check(context -> notExpiringSoon(context, webhook)));
        }
        return new Category(CategoryId.WEBHOOKS_AND_APISVC_TLS, checkers);
    }

    CheckOutcome hasValidCert(CheckContext context, Webhook webhook) {
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        String namespace = context.getOptions().getControlPlaneNamespace();
        Optional<Credentials> credentials = WebhookCredentialsLoader.load(client, namespace, webhook.component,
                webhook.legacySecret);
        Optional<WebhookConfiguration> configuration = client.getWebhookConfiguration(webhook.kind,
                webhook.configurationName());

        // ?: Is this an optional webhook that is not installed?
        if (webhook.optional && !credentials.isPresent() && !configuration.isPresent()) {
            // -> Yes, nothing to check.
            return CheckOutcome.skip(POLICY_VALIDATOR_NOT_INSTALLED);
        }
        if (!credentials.isPresent()) {
            return CheckOutcome.fail("secret " + namespace + "/" + WebhookCredentialsLoader.secretName(
                    webhook.component) + " does not exist");
        }
        if (!configuration.isPresent()) {
            return CheckOutcome.fail("webhook configuration " + webhook.configurationName() + " does not exist");
        }

        List<X509Certificate> anchors = PemCertificates.decodeCertificates(configuration.get().caBundlePem());
        try {
            verifier(context).checkCertAndAnchors(credentials.get(), anchors, webhook.identityName(namespace));
        }
        catch (CertificateRequirementException e) {
            return CheckOutcome.fail(e);
        }
        return CheckOutcome.ok();
    }

    CheckOutcome notExpiringSoon(CheckContext context, Webhook webhook) {
        ClusterClient client = context.getDiscovery().cluster().requireClient();
        String namespace = context.getOptions().getControlPlaneNamespace();
        Optional<Credentials> credentials = WebhookCredentialsLoader.load(client, namespace, webhook.component,
                webhook.legacySecret);
        if (!credentials.isPresent()) {
            // ?: Optional and not installed?
            if (webhook.optional && !client.getWebhookConfiguration(webhook.kind, webhook.configurationName())
                    .isPresent()) {
                // -> Yes, so nothing to check.
                return CheckOutcome.skip(POLICY_VALIDATOR_NOT_INSTALLED);
            }
            return CheckOutcome.fail("secret " + namespace + "/" + WebhookCredentialsLoader.secretName(
                    webhook.component) + " does not exist");
        }
        try {
            verifier(context).checkCertAndAnchorsExpiringSoon(credentials.get());
        }
        catch (CertificateRequirementException e) {
            return CheckOutcome.fail(e);
        }
        return CheckOutcome.ok();
    }

    private static TrustChainVerifier verifier(CheckContext context) {
        return new TrustChainVerifier(context.getClock(), context.getOptions().getExpirySoonThreshold());
    }

    /**
     * A webhook component: its name, the kind of its configuration, and whether it has a legacy secret or may be
     * absent altogether.
     */
    static final class Webhook {
        final String component;
        final Kind kind;
        final boolean legacySecret;
        final boolean optional;

        Webhook(String component, Kind kind, boolean legacySecret, boolean optional) {
            this.component = component;
            this.kind = kind;
            this.legacySecret = legacySecret;
            this.optional = optional;
        }

        String configurationName() {
            return "linkerd-" + component + "-webhook-config";
        }

        String identityName(String namespace) {
            return "linkerd-" + component + "." + namespace + ".svc";
        }
    }
}
