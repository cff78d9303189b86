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


package com.storebrand.meshcheck.multicluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.cluster.AccessReview;
import com.storebrand.meshcheck.cluster.ClusterClient;
import com.storebrand.meshcheck.cluster.RemoteClusterConnector;
import com.storebrand.meshcheck.cluster.RemoteClusterDescriptor;
import com.storebrand.meshcheck.cluster.RemoteClusterSecretParser;
import com.storebrand.meshcheck.cluster.Secret;

/**
 * Verifies that the service mirror controller can reach every target cluster it has credentials for, and that it is
 * allowed to get, list and watch services there. Each verb is probed with an access review, nothing is modified.
 * <p>
 * Remote clusters are probed one at a time.
 */
public class RemoteClusterProbe {
    private static final Logger log = LoggerFactory.getLogger(RemoteClusterProbe.class);

    static final List<String> EXPECTED_SERVICE_VERBS = Collections.unmodifiableList(
            Arrays.asList("get", "list", "watch"));

    private final RemoteClusterSecretParser _secretParser;
    private final RemoteClusterConnector _connector;

    public RemoteClusterProbe(RemoteClusterSecretParser secretParser, RemoteClusterConnector connector) {
        _secretParser = secretParser;
        _connector = connector;
    }

    public ProbeReport probe(List<Secret> secrets) {
        ProbeReport report = new ProbeReport();
        for (Secret secret : secrets) {
            RemoteClusterDescriptor descriptor;
            try {
                descriptor = _secretParser.parse(secret);
            }
            // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - Any parse failure is reported for this secret only.
            catch (RuntimeException e) {
                report._errors.add("* secret [" + secret.namespace + "/" + secret.name + "]: " + e.getMessage());
                continue;
            }

            try (ClusterClient remote = _connector.connect(descriptor)) {
                List<String> allowed = new ArrayList<>();
                for (String verb : EXPECTED_SERVICE_VERBS) {
                    if (remote.isAllowed(new AccessReview(verb, "", "", "v1", "services"))) {
                        allowed.add(verb);
                    }
                }
                if (!allowed.equals(EXPECTED_SERVICE_VERBS)) {
                    report._errors.add("* cluster: [" + descriptor.clusterName + "]: Insufficient Service permissions:"
                            + " expected " + EXPECTED_SERVICE_VERBS + ", got " + allowed);
                    continue;
                }
                log.debug("Validated access to remote cluster [" + descriptor.clusterName + "].");
                report._validated.add(descriptor);
            }
            // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - Any connection failure is reported for this cluster only.
            catch (Exception e) {
                report._errors.add("* cluster: [" + descriptor.clusterName + "]: " + e.getMessage());
            }
        }
        return report;
    }

    /**
     * The clusters that could be reached with the expected permissions, and one message for each that could not.
     */
    public static final class ProbeReport {
        private final List<RemoteClusterDescriptor> _validated = new ArrayList<>();
        private final List<String> _errors = new ArrayList<>();

        public List<RemoteClusterDescriptor> getValidated() {
            return Collections.unmodifiableList(_validated);
        }

        public List<String> getErrors() {
            return Collections.unmodifiableList(_errors);
        }
    }
}
