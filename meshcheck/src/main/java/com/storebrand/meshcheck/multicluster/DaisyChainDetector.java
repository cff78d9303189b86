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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.storebrand.meshcheck.cluster.Service;
import com.storebrand.meshcheck.cluster.TrafficSplit;
import com.storebrand.meshcheck.cluster.TrafficSplit.Backend;

/**
 * Finds mirror services that are exported again, directly or as the backend of an exported traffic split apex. Mirrors
 * of mirrors are not supported.
 */
public final class DaisyChainDetector {
    private DaisyChainDetector() {
        // Utility class - hiding constructor
    }

    public static List<String> detect(List<Service> services, List<TrafficSplit> trafficSplits) {
        Map<String, Service> byQualifiedName = new HashMap<>();
        List<String> problems = new ArrayList<>();
        for (Service service : services) {
            byQualifiedName.put(service.qualifiedName(), service);
            if (isMirror(service) && isExported(service)) {
                problems.add("mirror service " + service.qualifiedName() + " is exported");
            }
        }

        for (TrafficSplit trafficSplit : trafficSplits) {
            Service apex = byQualifiedName.get(trafficSplit.apexService + "." + trafficSplit.namespace);
            if (apex == null || !isExported(apex)) {
                continue;
            }
            for (Backend backend : trafficSplit.backends) {
                Service backendService = byQualifiedName.get(backend.service + "." + trafficSplit.namespace);
                if (backendService != null && isMirror(backendService)) {
                    problems.add("exported service " + apex.qualifiedName() + " routes to mirror service "
                            + backendService.qualifiedName() + " via traffic split " + trafficSplit);
                }
            }
        }
        return problems;
    }

    static boolean isMirror(Service service) {
        return "true".equals(service.labels.get(MulticlusterLabels.MIRRORED_SERVICE_LABEL));
    }

    static boolean isExported(Service service) {
        return notBlank(service.annotations.get(MulticlusterLabels.GATEWAY_NAME_ANNOTATION))
                && notBlank(service.annotations.get(MulticlusterLabels.GATEWAY_NAMESPACE_ANNOTATION));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
