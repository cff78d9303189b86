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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.storebrand.meshcheck.cluster.Service;
import com.storebrand.meshcheck.cluster.TrafficSplit;
import com.storebrand.meshcheck.cluster.TrafficSplit.Backend;

public class DaisyChainDetectorTest {

    @Test
    public void plainExportsAndMirrors_areFine() {
        List<Service> services = Arrays.asList(exported("web", "shop"), mirror("api-east", "shop"),
                service("db", "shop"));

        assertTrue(DaisyChainDetector.detect(services, Collections.emptyList()).isEmpty());
    }

    @Test
    public void exportedMirror_isReported() {
        Service exportedMirror = service("api-east", "shop", mirrorLabels(), exportAnnotations());

        List<String> problems = DaisyChainDetector.detect(Collections.singletonList(exportedMirror),
                Collections.emptyList());

        assertEquals(Collections.singletonList("mirror service api-east.shop is exported"), problems);
    }

    @Test
    public void exportedApex_routingToMirror_isReported() {
        // :: Arrange
        List<Service> services = Arrays.asList(exported("api", "shop"), service("api-local", "shop"),
                mirror("api-east", "shop"));
        TrafficSplit split = new TrafficSplit("api-split", "shop", "api",
                Arrays.asList(new Backend("api-local", 50), new Backend("api-east", 50)));

        // :: Act
        List<String> problems = DaisyChainDetector.detect(services, Collections.singletonList(split));

        // :: Assert
        assertEquals(Collections.singletonList("exported service api.shop routes to mirror service api-east.shop"
                + " via traffic split api-split.shop"), problems);
    }

    @Test
    public void unexportedApex_routingToMirror_isFine() {
        List<Service> services = Arrays.asList(service("api", "shop"), mirror("api-east", "shop"));
        TrafficSplit split = new TrafficSplit("api-split", "shop", "api",
                Collections.singletonList(new Backend("api-east", 100)));

        assertTrue(DaisyChainDetector.detect(services, Collections.singletonList(split)).isEmpty());
    }

    @Test
    public void blankGatewayAnnotation_isNotAnExport() {
        Map<String, String> annotations = exportAnnotations();
        annotations.put(MulticlusterLabels.GATEWAY_NAME_ANNOTATION, " ");

        assertTrue(!DaisyChainDetector.isExported(service("web", "shop", null, annotations)));
    }

    private static Service exported(String name, String namespace) {
        return service(name, namespace, null, exportAnnotations());
    }

    private static Service mirror(String name, String namespace) {
        return service(name, namespace, mirrorLabels(), null);
    }

    private static Service service(String name, String namespace) {
        return service(name, namespace, null, null);
    }

    private static Service service(String name, String namespace, Map<String, String> labels,
            Map<String, String> annotations) {
        return new Service(name, namespace, labels, annotations);
    }

    private static Map<String, String> mirrorLabels() {
        Map<String, String> labels = new HashMap<>();
        labels.put(MulticlusterLabels.MIRRORED_SERVICE_LABEL, "true");
        labels.put(MulticlusterLabels.REMOTE_CLUSTER_NAME_LABEL, "east");
        return labels;
    }

    private static Map<String, String> exportAnnotations() {
        Map<String, String> annotations = new HashMap<>();
        annotations.put(MulticlusterLabels.GATEWAY_NAME_ANNOTATION, "linkerd-gateway");
        annotations.put(MulticlusterLabels.GATEWAY_NAMESPACE_ANNOTATION, "linkerd-multicluster");
        return annotations;
    }
}
