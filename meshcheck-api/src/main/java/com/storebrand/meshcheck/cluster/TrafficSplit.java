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


package com.storebrand.meshcheck.cluster;

import java.util.Collections;
import java.util.List;

/**
 * A traffic split: requests to the apex service are spread over weighted backend services in the same namespace.
 */
@SuppressWarnings("VisibilityModifier")
public final class TrafficSplit {
    public final String name;
    public final String namespace;
    public final String apexService;
    public final List<Backend> backends;

    public TrafficSplit(String name, String namespace, String apexService, List<Backend> backends) {
        this.name = name;
        this.namespace = namespace;
        this.apexService = apexService;
        this.backends = backends == null ? Collections.emptyList() : Collections.unmodifiableList(backends);
    }

    public static class Backend {
        public final String service;
        public final int weight;

        public Backend(String service, int weight) {
            this.service = service;
            this.weight = weight;
        }
    }

    @Override
    public String toString() {
        return name + "." + namespace;
    }
}
