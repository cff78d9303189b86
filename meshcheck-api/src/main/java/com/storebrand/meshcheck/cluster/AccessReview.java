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

import java.util.Objects;

/**
 * An access the checks want to verify with an authorization dry-run. An empty namespace means all namespaces.
 */
@SuppressWarnings("VisibilityModifier")
public final class AccessReview {
    public final String verb;
    public final String namespace;
    public final String group;
    public final String version;
    public final String resource;

    public AccessReview(String verb, String namespace, String group, String version, String resource) {
        this.verb = verb;
        this.namespace = namespace == null ? "" : namespace;
        this.group = group == null ? "" : group;
        this.version = version;
        this.resource = resource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessReview)) {
            return false;
        }
        AccessReview that = (AccessReview) o;
        return verb.equals(that.verb) && namespace.equals(that.namespace) && group.equals(that.group)
                && Objects.equals(version, that.version) && resource.equals(that.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verb, namespace, group, version, resource);
    }

    @Override
    public String toString() {
        return verb + " " + (group.isEmpty() ? "" : group + "/") + resource
                + (namespace.isEmpty() ? "" : " in " + namespace);
    }
}
