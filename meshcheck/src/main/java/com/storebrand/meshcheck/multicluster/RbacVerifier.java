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
import java.util.Optional;
import java.util.TreeSet;

import com.storebrand.meshcheck.cluster.PolicyRule;
import com.storebrand.meshcheck.cluster.RbacRole;

/**
 * Compares the rules of an actual ClusterRole or Role with the permissions the service mirror controller needs.
 * <p>
 * For each expected policy, the candidate rules are those whose resources include all the expected resources. A rule
 * with exactly the expected resources is preferred, otherwise the first candidate is used. The verbs of the chosen rule
 * must then be exactly the expected verbs. Order never matters. All gaps are collected, so the operator sees every
 * missing permission at once.
 */
public final class RbacVerifier {
    /**
     * Permissions on the local cluster, granted through the ClusterRole.
     */
    public static final List<ExpectedPolicy> LOCAL_ACCESS_POLICIES = Collections.unmodifiableList(Arrays.asList(
            new ExpectedPolicy(Arrays.asList("endpoints", "services"),
                    Arrays.asList("create", "delete", "get", "list", "update", "watch")),
            new ExpectedPolicy(Collections.singletonList("namespaces"),
                    Arrays.asList("get", "list", "watch"))));

    /**
     * Permissions on the credentials for the remote clusters, granted through the Role.
     */
    public static final List<ExpectedPolicy> READ_REMOTE_CREDENTIALS_POLICIES = Collections.singletonList(
            new ExpectedPolicy(Collections.singletonList("secrets"), Arrays.asList("get", "list", "watch")));

    private RbacVerifier() {
        // Utility class - hiding constructor
    }

    /**
     * @return one message per expected policy the role does not satisfy, empty if all are satisfied.
     */
    public static List<String> verify(RbacRole role, List<ExpectedPolicy> expectedPolicies) {
        List<String> problems = new ArrayList<>();
        for (ExpectedPolicy expected : expectedPolicies) {
            verifyRule(expected, role.rules).ifPresent(problems::add);
        }
        return problems;
    }

    static Optional<String> verifyRule(ExpectedPolicy expected, List<PolicyRule> actualRules) {
        PolicyRule candidate = null;
        for (PolicyRule rule : actualRules) {
            TreeSet<String> resources = new TreeSet<>(rule.resources);
            // ?: Exactly the expected resources?
            if (resources.equals(expected.resources)) {
                // -> Yes, this is the rule, no need to look further.
                candidate = rule;
                break;
            }
            // ?: A broader rule that covers them, and the first one we've seen?
            if (candidate == null && resources.containsAll(expected.resources)) {
                // -> Yes, keep it unless we find an exact one.
                candidate = rule;
            }
        }
        if (candidate == null) {
            return Optional.of("could not find " + expected.verbs + " permissions for " + expected.resources);
        }
        TreeSet<String> actualVerbs = new TreeSet<>(candidate.verbs);
        if (!actualVerbs.equals(expected.verbs)) {
            return Optional.of("expected to find " + expected.verbs + " permissions for " + expected.resources
                    + ", instead found " + actualVerbs);
        }
        return Optional.empty();
    }

    /**
     * Resources and verbs a role must grant, compared as sorted sets.
     */
    @SuppressWarnings("VisibilityModifier")
    public static final class ExpectedPolicy {
        public final TreeSet<String> resources;
        public final TreeSet<String> verbs;

        public ExpectedPolicy(List<String> resources, List<String> verbs) {
            this.resources = new TreeSet<>(resources);
            this.verbs = new TreeSet<>(verbs);
        }

        @Override
        public String toString() {
            return verbs + " on " + resources;
        }
    }
}
