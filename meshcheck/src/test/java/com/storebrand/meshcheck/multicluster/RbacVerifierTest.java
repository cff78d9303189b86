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
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.storebrand.meshcheck.cluster.PolicyRule;
import com.storebrand.meshcheck.cluster.RbacRole;
import com.storebrand.meshcheck.multicluster.RbacVerifier.ExpectedPolicy;

public class RbacVerifierTest {
    private static final ExpectedPolicy SECRETS = new ExpectedPolicy(Collections.singletonList("secrets"),
            Arrays.asList("get", "list", "watch"));

    @Test
    public void exactRule_inAnyOrder_isAccepted() {
        PolicyRule rule = rule(Arrays.asList("services", "endpoints"),
                Arrays.asList("watch", "update", "list", "get", "delete", "create"));

        List<String> problems = RbacVerifier.verify(role(rule, rule(Collections.singletonList("namespaces"),
                Arrays.asList("list", "get", "watch"))), RbacVerifier.LOCAL_ACCESS_POLICIES);

        assertTrue(problems.toString(), problems.isEmpty());
    }

    @Test
    public void exactRule_isPreferredOverAnEarlierBroaderRule() {
        // :: Arrange
        List<PolicyRule> rules = Arrays.asList(
                rule(Arrays.asList("secrets", "configmaps"), Collections.singletonList("get")),
                rule(Collections.singletonList("secrets"), Arrays.asList("get", "list", "watch")));

        // :: Act
        Optional<String> problem = RbacVerifier.verifyRule(SECRETS, rules);

        // :: Assert
        assertEquals(Optional.empty(), problem);
    }

    @Test
    public void broaderRule_isUsedWhenThereIsNoExactOne() {
        // :: Arrange
        List<PolicyRule> rules = Collections.singletonList(
                rule(Arrays.asList("configmaps", "secrets"), Arrays.asList("get", "list", "watch")));

        // :: Act
        Optional<String> problem = RbacVerifier.verifyRule(SECRETS, rules);

        // :: Assert
        assertEquals(Optional.empty(), problem);
    }

    @Test
    public void wrongVerbs_areReported() {
        List<PolicyRule> rules = Collections.singletonList(
                rule(Collections.singletonList("secrets"), Arrays.asList("get", "list")));

        Optional<String> problem = RbacVerifier.verifyRule(SECRETS, rules);

        assertEquals("expected to find [get, list, watch] permissions for [secrets], instead found [get, list]",
                problem.orElse(null));
    }

    @Test
    public void extraVerbs_areAlsoReported() {
        List<PolicyRule> rules = Collections.singletonList(
                rule(Collections.singletonList("secrets"), Arrays.asList("get", "list", "watch", "delete")));

        Optional<String> problem = RbacVerifier.verifyRule(SECRETS, rules);

        assertEquals("expected to find [get, list, watch] permissions for [secrets], instead found "
                + "[delete, get, list, watch]", problem.orElse(null));
    }

    @Test
    public void everyMissingPolicy_isReported() {
        // :: Arrange
        RbacRole role = role(rule(Collections.singletonList("pods"), Collections.singletonList("get")));

        // :: Act
        List<String> problems = RbacVerifier.verify(role, RbacVerifier.LOCAL_ACCESS_POLICIES);

        // :: Assert
        assertEquals(Arrays.asList(
                "could not find [create, delete, get, list, update, watch] permissions for [endpoints, services]",
                "could not find [get, list, watch] permissions for [namespaces]"), problems);
    }

    private static RbacRole role(PolicyRule... rules) {
        return new RbacRole(MulticlusterLabels.LOCAL_ACCESS_CLUSTER_ROLE, null, Arrays.asList(rules));
    }

    private static PolicyRule rule(List<String> resources, List<String> verbs) {
        return new PolicyRule(Collections.singletonList(""), resources, verbs);
    }
}
