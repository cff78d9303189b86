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

import static com.storebrand.meshcheck.checks.IdentityChecksTest.assertFailure;
import static com.storebrand.meshcheck.checks.IdentityChecksTest.assertOk;
import static org.junit.Assert.assertThrows;

import java.time.Clock;

import org.junit.Test;

import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.DiscoveryContext.NotDiscoveredException;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ServerVersion;
import com.storebrand.meshcheck.test.TestCheckContext;

public class KubernetesVersionChecksTest {
    private final KubernetesVersionChecks _checks = new KubernetesVersionChecks();

    @Test
    public void newerOrEqualVersions_pass() {
        assertOk(_checks.minimumVersion(context("v1.21.0")));
        assertOk(_checks.minimumVersion(context("v1.21.3")));
        assertOk(_checks.minimumVersion(context("v1.28.3-eks-4f4795d")));
        assertOk(_checks.minimumVersion(context("v2.0.0")));
    }

    @Test
    public void olderVersion_fails() {
        assertFailure("Kubernetes is on version [v1.20.15], but version [1.21.0] or more recent is required",
                _checks.minimumVersion(context("v1.20.15")));
    }

    @Test
    public void versionNotDiscovered_throws() {
        CheckContext context = new TestCheckContext(Clock.systemUTC());

        assertThrows(NotDiscoveredException.class, () -> _checks.minimumVersion(context));
    }

    private static CheckContext context(String gitVersion) {
        TestCheckContext context = new TestCheckContext(HealthCheckOptions.defaults(), Clock.systemUTC());
        context.getDiscovery().cluster().setServerVersion(new ServerVersion(gitVersion));
        return context;
    }
}
