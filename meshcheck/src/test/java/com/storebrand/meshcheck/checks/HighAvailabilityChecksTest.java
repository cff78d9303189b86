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
import static org.junit.Assert.assertTrue;

import java.time.Clock;

import org.junit.Test;

import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.Deployment;
import com.storebrand.meshcheck.test.FakeClusterClient;
import com.storebrand.meshcheck.test.TestCheckContext;

public class HighAvailabilityChecksTest {
    private final FakeClusterClient _client = new FakeClusterClient();
    private final HighAvailabilityChecks _checks = new HighAvailabilityChecks();

    @Test
    public void nonHaInstall_isSkipped() {
        assertTrue(_checks.multipleReplicas(context(false)).isSkip());
    }

    @Test
    public void haInstall_withReplicas() {
        withDeployment("destination", 3);
        withDeployment("identity", 2);
        withDeployment("proxy-injector", 2);

        assertOk(_checks.multipleReplicas(context(true)));
    }

    @Test
    public void haInstall_listsUnderProvisionedComponents() {
        withDeployment("destination", 3);
        withDeployment("identity", 1);

        assertFailure("not enough replicas available for [linkerd-identity, linkerd-proxy-injector]",
                _checks.multipleReplicas(context(true)));
    }

    private void withDeployment(String component, int available) {
        _client.withDeployment(new Deployment("linkerd-" + component, "linkerd", null, 3, available));
    }

    private CheckContext context(boolean highAvailability) {
        TestCheckContext context = new TestCheckContext(Clock.systemUTC());
        context.getDiscovery().cluster().setClient(_client);
        context.getDiscovery().cluster().setControlPlaneConfig(ControlPlaneConfig.builder()
                .highAvailability(highAvailability)
                .build());
        return context;
    }
}
