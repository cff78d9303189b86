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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.Clock;

import org.junit.Test;

import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.DaemonSet;
import com.storebrand.meshcheck.test.FakeClusterClient;
import com.storebrand.meshcheck.test.TestCheckContext;

public class CniPluginChecksTest {
    private final FakeClusterClient _client = new FakeClusterClient();
    private final CniPluginChecks _checks = new CniPluginChecks();

    @Test
    public void withoutCni_bothChecksSkip() {
        CheckContext context = context(false, ControlPlaneConfig.builder().build());

        CheckOutcome exists = _checks.daemonSetExists(context);
        CheckOutcome running = _checks.podsRunning(context);

        assertTrue(exists.isSkip());
        assertTrue(running.isSkip());
        assertEquals(CniPluginChecks.NOT_USING_CNI, exists.getMessage().orElse(null));
    }

    @Test
    public void cniEnabledInConfig_requiresTheDaemonSet() {
        CheckContext context = context(false, ControlPlaneConfig.builder().cniEnabled(true).build());

        assertFailure("DaemonSet linkerd-cni does not exist in namespace linkerd-cni",
                _checks.daemonSetExists(context));
    }

    @Test
    public void cniEnabledByOption_withHealthyDaemonSet() {
        // :: Arrange
        CheckContext context = context(true, null);
        _client.withDaemonSet(new DaemonSet(CniPluginChecks.CNI_DAEMON_SET, "linkerd-cni", 3, 3, 3));

        // :: Act / Assert
        assertOk(_checks.daemonSetExists(context));
        assertOk(_checks.podsRunning(context));
    }

    @Test
    public void notAllScheduled_orNotAllReady_fails() {
        CheckContext context = context(true, null);

        _client.withDaemonSet(new DaemonSet(CniPluginChecks.CNI_DAEMON_SET, "linkerd-cni", 3, 2, 2));
        assertFailure("desired: 3, scheduled: 2", _checks.podsRunning(context));

        _client.withDaemonSet(new DaemonSet(CniPluginChecks.CNI_DAEMON_SET, "linkerd-cni", 3, 3, 1));
        assertFailure("number ready: 1, number scheduled: 3", _checks.podsRunning(context));
    }

    private CheckContext context(boolean cniOption, ControlPlaneConfig config) {
        TestCheckContext context = new TestCheckContext(HealthCheckOptions.builder().cniEnabled(cniOption).build(),
                Clock.systemUTC());
        context.getDiscovery().cluster().setClient(_client);
        if (config != null) {
            context.getDiscovery().cluster().setControlPlaneConfig(config);
        }
        return context;
    }
}
