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


package com.storebrand.meshcheck.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import org.junit.Test;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckResult;
import com.storebrand.meshcheck.cluster.ControlPlaneConfig;
import com.storebrand.meshcheck.cluster.ControlPlaneConfigException;
import com.storebrand.meshcheck.rpc.RpcException;
import com.storebrand.meshcheck.rpc.SelfCheckResult;

/**
 * Test that the fakes and assertions behave as the core tests expect.
 */
public class MeshCheckTestSupportTest {

    @Test
    public void publicApiClient_handsOutScriptedResponses_andRepeatsTheLast() {
        // :: Arrange
        FakePublicApiClient client = new FakePublicApiClient()
                .thenSelfCheckFails(new RpcException("unavailable"))
                .thenSelfCheck(SelfCheckResult.ok("api", "can query"));

        // :: Act / Assert
        assertThrows(RpcException.class, () -> client.selfCheck(Duration.ofSeconds(1)));
        assertEquals(1, client.selfCheck(Duration.ofSeconds(1)).size());
        assertEquals(1, client.selfCheck(Duration.ofSeconds(1)).size());
        assertEquals(3, client.getSelfCheckCalls());
    }

    @Test
    public void configFetcher_failsForUnknownNamespace() {
        FakeClusterClient client = new FakeClusterClient()
                .withControlPlaneConfig("linkerd", ControlPlaneConfig.builder().build());

        assertEquals("linkerd", MeshCheckFakes.configFetcher().fetch(client, "linkerd").getNamespace());
        assertThrows(ControlPlaneConfigException.class,
                () -> MeshCheckFakes.configFetcher().fetch(client, "other"));
    }

    @Test
    public void failingClient_throwsFromEveryCall() {
        FakeClusterClient client = new FakeClusterClient()
                .failingWith(new IllegalStateException("connection refused"));

        assertThrows(IllegalStateException.class, client::getServerVersion);
        assertThrows(IllegalStateException.class, () -> client.listSecrets(null, null));
    }

    @Test
    public void adjustableClock() {
        AdjustableClock clock = new AdjustableClock(Instant.parse("2026-01-01T00:00:00Z"));

        clock.advance(Duration.ofMinutes(90));

        assertEquals(Instant.parse("2026-01-01T01:30:00Z"), clock.instant());
    }

    @Test
    public void assertions_reportMismatches() {
        // :: Arrange
        CheckResult error = new CheckResult(CategoryId.IDENTITY, "issuer cert is within its validity period", null,
                "", false, false, true, new IllegalStateException("issuer certificate is not valid anymore"));
        RecordingCheckObserver observer = new RecordingCheckObserver();
        observer.observe(error);

        // :: Act / Assert
        CheckResultAssertions.assertThat(observer.requireLastResult("issuer cert"))
                .isFinal()
                .isFatal()
                .isInCategory(CategoryId.IDENTITY)
                .hasErrorContaining("not valid anymore");
        assertThrows(AssertionError.class, () -> CheckResultAssertions.assertThat(error).isSuccess());
        assertThrows(AssertionError.class, () -> observer.requireLastResult("trust anchors"));
        assertEquals(Collections.singletonList(error), observer.getFinalResults());
        assertTrue(observer.getRetryResults().isEmpty());
    }
}
