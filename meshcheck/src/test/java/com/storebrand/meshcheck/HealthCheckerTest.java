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


package com.storebrand.meshcheck;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.storebrand.meshcheck.cluster.ServerVersion;
import com.storebrand.meshcheck.test.AdjustableClock;
import com.storebrand.meshcheck.test.CheckResultAssertions;
import com.storebrand.meshcheck.test.FakeClusterClient;
import com.storebrand.meshcheck.test.RecordingCheckObserver;

/**
 * Tests for the {@link HealthChecker}: ordering, fatal and warning semantics, skips and added checks.
 */
public class HealthCheckerTest {
    private static final CategoryId A = CategoryId.of("category-a");
    private static final CategoryId B = CategoryId.of("category-b");
    private static final CategoryId C = CategoryId.of("category-c");

    private final AdjustableClock _clock = new AdjustableClock(Instant.parse("2026-01-01T12:00:00Z"));
    private final HealthCheckOptions _options = HealthCheckOptions.builder()
            .requestTimeout(Duration.ofSeconds(5))
            .retryWaitWindow(Duration.ofMillis(1))
            .build();

    @Test
    public void runsCategoriesAndChecksInOrder_andTheSameOrderOnTheNextRun() {
        // :: Arrange
        Category a = Category.of(A, ok("a1"), ok("a2"));
        Category b = Category.of(B, ok("b1"));
        Category c = Category.of(C, ok("c1"), ok("c2"));
        RecordingCheckObserver first = new RecordingCheckObserver();
        RecordingCheckObserver second = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a, b, c)) {
            // :: Act
            boolean firstSuccess = checker.run(first);
            boolean secondSuccess = checker.run(second);

            // :: Assert
            assertTrue(firstSuccess);
            assertTrue(secondSuccess);
            assertEquals(Arrays.asList("a1", "a2", "b1", "c1", "c2"), first.getDescriptions());
            assertEquals(first.getDescriptions(), second.getDescriptions());
            assertEquals(Arrays.asList(A, A, B, C, C), categoriesOf(first));
        }
    }

    @Test
    public void fatalFailure_stopsTheRun() {
        // :: Arrange
        Category a = Category.of(A, ok("a1"));
        Category b = Category.of(B, Checker.builder("b1").fatal().check(ctx -> CheckOutcome.fail("broken")),
                ok("b2"));
        Category c = Category.of(C, ok("c1"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a, b, c)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertFalse(success);
            assertEquals(Arrays.asList("a1", "b1"), observer.getDescriptions());
            CheckResultAssertions.assertThat(observer.requireLastResult("b1"))
                    .isFinal()
                    .isFatal()
                    .isInCategory(B)
                    .hasErrorMessage("broken");
        }
    }

    @Test
    public void warningFailure_isReportedButDoesNotFailTheRun() {
        // :: Arrange
        Category a = Category.of(A, ok("a1"));
        Category b = Category.of(B, Checker.builder("b1").warning().check(ctx -> CheckOutcome.fail("degraded")));
        Category c = Category.of(C, ok("c1"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a, b, c)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertTrue(success);
            assertEquals(Arrays.asList("a1", "b1", "c1"), observer.getDescriptions());
            CheckResultAssertions.assertThat(observer.requireLastResult("b1"))
                    .isWarning()
                    .hasErrorMessage("degraded");
        }
    }

    @Test
    public void fatalWarning_stopsTheRunButKeepsSuccess() {
        // :: Arrange
        Category a = Category.of(A, Checker.builder("a1").fatal().warning()
                .check(ctx -> CheckOutcome.fail("degraded")));
        Category b = Category.of(B, ok("b1"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a, b)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertTrue(success);
            assertEquals(Collections.singletonList("a1"), observer.getDescriptions());
        }
    }

    @Test
    public void ordinaryFailure_failsTheRunButContinues() {
        // :: Arrange
        Category a = Category.of(A, Checker.builder("a1").check(ctx -> CheckOutcome.fail("wrong")), ok("a2"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertFalse(success);
            assertEquals(Arrays.asList("a1", "a2"), observer.getDescriptions());
        }
    }

    @Test
    public void skippedCheck_isNeverReported_regardlessOfFlags() {
        // :: Arrange
        Category a = Category.of(A,
                Checker.builder("fatal skip").fatal().check(ctx -> CheckOutcome.skip("not applicable")),
                Checker.builder("warning skip").warning().check(ctx -> CheckOutcome.skip("not applicable")),
                Checker.builder("retry skip").retryDeadline(_clock.instant().plusSeconds(60))
                        .check(ctx -> CheckOutcome.skip("not applicable")),
                ok("a4"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertTrue(success);
            assertEquals(Collections.singletonList("a4"), observer.getDescriptions());
        }
    }

    @Test
    public void disabledCategories_doNotRun() {
        // :: Arrange
        Category a = Category.of(A, ok("a1"));
        Category b = Category.of(B, Checker.builder("b1").fatal().check(ctx -> CheckOutcome.fail("broken")));
        Category c = Category.of(C, ok("c1"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = new HealthChecker(Arrays.asList(a, b, c), Arrays.asList(A, C), _options,
                _clock)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertTrue(success);
            assertEquals(Arrays.asList("a1", "c1"), observer.getDescriptions());
        }
    }

    @Test
    public void addedChecks_runAfterStandardCategories_groupedByCategory() {
        // :: Arrange
        CategoryId extra = CategoryId.of("extra");
        CategoryId other = CategoryId.of("other");
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(Category.of(A, ok("a1")))) {
            checker.addCheck(extra, "extra1", "", ctx -> CheckOutcome.ok());
            checker.addCheck(other, "other1", "other-anchor", ctx -> CheckOutcome.ok());
            checker.addCheck(extra, "extra2", "", ctx -> CheckOutcome.fail("extra broken"));

            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertFalse(success);
            assertEquals(Arrays.asList("a1", "extra1", "extra2", "other1"), observer.getDescriptions());
            assertEquals("https://linkerd.io/2/checks/#other-anchor",
                    observer.requireLastResult("other1").getHintUrl());
            assertEquals("", observer.requireLastResult("extra1").getHintUrl());
        }
    }

    @Test
    public void addedCategory_withSameIdAsAnAddedOne_isMerged() {
        // :: Arrange
        CategoryId extra = CategoryId.of("extra");
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(Category.of(A, ok("a1")))) {
            checker.addCheck(extra, "extra1", "", ctx -> CheckOutcome.ok());
            checker.addCategory(Category.of(extra, ok("extra2")));
            checker.addCategory(Category.of(B, ok("b1")));

            // :: Act
            checker.run(observer);

            // :: Assert
            assertEquals(3, checker.categoriesToRun().size());
            assertEquals(Arrays.asList("a1", "extra1", "extra2", "b1"), observer.getDescriptions());
        }
    }

    @Test
    public void thrownException_isReportedAsCategoryError() {
        // :: Arrange
        Category a = Category.of(A, Checker.builder("a1").check(ctx -> {
            throw new IllegalStateException("boom");
        }));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertFalse(success);
            Throwable error = observer.requireLastResult("a1").getError().orElseThrow(AssertionError::new);
            assertTrue(CategoryException.isCategoryError(error, A));
            assertFalse(CategoryException.isCategoryError(error, B));
            assertEquals("boom", error.getMessage());
            assertTrue(error.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void attemptExceedingRequestTimeout_failsWithTimeout() {
        // :: Arrange
        HealthCheckOptions options = HealthCheckOptions.builder(_options)
                .requestTimeout(Duration.ofMillis(100))
                .build();
        Category a = Category.of(A, Checker.builder("slow").check(ctx -> {
            Thread.sleep(10_000);
            return CheckOutcome.ok();
        }), ok("a2"));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = new HealthChecker(Collections.singletonList(a), Collections.singletonList(A),
                options, _clock)) {
            // :: Act
            long start = System.currentTimeMillis();
            boolean success = checker.run(observer);
            long elapsed = System.currentTimeMillis() - start;

            // :: Assert
            assertFalse(success);
            assertTrue("Run should not wait for the slow check, took " + elapsed + " ms", elapsed < 5_000);
            Throwable error = observer.requireLastResult("slow").getError().orElseThrow(AssertionError::new);
            assertTrue(error.getCause() instanceof CheckTimeoutException);
            CheckResultAssertions.assertThat(observer.requireLastResult("a2")).isSuccess();
        }
    }

    @Test
    public void verboseSuccess_appendsMessageToDescription() {
        // :: Arrange
        Category a = Category.of(A, Checker.builder("gateways").check(ctx -> CheckOutcome.okVerbose("all alive")));
        RecordingCheckObserver observer = new RecordingCheckObserver();

        try (HealthChecker checker = healthChecker(a)) {
            // :: Act
            boolean success = checker.run(observer);

            // :: Assert
            assertTrue(success);
            CheckResultAssertions.assertThat(observer.requireLastResult("gateways"))
                    .isSuccess()
                    .hasDescription("gateways\nall alive");
        }
    }

    @Test
    public void eachRun_getsAFreshDiscoveryContext() {
        // :: Arrange
        Category a = Category.of(A, Checker.builder("discover").check(ctx -> {
            // ?: Has something already been discovered in this run?
            if (ctx.getDiscovery().multicluster().isSourceCluster()) {
                return CheckOutcome.fail("discovery leaked from an earlier run");
            }
            ctx.getDiscovery().multicluster().setSourceCluster(true);
            return CheckOutcome.ok();
        }));

        try (HealthChecker checker = healthChecker(a)) {
            // :: Act
            boolean first = checker.run(new RecordingCheckObserver());
            DiscoveryContext firstDiscovery = checker.getDiscovery().orElseThrow(AssertionError::new);
            boolean second = checker.run(new RecordingCheckObserver());

            // :: Assert
            assertTrue(first);
            assertTrue(second);
            assertNotSame(firstDiscovery, checker.getDiscovery().orElseThrow(AssertionError::new));
            assertTrue(firstDiscovery.multicluster().isSourceCluster());
        }
    }

    @Test
    public void closedCheckerCanNotRunAgain() {
        HealthChecker checker = healthChecker(Category.of(A, ok("a1")));
        assertTrue(checker.run(new RecordingCheckObserver()));

        checker.close();

        assertTrue(checker.isClosed());
        assertThrows(IllegalStateException.class, () -> checker.run(new RecordingCheckObserver()));
    }

    @Test
    public void clientOfEachRun_isClosed() {
        // :: Arrange
        List<FakeClusterClient> clients = new ArrayList<>();
        Category a = Category.of(A, Checker.builder("connect").check(ctx -> {
            FakeClusterClient client = new FakeClusterClient();
            clients.add(client);
            ctx.getDiscovery().cluster().setClient(client);
            return CheckOutcome.ok();
        }));
        HealthChecker checker = healthChecker(a);

        // :: Act
        checker.run(new RecordingCheckObserver());
        checker.run(new RecordingCheckObserver());
        boolean firstClosedBySecondRun = clients.get(0).isClosed();
        boolean secondClosedBeforeClose = clients.get(1).isClosed();
        checker.close();

        // :: Assert
        assertEquals(2, clients.size());
        assertTrue(firstClosedBySecondRun);
        assertFalse(secondClosedBeforeClose);
        assertTrue(clients.get(1).isClosed());
    }

    @Test
    public void abandonedAttempt_canNotWriteDiscoveryAfterTimingOut() throws InterruptedException {
        // :: Arrange
        HealthCheckOptions options = HealthCheckOptions.builder(_options)
                .requestTimeout(Duration.ofMillis(50))
                .build();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch written = new CountDownLatch(1);
        Category a = Category.of(A, Checker.builder("stubborn").check(ctx -> {
            awaitIgnoringInterrupts(release);
            ctx.getDiscovery().cluster().setServerVersion(new ServerVersion("v9.9.9"));
            written.countDown();
            return CheckOutcome.ok();
        }));

        try (HealthChecker checker = new HealthChecker(Collections.singletonList(a), Collections.singletonList(A),
                options, _clock)) {
            // :: Act
            boolean success = checker.run(new RecordingCheckObserver());
            release.countDown();
            assertTrue(written.await(5, TimeUnit.SECONDS));

            // :: Assert
            assertFalse(success);
            DiscoveryContext discovery = checker.getDiscovery().orElseThrow(AssertionError::new);
            assertFalse(discovery.cluster().getServerVersion().isPresent());
        }
    }

    // ===== Helpers ===================================================================================================

    private HealthChecker healthChecker(Category... categories) {
        List<CategoryId> enabled = new ArrayList<>();
        for (Category category : categories) {
            enabled.add(category.getId());
        }
        return new HealthChecker(Arrays.asList(categories), enabled, _options, _clock);
    }

    private static Checker ok(String description) {
        return Checker.builder(description).check(ctx -> CheckOutcome.ok());
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        while (true) {
            try {
                latch.await();
                return;
            }
            catch (InterruptedException e) {
                // Keep waiting, like a body blocked in a call that does not honour interrupts.
            }
        }
    }

    private static List<CategoryId> categoriesOf(RecordingCheckObserver observer) {
        List<CategoryId> categories = new ArrayList<>();
        observer.getResults().forEach(result -> categories.add(result.getCategory()));
        return categories;
    }
}
