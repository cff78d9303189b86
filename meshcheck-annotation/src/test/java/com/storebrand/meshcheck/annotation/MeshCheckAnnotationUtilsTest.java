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


package com.storebrand.meshcheck.annotation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.lang.reflect.Method;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.HealthChecker;
import com.storebrand.meshcheck.annotation.testclasses.InvalidMeshChecks;
import com.storebrand.meshcheck.annotation.testclasses.PaymentMeshChecks;
import com.storebrand.meshcheck.test.CheckResultAssertions;
import com.storebrand.meshcheck.test.RecordingCheckObserver;

public class MeshCheckAnnotationUtilsTest {
    private static final CategoryId PAYMENTS = CategoryId.of("payments");

    @Test
    public void validatesMethodSignatures() throws NoSuchMethodException {
        assertTrue(MeshCheckAnnotationUtils.isValidMeshCheckMethod(
                PaymentMeshChecks.class.getMethod("paymentServiceIsMeshed", CheckContext.class)));
        assertFalse(MeshCheckAnnotationUtils.isValidMeshCheckMethod(
                InvalidMeshChecks.class.getMethod("returnsNothing", CheckContext.class)));
        assertFalse(MeshCheckAnnotationUtils.isValidMeshCheckMethod(
                PaymentMeshChecks.class.getMethod("notACheck")));

        assertThrows(IllegalArgumentException.class, () -> MeshCheckAnnotationUtils.getAnnotation(
                InvalidMeshChecks.class.getMethod("returnsNothing", CheckContext.class)));
        assertThrows(IllegalStateException.class, () -> MeshCheckAnnotationUtils.getAnnotation(
                InvalidMeshChecks.class.getMethod("hasNoCategory", CheckContext.class)));
        assertThrows(IllegalStateException.class, () -> MeshCheckAnnotationUtils.getAnnotation(
                PaymentMeshChecks.class.getMethod("notACheck")));
    }

    @Test
    public void registeredMethodsRunAsPartOfTheCheckerRun() throws NoSuchMethodException {
        // :: Arrange
        HealthChecker checker = newChecker();
        MeshCheckAnnotationUtils.registerAnnotatedMethod(
                PaymentMeshChecks.class.getMethod("paymentServiceIsMeshed", CheckContext.class),
                checker, new SimpleInstanceResolver());
        MeshCheckAnnotationUtils.registerAnnotatedMethod(
                PaymentMeshChecks.class.getMethod("paymentGatewayAnswers", CheckContext.class),
                checker, new SimpleInstanceResolver());
        RecordingCheckObserver observer = new RecordingCheckObserver();

        // :: Act
        boolean success;
        try {
            success = checker.run(observer);
        }
        finally {
            checker.close();
        }

        // :: Assert
        assertFalse(success);
        assertEquals(Arrays.asList("payment service is meshed\npayments in linkerd", "payment gateway answers"),
                observer.getDescriptions());
        CheckResultAssertions.assertThat(observer.requireLastResult("payment service"))
                .isSuccess()
                .isInCategory(PAYMENTS);
        CheckResultAssertions.assertThat(observer.requireLastResult("payment gateway"))
                .isError()
                .hasErrorMessage("gateway timed out");
        // The method's own exception, not the reflection wrapper.
        Throwable cause = observer.requireLastResult("payment gateway").getError().get().getCause();
        assertTrue(String.valueOf(cause), cause instanceof IllegalStateException);
    }

    @Test
    public void multipleInstancesAreNumbered() throws NoSuchMethodException {
        // :: Arrange
        HealthChecker checker = newChecker();
        MeshCheckInstanceResolver twoInstances = new MeshCheckInstanceResolver() {
            @Override
            @SuppressWarnings("unchecked")
            public <T> Collection<T> getInstancesFor(Class<T> clazz) {
                return (Collection<T>) Arrays.asList(new PaymentMeshChecks("east"), new PaymentMeshChecks("west"));
            }
        };

        // :: Act
        List<String> descriptions = MeshCheckAnnotationUtils.registerAnnotatedMethod(
                PaymentMeshChecks.class.getMethod("paymentServiceIsMeshed", CheckContext.class),
                checker, twoInstances);
        RecordingCheckObserver observer = new RecordingCheckObserver();
        try {
            checker.run(observer);
        }
        finally {
            checker.close();
        }

        // :: Assert
        assertEquals(Arrays.asList("payment service is meshed#1", "payment service is meshed#2"), descriptions);
        assertEquals(Arrays.asList("payment service is meshed#1\neast in linkerd",
                "payment service is meshed#2\nwest in linkerd"), observer.getDescriptions());
        assertEquals("https://linkerd.io/2/checks/#payments-meshed", observer.getResults().get(0).getHintUrl());
    }

    @Test
    public void combinedResolverUsesFirstResolverWithInstances() {
        MeshCheckInstanceResolver none = new MeshCheckInstanceResolver() {
            @Override
            public <T> Collection<T> getInstancesFor(Class<T> clazz) {
                return Collections.emptyList();
            }
        };

        assertEquals(1, CombinedInstanceResolver.of(none, new SimpleInstanceResolver())
                .getInstancesFor(PaymentMeshChecks.class).size());
        assertThrows(IllegalStateException.class,
                () -> CombinedInstanceResolver.of(none).getInstancesFor(PaymentMeshChecks.class));
    }

    @Test
    public void simpleResolverNeedsNoArgConstructor() {
        assertThrows(IllegalStateException.class,
                () -> new SimpleInstanceResolver().getInstancesFor(Integer.class));
    }

    private static HealthChecker newChecker() {
        return new HealthChecker(Collections.emptyList(), Collections.emptyList(), HealthCheckOptions.defaults(),
                Clock.fixed(Instant.parse("2026-10-17T10:00:00Z"), ZoneOffset.UTC));
    }
}
