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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.CheckRegistry;

/**
 * Marks a method as an extra check that runs as part of a mesh health check run, after the standard categories.
 * <p>
 * A method using this annotation MUST take exactly one argument of type {@link CheckContext}, and return a
 * {@link CheckOutcome}. The context gives access to the collaborators discovered by the standard checks, such as the
 * cluster client and the control plane configuration.
 * <p>
 * Example:
 * <pre>
 * public class PaymentMeshChecks {
 *     &#064;MeshCheck(category = &quot;payments&quot;, description = &quot;payment service is meshed&quot;)
 *     public CheckOutcome paymentServiceIsMeshed(CheckContext context) {
 *         ClusterClient client = context.getDiscovery().cluster().requireClient();
 *         return client.listPods(&quot;payments&quot;, null).stream().allMatch(this::hasProxy)
 *                 ? CheckOutcome.ok()
 *                 : CheckOutcome.fail(&quot;some payment pods run without a proxy&quot;);
 *     }
 * }
 * </pre>
 * Checks with the same {@link #category()} are grouped together, in registration order. Annotated methods are
 * registered through {@link CheckRegistry#addCheck}, so they are neither fatal nor warnings. Throwing from the method
 * is reported as a failure of the check.
 * <p>
 * Use "com.storebrand.meshcheck:meshcheck-spring" to have these picked up from Spring beans automatically.
 */
// Allow scanning for this annotation on runtime
@Retention(RetentionPolicy.RUNTIME)
// Use in method only
@Target(ElementType.METHOD)
public @interface MeshCheck {
    /**
     * The category this check is reported under, see {@link CategoryId#of(String)}. E.g. "payments".
     */
    String category();

    /**
     * The line shown to the operator, e.g. "payment service is meshed".
     */
    String description();

    /**
     * Anchor appended to the hint base url when this check fails. No hint is shown if empty.
     */
    String hintAnchor() default "";
}
