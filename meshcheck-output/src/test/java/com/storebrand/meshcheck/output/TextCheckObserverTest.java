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


package com.storebrand.meshcheck.output;

import static org.junit.Assert.assertEquals;

import java.io.StringWriter;

import org.junit.Test;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckResult;

public class TextCheckObserverTest {
    private static final String HINT = "https://linkerd.io/2/checks/#k8s-api";

    @Test
    public void printsHeadingMarkersErrorsAndFatalLine() {
        // :: Arrange
        StringWriter out = new StringWriter();
        TextCheckObserver observer = new TextCheckObserver(out);

        // :: Act
        observer.observe(new CheckResult(CategoryId.KUBERNETES_API, "can initialize the client", null, HINT,
                false, false, true, null));
        observer.observe(new CheckResult(CategoryId.KUBERNETES_API, "can query the Kubernetes API", null, HINT,
                true, false, true, new IllegalStateException("waiting for check to complete")));
        observer.observe(new CheckResult(CategoryId.KUBERNETES_API, "can query the Kubernetes API", null, HINT,
                false, false, true, new IllegalStateException("connection refused")));
        observer.printSummary(false);

        // :: Assert
        assertEquals(lines(
                "kubernetes-api",
                "--------------",
                "√ can initialize the client",
                "… can query the Kubernetes API",
                "    waiting for check to complete",
                "    see " + HINT + " for hints",
                "× can query the Kubernetes API",
                "    connection refused",
                "    see " + HINT + " for hints",
                "    fatal error: subsequent checks were skipped",
                "",
                "Status check results are ×"), out.toString());
    }

    @Test
    public void separatesCategories_andPrintsSubsystemsWarningsAndVerboseLines() {
        // :: Arrange
        StringWriter out = new StringWriter();
        TextCheckObserver observer = new TextCheckObserver(out);

        // :: Act
        observer.observe(new CheckResult(CategoryId.PUBLIC_API, "can query the control plane API", "linkerd-api",
                "", false, false, true, null));
        observer.observe(new CheckResult(CategoryId.MULTICLUSTER, "remote cluster access credentials are valid",
                null, "", false, false, false, null));
        observer.observe(new CheckResult(CategoryId.MULTICLUSTER, "all gateways are alive\nall 2 gateways alive",
                null, "", false, false, false, null));
        observer.observe(new CheckResult(CategoryId.MULTICLUSTER, "multicluster extension proxies are healthy",
                null, "", false, true, false, new IllegalStateException("no daisy chains allowed")));
        observer.printSummary(true);

        // :: Assert
        assertEquals(lines(
                "linkerd-api",
                "-----------",
                "√ [linkerd-api] can query the control plane API",
                "",
                "linkerd-multicluster",
                "--------------------",
                "√ remote cluster access credentials are valid",
                "√ all gateways are alive",
                "    all 2 gateways alive",
                "‼ multicluster extension proxies are healthy",
                "    no daisy chains allowed",
                "",
                "Status check results are √"), out.toString());
    }

    /**
     * Joins the lines the way {@link java.io.PrintWriter#println()} ends them.
     */
    static String lines(String... lines) {
        StringBuilder buf = new StringBuilder();
        for (String line : lines) {
            buf.append(line).append(System.lineSeparator());
        }
        return buf.toString();
    }
}
