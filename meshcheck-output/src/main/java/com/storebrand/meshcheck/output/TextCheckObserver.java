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

import java.io.PrintWriter;
import java.io.Writer;
import java.util.Optional;

import com.storebrand.meshcheck.CheckObserver;
import com.storebrand.meshcheck.CheckResult;
import com.storebrand.meshcheck.ErrorMessages;

/**
 * Streams check results as human readable lines while the run is going on:
 * <pre>
 * linkerd-identity
 * ----------------
 * √ certificate config is valid
 * × issuer cert is within its validity period
 *     issuer certificate is not valid anymore. Expired on 2026-10-16T13:19:42Z
 *     see https://linkerd.io/2/checks/#l5d-identity-issuer-cert-is-time-valid for hints
 * </pre>
 * Headings are printed whenever the category changes. Call {@link #printSummary(boolean)} with the outcome of the run
 * when it is done.
 */
public class TextCheckObserver implements CheckObserver {
    static final String OK_MARKER = "√";
    static final String WARNING_MARKER = "‼";
    static final String ERROR_MARKER = "×";
    static final String RETRY_MARKER = "…";

    static final String FATAL_LINE = ErrorMessages.INDENT + "fatal error: subsequent checks were skipped";

    private final Writer _out;
    private final PrintWriter _printWriter;
    private String _currentCategory;

    public TextCheckObserver(Writer out) {
        _out = out;
        _printWriter = OutputUtils.toPrintWriter(out);
    }

    @Override
    public synchronized void observe(CheckResult result) {
        String category = result.getCategory().getName();
        // ?: New category?
        if (!category.equals(_currentCategory)) {
            // -> Yes, blank line between categories, then the heading.
            if (_currentCategory != null) {
                _printWriter.println();
            }
            printHeading(_printWriter, category);
            _currentCategory = category;
        }

        String marker;
        if (result.isRetry()) {
            marker = RETRY_MARKER;
        }
        else if (result.isSuccess()) {
            marker = OK_MARKER;
        }
        else {
            marker = result.isWarning() ? WARNING_MARKER : ERROR_MARKER;
        }
        printCheck(_printWriter, marker, result.getDescription(), result.getSubsystem(),
                result.getError().map(TextCheckObserver::errorMessage), result.getHintUrl());

        // ?: Did a fatal check just give up?
        if (result.isFatal() && !result.isSuccess() && !result.isRetry()) {
            // -> Yes, nothing more is coming in this run.
            _printWriter.println(FATAL_LINE);
        }
        OutputUtils.flushAndVerify(_printWriter, _out, "check result");
    }

    /**
     * Prints the closing line of a run.
     */
    public synchronized void printSummary(boolean success) {
        _printWriter.println();
        _printWriter.println(summaryLine(success));
        OutputUtils.flushAndVerify(_printWriter, _out, "summary");
    }

    // ===== Helpers ====================================================================

    static String summaryLine(boolean success) {
        return "Status check results are " + (success ? OK_MARKER : ERROR_MARKER);
    }

    static void printHeading(PrintWriter out, String category) {
        out.println(category);
        StringBuilder underline = new StringBuilder();
        for (int i = 0; i < category.length(); i++) {
            underline.append('-');
        }
        out.println(underline);
    }

    /**
     * Prints one check line. Extra description lines, the error and the hint are indented below it. The hint is only
     * printed when there is an error.
     */
    static void printCheck(PrintWriter out, String marker, String description, Optional<String> subsystem,
            Optional<String> error, String hintUrl) {
        String[] descriptionLines = description.split("\n");
        out.println(marker + " " + subsystem.map(s -> "[" + s + "] ").orElse("") + descriptionLines[0]);
        for (int i = 1; i < descriptionLines.length; i++) {
            out.println(ErrorMessages.INDENT + descriptionLines[i]);
        }
        if (error.isPresent()) {
            out.println(ErrorMessages.INDENT + error.get());
            if (hintUrl != null && !hintUrl.isEmpty()) {
                out.println(ErrorMessages.INDENT + "see " + hintUrl + " for hints");
            }
        }
    }

    static String errorMessage(Throwable error) {
        return error.getMessage() != null
                ? error.getMessage()
                : error.getClass().getSimpleName();
    }
}
