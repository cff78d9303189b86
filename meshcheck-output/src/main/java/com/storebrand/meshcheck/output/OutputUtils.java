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

import com.storebrand.meshcheck.output.CheckReportOutput.MeshCheckOutputException;

/**
 * Internal helpers for getting a {@link PrintWriter} out of any {@link Writer}.
 */
final class OutputUtils {

    private OutputUtils() {
        // Utility class - hiding constructor
    }

    static PrintWriter toPrintWriter(Writer out) {
        if (out instanceof PrintWriter) {
            return (PrintWriter) out;
        }
        return new PrintWriter(out);
    }

    /**
     * PrintWriter swallows IOExceptions, so we have to ask it.
     */
    static void flushAndVerify(PrintWriter printWriter, Writer out, String what) {
        printWriter.flush();
        if (printWriter.checkError()) {
            throw new MeshCheckOutputException("Unable to write " + what + " to output writer [" + out + "]");
        }
    }
}
