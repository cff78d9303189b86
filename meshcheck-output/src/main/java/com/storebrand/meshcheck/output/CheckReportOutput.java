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
import java.io.StringWriter;
import java.io.Writer;

import com.storebrand.meshcheck.CheckReportDto;

/**
 * Writes a collected {@link CheckReportDto} in a machine- or human-readable format.
 */
public interface CheckReportOutput {

    /**
     * Write the report to the {@link Writer}. The writer is not closed.
     *
     * @throws MeshCheckOutputException
     *         if the writer reports an error.
     */
    void write(CheckReportDto dto, Writer out);

    default String writeToString(CheckReportDto dto) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            write(dto, pw);
        }
        return sw.toString();
    }

    class MeshCheckOutputException extends RuntimeException {
        public MeshCheckOutputException(String message) {
            super(message);
        }
    }
}
