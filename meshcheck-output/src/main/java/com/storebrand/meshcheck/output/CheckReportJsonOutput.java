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

import com.storebrand.meshcheck.CheckReportDto;
import com.storebrand.meshcheck.serial.CheckReportJsonSerializer;

/**
 * Outputs a {@link CheckReportDto} as JSON.
 */
public class CheckReportJsonOutput implements CheckReportOutput {
    private static final CheckReportJsonSerializer SERIALIZER = new CheckReportJsonSerializer();

    @Override
    public void write(CheckReportDto dto, Writer out) {
        PrintWriter printWriter = OutputUtils.toPrintWriter(out); // NOPMD
        // Reason for NOPMD - the caller owns "out", and closes it.

        printWriter.write(SERIALIZER.serialize(dto));
        OutputUtils.flushAndVerify(printWriter, out, "check report as JSON");
    }
}
