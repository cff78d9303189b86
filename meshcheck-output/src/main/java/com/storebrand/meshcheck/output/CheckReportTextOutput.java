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
import java.time.Duration;

import com.storebrand.meshcheck.CheckReportDto;
import com.storebrand.meshcheck.CheckReportDto.CategoryDto;
import com.storebrand.meshcheck.CheckReportDto.CheckDto;

/**
 * Writes a collected {@link CheckReportDto} in the same format as {@link TextCheckObserver} streams it, followed by
 * the summary line and the duration of the run.
 */
public class CheckReportTextOutput implements CheckReportOutput {

    @Override
    public void write(CheckReportDto dto, Writer out) {
        PrintWriter printWriter = OutputUtils.toPrintWriter(out); // NOPMD
        // Reason for NOPMD - the caller owns "out", and closes it.
        printReport(dto, printWriter);
        OutputUtils.flushAndVerify(printWriter, out, "check report as text");
    }

    static void printReport(CheckReportDto dto, PrintWriter out) {
        for (int i = 0; i < dto.categories.size(); i++) {
            CategoryDto category = dto.categories.get(i);
            if (i > 0) {
                out.println();
            }
            TextCheckObserver.printHeading(out, category.categoryName);
            for (CheckDto check : category.checks) {
                TextCheckObserver.printCheck(out, marker(check), check.description, check.subsystem, check.error,
                        check.hint.orElse(""));
            }
        }
        // ?: Was the run stopped by a fatal check?
        if (dto.aborted) {
            // -> Yes, and that check is the last one in the report.
            out.println(TextCheckObserver.FATAL_LINE);
        }

        out.println();
        out.println(TextCheckObserver.summaryLine(dto.success));
        if (dto.startedAt != null && dto.completedAt != null) {
            out.println("Completed in " + DurationFormatter.format(Duration.between(dto.startedAt, dto.completedAt)));
        }
    }

    private static String marker(CheckDto check) {
        switch (check.result) {
            case SUCCESS:
                return TextCheckObserver.OK_MARKER;
            case WARNING:
                return TextCheckObserver.WARNING_MARKER;
            default:
                return TextCheckObserver.ERROR_MARKER;
        }
    }
}
