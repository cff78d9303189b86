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

import static com.storebrand.meshcheck.output.TextCheckObserverTest.lines;
import static org.junit.Assert.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Optional;

import org.junit.Test;

import com.storebrand.meshcheck.CheckReportDto;
import com.storebrand.meshcheck.CheckReportDto.CategoryDto;
import com.storebrand.meshcheck.CheckReportDto.CheckDto;
import com.storebrand.meshcheck.CheckReportDto.CheckResultDto;

public class CheckReportTextOutputTest {

    @Test
    public void writesReportInTheStreamingFormat() {
        // :: Arrange
        CheckReportDto dto = new CheckReportDto();
        dto.success = false;
        dto.aborted = true;
        dto.startedAt = Instant.parse("2026-10-17T10:00:00Z");
        dto.completedAt = Instant.parse("2026-10-17T10:01:02.345Z");
        CategoryDto category = new CategoryDto();
        category.categoryName = "linkerd-identity";
        category.checks = new ArrayList<>();
        category.checks.add(check("certificate config is valid", CheckResultDto.SUCCESS, null));
        category.checks.add(check("trust anchors are within their validity period", CheckResultDto.ERROR,
                "Invalid anchors:\n    * 1 identity.linkerd.cluster.local not valid anymore"));
        dto.categories = Collections.singletonList(category);

        // :: Act
        String text = new CheckReportTextOutput().writeToString(dto);

        // :: Assert
        assertEquals(lines(
                "linkerd-identity",
                "----------------",
                "√ certificate config is valid",
                "× trust anchors are within their validity period",
                "    Invalid anchors:\n    * 1 identity.linkerd.cluster.local not valid anymore",
                "    see https://linkerd.io/2/checks/#l5d-identity-trustAnchors-are-time-valid for hints",
                "    fatal error: subsequent checks were skipped",
                "",
                "Status check results are ×",
                "Completed in 1m 2.345s"), text);
    }

    @Test
    public void durationFormatting() {
        assertEquals("0.250s", DurationFormatter.format(Duration.ofMillis(250)));
        assertEquals("12.000s", DurationFormatter.format(Duration.ofSeconds(12)));
        assertEquals("61m 1.001s", DurationFormatter.format(Duration.ofSeconds(3661).plusMillis(1)));
    }

    private static CheckDto check(String description, CheckResultDto result, String error) {
        CheckDto check = new CheckDto();
        check.description = description;
        check.result = result;
        check.error = Optional.ofNullable(error);
        check.hint = error == null
                ? Optional.empty()
                : Optional.of("https://linkerd.io/2/checks/#l5d-identity-trustAnchors-are-time-valid");
        return check;
    }
}
