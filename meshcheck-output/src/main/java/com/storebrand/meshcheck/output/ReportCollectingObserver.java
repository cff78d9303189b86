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

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.storebrand.meshcheck.CheckObserver;
import com.storebrand.meshcheck.CheckReportDto;
import com.storebrand.meshcheck.CheckReportDto.CategoryDto;
import com.storebrand.meshcheck.CheckReportDto.CheckDto;
import com.storebrand.meshcheck.CheckReportDto.CheckResultDto;
import com.storebrand.meshcheck.CheckResult;

/**
 * Collects the final results of a run into a {@link CheckReportDto}. Retry results are ignored. Use one instance per
 * run.
 */
public class ReportCollectingObserver implements CheckObserver {
    private final Clock _clock;
    private final CheckReportDto _report = new CheckReportDto();
    private final Map<String, CategoryDto> _categories = new LinkedHashMap<>();

    public ReportCollectingObserver(Clock clock) {
        _clock = clock;
        _report.version = CheckReportDto.CHECK_REPORT_DTO_VERSION;
        _report.success = true;
        _report.startedAt = clock.instant();
    }

    @Override
    public synchronized void observe(CheckResult result) {
        if (result.isRetry()) {
            return;
        }

        CheckDto check = new CheckDto();
        check.description = result.getDescription();
        check.subsystem = result.getSubsystem();
        check.hint = result.isSuccess() || result.getHintUrl().isEmpty()
                ? Optional.empty()
                : Optional.of(result.getHintUrl());
        check.error = result.getError().map(TextCheckObserver::errorMessage);
        if (result.isSuccess()) {
            check.result = CheckResultDto.SUCCESS;
        }
        else if (result.isWarning()) {
            check.result = CheckResultDto.WARNING;
        }
        else {
            check.result = CheckResultDto.ERROR;
            _report.success = false;
        }
        // A failed fatal check is always the last one of the run.
        if (!result.isSuccess() && result.isFatal()) {
            _report.aborted = true;
        }

        _categories.computeIfAbsent(result.getCategory().getName(), name -> {
            CategoryDto category = new CategoryDto();
            category.categoryName = name;
            category.checks = new ArrayList<>();
            return category;
        }).checks.add(check);
    }

    /**
     * @return the report so far, with completion time set to now.
     */
    public synchronized CheckReportDto createReport() {
        CheckReportDto copy = new CheckReportDto();
        copy.version = _report.version;
        copy.success = _report.success;
        copy.aborted = _report.aborted;
        copy.startedAt = _report.startedAt;
        copy.completedAt = _clock.instant();
        copy.categories = new ArrayList<>(_categories.values());
        return copy;
    }
}
