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


package com.storebrand.meshcheck;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * DTO with the final results of a run, grouped by category. Intermediate retry results are not part of the report.
 * <p>
 * {@link Instant} should be serialized to standard ISO datetime format.
 */
@SuppressWarnings("VisibilityModifier") // Using public fields for dto
public class CheckReportDto {
    public static final String CHECK_REPORT_DTO_VERSION = "1.0";

    public String version;
    /** False if any non-warning check failed. */
    public boolean success;
    /** True if the run was stopped by a fatal check. */
    public boolean aborted;
    public Instant startedAt;
    public Instant completedAt;
    public List<CategoryDto> categories;

    /**
     * All final results for one category, in run order.
     */
    public static class CategoryDto {
        public String categoryName;
        public List<CheckDto> checks;
    }

    public static class CheckDto {
        public String description;
        public Optional<String> subsystem = Optional.empty();
        public Optional<String> hint = Optional.empty();
        public Optional<String> error = Optional.empty();
        public CheckResultDto result;
    }

    public enum CheckResultDto {
        SUCCESS,
        WARNING,
        ERROR
    }
}
