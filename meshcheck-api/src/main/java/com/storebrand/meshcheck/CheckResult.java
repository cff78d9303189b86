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

import java.util.Optional;

/**
 * The reported outcome of one check attempt. Immutable: a retried attempt produces a new result.
 * <p>
 * A remote self-check fans out into one result per subsystem, and those results carry the subsystem name in
 * {@link #getSubsystem()}.
 */
public final class CheckResult {
    private final CategoryId _category;
    private final String _description;
    private final String _subsystem;
    private final String _hintUrl;
    private final boolean _retry;
    private final boolean _warning;
    private final boolean _fatal;
    private final Throwable _error;

    public CheckResult(CategoryId category, String description, String subsystem, String hintUrl, boolean retry,
            boolean warning, boolean fatal, Throwable error) {
        _category = category;
        _description = description;
        _subsystem = subsystem;
        _hintUrl = hintUrl;
        _retry = retry;
        _warning = warning;
        _fatal = fatal;
        _error = error;
    }

    public CategoryId getCategory() {
        return _category;
    }

    public String getDescription() {
        return _description;
    }

    public Optional<String> getSubsystem() {
        return Optional.ofNullable(_subsystem);
    }

    public String getHintUrl() {
        return _hintUrl;
    }

    /**
     * @return true if this is an intermediate result, and the check will be attempted again.
     */
    public boolean isRetry() {
        return _retry;
    }

    public boolean isWarning() {
        return _warning;
    }

    public boolean isFatal() {
        return _fatal;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(_error);
    }

    public boolean isSuccess() {
        return _error == null;
    }

    @Override
    public String toString() {
        return "CheckResult[" + _category + "] " + _description
                + (_retry ? " (retry)" : "")
                + (_error == null ? " OK" : " ERROR: " + _error.getMessage());
    }
}
