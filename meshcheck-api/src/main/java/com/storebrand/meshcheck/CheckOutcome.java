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

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a single invocation of a check body. A body returns exactly one of:
 * <ul>
 *     <li>{@link Kind#OK} - the check passed.</li>
 *     <li>{@link Kind#OK_VERBOSE} - the check passed, and has an informational message for the operator.</li>
 *     <li>{@link Kind#SKIP} - the check does not apply. It is never reported, and never affects success.</li>
 *     <li>{@link Kind#FAIL} - the check failed with an error.</li>
 * </ul>
 * Retry, fatal and warning handling is done by the orchestrator, never by the check body itself.
 */
public final class CheckOutcome {
    private static final CheckOutcome OK = new CheckOutcome(Kind.OK, null, null);

    private final Kind _kind;
    private final String _message;
    private final Throwable _error;

    private CheckOutcome(Kind kind, String message, Throwable error) {
        _kind = kind;
        _message = message;
        _error = error;
    }

    public static CheckOutcome ok() {
        return OK;
    }

    public static CheckOutcome okVerbose(String message) {
        return new CheckOutcome(Kind.OK_VERBOSE, Objects.requireNonNull(message, "message"), null);
    }

    public static CheckOutcome skip(String reason) {
        return new CheckOutcome(Kind.SKIP, Objects.requireNonNull(reason, "reason"), null);
    }

    public static CheckOutcome fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new CheckOutcome(Kind.FAIL, error.getMessage(), error);
    }

    public static CheckOutcome fail(String message) {
        return fail(new CheckFailedException(message));
    }

    public Kind getKind() {
        return _kind;
    }

    public boolean isOk() {
        return _kind == Kind.OK || _kind == Kind.OK_VERBOSE;
    }

    public boolean isSkip() {
        return _kind == Kind.SKIP;
    }

    public boolean isFail() {
        return _kind == Kind.FAIL;
    }

    /**
     * @return the verbose success message, the skip reason or the error message, depending on {@link #getKind()}.
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(_message);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(_error);
    }

    @Override
    public String toString() {
        return _message == null ? _kind.name() : _kind.name() + "[" + _message + "]";
    }

    public enum Kind {
        OK,
        OK_VERBOSE,
        SKIP,
        FAIL
    }

    /**
     * Plain failure raised from a message, used by {@link #fail(String)}.
     */
    public static class CheckFailedException extends RuntimeException {
        public CheckFailedException(String message) {
            super(message);
        }
    }
}
