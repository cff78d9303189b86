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
import java.util.Objects;
import java.util.Optional;

/**
 * A single named unit of verification: a description, a policy (fatal, warning, retry), and exactly one body, which
 * is either a local {@link CheckBody} or a remote {@link SelfCheckBody}.
 * <p>
 * Checkers are immutable, and created with {@link #builder(String)}:
 * <pre>
 * Checker.builder("can query the Kubernetes API")
 *         .hintAnchor("k8s-api")
 *         .fatal()
 *         .check(context -&gt; CheckOutcome.ok());
 * </pre>
 */
public final class Checker {
    private final String _description;
    private final String _hintAnchor;
    private final boolean _fatal;
    private final boolean _warning;
    private final Instant _retryDeadline;
    private final boolean _surfaceErrorOnRetry;
    private final CheckBody _check;
    private final SelfCheckBody _selfCheck;

    private Checker(CheckerBuilder builder, CheckBody check, SelfCheckBody selfCheck) {
        _description = builder._description;
        _hintAnchor = builder._hintAnchor;
        _fatal = builder._fatal;
        _warning = builder._warning;
        _retryDeadline = builder._retryDeadline;
        _surfaceErrorOnRetry = builder._surfaceErrorOnRetry;
        _check = check;
        _selfCheck = selfCheck;
    }

    public static CheckerBuilder builder(String description) {
        return new CheckerBuilder(description);
    }

    public String getDescription() {
        return _description;
    }

    public String getHintAnchor() {
        return _hintAnchor;
    }

    public boolean isFatal() {
        return _fatal;
    }

    public boolean isWarning() {
        return _warning;
    }

    public Optional<Instant> getRetryDeadline() {
        return Optional.ofNullable(_retryDeadline);
    }

    public boolean isSurfaceErrorOnRetry() {
        return _surfaceErrorOnRetry;
    }

    public Optional<CheckBody> getCheck() {
        return Optional.ofNullable(_check);
    }

    public Optional<SelfCheckBody> getSelfCheck() {
        return Optional.ofNullable(_selfCheck);
    }

    /**
     * @return a copy of this checker with a different retry deadline. Used when the deadline is only known when the
     *         run starts.
     */
    public Checker withRetryDeadline(Instant retryDeadline) {
        CheckerBuilder builder = new CheckerBuilder(_description)
                .hintAnchor(_hintAnchor)
                .retryDeadline(retryDeadline);
        builder._fatal = _fatal;
        builder._warning = _warning;
        builder._surfaceErrorOnRetry = _surfaceErrorOnRetry;
        return new Checker(builder, _check, _selfCheck);
    }

    @Override
    public String toString() {
        return "Checker[" + _description + "]";
    }

    // ===== BUILDER CLASS =============================================================================================

    /**
     * Builder for {@link Checker}. Terminated by either {@link #check(CheckBody)} or {@link #selfCheck(SelfCheckBody)}.
     */
    public static final class CheckerBuilder {
        private final String _description;
        private String _hintAnchor = "";
        private boolean _fatal;
        private boolean _warning;
        private Instant _retryDeadline;
        private boolean _surfaceErrorOnRetry;

        private CheckerBuilder(String description) {
            _description = Objects.requireNonNull(description, "description");
        }

        public CheckerBuilder hintAnchor(String hintAnchor) {
            _hintAnchor = hintAnchor == null ? "" : hintAnchor;
            return this;
        }

        /**
         * A fatal check stops the whole run if it fails.
         */
        public CheckerBuilder fatal() {
            _fatal = true;
            return this;
        }

        /**
         * A failing warning check is reported, but does not flip the overall success of the run.
         */
        public CheckerBuilder warning() {
            _warning = true;
            return this;
        }

        /**
         * While the clock is before this deadline, a failing check is retried. Null means no retry.
         */
        public CheckerBuilder retryDeadline(Instant retryDeadline) {
            _retryDeadline = retryDeadline;
            return this;
        }

        /**
         * Report the real error on intermediate retry results, instead of a generic placeholder.
         */
        public CheckerBuilder surfaceErrorOnRetry() {
            _surfaceErrorOnRetry = true;
            return this;
        }

        public Checker check(CheckBody check) {
            return new Checker(this, Objects.requireNonNull(check, "check"), null);
        }

        public Checker selfCheck(SelfCheckBody selfCheck) {
            return new Checker(this, null, Objects.requireNonNull(selfCheck, "selfCheck"));
        }
    }
}
