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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.CheckOutcome.CheckFailedException;
import com.storebrand.meshcheck.CheckOutcome.Kind;
import com.storebrand.meshcheck.DiscoveryContext.AttemptScope;
import com.storebrand.meshcheck.rpc.SelfCheckResult;

/**
 * Runs a single {@link Checker} to completion: invokes the body with a bounded per-attempt timeout, retries while the
 * checker's retry deadline has not passed, and streams each result to the {@link CheckObserver}.
 * <p>
 * Only one check runs at a time. The executor is used for bounding the duration of each attempt, not for running checks
 * in parallel.
 */
class CheckRunner {
    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    static final String RETRY_PLACEHOLDER = "waiting for check to complete";
    static final String NO_SELF_CHECK_RESULTS = "no results returned";

    private final ExecutorService _executor;
    private final HealthCheckOptions _options;
    private final Clock _clock;

    CheckRunner(ExecutorService executor, HealthCheckOptions options, Clock clock) {
        _executor = executor;
        _options = options;
        _clock = clock;
    }

    /**
     * @return true if the check ended successfully or was skipped, false if the final result was an error.
     */
    boolean runCheck(CategoryId category, Checker checker, CheckContext context, CheckObserver observer) {
        Optional<SelfCheckBody> selfCheck = checker.getSelfCheck();
        if (selfCheck.isPresent()) {
            return runSelfCheck(category, checker, selfCheck.get(), context, observer);
        }
        return runLocalCheck(category, checker, checker.getCheck()
                .orElseThrow(() -> new IllegalStateException("Checker [" + checker + "] has no body")),
                context, observer);
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private boolean runLocalCheck(CategoryId category, Checker checker, CheckBody body, CheckContext context,
            CheckObserver observer) {
        int attempt = 0;
        while (true) {
            attempt++;
            CheckOutcome outcome = attempt(checker, body, context);
            log.debug("Check [" + category + "] [" + checker.getDescription() + "] attempt #" + attempt
                    + ": " + outcome);

            // ?: Was the check skipped?
            if (outcome.isSkip()) {
                // -> Yes, so nothing is reported, and it does not affect the run.
                return true;
            }

            String description = checker.getDescription();
            Throwable error = null;
            if (outcome.getKind() == Kind.OK_VERBOSE) {
                description = description + "\n" + outcome.getMessage().orElse("");
            }
            else if (outcome.isFail()) {
                error = outcome.getError().orElseGet(() -> new CheckFailedException(outcome.toString()));
            }

            // ?: Did it fail, and do we still have time to retry?
            if (error != null && isBeforeRetryDeadline(checker)) {
                // -> Yes, so report a retry, wait, and go again.
                observer.observe(result(category, checker, description, null, true,
                        errorShownOnRetry(category, checker, error)));
                if (!waitBeforeRetry(checker)) {
                    observer.observe(result(category, checker, description, null, false, error));
                    return false;
                }
                continue;
            }

            // E-> Final result for this check.
            observer.observe(result(category, checker, description, null, false, error));
            return error == null;
        }
    }

    private boolean runSelfCheck(CategoryId category, Checker checker, SelfCheckBody body, CheckContext context,
            CheckObserver observer) {
        // Keys of sub results that have already been reported, in the form description + NUL + error message.
        Set<String> seen = new HashSet<>();
        int attempt = 0;
        while (true) {
            attempt++;
            List<SelfCheckResult> results;
            try {
                results = callBounded(checker, () -> body.call(context));
            }
            // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - Transport errors of any kind are final.
            catch (Exception e) {
                log.debug("Self check [" + category + "] [" + checker.getDescription() + "] attempt #" + attempt
                        + " failed in transport: " + e.getMessage());
                observer.observe(result(category, checker, checker.getDescription(), null, false, e));
                return false;
            }

            // ?: Did we get anything back at all?
            if (results == null || results.isEmpty()) {
                // -> No, and an empty answer will not improve by waiting for it.
                observer.observe(result(category, checker, checker.getDescription(), null, false,
                        new CheckFailedException(NO_SELF_CHECK_RESULTS)));
                return false;
            }

            boolean anyFailed = results.stream().anyMatch(r -> !r.ok);
            boolean retrying = anyFailed && isBeforeRetryDeadline(checker);
            log.debug("Self check [" + category + "] [" + checker.getDescription() + "] attempt #" + attempt
                    + ": " + results.size() + " results, failing: " + anyFailed + ", retrying: " + retrying);

            for (SelfCheckResult subResult : results) {
                String description = "[" + subResult.subsystemName + "] " + subResult.checkDescription;
                String message = subResult.ok ? "" : String.valueOf(subResult.friendlyMessageToUser);
                Throwable error = subResult.ok ? null : new CheckFailedException(message);
                boolean finalFailure = error != null && !retrying;
                boolean firstTimeSeen = seen.add(description + "\u0000" + message);
                // ?: Have we reported this exact outcome before, and is this not the final word on it?
                if (!firstTimeSeen && !finalFailure) {
                    // -> Yes, so don't repeat it.
                    continue;
                }
                if (error != null && retrying) {
                    observer.observe(result(category, checker, description, subResult.subsystemName, true,
                            errorShownOnRetry(category, checker, error)));
                }
                else {
                    observer.observe(result(category, checker, description, subResult.subsystemName, false,
                            error));
                }
            }

            if (!anyFailed) {
                return true;
            }
            if (!retrying || !waitBeforeRetry(checker)) {
                return false;
            }
        }
    }

    private CheckOutcome attempt(Checker checker, CheckBody body, CheckContext context) {
        try {
            CheckOutcome outcome = callBounded(checker, () -> body.run(context));
            return outcome != null
                    ? outcome
                    : CheckOutcome.fail("check [" + checker.getDescription() + "] returned no outcome");
        }
        // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - A check body may throw anything, it is a failed attempt.
        catch (Exception e) {
            return CheckOutcome.fail(e);
        }
    }

    /**
     * Invokes the callable on the executor, and waits at most the request timeout for it. On timeout the attempt is
     * abandoned and cancelled, and {@link CheckTimeoutException} is thrown. An abandoned attempt that ignores the
     * interrupt can not write to the discovery context anymore. Exceptions from the callable are rethrown unwrapped.
     */
    private <T> T callBounded(Checker checker, Callable<T> callable) throws Exception {
        Duration timeout = _options.getRequestTimeout();
        AttemptScope scope = new AttemptScope();
        Future<T> future = _executor.submit(() -> scope.call(callable));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            scope.abandon();
            future.cancel(true);
            log.warn("Check [" + checker.getDescription() + "] timed out after " + timeout.toMillis()
                    + " ms, cancelling the attempt.");
            throw new CheckTimeoutException(checker.getDescription(), timeout);
        }
        catch (InterruptedException e) {
            scope.abandon();
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private boolean isBeforeRetryDeadline(Checker checker) {
        Optional<Instant> deadline = checker.getRetryDeadline();
        return deadline.isPresent() && _clock.instant().isBefore(deadline.get());
    }

    private Throwable errorShownOnRetry(CategoryId category, Checker checker, Throwable error) {
        if (checker.isSurfaceErrorOnRetry()) {
            return error;
        }
        log.warn("Check [" + category + "] [" + checker.getDescription() + "] failed, will retry: "
                + error.getMessage());
        return new CheckFailedException(RETRY_PLACEHOLDER);
    }

    /**
     * @return false if we were interrupted while waiting, in which case the caller should finish the check.
     */
    private boolean waitBeforeRetry(Checker checker) {
        try {
            Thread.sleep(_options.getRetryWaitWindow().toMillis());
            return true;
        }
        catch (InterruptedException e) {
            log.info("Interrupted while waiting to retry check [" + checker.getDescription()
                    + "], reporting the last result as final.");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CheckResult result(CategoryId category, Checker checker, String description, String subsystem,
            boolean retry, Throwable error) {
        Throwable wrapped = error == null || error instanceof CategoryException
                ? error
                : new CategoryException(category, error);
        return new CheckResult(category, description, subsystem, _options.hintUrl(checker.getHintAnchor()), retry,
                checker.isWarning(), checker.isFatal(), wrapped);
    }
}
