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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.storebrand.meshcheck.checks.StandardCategories;
import com.storebrand.meshcheck.cluster.ClusterClient;

/**
 * Runs ordered categories of checks against a mesh, and streams the results to a {@link CheckObserver}.
 * <p>
 * Categories run in the order given at construction, and only if their id is enabled. Checks within a category run
 * in declaration order. A failing fatal check stops the run. A failing warning check is reported, but does not affect
 * the overall success. Categories added through {@link #addCheck} or {@link #addCategory} run after the standard ones,
 * and are always enabled.
 * <p>
 * Each run gets a fresh {@link DiscoveryContext}, which earlier categories populate for later ones. The context of the
 * latest run is available from {@link #getDiscovery()}. The cluster client of a run is closed when the next run starts,
 * or when the checker is closed.
 */
public class HealthChecker implements CheckRegistry, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final List<Category> _categories;
    private final Set<CategoryId> _enabled;
    private final HealthCheckOptions _options;
    private final Clock _clock;
    private final ExecutorService _executor;
    private final CheckRunner _runner;

    // Synchronized on "this"
    private final List<Category> _addedCategories = new ArrayList<>();

    private volatile DiscoveryContext _discovery;

    public HealthChecker(List<Category> categories, Collection<CategoryId> enabled, HealthCheckOptions options,
            Clock clock) {
        _categories = Collections.unmodifiableList(new ArrayList<>(categories));
        _enabled = Collections.unmodifiableSet(new LinkedHashSet<>(enabled));
        _options = Objects.requireNonNull(options, "options");
        _clock = Objects.requireNonNull(clock, "clock");
        _executor = Executors.newCachedThreadPool(new AttemptThreadFactory());
        _runner = new CheckRunner(_executor, _options, _clock);
    }

    /**
     * Creates a checker with the standard categories, wired to the given collaborators.
     */
    public static HealthChecker standard(MeshCheckCollaborators collaborators, Collection<CategoryId> enabled,
            HealthCheckOptions options, Clock clock) {
        return new HealthChecker(StandardCategories.create(collaborators, options), enabled, options, clock);
    }

    /**
     * Runs all enabled categories, in order.
     *
     * @return true unless a non-warning check ended in error.
     * @throws IllegalStateException
     *         if the checker has been closed.
     */
    public synchronized boolean run(CheckObserver observer) {
        if (isClosed()) {
            throw new IllegalStateException("HealthChecker has been closed, and can not run again.");
        }
        MDC.put("traceId", "MeshCheck[" + generateRandomString() + "]");
        try {
            closeClientOf(_discovery);
            DiscoveryContext discovery = new DiscoveryContext();
            _discovery = discovery;
            CheckContext context = new RunContext(discovery, _options, _clock);
            List<Category> categories = categoriesToRun();
            log.info("Starting mesh check run of " + categories.size() + " categories: " + categoryIds(categories));

            boolean success = true;
            for (Category category : categories) {
                for (Checker checker : category.getCheckers()) {
                    // ?: Did this check end in error?
                    if (!_runner.runCheck(category.getId(), checker, context, observer)) {
                        // -> Yes, warnings are reported but do not fail the run.
                        if (!checker.isWarning()) {
                            success = false;
                        }
                        // ?: Is this a precondition for everything after it?
                        if (checker.isFatal()) {
                            // -> Yes, so there is no point in running anything else.
                            log.info("Fatal check [" + category.getId() + "] [" + checker.getDescription()
                                    + "] failed, skipping subsequent checks.");
                            return success;
                        }
                    }
                }
            }
            log.info("Mesh check run completed, success: " + success);
            return success;
        }
        finally {
            MDC.remove("traceId");
        }
    }

    @Override
    public synchronized void addCheck(CategoryId category, String description, String hintAnchor, CheckBody body) {
        Checker checker = Checker.builder(description)
                .hintAnchor(hintAnchor)
                .check(body);
        for (int i = 0; i < _addedCategories.size(); i++) {
            if (_addedCategories.get(i).getId().equals(category)) {
                _addedCategories.set(i, _addedCategories.get(i).with(checker));
                return;
            }
        }
        _addedCategories.add(Category.of(category, checker));
    }

    @Override
    public synchronized void addCategory(Category category) {
        for (int i = 0; i < _addedCategories.size(); i++) {
            Category existing = _addedCategories.get(i);
            if (existing.getId().equals(category.getId())) {
                List<Checker> checkers = new ArrayList<>(existing.getCheckers());
                checkers.addAll(category.getCheckers());
                _addedCategories.set(i, new Category(category.getId(), checkers));
                return;
            }
        }
        _addedCategories.add(category);
    }

    /**
     * @return the categories that a run would execute, in order.
     */
    public synchronized List<Category> categoriesToRun() {
        List<Category> categories = new ArrayList<>();
        for (Category category : _categories) {
            if (_enabled.contains(category.getId())) {
                categories.add(category);
            }
        }
        categories.addAll(_addedCategories);
        return categories;
    }

    /**
     * @return the discovery context of the latest run, or empty if nothing has run yet.
     */
    public Optional<DiscoveryContext> getDiscovery() {
        return Optional.ofNullable(_discovery);
    }

    public HealthCheckOptions getOptions() {
        return _options;
    }

    /**
     * Shuts down the executor running check attempts, and closes the cluster client of the latest run.
     */
    @Override
    public void close() {
        log.info("Closing HealthChecker.");
        _executor.shutdownNow();
        closeClientOf(_discovery);
    }

    /**
     * @return true when {@link #close()} has been called. A closed checker can not run again.
     */
    public boolean isClosed() {
        return _executor.isShutdown();
    }

    // ===== PRIVATE METHODS ===========================================================================================

    private static void closeClientOf(DiscoveryContext discovery) {
        if (discovery != null) {
            discovery.cluster().getClient().ifPresent(HealthChecker::closeQuietly);
        }
    }

    private static void closeQuietly(ClusterClient client) {
        try {
            client.close();
        }
        // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - Closing is best effort, we are shutting down.
        catch (Exception e) {
            log.warn("Failed to close cluster client: " + e.getMessage(), e);
        }
    }

    private static String categoryIds(List<Category> categories) {
        List<String> ids = new ArrayList<>();
        categories.forEach(category -> ids.add(category.getId().getName()));
        return ids.toString();
    }

    private static final String ALPHANUMERIC_CHARACTERS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    /**
     * Generate a random string, so our traceId will be unique (enough) for each run.
     */
    private static String generateRandomString() {
        char[] randomChars = new char[7];
        for (int i = 0; i < randomChars.length; i++) {
            randomChars[i] = ALPHANUMERIC_CHARACTERS
                    .charAt(ThreadLocalRandom.current().nextInt(ALPHANUMERIC_CHARACTERS.length()));
        }
        return new String(randomChars);
    }

    private static final class RunContext implements CheckContext {
        private final DiscoveryContext _discovery;
        private final HealthCheckOptions _options;
        private final Clock _clock;

        private RunContext(DiscoveryContext discovery, HealthCheckOptions options, Clock clock) {
            _discovery = discovery;
            _options = options;
            _clock = clock;
        }

        @Override
        public DiscoveryContext getDiscovery() {
            return _discovery;
        }

        @Override
        public HealthCheckOptions getOptions() {
            return _options;
        }

        @Override
        public Clock getClock() {
            return _clock;
        }
    }

    private static final class AttemptThreadFactory implements ThreadFactory {
        private final AtomicInteger _counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "MeshCheck-attempt-" + _counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
