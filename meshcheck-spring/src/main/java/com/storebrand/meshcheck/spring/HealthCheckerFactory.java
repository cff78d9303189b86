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


package com.storebrand.meshcheck.spring;

import java.time.Clock;
import java.util.Optional;

import javax.annotation.PreDestroy;
import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.AbstractFactoryBean;

import com.storebrand.meshcheck.HealthChecker;
import com.storebrand.meshcheck.MeshCheckCollaborators;

/**
 * Bean factory for the {@link HealthChecker}, which also closes it on exit so its attempt threads are stopped.
 * <p>
 * Requires a {@link MeshCheckCollaborators} bean. A {@link Clock} and {@link MeshCheckSettings} are picked up if
 * present.
 */
public class HealthCheckerFactory extends AbstractFactoryBean<HealthChecker> {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckerFactory.class);

    @Inject
    private Optional<Clock> _clock;
    @Inject
    private Optional<MeshCheckSettings> _settings;

    @Inject
    private MeshCheckCollaborators _collaborators;

    public HealthCheckerFactory() {
        setSingleton(true);
    }

    @Override
    public Class<?> getObjectType() {
        return HealthChecker.class;
    }

    @Override
    protected HealthChecker createInstance() {
        Clock clock = _clock.orElse(Clock.systemDefaultZone());
        MeshCheckSettings settings = _settings.orElseGet(SimpleMeshCheckSettings::new);
        log.info("Creating HealthChecker for control plane namespace ["
                + settings.getOptions().getControlPlaneNamespace() + "] with categories "
                + settings.getEnabledCategories());
        return HealthChecker.standard(_collaborators, settings.getEnabledCategories(), settings.getOptions(), clock);
    }

    @PreDestroy
    public void closeHealthChecker() {
        try {
            getObject().close();
        }
        // CHECKSTYLE IGNORE IllegalCatch FOR NEXT 1 LINES - getObject() from Spring throws Exception.
        catch (Exception e) {
            // We are shutting down anyway, so only log it.
            log.warn("Error closing HealthChecker", e);
        }
    }
}
