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


package com.storebrand.meshcheck.scanner;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.CheckRegistry;
import com.storebrand.meshcheck.annotation.MeshCheck;
import com.storebrand.meshcheck.annotation.MeshCheckAnnotationUtils;
import com.storebrand.meshcheck.annotation.MeshCheckInstanceResolver;

/**
 * Scans for all {@link MeshCheck} annotated methods using ClassGraph, and registers them in a {@link CheckRegistry}.
 */
public final class MeshCheckRegistrationHelper {
    private static final Logger log = LoggerFactory.getLogger(MeshCheckRegistrationHelper.class);

    private static final String LOGGER_PREFIX = "#MESH_CHECK_REGISTRATION_HELPER# ";

    private MeshCheckRegistrationHelper() {
        // Utility class - hiding constructor
    }

    /**
     * @param registry
     *         the registry to add the checks to, typically the health checker.
     * @param instanceResolver
     *         resolver used to get the instances to call the methods on.
     * @param packageNames
     *         packages to scan for {@link MeshCheck} annotated methods.
     * @param classLoaders
     *         optional collection of classloaders to override default classloader.
     * @return the descriptions of the registered checks, in registration order.
     */
    public static List<String> scanAndRegisterMeshChecks(CheckRegistry registry,
            MeshCheckInstanceResolver instanceResolver, Collection<String> packageNames,
            Collection<ClassLoader> classLoaders) {
        log.info(LOGGER_PREFIX + "Scanning and registering all @MeshCheck annotated methods from ["
                + String.join(", ", packageNames) + "]");

        List<String> registered = new ArrayList<>();
        for (Method method : ClassGraphMeshCheckMethodScanner.findMeshCheckMethods(packageNames, classLoaders)) {
            registered.addAll(MeshCheckAnnotationUtils.registerAnnotatedMethod(method, registry, instanceResolver));
        }
        log.info(LOGGER_PREFIX + "Registered " + registered.size() + " checks.");
        return registered;
    }
}
