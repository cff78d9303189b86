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
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.storebrand.meshcheck.annotation.MeshCheck;
import com.storebrand.meshcheck.annotation.MeshCheckAnnotationUtils;
import com.storebrand.meshcheck.annotation.MeshCheckMethodScanner;

import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import io.github.classgraph.MethodInfo;
import io.github.classgraph.ScanResult;

/**
 * Finds methods annotated with {@link MeshCheck} in the given packages, and their sub packages, using ClassGraph.
 */
public class ClassGraphMeshCheckMethodScanner implements MeshCheckMethodScanner {
    private static final Logger log = LoggerFactory.getLogger(ClassGraphMeshCheckMethodScanner.class);
    private final Collection<String> _packageNames;
    private final Collection<ClassLoader> _classLoaders;

    public ClassGraphMeshCheckMethodScanner(Collection<String> packageNames, Collection<ClassLoader> classLoaders) {
        _packageNames = packageNames;
        _classLoaders = classLoaders;
    }

    /**
     * Uses the default class loader of ClassGraph.
     */
    public ClassGraphMeshCheckMethodScanner(String... packageNames) {
        _packageNames = Arrays.asList(packageNames);
        _classLoaders = null;
    }

    @Override
    public Set<Method> getMeshCheckAnnotatedMethods() {
        return new LinkedHashSet<>(findMeshCheckMethods(_packageNames, _classLoaders));
    }

    /**
     * Scans for methods annotated with {@link MeshCheck}, in class name order, then declaration order.
     *
     * @param packageNames
     *         the packages to scan. Will also scan sub packages.
     * @param classLoaders
     *         class loaders to give ClassGraph instead of its defaults, or null.
     * @throws AssertionError
     *         if an annotated method does not have the signature "CheckOutcome methodName(CheckContext)".
     */
    public static List<Method> findMeshCheckMethods(Collection<String> packageNames,
            Collection<ClassLoader> classLoaders) {
        log.info("Using ClassGraph to scan for methods annotated with @MeshCheck in " + packageNames);
        ClassGraph classGraph = new ClassGraph()
                .enableClassInfo()
                .enableMethodInfo()
                .enableAnnotationInfo()
                .acceptPackages(packageNames.toArray(new String[0]));

        if (classLoaders != null) {
            log.info(" - Overriding default class loader");
            classGraph.overrideClassLoaders(classLoaders.toArray(new ClassLoader[0]));
        }

        try (ScanResult result = classGraph.scan()) {
            List<Method> meshCheckMethods = new ArrayList<>();
            for (ClassInfo classInfo : result.getClassesWithMethodAnnotation(MeshCheck.class)) {
                log.info(" - Found class [" + classInfo.getName() + "]");

                for (MethodInfo methodInfo : classInfo.getDeclaredMethodInfo()) {
                    if (!methodInfo.hasAnnotation(MeshCheck.class)) {
                        continue;
                    }
                    Method method = methodInfo.loadClassAndGetMethod();
                    if (!MeshCheckAnnotationUtils.isValidMeshCheckMethod(method)) {
                        throw new AssertionError("Invalid @MeshCheck annotated method found: ["
                                + classInfo.getName() + "." + methodInfo.getName() + "]. This should be fixed in"
                                + " code. Annotated methods should be of type"
                                + " \"CheckOutcome methodName(CheckContext)\".");
                    }
                    log.info(" -- Method: [" + methodInfo.getName() + "]");
                    meshCheckMethods.add(method);
                }
            }
            return meshCheckMethods;
        }
    }
}
