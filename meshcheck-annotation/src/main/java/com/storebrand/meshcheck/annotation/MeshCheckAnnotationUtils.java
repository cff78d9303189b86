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


package com.storebrand.meshcheck.annotation;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.CheckBody;
import com.storebrand.meshcheck.CheckContext;
import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.CheckRegistry;

/**
 * Utility class for interacting with {@link MeshCheck} annotated methods.
 */
public final class MeshCheckAnnotationUtils {

    private MeshCheckAnnotationUtils() {
        // Utility class - hiding constructor
    }

    /**
     * Validates if a method is of format "CheckOutcome methodName(CheckContext)".
     */
    public static boolean isValidMeshCheckMethod(Method method) {
        // ?: Does the method return an outcome?
        if (method.getReturnType() != CheckOutcome.class) {
            // -> Nope, then this is not a valid method for MeshChecks
            return false;
        }

        Class<?>[] parameterTypes = method.getParameterTypes();
        return parameterTypes.length == 1
                && parameterTypes[0] == CheckContext.class;
    }

    /**
     * @return the {@link MeshCheck} annotation of the method, after validating the method and the annotation.
     */
    public static MeshCheck getAnnotation(Method method) {
        MeshCheck annotation = method.getAnnotation(MeshCheck.class);
        if (annotation == null) {
            throw new IllegalStateException("Annotation @MeshCheck not present on method [" + method + "].");
        }
        if (!isValidMeshCheckMethod(method)) {
            throw new IllegalArgumentException("Method [" + method + "] must return CheckOutcome, and have exactly"
                    + " one argument of type CheckContext.");
        }
        if (annotation.category().trim().isEmpty() || annotation.description().trim().isEmpty()) {
            throw new IllegalStateException("Annotation @MeshCheck on method [" + method + "] must have both"
                    + " category and description.");
        }
        return annotation;
    }

    /**
     * Creates a {@link CheckBody} that calls the method on the instance. Exceptions thrown by the method are passed on
     * as they are, not wrapped in {@link InvocationTargetException}.
     */
    public static CheckBody createCheckBody(Method method, Object instance) {
        return context -> {
            try {
                return (CheckOutcome) method.invoke(instance, context);
            }
            catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        };
    }

    /**
     * Registers the {@link MeshCheck} annotated method in the {@link CheckRegistry}, once for every instance the
     * resolver gives. When there is more than one instance, the descriptions are suffixed with "#1", "#2", etc.
     *
     * @return the descriptions registered.
     */
    public static List<String> registerAnnotatedMethod(Method method, CheckRegistry registry,
            MeshCheckInstanceResolver instanceResolver) {
        MeshCheck annotation = getAnnotation(method);
        CategoryId category = CategoryId.of(annotation.category());
        Collection<?> instances = instanceResolver.getInstancesFor(method.getDeclaringClass());

        List<String> descriptions = new ArrayList<>();
        int i = 0;
        for (Object instance : instances) {
            String description = instances.size() == 1
                    ? annotation.description()
                    : annotation.description() + "#" + ++i;
            registry.addCheck(category, description, annotation.hintAnchor(), createCheckBody(method, instance));
            descriptions.add(description);
        }
        return descriptions;
    }
}
