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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionBuilder;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.context.annotation.Role;
import org.springframework.core.annotation.AnnotationAttributes;
import org.springframework.core.type.AnnotationMetadata;

import com.storebrand.meshcheck.HealthChecker;
import com.storebrand.meshcheck.MeshCheckCollaborators;
import com.storebrand.meshcheck.annotation.MeshCheck;

/**
 * Enables mesh health checks in Spring. Add this annotation to a Spring configuration class to get a
 * {@link HealthChecker} bean, with the methods annotated with {@link MeshCheck} on beans registered in it.
 * <p>
 * The context must hold a {@link MeshCheckCollaborators} bean, which connects the checks to the cluster.
 * <p>
 * The attributes set the options statically. Leave them at their defaults and provide a bean implementing
 * {@link MeshCheckSettings} to take full control.
 *
 * @see MeshCheckSpringAnnotationRegistration for details on automatic registration of checks.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({ MeshCheckSpringAnnotationRegistration.class, EnableMeshChecks.MeshCheckBeanRegistration.class })
public @interface EnableMeshChecks {

    /**
     * Namespace of the control plane. Empty means "linkerd".
     */
    String controlPlaneNamespace() default "";

    /**
     * Standard categories to run, e.g. "kubernetes-api". Empty means all of them except "pre-kubernetes-setup".
     */
    String[] categories() default {};

    /**
     * Fail the multicluster checks if multicluster support is not installed.
     */
    boolean multicluster() default false;

    @Role(BeanDefinition.ROLE_INFRASTRUCTURE)
    class MeshCheckBeanRegistration implements ImportBeanDefinitionRegistrar {
        private static final Logger log = LoggerFactory.getLogger(MeshCheckBeanRegistration.class);

        @Override
        public void registerBeanDefinitions(AnnotationMetadata importingClassMetadata,
                BeanDefinitionRegistry registry) {

            AnnotationAttributes annotationAttributes = (AnnotationAttributes) importingClassMetadata
                    .getAnnotationAttributes(EnableMeshChecks.class.getName());
            if (annotationAttributes != null) {
                String controlPlaneNamespace = annotationAttributes.getString("controlPlaneNamespace");
                String[] categories = annotationAttributes.getStringArray("categories");
                boolean multicluster = annotationAttributes.getBoolean("multicluster");

                // ?: Has anything been set on the annotation?
                if (!controlPlaneNamespace.isEmpty() || categories.length > 0 || multicluster) {
                    // -> Yes, then the annotation supplies the settings.
                    log.info("Found EnableMeshChecks annotation with control plane namespace ["
                            + controlPlaneNamespace + "], categories [" + String.join(", ", categories) + "]"
                            + " and multicluster [" + multicluster + "]");

                    BeanDefinition settingsBeanDefinition = BeanDefinitionBuilder.genericBeanDefinition(
                                    SimpleMeshCheckSettings.class)
                            .addConstructorArgValue(controlPlaneNamespace)
                            .addConstructorArgValue(categories)
                            .addConstructorArgValue(multicluster)
                            .setScope(BeanDefinition.SCOPE_SINGLETON)
                            .getBeanDefinition();

                    registry.registerBeanDefinition(SimpleMeshCheckSettings.class.getSimpleName(),
                            settingsBeanDefinition);
                }
            }

            registry.registerBeanDefinition(HealthCheckerFactory.class.getSimpleName(), BeanDefinitionBuilder
                    .genericBeanDefinition(HealthCheckerFactory.class)
                    .setScope(BeanDefinition.SCOPE_SINGLETON)
                    .getBeanDefinition());
        }
    }
}
