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

import static java.util.stream.Collectors.toList;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Role;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import com.storebrand.meshcheck.CheckRegistry;
import com.storebrand.meshcheck.annotation.CombinedInstanceResolver;
import com.storebrand.meshcheck.annotation.MeshCheck;
import com.storebrand.meshcheck.annotation.MeshCheckAnnotationUtils;
import com.storebrand.meshcheck.annotation.MeshCheckInstanceResolver;
import com.storebrand.meshcheck.annotation.MeshCheckMethodScanner;
import com.storebrand.meshcheck.annotation.SimpleInstanceResolver;

/**
 * Registers all {@link MeshCheck} annotated methods of singleton beans in the {@link CheckRegistry} of the context,
 * which {@link EnableMeshChecks} provides. Imported by {@link EnableMeshChecks}.
 * <p>
 * Methods found by {@link MeshCheckMethodScanner} beans are registered as well, each method only once.
 * <p>
 * Add a {@link MeshCheckInstanceResolver} bean to control which instances the methods are called on. The default
 * tries {@link SpringInstanceResolver} first, and then {@link SimpleInstanceResolver}.
 */
@Role(BeanDefinition.ROLE_INFRASTRUCTURE)
public class MeshCheckSpringAnnotationRegistration implements BeanPostProcessor, ApplicationContextAware {
    private static final Logger log = LoggerFactory.getLogger(MeshCheckSpringAnnotationRegistration.class);
    private static final String LOG_PREFIX = "#SPRINGMESHCHECK# ";

    private final Set<Class<?>> _classesThatHaveBeenChecked = ConcurrentHashMap.newKeySet();
    private final Set<Method> _pendingMethods = new LinkedHashSet<>();
    private final Set<Method> _registeredMethods = ConcurrentHashMap.newKeySet();

    private ConfigurableApplicationContext _configurableApplicationContext;
    private ConfigurableListableBeanFactory _configurableListableBeanFactory;
    private MeshCheckInstanceResolver _instanceResolver;

    private volatile CheckRegistry _checkRegistry;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        if (!(applicationContext instanceof ConfigurableApplicationContext)) {
            throw new IllegalStateException("The ApplicationContext when using MeshCheck's Spring integration"
                    + " must implement " + ConfigurableApplicationContext.class.getSimpleName()
                    + ", while the provided ApplicationContext is of type [" + applicationContext.getClass().getName()
                    + "], and evidently don't.");
        }
        _configurableApplicationContext = (ConfigurableApplicationContext) applicationContext;

        // NOTICE: Touching the beans here would create them before we are ready to post process them. Bean
        // definitions are fine.
        _configurableListableBeanFactory = _configurableApplicationContext.getBeanFactory();
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        // :: Get the BeanDefinition, to check for scope.
        BeanDefinition beanDefinition;
        try {
            beanDefinition = _configurableListableBeanFactory.getBeanDefinition(beanName);
        }
        catch (NoSuchBeanDefinitionException e) {
            // -> Not a registered bean, e.g. inner beans or beans from test runners.
            log.debug(LOG_PREFIX + "Found no bean definition for bean [" + beanName + "], ignoring.");
            return bean;
        }

        Class<?> targetClass = ClassUtils.getUserClass(bean);
        // ?: Have we checked this class before?
        if (!_classesThatHaveBeenChecked.add(targetClass)) {
            // -> Yes, it either has no @MeshCheck methods, or they are already handled.
            return bean;
        }

        List<Method> annotatedMethods = Arrays.stream(targetClass.getMethods())
                .filter(method -> AnnotationUtils.findAnnotation(method, MeshCheck.class) != null)
                .collect(toList());
        if (annotatedMethods.isEmpty()) {
            return bean;
        }

        // Other scopes would give us instances that come and go.
        if (!beanDefinition.isSingleton()) {
            throw new BeanCreationException("The bean [" + beanName + "] is not a singleton (scope: ["
                    + beanDefinition.getScope() + "]), which does not make sense for beans with @MeshCheck"
                    + " annotated methods.");
        }
        for (Method method : annotatedMethods) {
            if (!MeshCheckAnnotationUtils.isValidMeshCheckMethod(method)) {
                throw new BeanCreationException("The bean [" + beanName + "] contains an invalid @MeshCheck method: ["
                        + method + "]. Method should return CheckOutcome, and have one argument of type"
                        + " CheckContext.");
            }
        }

        log.info(LOG_PREFIX + "Found class " + targetClass.getSimpleName() + " with " + annotatedMethods.size()
                + " @MeshCheck methods.");

        // ?: Has the context been refreshed already?
        if (_checkRegistry != null) {
            // -> Yes, e.g. a lazy bean. Register right away.
            annotatedMethods.forEach(this::registerMeshCheckMethod);
        }
        else {
            // -> No, wait for the refresh, when the registry is ready.
            synchronized (_pendingMethods) {
                _pendingMethods.addAll(annotatedMethods);
            }
        }
        return bean;
    }

    @EventListener
    public void onContextRefreshedEvent(ContextRefreshedEvent ev) {
        try {
            _instanceResolver = _configurableApplicationContext.getBean(MeshCheckInstanceResolver.class);
        }
        catch (NoSuchBeanDefinitionException ex) {
            log.info(LOG_PREFIX + "No MeshCheckInstanceResolver bean found in Spring - creating default instance"
                    + " resolver.");
            _instanceResolver = CombinedInstanceResolver.of(
                    new SpringInstanceResolver(_configurableApplicationContext),
                    new SimpleInstanceResolver());
        }
        _checkRegistry = _configurableApplicationContext.getBean(CheckRegistry.class);

        Map<String, MeshCheckMethodScanner> scannerBeans =
                _configurableApplicationContext.getBeansOfType(MeshCheckMethodScanner.class);
        Set<Method> methods;
        synchronized (_pendingMethods) {
            for (MeshCheckMethodScanner scannerBean : scannerBeans.values()) {
                Set<Method> scanned = scannerBean.getMeshCheckAnnotatedMethods();
                log.info(LOG_PREFIX + "Scanner [" + scannerBean.getClass().getName() + "] found " + scanned.size()
                        + " @MeshCheck annotated methods.");
                _pendingMethods.addAll(scanned);
            }
            methods = new LinkedHashSet<>(_pendingMethods);
            _pendingMethods.clear();
        }
        methods.forEach(this::registerMeshCheckMethod);
    }

    private void registerMeshCheckMethod(Method method) {
        if (!_registeredMethods.add(method)) {
            log.info(LOG_PREFIX + "Skipping method [" + method + "], it has already been registered.");
            return;
        }
        List<String> descriptions = MeshCheckAnnotationUtils.registerAnnotatedMethod(method, _checkRegistry,
                _instanceResolver);
        log.info(LOG_PREFIX + "Registered " + descriptions + " from method [" + method + "]");
    }
}
