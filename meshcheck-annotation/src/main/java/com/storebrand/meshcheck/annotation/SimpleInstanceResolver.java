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
import java.util.Collection;
import java.util.Collections;

/**
 * Creates a new instance with the public no-arg constructor of the class.
 */
public class SimpleInstanceResolver implements MeshCheckInstanceResolver {
    @Override
    public <T> Collection<T> getInstancesFor(Class<T> clazz) {
        try {
            return Collections.singletonList(clazz.getConstructor().newInstance());
        }
        catch (NoSuchMethodException e) {
            throw new IllegalStateException("Class [" + clazz.getName() + "] has no public no-arg constructor,"
                    + " unable to create an instance for its @MeshCheck methods.", e);
        }
        catch (InvocationTargetException e) {
            throw new IllegalStateException("Constructor of [" + clazz.getName() + "] threw: "
                    + e.getCause().getMessage(), e.getCause());
        }
        catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Unable to create an instance of [" + clazz.getName() + "]", e);
        }
    }
}
