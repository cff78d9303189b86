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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Chains instance resolvers in priority order. The first resolver that returns any instances wins. If none of them
 * do, this throws.
 * <p>
 * Typically combines a resolver that looks up Spring beans with the {@link SimpleInstanceResolver}, so classes that
 * are not beans can still be instantiated.
 */
public class CombinedInstanceResolver implements MeshCheckInstanceResolver {

    private final List<MeshCheckInstanceResolver> _resolvers;

    public CombinedInstanceResolver(List<MeshCheckInstanceResolver> resolvers) {
        _resolvers = resolvers;
    }

    @Override
    public <T> Collection<T> getInstancesFor(Class<T> clazz) {
        for (MeshCheckInstanceResolver resolver : _resolvers) {
            Collection<T> instances = resolver.getInstancesFor(clazz);
            if (!instances.isEmpty()) {
                return instances;
            }
        }
        throw new IllegalStateException("None of the registered resolvers could create an instance of the class "
                + "[" + clazz.getName() + "]");
    }

    public static CombinedInstanceResolver of(MeshCheckInstanceResolver... instanceResolvers) { // NOPMD
        return new CombinedInstanceResolver(Arrays.asList(instanceResolvers));
    }
}
