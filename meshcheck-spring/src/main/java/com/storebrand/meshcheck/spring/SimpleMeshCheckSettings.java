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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.storebrand.meshcheck.CategoryId;
import com.storebrand.meshcheck.HealthCheckOptions;
import com.storebrand.meshcheck.checks.StandardCategories;

/**
 * Settings from the attributes of {@link EnableMeshChecks}. An empty namespace keeps the default, and no categories
 * means the standard categories for an installed mesh.
 */
public class SimpleMeshCheckSettings implements MeshCheckSettings {
    private final HealthCheckOptions _options;
    private final List<CategoryId> _enabledCategories;

    SimpleMeshCheckSettings() {
        this("", new String[0], false);
    }

    public SimpleMeshCheckSettings(String controlPlaneNamespace, String[] enabledCategories, boolean multicluster) {
        HealthCheckOptions.HealthCheckOptionsBuilder builder = HealthCheckOptions.builder()
                .multicluster(multicluster);
        if (controlPlaneNamespace != null && !controlPlaneNamespace.isEmpty()) {
            builder.controlPlaneNamespace(controlPlaneNamespace);
        }
        _options = builder.build();

        if (enabledCategories == null || enabledCategories.length == 0) {
            _enabledCategories = StandardCategories.installedMeshIds();
        }
        else {
            _enabledCategories = new ArrayList<>();
            for (String category : enabledCategories) {
                _enabledCategories.add(CategoryId.of(category));
            }
        }
    }

    @Override
    public HealthCheckOptions getOptions() {
        return _options;
    }

    @Override
    public Collection<CategoryId> getEnabledCategories() {
        return _enabledCategories;
    }
}
