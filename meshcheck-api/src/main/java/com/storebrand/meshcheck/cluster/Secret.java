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


package com.storebrand.meshcheck.cluster;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * A secret with its opaque byte payload, by key.
 */
@SuppressWarnings("VisibilityModifier")
public final class Secret {
    public final String name;
    public final String namespace;
    public final String type;
    public final Map<String, byte[]> data;

    public Secret(String name, String namespace, String type, Map<String, byte[]> data) {
        this.name = name;
        this.namespace = namespace;
        this.type = type;
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(data);
    }

    public Optional<String> getString(String key) {
        return Optional.ofNullable(data.get(key))
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
