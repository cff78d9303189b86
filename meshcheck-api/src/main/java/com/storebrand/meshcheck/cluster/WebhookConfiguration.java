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

/**
 * An admission webhook configuration, reduced to the CA bundle it publishes for its serving certificate.
 */
@SuppressWarnings("VisibilityModifier")
public final class WebhookConfiguration {
    public final String name;
    public final Kind kind;
    public final byte[] caBundle;

    public WebhookConfiguration(String name, Kind kind, byte[] caBundle) {
        this.name = name;
        this.kind = kind;
        this.caBundle = caBundle;
    }

    public String caBundlePem() {
        return caBundle == null ? "" : new String(caBundle, StandardCharsets.UTF_8);
    }

    public enum Kind {
        MUTATING,
        VALIDATING
    }
}
