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


package com.storebrand.meshcheck;

import java.time.Clock;
import java.time.Duration;

/**
 * Passed to every check body. Gives access to the discovery context that earlier checks have populated, and to the
 * options of the current run.
 */
public interface CheckContext {
    DiscoveryContext getDiscovery();

    HealthCheckOptions getOptions();

    Clock getClock();

    /**
     * @return the bound for a single attempt of the current check. Calls to collaborators that accept a timeout
     *         should use this.
     */
    default Duration getAttemptTimeout() {
        return getOptions().getRequestTimeout();
    }
}
