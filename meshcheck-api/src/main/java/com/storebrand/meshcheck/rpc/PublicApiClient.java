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


package com.storebrand.meshcheck.rpc;

import java.time.Duration;
import java.util.List;

/**
 * Client for the control plane's public API. Every call is bounded by the given timeout, and fails with
 * {@link RpcException} on transport errors.
 */
public interface PublicApiClient {
    /**
     * Asks the control plane to check itself. Returns one result per subsystem.
     */
    List<SelfCheckResult> selfCheck(Duration timeout);

    /**
     * Fetches the status of the gateways to remote clusters, with statistics over the given time window, e.g.
     * {@code "1m"}.
     */
    List<GatewayStatus> gateways(String timeWindow, Duration timeout);
}
