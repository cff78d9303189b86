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

/**
 * Opens a short-lived client to a remote cluster. The caller closes the client when done.
 */
@FunctionalInterface
public interface RemoteClusterConnector {
    /**
     * @throws ClusterApiException
     *         if the connection material is unusable, or the cluster can not be reached.
     */
    ClusterClient connect(RemoteClusterDescriptor descriptor);
}
