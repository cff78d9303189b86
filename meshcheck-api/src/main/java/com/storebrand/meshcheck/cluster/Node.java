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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * A cluster node, reduced to its conditions and their heartbeats.
 */
@SuppressWarnings("VisibilityModifier")
public final class Node {
    public final String name;
    public final List<Condition> conditions;

    public Node(String name, List<Condition> conditions) {
        this.name = name;
        this.conditions = conditions == null ? Collections.emptyList() : Collections.unmodifiableList(conditions);
    }

    public static class Condition {
        public static final String TYPE_READY = "Ready";
        public static final String STATUS_TRUE = "True";

        public final String type;
        public final String status;
        public final Instant lastHeartbeatTime;

        public Condition(String type, String status, Instant lastHeartbeatTime) {
            this.type = type;
            this.status = status;
            this.lastHeartbeatTime = lastHeartbeatTime;
        }

        public boolean isReady() {
            return TYPE_READY.equals(type) && STATUS_TRUE.equals(status);
        }
    }

    @Override
    public String toString() {
        return "node/" + name;
    }
}
