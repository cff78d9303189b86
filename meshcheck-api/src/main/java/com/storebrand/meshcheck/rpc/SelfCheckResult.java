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

/**
 * One subsystem's answer to a self-check request.
 */
@SuppressWarnings("VisibilityModifier")
public final class SelfCheckResult {
    public final String subsystemName;
    public final String checkDescription;
    public final boolean ok;
    /** Message for the operator when not ok. */
    public final String friendlyMessageToUser;

    public SelfCheckResult(String subsystemName, String checkDescription, boolean ok, String friendlyMessageToUser) {
        this.subsystemName = subsystemName;
        this.checkDescription = checkDescription;
        this.ok = ok;
        this.friendlyMessageToUser = friendlyMessageToUser;
    }

    public static SelfCheckResult ok(String subsystemName, String checkDescription) {
        return new SelfCheckResult(subsystemName, checkDescription, true, null);
    }

    public static SelfCheckResult failed(String subsystemName, String checkDescription, String message) {
        return new SelfCheckResult(subsystemName, checkDescription, false, message);
    }
}
