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
 * Version of a cluster API server, e.g. {@code v1.24.3}.
 */
@SuppressWarnings("VisibilityModifier")
public final class ServerVersion {
    public final String gitVersion;

    public ServerVersion(String gitVersion) {
        this.gitVersion = gitVersion;
    }

    /**
     * @return major, minor and patch numbers parsed from {@link #gitVersion}. Suffixes such as {@code -gke.100} or
     *         {@code +k3s1} are ignored, and missing parts are 0.
     */
    public int[] toSemanticVersion() {
        return parse(gitVersion);
    }

    public static int[] parse(String version) {
        String v = version.trim();
        if (v.startsWith("v")) {
            v = v.substring(1);
        }
        String[] parts = v.split("[.]");
        int[] result = new int[3];
        for (int i = 0; i < 3 && i < parts.length; i++) {
            String digits = parts[i].replaceAll("^(\\d+).*$", "$1");
            if (!digits.matches("\\d+")) {
                throw new IllegalArgumentException("Could not parse version [" + version + "]");
            }
            result[i] = Integer.parseInt(digits);
        }
        return result;
    }

    @Override
    public String toString() {
        return gitVersion;
    }
}
