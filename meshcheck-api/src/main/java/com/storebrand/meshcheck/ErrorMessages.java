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

import java.util.List;

/**
 * Helpers for collapsing several problems into one error message.
 */
public final class ErrorMessages {
    /** Indentation used between aggregated items, so they line up below the check description. */
    public static final String INDENT = "    ";

    private ErrorMessages() {
        // Utility class - hiding constructor
    }

    /**
     * Joins messages with a line break followed by {@link #INDENT}.
     */
    public static String join(List<String> messages) {
        return String.join("\n" + INDENT, messages);
    }

    /**
     * Joins messages under a heading, one indented line per message.
     */
    public static String joinUnder(String heading, List<String> messages) {
        return heading + "\n" + INDENT + join(messages);
    }
}
