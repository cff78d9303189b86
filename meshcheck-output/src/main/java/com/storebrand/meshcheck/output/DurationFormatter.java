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


package com.storebrand.meshcheck.output;

import java.time.Duration;

/**
 * Formats the duration of a run as e.g. "1m 12.345s".
 */
final class DurationFormatter {

    private DurationFormatter() {
        /* util-class, hide constructor */
    }

    static String format(Duration duration) {
        long minutes = duration.toMinutes();
        Duration left = duration.minusMinutes(minutes);
        long millis = left.toMillis();

        String seconds = String.format("%d.%03ds", millis / 1000, millis % 1000);
        return minutes != 0
                ? minutes + "m " + seconds
                : seconds;
    }
}
