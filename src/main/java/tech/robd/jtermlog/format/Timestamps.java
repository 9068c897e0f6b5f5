/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/Timestamps.java
 description: Locale-independent date/time strings for message prefixes, session headers and log file names.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.jtermlog.format;

import org.jspecify.annotations.NonNull;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats the current time of a {@link Clock} as {@code yyyy-MM-dd|HH:mm:ss}
 * (or just one half of it).
 */
public final class Timestamps {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

    private final @NonNull Clock clock;

    public Timestamps(@NonNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return timestamps in the system default zone
     */
    public static @NonNull Timestamps system() {
        return new Timestamps(Clock.systemDefaultZone());
    }

    public @NonNull Clock clock() {
        return clock;
    }

    /**
     * @return full date and time, e.g. {@code 2025-03-14|09:26:53}
     */
    public @NonNull String dateTime() {
        return dateTime(true, true);
    }

    /**
     * @param date include the date part
     * @param time include the time part
     * @return the requested parts joined by {@code |}, empty if neither is requested
     */
    public @NonNull String dateTime(boolean date, boolean time) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (date && time) return DATE.format(now) + '|' + TIME.format(now);
        if (date) return DATE.format(now);
        if (time) return TIME.format(now);
        return "";
    }

    /**
     * Build a file name of the form {@code <name>_<yyyy-MM-dd>T<HH-mm-ss>.log}.
     * The underscore is left out when {@code name} is empty.
     *
     * @param name optional prefix
     * @return a name that is safe on common file systems
     */
    public @NonNull String logFileName(@NonNull String name) {
        String stamp = dateTime().replace(':', '-').replace('|', 'T');
        return name.isEmpty() ? stamp + ".log" : name + '_' + stamp + ".log";
    }
}
