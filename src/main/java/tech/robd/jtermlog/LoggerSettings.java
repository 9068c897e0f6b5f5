/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/LoggerSettings.java
 description: Logger configuration (file, mode, queue length, formatting) read from
              java.util.Properties or JVM system properties with the `jtermlog.` prefix.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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

package tech.robd.jtermlog;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtermlog.format.FormattingOptions;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Everything needed to construct a {@link TermLogger}.
 *
 * <p>Recognised keys (all optional, defaults in brackets):
 * <ul>
 *   <li>{@code jtermlog.file} [none], {@code jtermlog.append} [true],
 *       {@code jtermlog.maxQueueLength} [10]</li>
 *   <li>{@code jtermlog.indent} [0], {@code jtermlog.width.tty} [0 = detect],
 *       {@code jtermlog.width.file} [0 = same as tty]</li>
 *   <li>{@code jtermlog.wrap.tty} [true], {@code jtermlog.wrap.file} [true],
 *       {@code jtermlog.colour} [true], {@code jtermlog.date} [false], {@code jtermlog.time} [true],
 *       {@code jtermlog.extraIndent} [true]</li>
 * </ul>
 * Booleans accept {@code true}/{@code false} in any case; anything else is rejected.
 *
 * @param file           log file, {@code null} for console only
 * @param append         keep existing file content
 * @param maxQueueLength queue length that triggers a flush
 * @param options        formatting switches
 */
public record LoggerSettings(@Nullable Path file,
                             boolean append,
                             int maxQueueLength,
                             @NonNull FormattingOptions options) {

    // 🧩 Section: keys
    public static final String PREFIX = "jtermlog.";
    public static final String FILE = PREFIX + "file";
    public static final String APPEND = PREFIX + "append";
    public static final String MAX_QUEUE_LENGTH = PREFIX + "maxQueueLength";
    public static final String INDENT = PREFIX + "indent";
    public static final String WIDTH_TTY = PREFIX + "width.tty";
    public static final String WIDTH_FILE = PREFIX + "width.file";
    public static final String WRAP_TTY = PREFIX + "wrap.tty";
    public static final String WRAP_FILE = PREFIX + "wrap.file";
    public static final String COLOUR = PREFIX + "colour";
    public static final String DATE = PREFIX + "date";
    public static final String TIME = PREFIX + "time";
    public static final String EXTRA_INDENT = PREFIX + "extraIndent";
    // [/🧩 Section: keys]

    public LoggerSettings {
        Objects.requireNonNull(options, "options");
        if (maxQueueLength < 0) {
            throw new IllegalArgumentException("maxQueueLength >= 0: " + maxQueueLength);
        }
    }

    /**
     * Console only, default queue length and formatting.
     */
    public static @NonNull LoggerSettings defaults() {
        return new LoggerSettings(null, true, TermLogger.DEFAULT_MAX_QUEUE_LENGTH, FormattingOptions.defaults());
    }

    // 🧩 Section: loading

    /**
     * Read settings from JVM system properties.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static @NonNull LoggerSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Read settings from {@code props}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed, naming the key
     */
    public static @NonNull LoggerSettings fromProperties(@NonNull Properties props) {
        Objects.requireNonNull(props, "props");
        FormattingOptions d = FormattingOptions.defaults();

        String file = props.getProperty(FILE);
        Path path = (file == null || file.isBlank()) ? null : Path.of(file.trim());

        FormattingOptions options = new FormattingOptions(
                bool(props, COLOUR, d.coloured()),
                bool(props, DATE, d.logDate()),
                bool(props, TIME, d.logTime()),
                bool(props, WRAP_TTY, d.wrapTty()),
                bool(props, WRAP_FILE, d.wrapFile()),
                integer(props, INDENT, d.indent()),
                integer(props, WIDTH_TTY, d.maxLineWidthTty()),
                integer(props, WIDTH_FILE, d.maxLineWidthFile()),
                bool(props, EXTRA_INDENT, d.extraIndent()));

        return new LoggerSettings(path,
                bool(props, APPEND, true),
                integer(props, MAX_QUEUE_LENGTH, TermLogger.DEFAULT_MAX_QUEUE_LENGTH),
                options);
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        v = v.trim();
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new IllegalArgumentException(key + ": expected true or false, got '" + v + "'");
    }

    private static int integer(Properties props, String key, int fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": expected an integer, got '" + v.trim() + "'", e);
        }
    }
    // [/🧩 Section: loading]
}
