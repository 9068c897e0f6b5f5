/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/GlobalLogger.java
 description: Process-wide slot for one TermLogger with build/replace/delete lifecycle and
              caller-aware report helpers that fall back to plain printing.
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
import tech.robd.jtermlog.diagnostics.Diagnostics;
import tech.robd.jtermlog.format.FormattingOptions;
import tech.robd.jtermlog.format.Origin;

import java.nio.file.Path;

/**
 * Holder of the "global" {@link TermLogger}.
 *
 * <p>Set it up once with one of the {@code build} methods, use it anywhere through {@link #get()}
 * or the {@code rep*} helpers, and call {@link #delete()} before the program ends so pending
 * messages reach the file. The registry owns the instance: close it through {@link #delete()}
 * only.
 *
 * <p><b>Not thread-safe.</b> {@code build}/{@code delete} must not race with each other or with
 * users of the instance; do them before starting worker threads and after joining them.
 * The instance itself is thread-safe.
 */
public final class GlobalLogger {

    private static final Diagnostics DIAG = Diagnostics.of(GlobalLogger.class);

    private static @Nullable TermLogger instance;

    private GlobalLogger() {
    }

    // 🧩 Section: lifecycle

    /**
     * Replace the global logger with a console-only one.
     *
     * @return the new global logger
     */
    public static @NonNull TermLogger build(@NonNull FormattingOptions options) {
        return install(new TermLogger(options));
    }

    /**
     * Replace the global logger with one writing to {@code file}.
     *
     * @return the new global logger
     */
    public static @NonNull TermLogger build(@NonNull Path file, boolean append, @NonNull FormattingOptions options) {
        return install(new TermLogger(file, append, options));
    }

    /**
     * Replace the global logger with one built from {@code settings}.
     *
     * @return the new global logger
     */
    public static @NonNull TermLogger build(@NonNull LoggerSettings settings) {
        return install(new TermLogger(settings));
    }

    /**
     * Replace the global logger with one configured from {@code jtermlog.*} system properties.
     *
     * @throws IllegalArgumentException if a property value is malformed
     */
    public static @NonNull TermLogger buildFromSystemProperties() {
        return build(LoggerSettings.fromSystemProperties());
    }

    /**
     * Install an already constructed logger, closing (and so flushing) the previous one.
     *
     * @return {@code logger}
     */
    public static @NonNull TermLogger install(@NonNull TermLogger logger) {
        if (logger == null) throw new IllegalArgumentException("logger == null");
        if (instance != null && instance != logger) {
            delete();
        }
        instance = logger;
        DIAG.debug("global logger installed, file={}", logger.getLogFile().orElse(null));
        return logger;
    }

    /**
     * Close and remove the global logger.
     *
     * @return {@link LogStatus#INVALID_USE} if there is none, else {@link LogStatus#OK}
     */
    public static @NonNull LogStatus delete() {
        TermLogger current = instance;
        if (current == null) {
            return LogStatus.INVALID_USE;
        }
        current.close();
        instance = null;
        DIAG.debug("global logger deleted");
        return LogStatus.OK;
    }

    /**
     * @return the global logger, {@code null} if none was built
     */
    public static @Nullable TermLogger get() {
        return instance;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: convenience

    /**
     * Report {@code message} unchanged through the global logger, or print it to stdout if there is none.
     */
    public static void repRaw(@NonNull String message) {
        TermLogger logger = instance;
        if (logger != null) {
            logger.reportRaw(message, StreamTarget.STDOUT);
        } else {
            System.out.println(message);
        }
    }

    /**
     * Report a message tagged with the calling file, line and method.
     * Without a global logger the tag and message are printed to stdout.
     */
    public static void repMsg(@NonNull String message) {
        Origin origin = Origin.caller(1);
        TermLogger logger = instance;
        if (logger != null) {
            logger.reportMessage(origin, message, null);
        } else {
            System.out.println(fallbackTag(origin) + message);
        }
    }

    /**
     * Report an error tagged with the calling file, line and method.
     * Without a global logger {@code ERROR <tag> message} is printed to stderr.
     */
    public static void repErr(@NonNull String message) {
        Origin origin = Origin.caller(1);
        TermLogger logger = instance;
        if (logger != null) {
            logger.reportError(origin, message, null);
        } else {
            System.err.println("ERROR " + fallbackTag(origin) + message);
        }
    }

    static @NonNull String fallbackTag(@NonNull Origin origin) {
        if (origin.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("[");
        origin.file().ifPresent(f -> {
            sb.append(f);
            origin.line().ifPresent(l -> sb.append(" | ").append(l));
        });
        origin.function().ifPresent(fn -> {
            if (origin.file().isPresent()) sb.append(" | ");
            sb.append(fn).append("()");
        });
        return sb.append("]: ").toString();
    }
    // [/🧩 Section: convenience]
}
