/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/diagnostics/Diagnostics.java
 description: Internal tracing of the logger's own queue/flush/sink behaviour through SLF4J.
              Debug output is switched by the `jtermlog.diag` system property; warnings always pass.
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

package tech.robd.jtermlog.diagnostics;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Diagnostics channel bound to an owning {@link Class}.
 * <p>
 * {@code TermLogger} is itself a logger, so it cannot report on its own queue and file
 * handling through itself. Those events go to SLF4J instead:
 * <ul>
 *   <li>{@link #debug(String, Object...)} traces enqueue/flush/header events and is dropped
 *       unless diagnostics are enabled ({@code -Djtermlog.diag=true} or {@link #enable()}).</li>
 *   <li>{@link #warn(String, Object...)} is used for I/O failures and is always forwarded.</li>
 * </ul>
 * Instances are cheap; hold one per class in a {@code static final} field.
 */
public final class Diagnostics {

    // 🧩 Section: global-switch
    /**
     * System property that turns debug tracing on: {@code -Djtermlog.diag=true}.
     */
    public static final String DIAGNOSTICS_PROPERTY_NAME = "jtermlog.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());

    /**
     * Turn debug tracing on for every instance.
     */
    public static void enable() {
        enabled = true;
    }

    /**
     * Turn debug tracing off. Warnings are unaffected.
     */
    public static void disable() {
        enabled = false;
    }

    /**
     * @return whether debug tracing is currently on
     */
    public static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: global-switch]

    // 🧩 Section: instance
    private final @NonNull Class<?> owner;
    private final @NonNull Logger log;

    private Diagnostics(@NonNull Class<?> owner) {
        this.owner = owner;
        this.log = LoggerFactory.getLogger(owner);
    }

    /**
     * Create the diagnostics channel for {@code owner}.
     *
     * @param owner class the messages are attributed to
     * @return a new channel
     */
    public static @NonNull Diagnostics of(@NonNull Class<?> owner) {
        return new Diagnostics(Objects.requireNonNull(owner, "owner"));
    }

    /**
     * @return the class this channel reports for
     */
    public @NonNull Class<?> owner() {
        return owner;
    }
    // [/🧩 Section: instance]

    // 🧩 Section: emitters

    /**
     * Trace an internal event; no-op unless enabled.
     *
     * @param msg  SLF4J message pattern
     * @param args pattern arguments
     */
    public void debug(@NonNull String msg, @Nullable Object... args) {
        if (!enabled) return; // fast path
        if (log.isDebugEnabled()) {
            log.debug(msg, args);
        }
    }

    /**
     * Report a failure the caller also sees as a status value.
     *
     * @param msg  SLF4J message pattern
     * @param args pattern arguments, a trailing {@link Throwable} is logged with its stack trace
     */
    public void warn(@NonNull String msg, @Nullable Object... args) {
        log.warn(msg, args);
    }
    // [/🧩 Section: emitters]
}
