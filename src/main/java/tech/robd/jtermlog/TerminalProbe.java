/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/TerminalProbe.java
 description: Queries terminal width and whether a standard stream is an interactive terminal.
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

package tech.robd.jtermlog;

import org.jspecify.annotations.NonNull;

/**
 * Terminal capabilities needed by the formatter.
 * <p>
 * {@link #width()} is only consulted when a configured line width is {@code 0}.
 */
public interface TerminalProbe {

    /**
     * Width used when nothing better is known.
     */
    int DEFAULT_WIDTH = 80;

    /**
     * @return number of columns, at least 1
     */
    int width();

    /**
     * @param stream stream that would receive coloured output
     * @return whether escape sequences make sense on it
     */
    boolean isInteractive(@NonNull StreamTarget stream);

    /**
     * Probe for the running JVM.
     * <ul>
     *   <li>Width: the {@code COLUMNS} environment variable if it is a positive number,
     *       else {@value #DEFAULT_WIDTH}.</li>
     *   <li>Interactive: {@code TERM} is set and not {@code dumb}, and {@link System#console()}
     *       is present (it is {@code null} when output is piped or redirected).</li>
     * </ul>
     */
    static @NonNull TerminalProbe system() {
        return new TerminalProbe() {
            @Override
            public int width() {
                String columns = System.getenv("COLUMNS");
                if (columns != null) {
                    try {
                        int w = Integer.parseInt(columns.trim());
                        if (w > 0) return Math.min(w, 0xFFFF);
                    } catch (NumberFormatException ignored) {
                        // fall through to the default
                    }
                }
                return DEFAULT_WIDTH;
            }

            @Override
            public boolean isInteractive(@NonNull StreamTarget stream) {
                String term = System.getenv("TERM");
                if (term == null || term.equals("dumb")) {
                    return false;
                }
                return System.console() != null;
            }
        };
    }

    /**
     * Fixed answers, for tests and for redirected output with a known layout.
     *
     * @param width       columns to report
     * @param interactive whether every stream counts as a terminal
     */
    static @NonNull TerminalProbe fixed(int width, boolean interactive) {
        if (width <= 0) throw new IllegalArgumentException("width > 0");
        return new TerminalProbe() {
            @Override
            public int width() {
                return width;
            }

            @Override
            public boolean isInteractive(@NonNull StreamTarget stream) {
                return interactive;
            }
        };
    }
}
