/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/FormattingOptions.java
 description: Immutable switches and widths that control how MessageFormatter renders a message.
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

package tech.robd.jtermlog.format;

import org.jspecify.annotations.NonNull;

/**
 * Output properties of a logger.
 *
 * <p>Widths are 16 bit unsigned quantities ({@code 0..65535}):
 * <ul>
 *   <li>{@code maxLineWidthTty == 0}: ask the terminal for its width.</li>
 *   <li>{@code maxLineWidthFile == 0}: use the TTY width (after auto-detection).</li>
 * </ul>
 * Use {@link #defaults()} and the {@code with*} methods rather than the canonical constructor.
 *
 * @param coloured         colour console output when the stream is a terminal
 * @param logDate          put the date into the file timestamp
 * @param logTime          put the time into the file timestamp
 * @param wrapTty          break long lines on the console
 * @param wrapFile         break long lines in the log file
 * @param indent           spaces in front of every physical line
 * @param maxLineWidthTty  console line width, 0 for auto-detection
 * @param maxLineWidthFile file line width, 0 to inherit the console width
 * @param extraIndent      align continuation lines under the message body
 */
public record FormattingOptions(boolean coloured,
                                boolean logDate,
                                boolean logTime,
                                boolean wrapTty,
                                boolean wrapFile,
                                int indent,
                                int maxLineWidthTty,
                                int maxLineWidthFile,
                                boolean extraIndent) {

    /**
     * Upper bound of indent and widths.
     */
    public static final int MAX_WIDTH = 0xFFFF;

    private static final FormattingOptions DEFAULTS =
            new FormattingOptions(true, false, true, true, true, 0, 0, 0, true);

    public FormattingOptions {
        checkRange("indent", indent);
        checkRange("maxLineWidthTty", maxLineWidthTty);
        checkRange("maxLineWidthFile", maxLineWidthFile);
    }

    private static void checkRange(String name, int value) {
        if (value < 0 || value > MAX_WIDTH) {
            throw new IllegalArgumentException(name + " must be in 0.." + MAX_WIDTH + ": " + value);
        }
    }

    /**
     * Colour, time stamps without date, wrapping on both destinations, extra indentation,
     * no indent, auto-detected widths.
     */
    public static @NonNull FormattingOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Everything off: no colour, no time stamp, no wrapping, no indentation.
     * Rendering with these options and an empty origin returns the input text unchanged.
     */
    public static @NonNull FormattingOptions plain() {
        return new FormattingOptions(false, false, false, false, false, 0, 0, 0, false);
    }

    /**
     * @return whether a file line gets a {@code (timestamp) } prefix
     */
    public boolean insertTimestamp() {
        return logDate || logTime;
    }

    /**
     * @param toFile destination of the message
     * @return whether long lines are broken for that destination
     */
    public boolean wraps(boolean toFile) {
        return toFile ? wrapFile : wrapTty;
    }

    // 🧩 Section: withers
    public @NonNull FormattingOptions withColoured(boolean v) {
        return new FormattingOptions(v, logDate, logTime, wrapTty, wrapFile, indent, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withLogDate(boolean v) {
        return new FormattingOptions(coloured, v, logTime, wrapTty, wrapFile, indent, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withLogTime(boolean v) {
        return new FormattingOptions(coloured, logDate, v, wrapTty, wrapFile, indent, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withWrapTty(boolean v) {
        return new FormattingOptions(coloured, logDate, logTime, v, wrapFile, indent, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withWrapFile(boolean v) {
        return new FormattingOptions(coloured, logDate, logTime, wrapTty, v, indent, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withIndent(int v) {
        return new FormattingOptions(coloured, logDate, logTime, wrapTty, wrapFile, v, maxLineWidthTty, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withMaxLineWidthTty(int v) {
        return new FormattingOptions(coloured, logDate, logTime, wrapTty, wrapFile, indent, v, maxLineWidthFile, extraIndent);
    }

    public @NonNull FormattingOptions withMaxLineWidthFile(int v) {
        return new FormattingOptions(coloured, logDate, logTime, wrapTty, wrapFile, indent, maxLineWidthTty, v, extraIndent);
    }

    public @NonNull FormattingOptions withExtraIndent(boolean v) {
        return new FormattingOptions(coloured, logDate, logTime, wrapTty, wrapFile, indent, maxLineWidthTty, maxLineWidthFile, v);
    }
    // [/🧩 Section: withers]
}
