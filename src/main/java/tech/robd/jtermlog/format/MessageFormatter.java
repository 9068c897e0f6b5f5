/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/MessageFormatter.java
 description: Renders origin tag, error flag, time stamp and message body into one string,
              breaking long lines at the destination width and aligning continuation lines.
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
import tech.robd.jtermlog.StreamTarget;
import tech.robd.jtermlog.TerminalProbe;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw text plus origin metadata into the exact string that is printed or queued.
 *
 * <p>Layout of the first physical line:
 * <pre>
 *   &lt;indent&gt;(&lt;time stamp&gt;)  ERROR  [file | line | function()]: message...
 * </pre>
 * <ul>
 *   <li>The time stamp only appears in file output.</li>
 *   <li>Colour escapes only appear in console output, and only if the stream is a terminal.</li>
 *   <li>Continuation lines start with the indent plus, when enabled, enough spaces to line up
 *       with the message body ("extra indent").</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class MessageFormatter {

    // 🧩 Section: constants
    /**
     * Width assumed for the extra indent clamp when line breaking is off.
     */
    static final int UNWRAPPED_WIDTH = 80;

    static final String ERROR_TAG = " ERROR  ";

    private static final TextProperties ERROR_STYLE = TextProperties.foreground(Colour.RED, true);
    private static final TextProperties FILE_STYLE = TextProperties.foreground(Colour.YELLOW);
    private static final TextProperties LINE_STYLE = TextProperties.foreground(Colour.GREEN);
    // [/🧩 Section: constants]

    // 🧩 Section: state
    private final @NonNull AnsiColourEncoder encoder;
    private final @NonNull TerminalProbe probe;
    private final @NonNull Timestamps timestamps;
    private final @NonNull String lineSeparator;
    // [/🧩 Section: state]

    public MessageFormatter(@NonNull TerminalProbe probe) {
        this(AnsiColourEncoder.standard(), probe, Timestamps.system(), System.lineSeparator());
    }

    public MessageFormatter(@NonNull AnsiColourEncoder encoder,
                            @NonNull TerminalProbe probe,
                            @NonNull Timestamps timestamps,
                            @NonNull String lineSeparator) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
        if (lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("lineSeparator must not be empty");
        }
    }

    public @NonNull String lineSeparator() {
        return lineSeparator;
    }

    public @NonNull Timestamps timestamps() {
        return timestamps;
    }

    // 🧩 Section: compose

    /**
     * Render a message.
     *
     * @param origin  where the message comes from, {@link Origin#none()} for no tag
     * @param text    message body, may contain {@code '\n'}
     * @param error   flag the message as an error (also selects stderr for colour detection)
     * @param toFile  render for the log file (time stamp, never colour) instead of the console
     * @param options formatting switches
     * @return the rendered message, physical lines joined by {@link #lineSeparator()}
     */
    public @NonNull String compose(@NonNull Origin origin,
                                   @NonNull String text,
                                   boolean error,
                                   boolean toFile,
                                   @NonNull FormattingOptions options) {
        StreamTarget stream = StreamTarget.forMessage(error);
        boolean colour = !toFile && options.coloured() && probe.isInteractive(stream);
        int contentWidth = Math.max(1, lineWidth(toFile, options) - options.indent());

        String indent = " ".repeat(options.indent());
        StringBuilder sb = new StringBuilder(indent.length() + text.length() + 64).append(indent);

        if (toFile && options.insertTimestamp()) {
            sb.append('(').append(timestamps.dateTime(options.logDate(), options.logTime())).append(") ");
        }
        if (error) {
            styled(sb, colour, ERROR_STYLE, ERROR_TAG);
        }
        appendOriginTag(sb, origin, colour);

        // 🧩 Point: compose/extra-indent
        int visiblePrefix = sb.length() - indent.length() - AnsiColourEncoder.escapeLength(sb);
        int extraIndentWidth = clampExtraIndent(visiblePrefix, contentWidth);
        String continuation = options.extraIndent() ? indent + " ".repeat(extraIndentWidth) : indent;

        List<String> lines = logicalLines(text);
        if (options.wraps(toFile)) {
            appendWrapped(sb, lines, contentWidth, extraIndentWidth, options.extraIndent(), continuation);
        } else {
            appendVerbatim(sb, lines, continuation);
        }
        return sb.toString();
    }
    // [/🧩 Section: compose]

    // 🧩 Section: width

    /**
     * Width of a physical line (indent included) for the given destination.
     */
    int lineWidth(boolean toFile, @NonNull FormattingOptions options) {
        if (!options.wraps(toFile)) {
            return UNWRAPPED_WIDTH;
        }
        int width = options.maxLineWidthTty();
        if (toFile && options.maxLineWidthFile() != 0) {
            width = options.maxLineWidthFile();
        }
        return width != 0 ? width : Math.max(1, probe.width());
    }

    /**
     * Keep at least a third of the content width for the message body.
     *
     * @param natural      visible width of everything in front of the body
     * @param contentWidth line width minus indent, at least 1
     * @return the extra indent to use for continuation lines
     */
    static int clampExtraIndent(int natural, int contentWidth) {
        if (natural > contentWidth * 2 / 3) {
            return contentWidth / 3;
        }
        return natural;
    }
    // [/🧩 Section: width]

    // 🧩 Section: tag
    private void appendOriginTag(StringBuilder sb, Origin origin, boolean colour) {
        if (origin.file().isPresent()) {
            sb.append('[');
            styled(sb, colour, FILE_STYLE, origin.file().get());
            if (origin.line().isPresent()) {
                sb.append(" | ");
                styled(sb, colour, LINE_STYLE, Integer.toString(origin.line().getAsInt()));
            }
            sb.append(origin.function().isPresent() ? " | " : "]: ");
        }
        if (origin.function().isPresent()) {
            if (origin.file().isEmpty()) {
                sb.append('[');
            }
            sb.append(origin.function().get()).append("()]: ");
        }
    }

    private void styled(StringBuilder sb, boolean colour, TextProperties style, String text) {
        if (colour) sb.append(encoder.encode(style));
        sb.append(text);
        if (colour) sb.append(encoder.encode(TextProperties.plain()));
    }
    // [/🧩 Section: tag]

    // 🧩 Section: body
    private void appendWrapped(StringBuilder sb,
                               List<String> lines,
                               int contentWidth,
                               int extraIndentWidth,
                               boolean extraIndent,
                               String continuation) {
        int firstWidth = Math.max(1, contentWidth - extraIndentWidth);
        int restWidth = extraIndent ? firstWidth : contentWidth;

        boolean first = true;
        for (String line : lines) {
            int start = 0;
            if (first) {
                first = false;
                if (line.length() <= firstWidth) {
                    sb.append(line);
                    continue;
                }
                start = cut(line, 0, firstWidth);
                sb.append(line, 0, start);
            } else if (line.isEmpty()) {
                sb.append(lineSeparator);
                continue;
            }
            // each pass consumes restWidth >= 1 characters
            while (line.length() - start > restWidth) {
                int end = cut(line, start, restWidth);
                sb.append(lineSeparator).append(continuation).append(line, start, end);
                start = end;
            }
            if (start < line.length()) {
                sb.append(lineSeparator).append(continuation).append(line, start, line.length());
            }
        }
    }

    /**
     * End index of a chunk of {@code width} chars starting at {@code start}, moved so that it
     * never separates a surrogate pair. Always greater than {@code start}.
     */
    static int cut(String line, int start, int width) {
        int end = start + width;
        if (end < line.length()
                && Character.isHighSurrogate(line.charAt(end - 1))
                && Character.isLowSurrogate(line.charAt(end))) {
            // keep the pair together; a one-char chunk takes the whole pair instead
            end = end - 1 > start ? end - 1 : end + 1;
        }
        return end;
    }

    private void appendVerbatim(StringBuilder sb, List<String> lines, String continuation) {
        boolean first = true;
        for (String line : lines) {
            if (first) {
                sb.append(line);
                first = false;
            } else if (line.isEmpty()) {
                sb.append(lineSeparator);
            } else {
                sb.append(lineSeparator).append(continuation).append(line);
            }
        }
    }

    /**
     * Split on {@code '\n'}. A single trailing newline does not start another line.
     */
    static List<String> logicalLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (start < text.length() || lines.isEmpty()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
    // [/🧩 Section: body]
}
