/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/sink/FileSink.java
 description: Owns the log file path, append/truncate mode and session-header state; performs
              open-write-close for headers and message batches.
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

package tech.robd.jtermlog.sink;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtermlog.diagnostics.Diagnostics;
import tech.robd.jtermlog.format.Timestamps;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes to the log file of one logger.
 *
 * <p>State:
 * <ul>
 *   <li>{@code path}: {@code null} means no file is configured.</li>
 *   <li>{@code append}: whether the first write of a session keeps existing content.</li>
 *   <li>{@code headerWritten}: whether the current session already has its header block.</li>
 * </ul>
 * The file is opened, written and closed on every call; no handle survives between calls.
 * Not thread-safe, the owning logger serializes access.
 *
 * <p>Header block ({@code N = max(19, name length) + 10}):
 * <pre>
 * [blank line, append mode only]
 * ----- N dashes -----
 *      session name        (only if given)
 *      yyyy-MM-dd|HH:mm:ss
 * ----- N dashes -----
 * </pre>
 */
public final class FileSink {

    // 🧩 Section: constants
    private static final Diagnostics DIAG = Diagnostics.of(FileSink.class);

    /**
     * Header width ignoring the session name: the time stamp length.
     */
    static final int MIN_HEADER_TEXT = 19;

    /**
     * Padding around the header text: five spaces on either side.
     */
    static final int HEADER_PADDING = 10;

    private static final String HEADER_INDENT = "     ";
    // [/🧩 Section: constants]

    // 🧩 Section: state
    private final @NonNull Timestamps timestamps;
    private final @NonNull String lineSeparator;

    private @Nullable Path path;
    private boolean append;
    private boolean headerWritten;
    // [/🧩 Section: state]

    public FileSink(@Nullable Path path, boolean append,
                    @NonNull Timestamps timestamps, @NonNull String lineSeparator) {
        this.path = path;
        this.append = append;
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
    }

    // 🧩 Section: accessors
    public @Nullable Path path() {
        return path;
    }

    public boolean isConfigured() {
        return path != null;
    }

    public boolean isAppend() {
        return append;
    }

    public boolean isHeaderWritten() {
        return headerWritten;
    }
    // [/🧩 Section: accessors]

    // 🧩 Section: lifecycle

    /**
     * Point the sink at another file (or none). The next write starts a new session with a
     * fresh header; the previous file is left as it is.
     *
     * @param newPath   file to use, {@code null} for none
     * @param newAppend keep existing content of {@code newPath}
     */
    public void retarget(@Nullable Path newPath, boolean newAppend) {
        DIAG.debug("sink retarget {} -> {} (append={})", path, newPath, newAppend);
        this.path = newPath;
        this.append = newAppend;
        this.headerWritten = false;
    }

    /**
     * Write the session header unless this session already has one.
     *
     * @param sessionName name shown in the header, {@code null} or empty for none
     * @return {@code true} if a header was written by this call
     * @throws FileSinkException    if the file cannot be opened or written; the header stays pending
     * @throws IllegalStateException if no file is configured
     */
    public boolean ensureHeader(@Nullable String sessionName) throws FileSinkException {
        Path target = requirePath();
        if (headerWritten) {
            return false;
        }

        String name = sessionName == null ? "" : sessionName;
        String rule = "-".repeat(Math.max(MIN_HEADER_TEXT, name.length()) + HEADER_PADDING);

        OpenOption[] mode = append
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING};

        BufferedWriter out = open(target, mode);
        try (out) {
            if (append) {
                out.write(lineSeparator);
            }
            writeLine(out, rule);
            if (!name.isEmpty()) {
                writeLine(out, HEADER_INDENT + name);
            }
            writeLine(out, HEADER_INDENT + timestamps.dateTime());
            writeLine(out, rule);
        } catch (IOException e) {
            throw new FileSinkException(FileSinkException.Kind.WRITE, target, e);
        }

        headerWritten = true;
        DIAG.debug("sink header written to {} (append={}, name='{}')", target, append, name);
        return true;
    }

    /**
     * Append lines to the file, each followed by the line separator.
     * Stops at the first failure; lines written before it stay in the file.
     *
     * @param lines rendered messages in write order
     * @throws FileSinkException    if the file cannot be opened or written
     * @throws IllegalStateException if no file is configured
     */
    public void appendLines(@NonNull List<String> lines) throws FileSinkException {
        Path target = requirePath();
        BufferedWriter out = open(target,
                new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND});
        try (out) {
            for (String line : lines) {
                writeLine(out, line);
            }
        } catch (IOException e) {
            throw new FileSinkException(FileSinkException.Kind.WRITE, target, e);
        }
        DIAG.debug("sink appended {} line(s) to {}", lines.size(), target);
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: io
    private static BufferedWriter open(Path target, OpenOption[] mode) throws FileSinkException {
        try {
            return Files.newBufferedWriter(target, StandardCharsets.UTF_8, mode);
        } catch (IOException e) {
            throw new FileSinkException(FileSinkException.Kind.OPEN, target, e);
        }
    }

    private void writeLine(BufferedWriter out, String line) throws IOException {
        out.write(line);
        out.write(lineSeparator);
    }

    private Path requirePath() {
        Path p = path;
        if (p == null) {
            throw new IllegalStateException("no log file configured");
        }
        return p;
    }
    // [/🧩 Section: io]
}
