/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/sink/FileSinkException.java
 description: Checked exception for a log file that could not be opened or written.
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

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown by {@link FileSink} when the log file cannot be opened or written.
 * <p>
 * The message has the form shown to operators on the error stream, e.g.
 * {@code Logger: Could not open log file 'run.log': Permission denied}.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class FileSinkException extends IOException {

    // [🧩 Section: api]

    /**
     * Which step of the file operation failed.
     */
    public enum Kind {
        /**
         * The file could not be created or opened.
         */
        OPEN,
        /**
         * The file was open but a write or close failed.
         */
        WRITE
    }

    private final @NonNull Kind kind;
    private final @NonNull Path path;

    public FileSinkException(@NonNull Kind kind, @NonNull Path path, @NonNull IOException cause) {
        super(describe(kind, path, cause), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = path;
    }

    public @NonNull Kind kind() {
        return kind;
    }

    public @NonNull Path path() {
        return path;
    }

    private static String describe(Kind kind, Path path, IOException cause) {
        String reason = reason(cause);
        return switch (kind) {
            case OPEN -> "Logger: Could not open log file '" + path + "': " + reason;
            case WRITE -> "Logger: Error writing to log file '" + path + "': " + reason;
        };
    }

    // NIO file system exceptions put the path in getMessage(); the OS text is in getReason()
    private static String reason(IOException cause) {
        String text = cause instanceof FileSystemException fse ? fse.getReason() : cause.getMessage();
        return text != null ? text : cause.getClass().getSimpleName();
    }
    // [/🧩 Section: api]
}
