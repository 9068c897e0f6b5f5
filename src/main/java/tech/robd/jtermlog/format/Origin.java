/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/Origin.java
 description: Where a message comes from: independently optional file, line and function.
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
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Origin metadata rendered in front of a message as {@code [file | line | function()]: }.
 * <p>
 * Each part may be absent on its own. The line is only printed together with a file.
 * Empty strings are treated like absent values.
 *
 * @param file     source file name
 * @param line     line number inside {@code file}
 * @param function function or method name, rendered with {@code ()}
 */
public record Origin(@NonNull Optional<String> file,
                     @NonNull OptionalInt line,
                     @NonNull Optional<String> function) {

    private static final Origin NONE = new Origin(Optional.empty(), OptionalInt.empty(), Optional.empty());

    public Origin {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(function, "function");
        file = file.filter(s -> !s.isEmpty());
        function = function.filter(s -> !s.isEmpty());
    }

    // 🧩 Section: factories

    /**
     * @return an origin that renders no tag at all
     */
    public static @NonNull Origin none() {
        return NONE;
    }

    /**
     * @param file     source file, may be {@code null}
     * @param line     line number
     * @param function function name, may be {@code null}
     */
    public static @NonNull Origin of(@Nullable String file, int line, @Nullable String function) {
        return new Origin(Optional.ofNullable(file), OptionalInt.of(line), Optional.ofNullable(function));
    }

    /**
     * @param file source file
     * @param line line number
     */
    public static @NonNull Origin of(@NonNull String file, int line) {
        return new Origin(Optional.of(file), OptionalInt.of(line), Optional.empty());
    }

    /**
     * @param function function name, rendered as {@code [function()]: }
     */
    public static @NonNull Origin function(@NonNull String function) {
        return new Origin(Optional.empty(), OptionalInt.empty(), Optional.of(function));
    }

    /**
     * Capture a frame of the current call stack: {@code 0} is the method invoking
     * {@code caller}, {@code 1} is whoever called that method, and so on.
     *
     * @param skipFrames how far up the stack to look
     * @return origin of that frame, or {@link #none()} if the stack is too short
     */
    public static @NonNull Origin caller(int skipFrames) {
        // +1 skips caller() itself
        return StackWalker.getInstance()
                .walk(frames -> frames.skip(skipFrames + 1L).findFirst())
                .map(f -> new Origin(
                        Optional.ofNullable(f.getFileName()),
                        f.getLineNumber() >= 0 ? OptionalInt.of(f.getLineNumber()) : OptionalInt.empty(),
                        Optional.of(f.getMethodName())))
                .orElse(NONE);
    }
    // [/🧩 Section: factories]

    /**
     * @return true if neither file nor function is present, so no tag is rendered
     */
    public boolean isEmpty() {
        return file.isEmpty() && function.isEmpty();
    }
}
