/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/ConsoleSink.java
 description: The pair of print streams a logger writes to, plus the probe describing the terminal behind them.
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

import java.io.PrintStream;
import java.util.Objects;

/**
 * Console side of a logger. Swap in capturing streams for tests.
 *
 * @param out   receives regular messages
 * @param err   receives errors and the logger's own failure reports
 * @param probe terminal width and interactivity
 */
public record ConsoleSink(@NonNull PrintStream out,
                          @NonNull PrintStream err,
                          @NonNull TerminalProbe probe) {

    public ConsoleSink {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        Objects.requireNonNull(probe, "probe");
    }

    /**
     * {@link System#out}, {@link System#err} and {@link TerminalProbe#system()}.
     */
    public static @NonNull ConsoleSink system() {
        return new ConsoleSink(System.out, System.err, TerminalProbe.system());
    }

    /**
     * @param target stream selector
     * @return the matching print stream
     */
    @NonNull PrintStream stream(@NonNull StreamTarget target) {
        return target == StreamTarget.STDERR ? err : out;
    }

    /**
     * Print one rendered message and flush.
     */
    void print(@NonNull StreamTarget target, @NonNull String rendered) {
        PrintStream ps = stream(target);
        ps.println(rendered);
        ps.flush();
    }
}
