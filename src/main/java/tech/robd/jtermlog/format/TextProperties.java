/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/TextProperties.java
 description: Immutable description of how a span of terminal text should look.
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

package tech.robd.jtermlog.format;

import org.jspecify.annotations.NonNull;

import java.util.Objects;

/**
 * Foreground/background colours plus a bit set of modifiers.
 * <p>
 * {@link #plain()} encodes to a full reset and is used to end a coloured span.
 *
 * @param foreground      foreground colour
 * @param brightForeground use the high intensity variant of the foreground
 * @param background      background colour
 * @param brightBackground use the high intensity variant of the background
 * @param modifiers       bitwise OR of the {@code BOLD}...{@code STRIKE_OUT} constants
 */
public record TextProperties(@NonNull Colour foreground,
                             boolean brightForeground,
                             @NonNull Colour background,
                             boolean brightBackground,
                             int modifiers) {

    public static final int NORMAL = 0;
    public static final int BOLD = 1;
    public static final int DIM = 1 << 1;
    public static final int SLANT = 1 << 2;
    public static final int UNDERLINE = 1 << 3;
    public static final int BLINK = 1 << 4;
    public static final int INVERSE = 1 << 5;
    public static final int HIDDEN = 1 << 6;
    public static final int STRIKE_OUT = 1 << 7;

    private static final TextProperties PLAIN =
            new TextProperties(Colour.DEFAULT, false, Colour.DEFAULT, false, NORMAL);

    public TextProperties {
        Objects.requireNonNull(foreground, "foreground");
        Objects.requireNonNull(background, "background");
        if (modifiers < 0 || modifiers > 0xFF) {
            throw new IllegalArgumentException("modifiers out of range: " + modifiers);
        }
    }

    /**
     * @return default colours without modifiers
     */
    public static @NonNull TextProperties plain() {
        return PLAIN;
    }

    /**
     * @param fg foreground colour, everything else default
     */
    public static @NonNull TextProperties foreground(@NonNull Colour fg) {
        return new TextProperties(fg, false, Colour.DEFAULT, false, NORMAL);
    }

    /**
     * @param fg     foreground colour
     * @param bright high intensity foreground
     */
    public static @NonNull TextProperties foreground(@NonNull Colour fg, boolean bright) {
        return new TextProperties(fg, bright, Colour.DEFAULT, false, NORMAL);
    }

    public boolean has(int modifier) {
        return (modifiers & modifier) != 0;
    }
}
