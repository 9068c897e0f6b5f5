/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/AnsiColourEncoder.java
 description: Pure encoder from TextProperties to an ANSI/VT100 SGR escape sequence.
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

/**
 * Turns {@link TextProperties} into Select Graphic Rendition sequences.
 * <p>
 * No I/O and no terminal detection happens here; whether colour is appropriate for a
 * stream is decided by {@link MessageFormatter}.
 */
@FunctionalInterface
public interface AnsiColourEncoder {

    /**
     * Escape character that starts every control sequence.
     */
    char ESC = '\u001B';

    /**
     * @param properties what the following text should look like
     * @return the escape sequence, never {@code null}
     */
    @NonNull String encode(@NonNull TextProperties properties);

    /**
     * Standard encoder: {@code ESC[0;<modifiers>;<fg>;<bg>m}.
     */
    static @NonNull AnsiColourEncoder standard() {
        return tp -> {
            StringBuilder sb = new StringBuilder(24).append(ESC).append("[0");
            // modifier bit i maps onto SGR parameter modifierCodes[i]
            int[] modifierCodes = {1, 2, 3, 4, 5, 7, 8, 9};
            for (int bit = 0; bit < modifierCodes.length; bit++) {
                if ((tp.modifiers() & (1 << bit)) != 0) {
                    sb.append(';').append(modifierCodes[bit]);
                }
            }
            sb.append(';').append(colourCode(tp.foreground(), tp.brightForeground(), 30));
            sb.append(';').append(colourCode(tp.background(), tp.brightBackground(), 40));
            return sb.append('m').toString();
        };
    }

    private static int colourCode(Colour colour, boolean bright, int base) {
        if (colour == Colour.DEFAULT) {
            return base + Colour.DEFAULT.code();
        }
        return (bright ? base + 60 : base) + colour.code();
    }

    /**
     * Count the characters in {@code s} that belong to CSI escape sequences.
     *
     * @param s text that may contain {@code ESC[...<final byte>} sequences
     * @return number of escape characters, so that {@code s.length() - result} is the visible width
     */
    static int escapeLength(@NonNull CharSequence s) {
        int count = 0;
        int i = 0;
        while (i < s.length()) {
            if (s.charAt(i) == ESC && i + 1 < s.length() && s.charAt(i + 1) == '[') {
                int j = i + 2;
                while (j < s.length() && (s.charAt(j) < 0x40 || s.charAt(j) > 0x7E)) j++;
                int end = Math.min(j + 1, s.length());
                count += end - i;
                i = end;
            } else {
                i++;
            }
        }
        return count;
    }
}
