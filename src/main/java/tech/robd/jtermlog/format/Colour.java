/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/format/Colour.java
 description: Terminal colours, ordinal values match the ANSI colour offsets.
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

/**
 * Colours understood by ANSI/VT100 terminals.
 */
public enum Colour {
    BLACK(0), RED(1), GREEN(2), YELLOW(3), BLUE(4), PURPLE(5), CYAN(6), WHITE(7),
    /**
     * The terminal's own default colour.
     */
    DEFAULT(9);

    private final int code;

    Colour(int code) {
        this.code = code;
    }

    /**
     * @return offset added to the SGR base (30 foreground, 40 background)
     */
    public int code() {
        return code;
    }
}
