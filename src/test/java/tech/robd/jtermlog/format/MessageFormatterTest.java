/*
 [File Info]
 path: src/test/java/tech/robd/jtermlog/format/MessageFormatterTest.java
 description: Tag layout, colour/time stamp placement, line breaking and extra indentation of rendered messages.
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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jtermlog.TerminalProbe;
import tech.robd.jtermlog.tools.CapturedConsole;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageFormatterTest {

    private static final String NL = "\n";

    private static MessageFormatter formatter(int terminalWidth, boolean interactive) {
        return new MessageFormatter(AnsiColourEncoder.standard(),
                TerminalProbe.fixed(terminalWidth, interactive),
                new Timestamps(CapturedConsole.FIXED_CLOCK), NL);
    }

    private static final MessageFormatter PLAIN_TTY = formatter(80, false);

    @Test
    @DisplayName("No origin and no wrapping returns the text unchanged")
    void identityWithoutTagOrWrapping() {
        String text = "a message with  spacing\nand a second line";
        assertEquals(text, PLAIN_TTY.compose(Origin.none(), text, false, false, FormattingOptions.plain()));
    }

    @Test
    void fullOriginTag() {
        String s = PLAIN_TTY.compose(Origin.of("a.cpp", 10, "main"), "hello", false, false, FormattingOptions.plain());
        assertEquals("[a.cpp | 10 | main()]: hello", s);
    }

    @Test
    void fileAndLineOnly() {
        String s = PLAIN_TTY.compose(Origin.of("a.cpp", 10), "hello", false, false, FormattingOptions.plain());
        assertEquals("[a.cpp | 10]: hello", s);
    }

    @Test
    void functionOnly() {
        String s = PLAIN_TTY.compose(Origin.function("main"), "hello", false, false, FormattingOptions.plain());
        assertEquals("[main()]: hello", s);
    }

    @Test
    void emptyStringsCountAsAbsent() {
        String s = PLAIN_TTY.compose(Origin.of("", 3, ""), "hello", false, false, FormattingOptions.plain());
        assertEquals("hello", s);
    }

    @Test
    void errorTagComesBeforeOrigin() {
        String s = PLAIN_TTY.compose(Origin.function("f"), "boom", true, false, FormattingOptions.plain());
        assertEquals(" ERROR  [f()]: boom", s);
    }

    @Test
    @DisplayName("Time stamp is only inserted into file output")
    void timestampOnlyForFile() {
        FormattingOptions o = FormattingOptions.plain().withLogDate(true).withLogTime(true);
        assertEquals("(2025-03-14|09:26:53) msg", PLAIN_TTY.compose(Origin.none(), "msg", false, true, o));
        assertEquals("msg", PLAIN_TTY.compose(Origin.none(), "msg", false, false, o));

        assertEquals("(09:26:53) msg",
                PLAIN_TTY.compose(Origin.none(), "msg", false, true, FormattingOptions.plain().withLogTime(true)));
        assertEquals("(2025-03-14) msg",
                PLAIN_TTY.compose(Origin.none(), "msg", false, true, FormattingOptions.plain().withLogDate(true)));
    }

    @Test
    void indentPrefixesEveryLine() {
        FormattingOptions o = FormattingOptions.plain().withIndent(2);
        assertEquals("  one" + NL + "  two", PLAIN_TTY.compose(Origin.none(), "one\ntwo", false, false, o));
    }

    @Test
    @DisplayName("Colour escapes appear on an interactive console only")
    void colourOnlyOnInteractiveConsole() {
        FormattingOptions o = FormattingOptions.plain().withColoured(true);
        MessageFormatter tty = formatter(80, true);

        String console = tty.compose(Origin.of("a.cpp", 10, "main"), "hello", true, false, o);
        assertTrue(console.indexOf(AnsiColourEncoder.ESC) >= 0);
        assertTrue(console.endsWith("main()]: hello"));

        String file = tty.compose(Origin.of("a.cpp", 10, "main"), "hello", true, true, o);
        assertEquals(-1, file.indexOf(AnsiColourEncoder.ESC));
        assertEquals(" ERROR  [a.cpp | 10 | main()]: hello", file);

        String piped = PLAIN_TTY.compose(Origin.of("a.cpp", 10, "main"), "hello", true, false, o);
        assertEquals(-1, piped.indexOf(AnsiColourEncoder.ESC));
    }

    @Test
    @DisplayName("Escape bytes do not count towards the extra indent")
    void escapesExcludedFromExtraIndent() {
        FormattingOptions o = FormattingOptions.plain().withColoured(true).withExtraIndent(true);
        String s = formatter(80, true).compose(Origin.of("f.c", 1), "x\ny", false, false, o);
        String[] lines = s.split(NL, -1);
        assertEquals(2, lines.length);
        assertEquals(" ".repeat("[f.c | 1]: ".length()) + "y", lines[1]);
    }

    @Test
    @DisplayName("A long single line splits into ceil(L / width) pieces that rebuild the input")
    void wrapsLongLine() {
        int width = 10;
        String text = "abcdefghijklmnopqrstuvwxyz0123456789!";  // 37 characters
        FormattingOptions o = FormattingOptions.plain().withWrapTty(true).withMaxLineWidthTty(width);

        String s = PLAIN_TTY.compose(Origin.none(), text, false, false, o);
        String[] lines = s.split(NL, -1);

        assertEquals((text.length() + width - 1) / width, lines.length);
        StringBuilder rebuilt = new StringBuilder();
        for (String line : lines) {
            assertTrue(line.length() <= width, () -> "too long: '" + line + "'");
            rebuilt.append(line);
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    void continuationLinesAlignUnderBody() {
        FormattingOptions o = FormattingOptions.plain()
                .withWrapTty(true).withMaxLineWidthTty(30).withExtraIndent(true);
        String tag = "[main()]: ";                    // 10 visible characters
        String text = "x".repeat(45);

        String[] lines = PLAIN_TTY.compose(Origin.function("main"), text, false, false, o).split(NL, -1);

        assertEquals(tag + "x".repeat(20), lines[0]);
        assertEquals(" ".repeat(10) + "x".repeat(20), lines[1]);
        assertEquals(" ".repeat(10) + "x".repeat(5), lines[2]);
        assertEquals(3, lines.length);
    }

    @Test
    void withoutExtraIndentContinuationUsesFullWidth() {
        FormattingOptions o = FormattingOptions.plain()
                .withWrapTty(true).withMaxLineWidthTty(30).withExtraIndent(false);
        String[] lines = PLAIN_TTY.compose(Origin.function("main"), "y".repeat(60), false, false, o).split(NL, -1);

        assertEquals("[main()]: " + "y".repeat(20), lines[0]);
        assertEquals("y".repeat(30), lines[1]);
        assertEquals("y".repeat(10), lines[2]);
    }

    @Test
    void fileWidthInheritsTtyWidthWhenZero() {
        FormattingOptions o = FormattingOptions.plain().withWrapFile(true).withMaxLineWidthTty(8);
        String s = PLAIN_TTY.compose(Origin.none(), "0123456789abcdef", false, true, o);
        assertEquals(List.of("01234567", "89abcdef"), List.of(s.split(NL)));

        FormattingOptions own = o.withMaxLineWidthFile(4);
        assertEquals(4, PLAIN_TTY.compose(Origin.none(), "0123456789abcdef", false, true, own).split(NL).length);
    }

    @Test
    void autoDetectedWidthComesFromProbe() {
        FormattingOptions o = FormattingOptions.plain().withWrapTty(true);
        String s = formatter(5, false).compose(Origin.none(), "0123456789", false, false, o);
        assertEquals("01234" + NL + "56789", s);
    }

    @Test
    void trailingNewlineDoesNotAddALine() {
        assertEquals("done", PLAIN_TTY.compose(Origin.none(), "done\n", false, false, FormattingOptions.plain()));
        assertEquals(List.of("a", ""), MessageFormatter.logicalLines("a\n\n"));
        assertEquals(List.of(""), MessageFormatter.logicalLines(""));
    }

    @Test
    void blankLinesInsideMessageAreKept() {
        FormattingOptions o = FormattingOptions.plain().withWrapTty(true).withMaxLineWidthTty(40);
        assertEquals("a" + NL + NL + "b", PLAIN_TTY.compose(Origin.none(), "a\n\nb", false, false, o));
    }

    @Test
    @DisplayName("Very narrow width with a large indent still makes progress")
    @Timeout(2)
    void tinyWidthLargeIndent() {
        FormattingOptions o = FormattingOptions.plain()
                .withWrapTty(true).withMaxLineWidthTty(4).withIndent(10).withExtraIndent(true);
        String s = PLAIN_TTY.compose(Origin.function("run"), "abc", false, false, o);
        String[] lines = s.split(NL, -1);

        assertEquals(3, lines.length);
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            assertTrue(line.startsWith(" ".repeat(10)));
            body.append(i == 0 ? line.substring(line.length() - 1) : line.trim());
        }
        assertEquals("abc", body.toString());
    }

    @Test
    void wrapNeverSplitsASurrogatePair() {
        FormattingOptions o = FormattingOptions.plain().withWrapTty(true).withMaxLineWidthTty(5);
        String text = "abcd\uD83D\uDE00ef";
        String s = PLAIN_TTY.compose(Origin.none(), text, false, false, o);

        assertEquals("abcd" + NL + "\uD83D\uDE00ef", s);
        assertEquals(text, s.replace(NL, ""));
    }

    @Test
    void cutKeepsPairsTogether() {
        String pair = "\uD83D\uDE00";
        assertEquals(3, MessageFormatter.cut("abc" + pair, 0, 3));
        assertEquals(1, MessageFormatter.cut("a" + pair + "b", 0, 2));
        assertEquals(2, MessageFormatter.cut(pair + "b", 0, 1));
        assertEquals(5, MessageFormatter.cut("abcdefg", 2, 3));
    }

    @Test
    void extraIndentClamp() {
        assertEquals(10, MessageFormatter.clampExtraIndent(10, 30));
        assertEquals(20, MessageFormatter.clampExtraIndent(20, 30));
        assertEquals(10, MessageFormatter.clampExtraIndent(21, 30));
        assertEquals(0, MessageFormatter.clampExtraIndent(5, 1));
    }
}
