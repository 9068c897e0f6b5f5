/*
 [File Info]
 path: src/test/java/tech/robd/jtermlog/TermLoggerTest.java
 description: Queue/flush protocol, header lifecycle, status values and console routing of TermLogger.
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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.robd.jtermlog.format.AnsiColourEncoder;
import tech.robd.jtermlog.format.FormattingOptions;
import tech.robd.jtermlog.format.Origin;
import tech.robd.jtermlog.tools.CapturedConsole;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermLoggerTest {

    private static final String RULE = "-".repeat(29);

    @TempDir
    Path dir;

    private CapturedConsole console;

    @BeforeEach
    void setUp() {
        console = new CapturedConsole();
    }

    private TermLogger logger(Path file, boolean append, int maxQueue) {
        return new TermLogger(new LoggerSettings(file, append, maxQueue, FormattingOptions.defaults()),
                console.sink(), CapturedConsole.FIXED_CLOCK);
    }

    private static List<String> lines(Path file) throws Exception {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    private static long rules(List<String> lines) {
        return lines.stream().filter(RULE::equals).count();
    }

    @Test
    @DisplayName("Scenario: one logged message lands after a single header, with time stamp and no colour")
    void logMessageThenFlush() throws Exception {
        Path run = dir.resolve("run.log");
        TermLogger log = new TermLogger(LoggerSettings.defaults(), new CapturedConsole(80, true).sink(),
                CapturedConsole.FIXED_CLOCK);

        assertEquals(LogStatus.OK, log.setLogFile(run, false));
        assertEquals(LogStatus.OK, log.logMessage("a.cpp", 10, "main", "hello"));
        assertEquals(LogStatus.OK, log.flush());

        List<String> content = lines(run);
        assertEquals(List.of(RULE, "     " + CapturedConsole.FIXED_STAMP, RULE), content.subList(0, 3));
        assertEquals(4, content.size());
        String line = content.get(3);
        assertEquals("(09:26:53) [a.cpp | 10 | main()]: hello", line);
        assertEquals(-1, line.indexOf(AnsiColourEncoder.ESC));
    }

    @Test
    @DisplayName("Scenario: reportError without a file prints to stderr and returns NO_LOG_FILE")
    void reportErrorWithoutFile() {
        TermLogger log = logger(null, true, 10);

        assertEquals(LogStatus.NO_LOG_FILE, log.reportError(Origin.none(), "boom"));
        assertTrue(console.err().contains("ERROR"));
        assertTrue(console.err().contains("boom"));
        assertEquals("", console.out());
        assertEquals(0, log.getQueueLength());
    }

    @Test
    void nothingIsWrittenBeforeThresholdOrFlush() throws Exception {
        Path f = dir.resolve("deferred.log");
        TermLogger log = logger(f, false, 10);

        for (int i = 0; i < 9; i++) {
            assertEquals(LogStatus.OK, log.logMessage("m" + i));
        }
        assertFalse(Files.exists(f));
        assertEquals(9, log.getQueueLength());

        assertEquals(LogStatus.OK, log.flush());
        assertEquals(3 + 9, lines(f).size());
        assertEquals(0, log.getQueueLength());
    }

    @Test
    void reachingTheThresholdFlushes() throws Exception {
        Path f = dir.resolve("threshold.log");
        TermLogger log = logger(f, false, 3);

        log.logRaw("one");
        log.logRaw("two");
        assertFalse(Files.exists(f));
        assertEquals(LogStatus.OK, log.logRaw("three"));

        assertEquals(List.of("one", "two", "three"), lines(f).subList(3, 6));
        assertEquals(0, log.getQueueLength());
    }

    @Test
    void flushWithEmptyQueueDoesNotTouchTheFile() throws Exception {
        Path f = dir.resolve("idle.log");
        TermLogger log = logger(f, false, 10);

        assertEquals(LogStatus.OK, log.flush());
        assertFalse(Files.exists(f));

        log.logRaw("x");
        log.flush();
        Files.delete(f);
        assertEquals(LogStatus.OK, log.flush());
        assertEquals(LogStatus.OK, log.flush());
        assertFalse(Files.exists(f));
    }

    @Test
    void oneHeaderPerSessionAcrossFlushes() throws Exception {
        Path f = dir.resolve("session.log");
        TermLogger log = logger(f, true, 2);

        for (int i = 0; i < 7; i++) {
            log.logRaw("line " + i);
        }
        log.flush();
        log.flush();
        log.close();

        List<String> content = lines(f);
        assertEquals(2, rules(content));
        assertEquals(1 + 3 + 7, content.size());
        assertTrue(log.isHeaderWritten());
    }

    @Test
    void namedHeaderFromPrepareLogFile() throws Exception {
        Path f = dir.resolve("named.log");
        TermLogger log = logger(f, false, 10);

        assertEquals(LogStatus.OK, log.prepareLogFile("solver run"));
        log.logRaw("payload");
        log.flush();

        assertEquals(List.of(RULE, "     solver run", "     " + CapturedConsole.FIXED_STAMP, RULE, "payload"), lines(f));
    }

    @Test
    void setLogFileFlushesOldFileAndStartsNewSession() throws Exception {
        Path a = dir.resolve("a.log");
        Path b = dir.resolve("b.log");
        TermLogger log = logger(a, false, 10);

        log.logRaw("for a");
        assertEquals(LogStatus.OK, log.setLogFile(b, false));
        assertEquals(List.of("for a"), lines(a).subList(3, 4));
        assertFalse(log.isHeaderWritten());
        assertEquals(b, log.getLogFile().orElseThrow());

        log.logRaw("for b");
        log.flush();
        assertEquals(List.of(RULE, "     " + CapturedConsole.FIXED_STAMP, RULE, "for b"), lines(b));
        assertEquals(4, lines(a).size());
    }

    @Test
    void clearLogFileReturnsToConsoleOnly() throws Exception {
        Path f = dir.resolve("cleared.log");
        TermLogger log = logger(f, false, 10);
        log.logRaw("kept");

        assertEquals(LogStatus.OK, log.clearLogFile());
        assertTrue(log.getLogFile().isEmpty());
        assertEquals(LogStatus.NO_LOG_FILE, log.logRaw("dropped"));
        assertEquals(LogStatus.NO_LOG_FILE, log.flush());
        assertEquals("kept", lines(f).get(3));
    }

    @Test
    void closeFlushesPendingMessages() throws Exception {
        Path f = dir.resolve("close.log");
        try (TermLogger log = logger(f, false, 100)) {
            log.reportMessage("Worker.java", 42, "run", "closing soon");
        }
        List<String> content = lines(f);
        assertEquals(4, content.size());
        assertTrue(content.get(3).endsWith("[Worker.java | 42 | run()]: closing soon"));
        assertTrue(console.out().contains("[Worker.java | 42 | run()]: closing soon"));
    }

    @Test
    void reportRawPrintsAndQueues() throws Exception {
        Path f = dir.resolve("raw.log");
        TermLogger log = logger(f, false, 10);

        assertEquals(LogStatus.OK, log.reportRaw("to stdout"));
        assertEquals(LogStatus.OK, log.reportRaw("to stderr", StreamTarget.STDERR));
        assertEquals(LogStatus.INVALID_USE, log.reportRaw("nowhere", null));
        assertTrue(console.out().contains("to stdout"));
        assertTrue(console.err().contains("to stderr"));
        assertTrue(console.err().contains("Unknown stream"));

        log.flush();
        assertEquals(List.of("to stdout", "to stderr", "nowhere"), lines(f).subList(3, 6));
    }

    @Test
    void showVariantsNeverQueue() {
        TermLogger log = logger(dir.resolve("show.log"), false, 10);

        log.showMessage("plain message");
        log.showError("f.c", 1, null, "bad");
        assertEquals(LogStatus.OK, log.showRaw("raw"));
        assertEquals(LogStatus.INVALID_USE, log.showRaw("raw", null));

        assertEquals(0, log.getQueueLength());
        assertTrue(console.out().contains("plain message"));
        assertTrue(console.err().contains(" ERROR  [f.c | 1]: bad"));
    }

    @Test
    void logVariantsWithoutFileStoreNothing() {
        TermLogger log = logger(null, true, 10);

        assertEquals(LogStatus.NO_LOG_FILE, log.logMessage("m"));
        assertEquals(LogStatus.NO_LOG_FILE, log.logError("e"));
        assertEquals(LogStatus.NO_LOG_FILE, log.logRaw("r"));
        assertEquals(LogStatus.NO_LOG_FILE, log.reportMessage("shown"));
        assertEquals(LogStatus.NO_LOG_FILE, log.prepareLogFile("x"));
        assertEquals(0, log.getQueueLength());
        assertTrue(console.out().contains("shown"));
    }

    @Test
    void perCallOptionsOverrideInstanceOptions() {
        TermLogger log = logger(null, true, 10);
        log.reportMessage(Origin.function("tagged"), "exact", FormattingOptions.plain());
        assertTrue(console.out().contains("[tagged()]: exact"));

        log.setOptions(FormattingOptions.plain().withIndent(4));
        log.showMessage("indented");
        assertTrue(console.out().contains("    indented"));
        assertEquals(4, log.getOptions().indent());
    }

    @Test
    @DisplayName("A file that cannot be opened is reported, keeps the queue and is retried")
    void openFailureIsReportedAndRetried() throws Exception {
        Path missing = dir.resolve("later");
        Path f = missing.resolve("retry.log");
        TermLogger log = logger(f, false, 1);

        assertEquals(LogStatus.FILE_OPEN_ERROR, log.logMessage("queued while broken"));
        assertTrue(console.err().contains("Logger: Could not open log file"));
        assertEquals(1, log.getQueueLength());
        assertFalse(log.isHeaderWritten());

        Files.createDirectories(missing);
        assertEquals(LogStatus.OK, log.flush());
        List<String> content = lines(f);
        assertEquals(2, rules(content));
        assertTrue(content.get(3).endsWith("queued while broken"));
    }

    @Test
    @DisplayName("A write failure after the header drops the drained batch")
    void writeFailureDropsTheBatch() throws Exception {
        Path f = dir.resolve("dropped.log");
        TermLogger log = logger(f, false, 10);
        assertEquals(LogStatus.OK, log.prepareLogFile(null));

        log.logRaw("before");
        log.logRaw("lone \uDC00 surrogate");
        assertEquals(LogStatus.WRITE_ERROR, log.flush());
        assertEquals(0, log.getQueueLength());
        assertTrue(console.err().contains("Logger: Error writing to log file '" + f + "'"), console.err());
        assertTrue(log.isHeaderWritten());

        log.logRaw("after");
        assertEquals(LogStatus.OK, log.flush());
        List<String> content = lines(f);
        assertEquals(2, rules(content));
        assertEquals("after", content.get(content.size() - 1));
    }

    @Test
    void openFailureNamesTheReason() {
        Path f = dir.resolve("missing").resolve("x.log");
        TermLogger log = logger(f, false, 1);

        assertEquals(LogStatus.FILE_OPEN_ERROR, log.logRaw("m"));
        String err = console.err();
        assertFalse(err.contains("': " + f), err);
        assertTrue(err.contains("NoSuchFile") || err.contains("No such file"), err);
    }

    @Test
    void maxQueueLengthValidationAndZeroFlushesImmediately() throws Exception {
        Path f = dir.resolve("zero.log");
        TermLogger log = logger(f, false, 10);
        assertThrows(IllegalArgumentException.class, () -> log.setMaxQueueLength(-1));

        log.setMaxQueueLength(0);
        assertEquals(0, log.getMaxQueueLength());
        log.logRaw("immediate");
        assertEquals("immediate", lines(f).get(3));
    }

    @Test
    void makeLogNameShape() {
        String name = TermLogger.makeLogName("sim");
        assertTrue(name.matches("sim_\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}\\.log"), name);
    }
}
