/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/TermLogger.java
 description: Thread-safe logger printing formatted messages to stdout/stderr and mirroring them
              into a log file through a bounded queue that is flushed at a threshold, on demand and on close.
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

package tech.robd.jtermlog;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtermlog.diagnostics.Diagnostics;
import tech.robd.jtermlog.format.AnsiColourEncoder;
import tech.robd.jtermlog.format.FormattingOptions;
import tech.robd.jtermlog.format.MessageFormatter;
import tech.robd.jtermlog.format.Origin;
import tech.robd.jtermlog.format.Timestamps;
import tech.robd.jtermlog.sink.FileSink;
import tech.robd.jtermlog.sink.FileSinkException;
import tech.robd.jtermlog.sink.MessageQueue;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prints messages to the console and optionally writes them to a log file.
 *
 * <p>Three kinds of message:
 * <ul>
 *   <li><b>raw</b>: printed and stored unchanged.</li>
 *   <li><b>message</b>: prefixed with an origin tag {@code [file | line | function()]: }.</li>
 *   <li><b>error</b>: like a message with an {@code ERROR} flag, printed to stderr.</li>
 * </ul>
 * Each kind comes in three flavours: {@code show*} prints only, {@code log*} queues for the
 * file only, {@code report*} does both.
 *
 * <p>File output is deferred. Rendered messages are queued and written when the queue reaches
 * {@link #getMaxQueueLength()}, on {@link #flush()}, on {@link #setLogFile(Path, boolean)}
 * and on {@link #close()}. The first write of each file session is preceded by a header block.
 * Without a file, file-related operations return {@link LogStatus#NO_LOG_FILE}.
 *
 * <p><b>Threading:</b> every public method takes the instance lock, so composed messages have one
 * total order and never interleave. Methods named {@code ...Locked} require the lock to be held
 * by the caller and never take it themselves; they are how a flush runs inside another
 * operation without re-entering the lock. A stuck file system blocks the thread holding the
 * lock and therefore every other caller.
 *
 * <p>I/O failures are never thrown: they are returned as a {@link LogStatus}, printed to the
 * error stream and forwarded to SLF4J.
 */
public final class TermLogger implements AutoCloseable {

    // 🧩 Section: constants
    /**
     * Queue length that triggers a flush unless configured otherwise.
     */
    public static final int DEFAULT_MAX_QUEUE_LENGTH = 10;

    private static final Diagnostics DIAG = Diagnostics.of(TermLogger.class);
    // [/🧩 Section: constants]

    // 🧩 Section: state
    private final int logId = System.identityHashCode(this);
    private final ReentrantLock lock = new ReentrantLock();

    private final @NonNull ConsoleSink console;
    private final @NonNull MessageFormatter formatter;
    private final @NonNull MessageQueue queue = new MessageQueue();
    private final @NonNull FileSink sink;

    // guarded by lock
    private @NonNull FormattingOptions options;
    private int maxQueueLength;
    // [/🧩 Section: state]

    // 🧩 Section: construction

    /**
     * Console-only logger with default formatting.
     */
    public TermLogger() {
        this(LoggerSettings.defaults());
    }

    /**
     * Console-only logger.
     */
    public TermLogger(@NonNull FormattingOptions options) {
        this(new LoggerSettings(null, true, DEFAULT_MAX_QUEUE_LENGTH, options));
    }

    /**
     * Logger with a file and default formatting.
     *
     * @param file   log file
     * @param append keep existing content (a blank line separates sessions) or truncate
     */
    public TermLogger(@NonNull Path file, boolean append) {
        this(file, append, FormattingOptions.defaults());
    }

    public TermLogger(@NonNull Path file, boolean append, @NonNull FormattingOptions options) {
        this(new LoggerSettings(Objects.requireNonNull(file, "file"), append, DEFAULT_MAX_QUEUE_LENGTH, options));
    }

    public TermLogger(@NonNull LoggerSettings settings) {
        this(settings, ConsoleSink.system(), Clock.systemDefaultZone());
    }

    /**
     * Fully specified logger.
     *
     * @param settings file, mode, queue length and formatting
     * @param console  streams and terminal probe
     * @param clock    source of header and message time stamps
     */
    public TermLogger(@NonNull LoggerSettings settings, @NonNull ConsoleSink console, @NonNull Clock clock) {
        Objects.requireNonNull(settings, "settings");
        this.console = Objects.requireNonNull(console, "console");
        Timestamps timestamps = new Timestamps(Objects.requireNonNull(clock, "clock"));
        this.formatter = new MessageFormatter(
                AnsiColourEncoder.standard(),
                console.probe(), timestamps, System.lineSeparator());
        this.sink = new FileSink(settings.file(), settings.append(), timestamps, formatter.lineSeparator());
        this.options = settings.options();
        this.maxQueueLength = settings.maxQueueLength();
        DIAG.debug("log#{} init file={} append={} maxQueue={}",
                logId, settings.file(), settings.append(), maxQueueLength);
    }

    /**
     * Flush pending messages. Failures are reported on the error stream. Safe to call repeatedly.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            LogStatus st = flushLocked();
            DIAG.debug("log#{} closed, final flush -> {}", logId, st);
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: construction]

    // 🧩 Section: file-management

    /**
     * Switch to another log file. Pending messages are flushed to the current file first.
     * The new file gets its own header on the next write.
     *
     * @param file   new log file, {@code null} to stop writing to a file
     * @param append keep existing content of {@code file}
     * @return status of flushing the previous file, {@link LogStatus#OK} if there was none
     */
    public @NonNull LogStatus setLogFile(@Nullable Path file, boolean append) {
        lock.lock();
        try {
            LogStatus st = LogStatus.OK;
            if (sink.isConfigured()) {
                st = flushLocked();
            }
            sink.retarget(file, append);
            return st;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @see #setLogFile(Path, boolean)
     */
    public @NonNull LogStatus setLogFile(@NonNull String fileName, boolean append) {
        return setLogFile(Path.of(fileName), append);
    }

    /**
     * Flush to the current file and continue console-only.
     */
    public @NonNull LogStatus clearLogFile() {
        return setLogFile((Path) null, true);
    }

    public @NonNull Optional<Path> getLogFile() {
        lock.lock();
        try {
            return Optional.ofNullable(sink.path());
        } finally {
            lock.unlock();
        }
    }

    public boolean isAppend() {
        lock.lock();
        try {
            return sink.isAppend();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return whether the current file session already has its header
     */
    public boolean isHeaderWritten() {
        lock.lock();
        try {
            return sink.isHeaderWritten();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the session header now, showing {@code sessionName}. Does nothing if this session
     * already has a header (written explicitly or by an earlier flush).
     *
     * @param sessionName name to show, e.g. the program and its run id
     * @return {@link LogStatus#NO_LOG_FILE}, a failure status, or {@link LogStatus#OK}
     */
    public @NonNull LogStatus prepareLogFile(@Nullable String sessionName) {
        lock.lock();
        try {
            return prepareLogFileLocked(sessionName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write all queued messages to the file, preceded by the header if this session has none.
     * <p>
     * If the header cannot be written the queue is kept for a later attempt. If the messages
     * themselves cannot be written they are lost; the failure is reported.
     *
     * @return {@link LogStatus#NO_LOG_FILE}, a failure status, or {@link LogStatus#OK}
     *         (also when there was nothing to write)
     */
    public @NonNull LogStatus flush() {
        lock.lock();
        try {
            return flushLocked();
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: file-management]

    // 🧩 Section: raw

    /**
     * Print {@code message} unchanged to stdout and queue it for the file.
     */
    public @NonNull LogStatus reportRaw(@NonNull String message) {
        return reportRaw(message, StreamTarget.STDOUT);
    }

    /**
     * Print {@code message} unchanged and queue it for the file.
     *
     * @param stream where to print; {@code null} is rejected with {@link LogStatus#INVALID_USE}
     *               but the message is still queued
     * @return {@link LogStatus#INVALID_USE} for a bad stream, else {@link LogStatus#NO_LOG_FILE}
     *         without a file, else the queue/flush status
     */
    public @NonNull LogStatus reportRaw(@NonNull String message, @Nullable StreamTarget stream) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            LogStatus shown = showRawLocked(message, stream);
            LogStatus logged = logRawLocked(message);
            return shown.isFailure() ? shown : logged;
        } finally {
            lock.unlock();
        }
    }

    public @NonNull LogStatus showRaw(@NonNull String message) {
        return showRaw(message, StreamTarget.STDOUT);
    }

    /**
     * Print {@code message} unchanged.
     *
     * @return {@link LogStatus#INVALID_USE} if {@code stream} is {@code null}, else {@link LogStatus#OK}
     */
    public @NonNull LogStatus showRaw(@NonNull String message, @Nullable StreamTarget stream) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            return showRawLocked(message, stream);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queue {@code message} unchanged for the file.
     */
    public @NonNull LogStatus logRaw(@NonNull String message) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            return logRawLocked(message);
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: raw]

    // 🧩 Section: messages

    public @NonNull LogStatus reportMessage(@NonNull String message) {
        return reportMessage(Origin.none(), message, null);
    }

    public @NonNull LogStatus reportMessage(@Nullable String file, int line,
                                            @Nullable String function, @NonNull String message) {
        return reportMessage(Origin.of(file, line, function), message, null);
    }

    public @NonNull LogStatus reportMessage(@NonNull Origin origin, @NonNull String message) {
        return reportMessage(origin, message, null);
    }

    /**
     * Print a formatted message to stdout and queue it for the file.
     *
     * @param override formatting for this call only, {@code null} for the logger's options
     * @return {@link LogStatus#NO_LOG_FILE} without a file, else the queue/flush status
     */
    public @NonNull LogStatus reportMessage(@NonNull Origin origin, @NonNull String message,
                                            @Nullable FormattingOptions override) {
        return report(origin, message, false, override);
    }

    public void showMessage(@NonNull String message) {
        show(Origin.none(), message, false, null);
    }

    public void showMessage(@Nullable String file, int line,
                            @Nullable String function, @NonNull String message) {
        show(Origin.of(file, line, function), message, false, null);
    }

    /**
     * Print a formatted message to stdout. Colour is allowed, the time stamp is not.
     */
    public void showMessage(@NonNull Origin origin, @NonNull String message,
                            @Nullable FormattingOptions override) {
        show(origin, message, false, override);
    }

    public @NonNull LogStatus logMessage(@NonNull String message) {
        return log(Origin.none(), message, false, null);
    }

    public @NonNull LogStatus logMessage(@Nullable String file, int line,
                                         @Nullable String function, @NonNull String message) {
        return log(Origin.of(file, line, function), message, false, null);
    }

    /**
     * Queue a formatted message for the file. The time stamp is allowed, colour is not.
     *
     * @return {@link LogStatus#NO_LOG_FILE} without a file (nothing is stored), else the
     *         queue/flush status
     */
    public @NonNull LogStatus logMessage(@NonNull Origin origin, @NonNull String message,
                                         @Nullable FormattingOptions override) {
        return log(origin, message, false, override);
    }
    // [/🧩 Section: messages]

    // 🧩 Section: errors

    public @NonNull LogStatus reportError(@NonNull String message) {
        return reportError(Origin.none(), message, null);
    }

    public @NonNull LogStatus reportError(@Nullable String file, int line,
                                          @Nullable String function, @NonNull String message) {
        return reportError(Origin.of(file, line, function), message, null);
    }

    public @NonNull LogStatus reportError(@NonNull Origin origin, @NonNull String message) {
        return reportError(origin, message, null);
    }

    /**
     * Print a formatted error to stderr and queue it for the file.
     *
     * @return {@link LogStatus#NO_LOG_FILE} without a file, else the queue/flush status
     */
    public @NonNull LogStatus reportError(@NonNull Origin origin, @NonNull String message,
                                          @Nullable FormattingOptions override) {
        return report(origin, message, true, override);
    }

    public void showError(@NonNull String message) {
        show(Origin.none(), message, true, null);
    }

    public void showError(@Nullable String file, int line,
                          @Nullable String function, @NonNull String message) {
        show(Origin.of(file, line, function), message, true, null);
    }

    public void showError(@NonNull Origin origin, @NonNull String message,
                          @Nullable FormattingOptions override) {
        show(origin, message, true, override);
    }

    public @NonNull LogStatus logError(@NonNull String message) {
        return log(Origin.none(), message, true, null);
    }

    public @NonNull LogStatus logError(@Nullable String file, int line,
                                       @Nullable String function, @NonNull String message) {
        return log(Origin.of(file, line, function), message, true, null);
    }

    public @NonNull LogStatus logError(@NonNull Origin origin, @NonNull String message,
                                       @Nullable FormattingOptions override) {
        return log(origin, message, true, override);
    }
    // [/🧩 Section: errors]

    // 🧩 Section: settings

    /**
     * Does not flush by itself; the new limit applies from the next queued message.
     *
     * @param length queue length that triggers a flush; {@code 0} and {@code 1} flush on every message
     */
    public void setMaxQueueLength(int length) {
        if (length < 0) throw new IllegalArgumentException("length >= 0");
        lock.lock();
        try {
            this.maxQueueLength = length;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxQueueLength() {
        lock.lock();
        try {
            return maxQueueLength;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of messages waiting for the next flush
     */
    public int getQueueLength() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public @NonNull FormattingOptions getOptions() {
        lock.lock();
        try {
            return options;
        } finally {
            lock.unlock();
        }
    }

    public void setOptions(@NonNull FormattingOptions options) {
        Objects.requireNonNull(options, "options");
        lock.lock();
        try {
            this.options = options;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make a log file name {@code <name>_<yyyy-MM-dd>T<HH-mm-ss>.log} from the current time.
     *
     * @param name prefix, may be empty (then the underscore is left out)
     */
    public static @NonNull String makeLogName(@NonNull String name) {
        return Timestamps.system().logFileName(Objects.requireNonNull(name, "name"));
    }
    // [/🧩 Section: settings]

    // 🧩 Section: public-to-locked
    private LogStatus report(Origin origin, String message, boolean error, @Nullable FormattingOptions override) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            FormattingOptions o = override != null ? override : options;
            showLocked(origin, message, error, o);
            return logLocked(origin, message, error, o);
        } finally {
            lock.unlock();
        }
    }

    private void show(Origin origin, String message, boolean error, @Nullable FormattingOptions override) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            showLocked(origin, message, error, override != null ? override : options);
        } finally {
            lock.unlock();
        }
    }

    private LogStatus log(Origin origin, String message, boolean error, @Nullable FormattingOptions override) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            return logLocked(origin, message, error, override != null ? override : options);
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: public-to-locked]

    // 🧩 Section: locked
    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("log#" + logId + " lock must be held by the caller");
        }
    }

    private LogStatus showRawLocked(String message, @Nullable StreamTarget stream) {
        requireLock();
        if (stream == null) {
            console.err().println("Logger.showRaw: Unknown stream: null");
            return LogStatus.INVALID_USE;
        }
        console.print(stream, message);
        return LogStatus.OK;
    }

    private LogStatus logRawLocked(String message) {
        requireLock();
        if (!sink.isConfigured()) {
            return LogStatus.NO_LOG_FILE;
        }
        return enqueueLocked(message);
    }

    private void showLocked(Origin origin, String message, boolean error, FormattingOptions o) {
        requireLock();
        console.print(StreamTarget.forMessage(error), formatter.compose(origin, message, error, false, o));
    }

    private LogStatus logLocked(Origin origin, String message, boolean error, FormattingOptions o) {
        requireLock();
        if (!sink.isConfigured()) {
            return LogStatus.NO_LOG_FILE;
        }
        return enqueueLocked(formatter.compose(origin, message, error, true, o));
    }

    private LogStatus enqueueLocked(String rendered) {
        requireLock();
        int length = queue.push(rendered);
        if (length >= maxQueueLength) {
            DIAG.debug("log#{} queue length {} reached limit {} -> flush", logId, length, maxQueueLength);
            return flushLocked();
        }
        return LogStatus.OK;
    }

    private LogStatus prepareLogFileLocked(@Nullable String sessionName) {
        requireLock();
        if (!sink.isConfigured()) {
            return LogStatus.NO_LOG_FILE;
        }
        try {
            sink.ensureHeader(sessionName);
            return LogStatus.OK;
        } catch (FileSinkException e) {
            return failed(e, "queue kept");
        }
    }

    private LogStatus flushLocked() {
        requireLock();
        if (!sink.isConfigured()) {
            return LogStatus.NO_LOG_FILE;
        }
        if (queue.isEmpty()) {
            return LogStatus.OK;
        }

        LogStatus header = prepareLogFileLocked(null);
        if (header != LogStatus.OK) {
            return header;
        }

        List<String> batch = queue.drainAll();
        try {
            sink.appendLines(batch);
            DIAG.debug("log#{} flushed {} message(s)", logId, batch.size());
            return LogStatus.OK;
        } catch (FileSinkException e) {
            return failed(e, batch.size() + " queued message(s) dropped");
        }
    }

    private LogStatus failed(FileSinkException e, String queueState) {
        console.err().println(e.getMessage());
        console.err().flush();
        DIAG.warn("log#{} {} ({})", logId, e.getMessage(), queueState);
        return e.kind() == FileSinkException.Kind.OPEN ? LogStatus.FILE_OPEN_ERROR : LogStatus.WRITE_ERROR;
    }
    // [/🧩 Section: locked]
}
