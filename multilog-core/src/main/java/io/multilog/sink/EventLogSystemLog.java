/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.multilog.sink;

import io.multilog.common.OsUtils;
import io.multilog.log.Level;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Windows event log (Application), written through {@code eventcreate}.
 * <p>
 * The first entry registers the source. Sources that already exist, or that
 * cannot be registered without administrative rights but were registered
 * before, are accepted.
 */
public class EventLogSystemLog implements SystemLog {

    static final String INFORMATION = "INFORMATION";
    static final String WARNING = "WARNING";
    static final String ERROR = "ERROR";

    // eventcreate accepts at most 32766 characters in /D
    private static final int MAX_DESCRIPTION = 32000;

    private final String source;
    private final Map<Level, EventLogChannel> channels = new EnumMap<>(Level.class);

    EventLogSystemLog(String source) {
        this.source = source;
        for (Level level : Level.values()) {
            channels.put(level, new EventLogChannel(this, level));
        }
    }

    public static EventLogSystemLog open(String source) throws IOException {
        if (!OsUtils.isWindows()) {
            throw new IOException("event log is not available on " + OsUtils.getOsType());
        }
        if (source == null || source.isBlank()) {
            throw new IOException("event log source name must not be empty");
        }
        return new EventLogSystemLog(source);
    }

    static String type(Level level) {
        return switch (level) {
            case DEBUG, INFO -> INFORMATION;
            case WARNING -> WARNING;
            case ERROR, PANIC, FATAL -> ERROR;
        };
    }

    static int eventId(Level level) {
        return switch (type(level)) {
            case INFORMATION -> 1;
            case ERROR -> 2;
            default -> 3;
        };
    }

    List<String> command(Level level, String message) {
        String description = message.length() > MAX_DESCRIPTION ? message.substring(0, MAX_DESCRIPTION) : message;
        return List.of("eventcreate", "/L", "APPLICATION", "/T", type(level), "/SO", source,
                "/ID", String.valueOf(eventId(level)), "/D", description);
    }

    static boolean isTolerated(String output) {
        String lower = output.toLowerCase();
        return lower.contains("already exists") || lower.contains("access is denied");
    }

    void report(Level level, String message) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command(level, message));
        pb.redirectErrorStream(true);
        Process process = pb.start();
        String output;
        try {
            output = new String(process.getInputStream().readAllBytes(), Charset.defaultCharset());
            int exitCode = process.waitFor();
            if (exitCode != 0 && !isTolerated(output)) {
                throw new IOException("eventcreate failed with exit code " + exitCode + ": " + output.trim());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new InterruptedIOException("interrupted while writing to the event log");
        }
    }

    @Override
    public OutputStream channel(Level level) {
        return channels.get(level);
    }

    @Override
    public void close() {
        // every entry runs its own process, nothing held open
    }

    @Override
    public String toString() {
        return "eventlog:" + source;
    }

    static class EventLogChannel extends OutputStream {

        private final EventLogSystemLog log;
        private final Level level;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        EventLogChannel(EventLogSystemLog log, Level level) {
            this.log = log;
            this.level = level;
        }

        @Override
        public void write(int b) {
            buffer.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            buffer.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            if (buffer.size() == 0) {
                return;
            }
            String message = buffer.toString(StandardCharsets.UTF_8).stripTrailing();
            buffer.reset();
            log.report(level, message);
        }

        @Override
        public String toString() {
            return log + "/" + type(level);
        }

    }

}
