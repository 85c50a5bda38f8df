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

import ch.qos.logback.core.net.SyslogConstants;
import ch.qos.logback.core.net.SyslogOutputStream;
import io.multilog.log.Level;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Syslog over UDP (RFC 3164), facility USER, one datagram per line.
 * <pre>
 * &lt;13&gt;May  1 10:15:30 myhost myapp[4242]: INFO : 2024/05/01 10:15:30 started
 * </pre>
 * UDP gives no delivery feedback: when nothing listens on the port (hosts whose
 * daemon only reads {@code /dev/log}), opening still succeeds and lines are lost
 * without an error. Point {@code multilog.syslog.address} at a daemon that
 * accepts UDP in that case.
 */
public class SyslogSystemLog implements SystemLog {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss", Locale.US);

    private final Map<Level, SyslogChannel> channels = new EnumMap<>(Level.class);

    private SyslogSystemLog() {
    }

    public static SyslogSystemLog open(String source, String host, int port) throws IOException {
        return open(source, host, port, Clock.systemDefaultZone());
    }

    static SyslogSystemLog open(String source, String host, int port, Clock clock) throws IOException {
        String tag = source == null || source.isBlank() ? "multilog" : source;
        String hostname = localHostname();
        long pid = ProcessHandle.current().pid();
        SyslogSystemLog log = new SyslogSystemLog();
        try {
            for (Level level : Level.values()) {
                int priority = SyslogConstants.LOG_USER | severity(level);
                SyslogOutputStream out = new SyslogOutputStream(host, port);
                log.channels.put(level, new SyslogChannel(out, priority, hostname, tag, pid, clock));
            }
        } catch (IOException e) {
            log.close();
            throw new IOException("cannot open syslog at " + host + ":" + port + ": " + e.getMessage(), e);
        }
        return log;
    }

    static int severity(Level level) {
        return switch (level) {
            case DEBUG -> SyslogConstants.DEBUG_SEVERITY;
            case INFO -> SyslogConstants.NOTICE_SEVERITY;
            case WARNING -> SyslogConstants.WARNING_SEVERITY;
            case ERROR, FATAL -> SyslogConstants.ERROR_SEVERITY;
            case PANIC -> SyslogConstants.CRITICAL_SEVERITY;
        };
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    @Override
    public OutputStream channel(Level level) {
        return channels.get(level);
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (SyslogChannel channel : channels.values()) {
            try {
                channel.close();
            } catch (IOException e) {
                failure = e;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "syslog" + channels.keySet();
    }

    static class SyslogChannel extends OutputStream {

        private final SyslogOutputStream out;
        private final int priority;
        private final String hostname;
        private final String tag;
        private final long pid;
        private final Clock clock;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        SyslogChannel(SyslogOutputStream out, int priority, String hostname, String tag, long pid, Clock clock) {
            this.out = out;
            this.priority = priority;
            this.hostname = hostname;
            this.tag = tag;
            this.pid = pid;
            this.clock = clock;
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
            byte[] datagram = header().concat(message).getBytes(StandardCharsets.UTF_8);
            out.write(datagram, 0, datagram.length);
            out.flush();
        }

        String header() {
            return "<" + priority + ">" + STAMP.format(clock.instant().atZone(clock.getZone()))
                    + " " + hostname + " " + tag + "[" + pid + "]: ";
        }

        @Override
        public void close() throws IOException {
            out.close();
        }

        @Override
        public String toString() {
            return "syslog<" + priority + ">";
        }

    }

}
