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
package io.multilog.log;

import io.multilog.output.ColorizedFormatter;
import io.multilog.output.Console;
import io.multilog.output.JsonFormatter;
import io.multilog.output.LogFlags;
import io.multilog.sink.FanOutStream;
import io.multilog.sink.LevelChannel;
import io.multilog.sink.Slf4jSink;
import io.multilog.sink.SystemLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class LoggersTest {

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        Log.reset();
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        out = new PrintStream(stdout, true);
        err = new PrintStream(stderr, true);
    }

    @AfterEach
    void cleanup() {
        Log.reset();
    }

    private LogOption console() {
        return LogOptions.withConsole(out, err);
    }

    private static String text(ByteArrayOutputStream buf) {
        return buf.toString(StandardCharsets.UTF_8);
    }

    /**
     * In-memory system log, one buffer per level.
     */
    static class FakeSystemLog implements SystemLog {

        final Map<Level, ByteArrayOutputStream> channels = new EnumMap<>(Level.class);
        String source;
        boolean closed;

        FakeSystemLog() {
            for (Level level : Level.values()) {
                channels.put(level, new ByteArrayOutputStream());
            }
        }

        @Override
        public OutputStream channel(Level level) {
            return channels.get(level);
        }

        @Override
        public void close() {
            closed = true;
        }

        String text(Level level) {
            return channels.get(level).toString(StandardCharsets.UTF_8);
        }

    }

    @Test
    void testStdLoggerRoutesByLevel() {
        Logger logger = Loggers.newStdLogger(console(), LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withLevel(Level.DEBUG));
        logger.debug("d");
        logger.info("i");
        logger.warning("w");
        logger.error("e");
        assertEquals("DEBUG: d\nINFO : i\nWARN : w\n", text(stdout));
        assertEquals("ERROR: e\n", text(stderr));
    }

    @Test
    void testPanicAndFatalGoToStderr() {
        RecordingTerminator terminator = new RecordingTerminator();
        Logger logger = Loggers.newStdLogger(console(), LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withTerminator(terminator));
        logger.panic("p");
        Logger second = Loggers.newStdLogger(console(), LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withTerminator(terminator));
        assertThrows(RecordingTerminator.ExitCalled.class, () -> second.fatal("f"));
        assertEquals("", text(stdout));
        assertEquals("PANIC: p\nFATAL: f\n", text(stderr));
    }

    @Test
    void testDestinationOrder() {
        FakeSystemLog syslog = new FakeSystemLog();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        DefaultLogger logger = Loggers.create("app", true, buf, console(),
                LogOptions.withSystemLog(source -> syslog),
                LogOptions.withSlf4j("multilog.test"));
        for (Level level : Level.values()) {
            FanOutStream fanOut = (FanOutStream) logger.getChannel(level).getOut();
            List<OutputStream> destinations = fanOut.getDestinations();
            assertEquals(4, destinations.size(), level.name());
            assertSame(buf, destinations.get(0));
            assertSame(syslog.channel(level), destinations.get(1));
            assertInstanceOf(Slf4jSink.class, destinations.get(2));
            assertSame(level.isEnabled(Level.ERROR) ? err : out, destinations.get(3));
        }
    }

    @Test
    void testSyslogLoggerWritesEveryDestination() {
        FakeSystemLog syslog = new FakeSystemLog();
        Logger logger = Loggers.newSyslogLogger("myapp", console(), LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withSystemLog(source -> {
                    syslog.source = source;
                    return syslog;
                }));
        logger.info("hello");
        logger.error("oops");
        assertEquals("myapp", syslog.source);
        assertEquals("INFO : hello\n", syslog.text(Level.INFO));
        assertEquals("ERROR: oops\n", syslog.text(Level.ERROR));
        assertEquals("INFO : hello\n", text(stdout));
        assertEquals("ERROR: oops\n", text(stderr));

        logger.close();
        assertTrue(syslog.closed);
    }

    @Test
    void testSystemLogFailureLoggedOnce() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Logger logger = Loggers.create("broken", true, buf, new LogOption[]{console(),
                LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withSystemLog(source -> {
                    throw new IOException("no daemon");
                })});
        assertEquals("ERROR: Failed to open system log broken: no daemon\n", text(buf));
        assertEquals("ERROR: Failed to open system log broken: no daemon\n", text(stderr));

        logger.info("still works");
        assertTrue(text(buf).endsWith("INFO : still works\n"));
    }

    @Test
    void testFirstLoggerBecomesDefault() {
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        Logger a = Loggers.newLogger(first, console(), LogOptions.withFlags(LogFlags.DISABLED));
        Logger b = Loggers.newLogger(second, console(), LogOptions.withFlags(LogFlags.DISABLED));
        assertNotSame(a, b);
        assertSame(a, Log.get());

        Log.info("through default");
        b.info("through second");
        assertEquals("INFO : through default\n", text(first));
        assertEquals("INFO : through second\n", text(second));
    }

    @Test
    void testIndependentLoggersKeepOwnSettings() {
        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        Logger a = Loggers.newLogger(first, console(), LogOptions.withFlags(LogFlags.DISABLED));
        Logger b = Loggers.newLogger(second, console(), LogOptions.withFlags(LogFlags.DISABLED),
                LogOptions.withLevel(Level.DEBUG));
        a.debug("hidden");
        b.debug("shown");
        a.with(Fields.of("only", "a"));
        b.info("plain");
        a.info("tagged");
        assertEquals("INFO : only=a tagged\n", text(first));
        assertEquals("DEBUG: shown\nINFO : plain\n", text(second));
    }

    @Test
    void testJsonLoggerOverridesChannels() {
        DefaultLogger logger = (DefaultLogger) Loggers.newJsonLogger(console());
        assertInstanceOf(JsonFormatter.class, logger.getFormatter());
        for (Level level : Level.values()) {
            LevelChannel channel = logger.getChannel(level);
            assertEquals(LogFlags.DISABLED, channel.getFlags());
            assertEquals("", channel.getPrefix());
        }
        logger.setFlags(LogFlags.STD);
        assertEquals(LogFlags.DISABLED, logger.getChannel(Level.INFO).getFlags());
        assertEquals(LogFlags.STD, logger.getFlags());
    }

    @Test
    void testJsonLoggerWritesObjects() {
        DefaultLogger logger = (DefaultLogger) Loggers.newJsonLogger(console(), LogOptions.withFlags(LogFlags.DISABLED));
        logger.with(Fields.of("port", 8080)).info("started");
        assertEquals("{\"level\":\"info\",\"msg\":\"started\",\"port\":8080}\n", text(stdout));
    }

    @Test
    void testColorLoggerPrefixes() {
        DefaultLogger logger = (DefaultLogger) Loggers.newColorLogger(console(), LogOptions.withFlags(LogFlags.DISABLED));
        assertInstanceOf(ColorizedFormatter.class, logger.getFormatter());
        logger.warning("careful");
        assertEquals(Console.YELLOW + "WARN : " + Console.RESET + "careful\n", text(stdout));

        logger.setFlags(LogFlags.TIME);
        assertEquals(LogFlags.TIME, logger.getChannel(Level.WARNING).getFlags());
    }

    @Test
    void testWriteFailureDoesNotStopOtherDestinations() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public String toString() {
                return "broken";
            }
        };
        Logger logger = Loggers.newLogger(broken, console(), LogOptions.withFlags(LogFlags.DISABLED));
        logger.info("survives");
        assertEquals("INFO : survives\n", text(stdout));
        assertTrue(text(stderr).contains("Failed to write log to broken: java.io.IOException: disk full"), text(stderr));
    }

    @Test
    void testCloseFailureReported() {
        OutputStream failing = new ByteArrayOutputStream() {
            @Override
            public void close() throws IOException {
                throw new IOException("stuck");
            }

            @Override
            public String toString() {
                return "failing";
            }
        };
        Logger logger = Loggers.newLogger(failing, console());
        logger.close();
        String expected = "Failed to close log failing: java.io.IOException: stuck" + System.lineSeparator();
        assertEquals(expected, text(stderr));
        logger.close();
        assertEquals(expected, text(stderr));
    }

    @Test
    void testPlatformStreamsNotClosed() {
        Logger logger = Loggers.newStdLogger(console(), LogOptions.withFlags(LogFlags.DISABLED));
        logger.close();
        out.println("still open");
        assertFalse(out.checkError());
        assertEquals("still open" + System.lineSeparator(), text(stdout));
    }

    @Test
    void testNewLoggerFromConfig() {
        Properties props = new Properties();
        props.setProperty(LoggerConfig.LEVEL, "debug");
        props.setProperty(LoggerConfig.FORMAT, "json");
        props.setProperty(LoggerConfig.FLAGS, "disabled");
        DefaultLogger logger = (DefaultLogger) Loggers.newLogger(LoggerConfig.from(props), console());
        assertInstanceOf(JsonFormatter.class, logger.getFormatter());
        assertEquals(new ThresholdGate(Level.DEBUG), logger.getGate());
        logger.debug("configured");
        assertEquals("{\"level\":\"debug\",\"msg\":\"configured\"}\n", text(stdout));
    }

    @Test
    void testNewLoggerFromConfigWithSyslog() {
        FakeSystemLog syslog = new FakeSystemLog();
        LoggerConfig config = new LoggerConfig();
        config.setSyslogSource("svc");
        config.setFlags(LogFlags.DISABLED);
        Logger logger = Loggers.newLogger(config, console(), LogOptions.withSystemLog(source -> {
            syslog.source = source;
            return syslog;
        }));
        logger.warning("to syslog");
        assertEquals("svc", syslog.source);
        assertEquals("WARN : to syslog\n", syslog.text(Level.WARNING));
    }

}
