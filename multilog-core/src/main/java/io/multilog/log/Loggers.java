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
import io.multilog.output.Formatter;
import io.multilog.output.JsonFormatter;
import io.multilog.output.LogFlags;
import io.multilog.sink.FanOutStream;
import io.multilog.sink.LevelChannel;
import io.multilog.sink.Slf4jSink;
import io.multilog.sink.SystemLog;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds loggers.
 * <p>
 * The first logger built here also becomes the process-wide default behind
 * {@link Log}; later ones are independent and leave the default alone.
 * An explicit output stream and an opened system log are owned by the logger
 * and closed with it.
 */
public final class Loggers {

    static final String EARLY_WARNING = "ERROR: Logging before a logger was created.\n";

    private Loggers() {
    }

    /**
     * Console logger: stdout for debug, info and warning, stderr for the rest.
     */
    public static Logger newStdLogger(LogOption... options) {
        return create("", false, null, options);
    }

    /**
     * Console logger that also writes to the platform system log under the given source name.
     */
    public static Logger newSyslogLogger(String name, LogOption... options) {
        return create(name, true, null, options);
    }

    public static Logger newJsonLogger(LogOption... options) {
        return create("", false, null, prepend(LogOptions.withFormatter(new JsonFormatter()), options));
    }

    public static Logger newColorLogger(LogOption... options) {
        return create("", false, null, prepend(LogOptions.withFormatter(new ColorizedFormatter()), options));
    }

    /**
     * Logger writing to the given stream, then to the console.
     */
    public static Logger newLogger(OutputStream out, LogOption... options) {
        return create("", false, out, options);
    }

    /**
     * Logger built from configuration; options given here are applied after the configured ones.
     */
    public static Logger newLogger(LoggerConfig config, LogOption... options) {
        List<LogOption> all = new ArrayList<>(config.toOptions());
        all.addAll(List.of(options));
        String source = config.getSyslogSource();
        return create(source == null ? "" : source, source != null, null, all.toArray(new LogOption[0]));
    }

    private static LogOption[] prepend(LogOption first, LogOption... rest) {
        LogOption[] all = new LogOption[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    static DefaultLogger create(String name, boolean systemLog, OutputStream out, LogOption... options) {
        LoggerSettings settings = new LoggerSettings();
        for (LogOption option : options) {
            option.apply(settings);
        }

        SystemLog syslog = null;
        IOException syslogError = null;
        if (systemLog) {
            try {
                syslog = settings.getSystemLogFactory().open(name);
            } catch (IOException e) {
                syslogError = e;
            }
        }

        Formatter formatter = settings.getFormatter();
        int channelFlags = formatter.overridesFlags() ? formatter.flags() : settings.getFlags();
        PrintStream stderr = settings.getStderr();
        Map<Level, LevelChannel> channels = new EnumMap<>(Level.class);
        for (Level level : Level.values()) {
            List<OutputStream> destinations = new ArrayList<>();
            if (out != null) {
                destinations.add(out);
            }
            if (syslog != null && syslog.channel(level) != null) {
                destinations.add(syslog.channel(level));
            }
            if (settings.getSlf4jCategory() != null) {
                destinations.add(new Slf4jSink(settings.getSlf4jCategory(), level));
            }
            // console last: if a primary sink fails the line can still show up here
            destinations.add(level.isEnabled(Level.ERROR) ? stderr : settings.getStdout());
            String prefix = formatter.overridesPrefixes() ? formatter.prefix(level) : level.tag();
            FanOutStream fanOut = new FanOutStream(destinations, stderr);
            channels.put(level, new LevelChannel(level, prefix, channelFlags, fanOut, stderr, settings.getClock()));
        }

        List<Closeable> closers = new ArrayList<>();
        if (out != null) {
            closers.add(out);
        }
        if (syslog != null) {
            closers.add(syslog);
        }

        DefaultLogger logger = new DefaultLogger(formatter, channels, closers, settings.getGate(),
                settings.getFlags(), settings.getTerminator(), stderr);
        logger.markInitialized();
        if (syslogError != null) {
            logger.errorf("Failed to open system log %s: %s", name, syslogError.getMessage());
        }
        Log.install(logger);
        return logger;
    }

    /**
     * The stderr-only logger used by {@link Log} until a real logger is built.
     * Every line is preceded by a warning that no logger was created yet.
     */
    static DefaultLogger fallback(LogOption... options) {
        LoggerSettings settings = new LoggerSettings();
        settings.setFlags(LogFlags.DATE | LogFlags.MICROSECONDS | LogFlags.SHORT_FILE);
        for (LogOption option : options) {
            option.apply(settings);
        }
        PrintStream stderr = settings.getStderr();
        Map<Level, LevelChannel> channels = new EnumMap<>(Level.class);
        for (Level level : Level.values()) {
            FanOutStream fanOut = new FanOutStream(List.of(stderr), stderr);
            channels.put(level, new LevelChannel(level, EARLY_WARNING + level.tag(), settings.getFlags(),
                    fanOut, stderr, settings.getClock()));
        }
        DefaultLogger logger = new DefaultLogger(settings.getFormatter(), channels, List.of(), settings.getGate(),
                settings.getFlags(), settings.getTerminator(), stderr);
        logger.markInitialized();
        return logger;
    }

}
