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

import io.multilog.output.Formatter;
import io.multilog.sink.SystemLogFactory;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Factory methods for {@link LogOption}s.
 * <pre>
 * Logger logger = Loggers.newLogger(out, LogOptions.withLevel(Level.DEBUG), LogOptions.withFlags(LogFlags.DISABLED));
 * </pre>
 */
public final class LogOptions {

    private LogOptions() {
    }

    public static LogOption withFormatter(Formatter formatter) {
        return settings -> settings.setFormatter(formatter);
    }

    public static LogOption withLevel(Level threshold) {
        return settings -> settings.setGate(new ThresholdGate(threshold));
    }

    public static LogOption withLevelMask(int mask) {
        return settings -> settings.setGate(new MaskGate(mask));
    }

    public static LogOption withFlags(int flags) {
        return settings -> settings.setFlags(flags);
    }

    public static LogOption withTerminator(Terminator terminator) {
        return settings -> settings.setTerminator(terminator);
    }

    /**
     * Replace the platform streams (stdout for debug/info/warning, stderr for the rest).
     */
    public static LogOption withConsole(PrintStream stdout, PrintStream stderr) {
        return settings -> {
            settings.setStdout(stdout);
            settings.setStderr(stderr);
        };
    }

    public static LogOption withSystemLog(SystemLogFactory factory) {
        return settings -> settings.setSystemLogFactory(factory);
    }

    /**
     * Also forward every line to the given SLF4J category.
     */
    public static LogOption withSlf4j(String category) {
        return settings -> settings.setSlf4jCategory(category);
    }

    public static LogOption withClock(Clock clock) {
        return settings -> settings.setClock(clock);
    }

}
