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

/**
 * Process-wide default logger.
 * <p>
 * Until a logger is built through {@link Loggers}, calls go to a stderr-only
 * fallback that flags every line as logged too early. The first logger built
 * replaces it, exactly once. Prefer passing a {@link Logger} around; these
 * static methods only delegate to the current default.
 */
public final class Log {

    /**
     * Guards line writes, one-shot fields and the default instance.
     */
    static final Object LOCK = new Object();

    private static DefaultLogger current;
    private static boolean replaced;
    private static LogOption[] fallbackOptions = new LogOption[0];

    private Log() {
    }

    public static Logger get() {
        synchronized (LOCK) {
            if (current == null) {
                current = Loggers.fallback(fallbackOptions);
            }
            return current;
        }
    }

    static void install(DefaultLogger logger) {
        synchronized (LOCK) {
            if (!replaced) {
                current = logger;
                replaced = true;
            }
        }
    }

    /**
     * Drop the current default and go back to the fallback, built lazily with the given options.
     * Meant for tests.
     */
    public static void reset(LogOption... options) {
        synchronized (LOCK) {
            current = null;
            replaced = false;
            fallbackOptions = options.clone();
        }
    }

    // ========== Delegates ==========

    public static void debug(Object... values) {
        get().debug(values);
    }

    public static void debugf(String format, Object... args) {
        get().debugf(format, args);
    }

    public static void info(Object... values) {
        get().info(values);
    }

    public static void infof(String format, Object... args) {
        get().infof(format, args);
    }

    public static void warning(Object... values) {
        get().warning(values);
    }

    public static void warningf(String format, Object... args) {
        get().warningf(format, args);
    }

    public static void error(Object... values) {
        get().error(values);
    }

    public static void errorf(String format, Object... args) {
        get().errorf(format, args);
    }

    public static void panic(Object... values) {
        get().panic(values);
    }

    public static void panicf(String format, Object... args) {
        get().panicf(format, args);
    }

    public static void fatal(Object... values) {
        get().fatal(values);
    }

    public static void fatalf(String format, Object... args) {
        get().fatalf(format, args);
    }

    public static void setLevel(Level threshold) {
        get().setLevel(threshold);
    }

    public static void setLevelMask(int mask) {
        get().setLevelMask(mask);
    }

    public static void setFlags(int flags) {
        get().setFlags(flags);
    }

    public static Logger with(Fields fields) {
        return get().with(fields);
    }

    public static Logger withContextFields(Fields fields) {
        return get().withContextFields(fields);
    }

    public static void close() {
        get().close();
    }

}
