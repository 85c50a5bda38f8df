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
package io.multilog.output;

/**
 * Output flags controlling the header of a plain text line.
 * <p>
 * A header is {@code date time file: } and is written after the level prefix,
 * or before it when {@link #MSG_PREFIX} is set.
 */
public final class LogFlags {

    /** the date in the local time zone: 2009/01/23 */
    public static final int DATE = 1;
    /** the time in the local time zone: 01:23:23 */
    public static final int TIME = 1 << 1;
    /** microsecond resolution: 01:23:23.123123, implies TIME */
    public static final int MICROSECONDS = 1 << 2;
    /** class path and line number: io/multilog/example/Main.java:23 */
    public static final int LONG_FILE = 1 << 3;
    /** file name and line number: Main.java:23, overrides LONG_FILE */
    public static final int SHORT_FILE = 1 << 4;
    /** if DATE or TIME is set, use UTC rather than the local time zone */
    public static final int UTC = 1 << 5;
    /** move the prefix from the beginning of the line to before the message */
    public static final int MSG_PREFIX = 1 << 6;

    public static final int STD = DATE | TIME;
    public static final int DISABLED = 0;

    private LogFlags() {
    }

    public static boolean hasTimestamp(int flags) {
        return (flags & (DATE | TIME | MICROSECONDS)) != 0;
    }

    public static boolean hasFile(int flags) {
        return (flags & (LONG_FILE | SHORT_FILE)) != 0;
    }

    /**
     * Parse a comma separated list of flag names, e.g. {@code "std,microseconds,shortfile"}.
     * An empty string or {@code "disabled"} yields {@link #DISABLED}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static int parse(String text) {
        if (text == null || text.isBlank()) {
            return DISABLED;
        }
        int flags = DISABLED;
        for (String part : text.split(",")) {
            String name = part.trim().toLowerCase();
            flags |= switch (name) {
                case "date" -> DATE;
                case "time" -> TIME;
                case "micro", "microseconds" -> MICROSECONDS;
                case "longfile" -> LONG_FILE;
                case "shortfile" -> SHORT_FILE;
                case "utc" -> UTC;
                case "msgprefix" -> MSG_PREFIX;
                case "std" -> STD;
                case "disabled", "" -> DISABLED;
                default -> throw new IllegalArgumentException("unknown log flag: " + part.trim());
            };
        }
        return flags;
    }

}
