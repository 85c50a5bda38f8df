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

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamp and caller parts of a line header, shared by the plain channels
 * and the JSON formatter.
 */
public final class Headers {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter MICROS_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    private Headers() {
    }

    /**
     * Date and/or time as selected by the flags, separated by a space.
     * Empty when no time flag is set.
     */
    public static String timestamp(int flags, Instant now, ZoneId zone) {
        if (!LogFlags.hasTimestamp(flags)) {
            return "";
        }
        ZonedDateTime t = now.atZone((flags & LogFlags.UTC) != 0 ? ZoneOffset.UTC : zone);
        StringBuilder sb = new StringBuilder(26);
        if ((flags & LogFlags.DATE) != 0) {
            sb.append(DATE_FORMAT.format(t));
        }
        if ((flags & (LogFlags.TIME | LogFlags.MICROSECONDS)) != 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(((flags & LogFlags.MICROSECONDS) != 0 ? MICROS_FORMAT : TIME_FORMAT).format(t));
        }
        return sb.toString();
    }

    /**
     * {@code file:line}, the short file name when {@link LogFlags#SHORT_FILE} is set.
     */
    public static String file(int flags, CallerLocation location) {
        String file = (flags & LogFlags.SHORT_FILE) != 0 ? location.file() : location.path();
        return file + ":" + location.line();
    }

}
