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

import io.multilog.log.Level;
import io.multilog.output.CallerLocator;
import io.multilog.output.Headers;
import io.multilog.output.LogFlags;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Writes complete lines for one level: prefix, header, text and a newline.
 * Callers serialize access.
 */
public class LevelChannel {

    private final Level level;
    private final String prefix;
    private final OutputStream out;
    private final PrintStream fallback;
    private final Clock clock;
    private volatile int flags;

    public LevelChannel(Level level, String prefix, int flags, OutputStream out, PrintStream fallback, Clock clock) {
        this.level = level;
        this.prefix = prefix;
        this.flags = flags;
        this.out = out;
        this.fallback = fallback;
        this.clock = clock;
    }

    public Level getLevel() {
        return level;
    }

    public String getPrefix() {
        return prefix;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public OutputStream getOut() {
        return out;
    }

    public void output(String text) {
        byte[] bytes = format(text).getBytes(StandardCharsets.UTF_8);
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException e) {
            fallback.println("Failed to write " + level.label() + " log: " + e);
        }
    }

    String format(String text) {
        int f = flags;
        StringBuilder sb = new StringBuilder(prefix.length() + text.length() + 48);
        if ((f & LogFlags.MSG_PREFIX) == 0) {
            sb.append(prefix);
        }
        if (LogFlags.hasTimestamp(f)) {
            sb.append(Headers.timestamp(f, clock.instant(), clock.getZone())).append(' ');
        }
        if (LogFlags.hasFile(f)) {
            sb.append(Headers.file(f, CallerLocator.locate())).append(": ");
        }
        if ((f & LogFlags.MSG_PREFIX) != 0) {
            sb.append(prefix);
        }
        sb.append(text);
        if (text.isEmpty() || text.charAt(text.length() - 1) != '\n') {
            sb.append('\n');
        }
        return sb.toString();
    }

}
