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
 * Severity levels, most severe first.
 * <p>
 * The ordinal order is the severity order: a level is enabled under a threshold
 * when the threshold is at least as verbose as the level. Each level also owns a
 * distinct bit for mask based gating, a lowercase name used in structured output
 * and a fixed width tag used as the line prefix.
 */
public enum Level {

    FATAL("fatal", "FATAL: "),
    PANIC("panic", "PANIC: "),
    ERROR("error", "ERROR: "),
    WARNING("warning", "WARN : "),
    INFO("info", "INFO : "),
    DEBUG("debug", "DEBUG: ");

    public static final Level DEFAULT = INFO;

    private final String label;
    private final String tag;

    Level(String label, String tag) {
        this.label = label;
        this.tag = tag;
    }

    public String label() {
        return label;
    }

    public String tag() {
        return tag;
    }

    public int bit() {
        return 1 << ordinal();
    }

    /**
     * True if a call at this level passes the given threshold.
     */
    public boolean isEnabled(Level threshold) {
        return threshold.ordinal() >= ordinal();
    }

    /**
     * Parse a level name, case-insensitive. Accepts "warn" as an alias.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Level fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("level name must not be empty");
        }
        String lower = name.trim().toLowerCase();
        if (lower.equals("warn")) {
            return WARNING;
        }
        for (Level level : values()) {
            if (level.label.equals(lower)) {
                return level;
            }
        }
        throw new IllegalArgumentException("unknown log level: " + name);
    }

}
