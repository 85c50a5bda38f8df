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

import io.multilog.log.Level;

import java.util.regex.Pattern;

/**
 * ANSI color support for console output.
 */
public final class Console {

    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    // ANSI escape codes
    public static final String RESET = "\u001B[0m";

    // Colors
    public static final String RED = "\u001B[31m";
    public static final String YELLOW = "\u001B[33m";
    public static final String MAGENTA = "\u001B[35m";
    public static final String CYAN = "\u001B[36m";
    public static final String WHITE = "\u001B[37m";

    private static boolean colorsEnabled = detectColorSupport();

    private Console() {
    }

    static boolean detectColorSupport() {
        String term = System.getenv("TERM");
        String colorterm = System.getenv("COLORTERM");
        String forceColor = System.getenv("FORCE_COLOR");
        String noColor = System.getenv("NO_COLOR");

        // NO_COLOR takes precedence (https://no-color.org/)
        if (noColor != null) {
            return false;
        }

        if (forceColor != null && !forceColor.equals("0")) {
            return true;
        }

        if (term != null && (term.contains("color") || term.contains("xterm") || term.contains("256"))) {
            return true;
        }

        if (colorterm != null) {
            return true;
        }

        // Windows Terminal sets WT_SESSION, older consoles don't understand ANSI
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            return System.getenv("WT_SESSION") != null;
        }

        return System.console() != null;
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    /**
     * Whether the current terminal is expected to render ANSI colors.
     */
    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    /**
     * Wrap text in the given codes followed by a reset, regardless of terminal support.
     */
    public static String wrap(String text, String... codes) {
        if (codes.length == 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (String code : codes) {
            sb.append(code);
        }
        sb.append(text);
        sb.append(RESET);
        return sb.toString();
    }

    public static String colorOf(Level level) {
        return switch (level) {
            case FATAL, ERROR -> RED;
            case PANIC -> MAGENTA;
            case WARNING -> YELLOW;
            case INFO -> CYAN;
            case DEBUG -> WHITE;
        };
    }

    public static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

}
