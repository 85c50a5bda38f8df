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
 * Builds the message text of a log call.
 */
final class Messages {

    private Messages() {
    }

    /**
     * Concatenate the operands, adding a space between two operands when
     * neither of them is a string. A value whose {@code toString()} fails is
     * rendered as {@code %!v(PANIC=<exception>)}.
     */
    static String join(Object... values) {
        if (values == null || values.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            Object value = values[i];
            if (i > 0 && !(value instanceof String) && !(values[i - 1] instanceof String)) {
                sb.append(' ');
            }
            sb.append(stringify(value));
        }
        return sb.toString();
    }

    /**
     * {@link String#format(String, Object...)}, also when there are no arguments,
     * so {@code %%} always collapses to {@code %}.
     *
     * @throws java.util.IllegalFormatException when the format does not match the arguments
     */
    static String format(String format, Object... args) {
        return String.format(String.valueOf(format), args == null ? new Object[0] : args);
    }

    /**
     * Rendering used when {@link #format} fails: the format as given followed by
     * the stringified arguments, e.g. {@code count=%d %!(abc)}.
     */
    static String badFormat(String format, Object... args) {
        StringBuilder sb = new StringBuilder(String.valueOf(format));
        sb.append(" %!(");
        if (args != null) {
            for (int i = 0; i < args.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(stringify(args[i]));
            }
        }
        return sb.append(')').toString();
    }

    private static String stringify(Object value) {
        try {
            return Fields.stringify(value);
        } catch (RuntimeException e) {
            return "%!v(PANIC=" + e + ")";
        }
    }

}
