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

import io.multilog.common.Diagnostics;

import java.util.Optional;
import java.util.Set;

/**
 * Finds the application frame that issued a log call: the first frame below
 * the logging classes on the current stack.
 */
public final class CallerLocator {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    // frames of these classes (and their nested classes) belong to the logger
    private static final Set<String> INTERNAL = Set.of(
            "io.multilog.log.DefaultLogger",
            "io.multilog.log.Log",
            "io.multilog.sink.LevelChannel",
            "io.multilog.sink.FanOutStream",
            "io.multilog.output.CallerLocator",
            "io.multilog.output.Formatter",
            "io.multilog.output.PlainFormatter",
            "io.multilog.output.JsonFormatter",
            "io.multilog.output.ColorizedFormatter"
    );

    private CallerLocator() {
    }

    public static CallerLocation locate() {
        try {
            Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames
                    .dropWhile(f -> isInternal(f.getDeclaringClass()))
                    .findFirst());
            return frame.map(CallerLocator::toLocation).orElse(CallerLocation.UNKNOWN);
        } catch (RuntimeException e) {
            Diagnostics.LOGGER.debug("caller lookup failed: {}", e.getMessage());
            return CallerLocation.UNKNOWN;
        }
    }

    static boolean isInternal(Class<?> type) {
        String name = type.getName();
        int pos = name.indexOf('$');
        return INTERNAL.contains(pos == -1 ? name : name.substring(0, pos));
    }

    private static CallerLocation toLocation(StackWalker.StackFrame frame) {
        String file = frame.getFileName();
        if (file == null) {
            return CallerLocation.UNKNOWN;
        }
        String pkg = frame.getDeclaringClass().getPackageName();
        String path = pkg.isEmpty() ? file : pkg.replace('.', '/') + "/" + file;
        return new CallerLocation(file, path, Math.max(frame.getLineNumber(), 0));
    }

}
