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

import io.multilog.log.Fields;
import io.multilog.log.Level;

/**
 * Turns one log call into the text handed to the level's channel.
 * <p>
 * A formatter may take over the channel header flags (the channel then writes
 * with {@link #flags()}) and the per-level prefixes (the channel then uses
 * {@link #prefix(Level)} instead of {@link Level#tag()}).
 */
public interface Formatter {

    /**
     * @param flags   the logger's output flags
     * @param level   level of the call
     * @param fields  fields of the call, already merged
     * @param message rendered message
     */
    String output(int flags, Level level, Fields fields, String message);

    boolean overridesFlags();

    boolean overridesPrefixes();

    default int flags() {
        return LogFlags.DISABLED;
    }

    default String prefix(Level level) {
        return level.tag();
    }

}
