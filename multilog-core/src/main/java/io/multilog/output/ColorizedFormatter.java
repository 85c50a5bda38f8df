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
 * Wraps another formatter and replaces the level prefixes with colored ones.
 */
public class ColorizedFormatter implements Formatter {

    private final Formatter delegate;

    public ColorizedFormatter() {
        this(new PlainFormatter());
    }

    public ColorizedFormatter(Formatter delegate) {
        this.delegate = delegate;
    }

    @Override
    public String output(int flags, Level level, Fields fields, String message) {
        return delegate.output(flags, level, fields, message);
    }

    @Override
    public boolean overridesFlags() {
        return delegate.overridesFlags();
    }

    @Override
    public int flags() {
        return delegate.flags();
    }

    @Override
    public boolean overridesPrefixes() {
        return true;
    }

    @Override
    public String prefix(Level level) {
        return Console.wrap(level.tag(), Console.colorOf(level));
    }

}
