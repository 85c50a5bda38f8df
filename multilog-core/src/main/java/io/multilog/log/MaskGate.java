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
 * Bitmask gate: a level passes when its bit is set in the mask.
 */
public record MaskGate(int mask) implements SeverityGate {

    public static final int NONE = 0;

    public static final int DEFAULT_MASK = Level.FATAL.bit() | Level.PANIC.bit() | Level.ERROR.bit()
            | Level.WARNING.bit() | Level.INFO.bit();

    public static final int ALL = DEFAULT_MASK | Level.DEBUG.bit();

    public static MaskGate of(Level... levels) {
        int mask = NONE;
        for (Level level : levels) {
            mask |= level.bit();
        }
        return new MaskGate(mask);
    }

    @Override
    public boolean enabled(Level level) {
        return (mask & level.bit()) != 0;
    }

}
