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
 * A leveled logger writing each line to all destinations configured for the level.
 * <p>
 * Non-formatted methods join their operands; the {@code *f} methods use
 * {@link String#format(String, Object...)}. {@link #fatal} and {@link #panic} close
 * the logger after writing and then hand over to the logger's {@link Terminator}.
 */
public interface Logger extends AutoCloseable {

    void debug(Object... values);

    void debugf(String format, Object... args);

    void info(Object... values);

    void infof(String format, Object... args);

    void warning(Object... values);

    void warningf(String format, Object... args);

    void error(Object... values);

    void errorf(String format, Object... args);

    void panic(Object... values);

    void panicf(String format, Object... args);

    void fatal(Object... values);

    void fatalf(String format, Object... args);

    void setLevel(Level threshold);

    void setLevelMask(int mask);

    void setGate(SeverityGate gate);

    SeverityGate getGate();

    void setFlags(int flags);

    int getFlags();

    /**
     * Attach fields to the next call only.
     *
     * @return this logger, for chaining
     */
    Logger with(Fields fields);

    /**
     * Bind fields that are merged into every following call, replacing any
     * previously bound fields.
     *
     * @return this logger, for chaining
     */
    Logger withContextFields(Fields fields);

    /**
     * Close the owned sinks. Errors are reported to the fallback error stream.
     */
    @Override
    void close();

}
