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

import io.multilog.output.Formatter;
import io.multilog.output.LogFlags;
import io.multilog.output.PlainFormatter;
import io.multilog.sink.SystemLogFactory;
import io.multilog.sink.SystemLogs;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Mutable construction settings, filled in by {@link LogOption}s before a
 * logger is built. Not shared once the logger exists.
 */
public class LoggerSettings {

    private Formatter formatter = new PlainFormatter();
    private int flags = LogFlags.STD;
    private SeverityGate gate = new ThresholdGate(Level.DEFAULT);
    private Terminator terminator = Terminator.SYSTEM;

    // platform streams, last destination of every level
    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;

    private SystemLogFactory systemLogFactory = SystemLogs.platform();
    private String slf4jCategory;
    private Clock clock = Clock.systemDefaultZone();

    public Formatter getFormatter() {
        return formatter;
    }

    public void setFormatter(Formatter formatter) {
        this.formatter = require(formatter, "formatter");
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public SeverityGate getGate() {
        return gate;
    }

    public void setGate(SeverityGate gate) {
        this.gate = require(gate, "gate");
    }

    public Terminator getTerminator() {
        return terminator;
    }

    public void setTerminator(Terminator terminator) {
        this.terminator = require(terminator, "terminator");
    }

    public PrintStream getStdout() {
        return stdout;
    }

    public void setStdout(PrintStream stdout) {
        this.stdout = require(stdout, "stdout");
    }

    public PrintStream getStderr() {
        return stderr;
    }

    public void setStderr(PrintStream stderr) {
        this.stderr = require(stderr, "stderr");
    }

    public SystemLogFactory getSystemLogFactory() {
        return systemLogFactory;
    }

    public void setSystemLogFactory(SystemLogFactory systemLogFactory) {
        this.systemLogFactory = require(systemLogFactory, "systemLogFactory");
    }

    public String getSlf4jCategory() {
        return slf4jCategory;
    }

    public void setSlf4jCategory(String slf4jCategory) {
        this.slf4jCategory = slf4jCategory;
    }

    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = require(clock, "clock");
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

}
