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

import io.multilog.common.Diagnostics;
import io.multilog.output.Formatter;
import io.multilog.sink.LevelChannel;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * The logger built by {@link Loggers}.
 * <p>
 * Lifecycle: uninitialized while being wired, initialized once construction
 * completes, closed after {@link #close()}. Lines emitted after close are dropped.
 * Line writes, one-shot field changes and state changes all hold {@link Log#LOCK},
 * so lines from concurrent callers never interleave.
 */
public class DefaultLogger implements Logger {

    enum State {
        UNINITIALIZED, INITIALIZED, CLOSED
    }

    private final Formatter formatter;
    private final Map<Level, LevelChannel> channels;
    private final List<Closeable> closers;
    private final Terminator terminator;
    private final PrintStream fallback;

    private volatile SeverityGate gate;
    private volatile int flags;
    private volatile Fields contextFields = Fields.EMPTY;

    // guarded by Log.LOCK
    private Fields fields = Fields.EMPTY;
    private State state = State.UNINITIALIZED;

    DefaultLogger(Formatter formatter, Map<Level, LevelChannel> channels, List<Closeable> closers,
                  SeverityGate gate, int flags, Terminator terminator, PrintStream fallback) {
        this.formatter = formatter;
        this.channels = Map.copyOf(channels);
        this.closers = List.copyOf(closers);
        this.gate = gate;
        this.flags = flags;
        this.terminator = terminator;
        this.fallback = fallback;
    }

    void markInitialized() {
        synchronized (Log.LOCK) {
            if (state == State.UNINITIALIZED) {
                state = State.INITIALIZED;
            }
        }
    }

    State getState() {
        synchronized (Log.LOCK) {
            return state;
        }
    }

    public boolean isClosed() {
        return getState() == State.CLOSED;
    }

    public Formatter getFormatter() {
        return formatter;
    }

    public LevelChannel getChannel(Level level) {
        return channels.get(level);
    }

    // ========== Emit ==========

    private void emit(Level level, String message) {
        Fields callFields = takeFields();
        if (!gate.enabled(level)) {
            return;
        }
        String text;
        try {
            text = formatter.output(flags, level, callFields, message);
        } catch (RuntimeException e) {
            fallback.println("Failed to format " + level.label() + " log: " + e);
            return;
        }
        synchronized (Log.LOCK) {
            if (state == State.CLOSED) {
                Diagnostics.LOGGER.debug("dropped {} line, logger is closed", level.label());
                return;
            }
            try {
                channels.get(level).output(text);
            } catch (RuntimeException e) {
                fallback.println("Failed to write " + level.label() + " log: " + e);
            }
        }
    }

    /**
     * One-shot fields are taken and cleared in one step, so they can never leak
     * into a later call, whatever happens while the line is written.
     */
    private Fields takeFields() {
        synchronized (Log.LOCK) {
            Fields taken = fields.merge(contextFields);
            fields = Fields.EMPTY;
            return taken;
        }
    }

    private void exit(String message) {
        try {
            emit(Level.FATAL, message);
            close();
        } finally {
            terminator.exit(1);
        }
    }

    private void panicWith(String message) {
        try {
            emit(Level.PANIC, message);
            close();
        } finally {
            terminator.panic(message);
        }
    }

    /**
     * A format that does not match its arguments still yields a line; the
     * failure goes to the fallback stream instead of the caller.
     */
    private String sprintf(String format, Object... args) {
        try {
            return Messages.format(format, args);
        } catch (RuntimeException e) {
            fallback.println("Failed to format log message \"" + format + "\": " + e);
            return Messages.badFormat(format, args);
        }
    }

    @Override
    public void debug(Object... values) {
        emit(Level.DEBUG, Messages.join(values));
    }

    @Override
    public void debugf(String format, Object... args) {
        emit(Level.DEBUG, sprintf(format, args));
    }

    @Override
    public void info(Object... values) {
        emit(Level.INFO, Messages.join(values));
    }

    @Override
    public void infof(String format, Object... args) {
        emit(Level.INFO, sprintf(format, args));
    }

    @Override
    public void warning(Object... values) {
        emit(Level.WARNING, Messages.join(values));
    }

    @Override
    public void warningf(String format, Object... args) {
        emit(Level.WARNING, sprintf(format, args));
    }

    @Override
    public void error(Object... values) {
        emit(Level.ERROR, Messages.join(values));
    }

    @Override
    public void errorf(String format, Object... args) {
        emit(Level.ERROR, sprintf(format, args));
    }

    @Override
    public void panic(Object... values) {
        panicWith(Messages.join(values));
    }

    @Override
    public void panicf(String format, Object... args) {
        panicWith(sprintf(format, args));
    }

    @Override
    public void fatal(Object... values) {
        exit(Messages.join(values));
    }

    @Override
    public void fatalf(String format, Object... args) {
        exit(sprintf(format, args));
    }

    // ========== Settings ==========

    @Override
    public void setLevel(Level threshold) {
        setGate(new ThresholdGate(threshold));
    }

    @Override
    public void setLevelMask(int mask) {
        setGate(new MaskGate(mask));
    }

    @Override
    public void setGate(SeverityGate gate) {
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        this.gate = gate;
    }

    @Override
    public SeverityGate getGate() {
        return gate;
    }

    /**
     * Channel headers follow the new flags unless the formatter controls them;
     * the formatter always receives the flags.
     */
    @Override
    public void setFlags(int flags) {
        if (!formatter.overridesFlags()) {
            for (LevelChannel channel : channels.values()) {
                channel.setFlags(flags);
            }
        }
        this.flags = flags;
    }

    @Override
    public int getFlags() {
        return flags;
    }

    @Override
    public Logger with(Fields fields) {
        if (fields != null) {
            synchronized (Log.LOCK) {
                this.fields = this.fields.merge(fields);
            }
        }
        return this;
    }

    @Override
    public Logger withContextFields(Fields fields) {
        contextFields = fields == null ? Fields.EMPTY : fields;
        return this;
    }

    @Override
    public void close() {
        synchronized (Log.LOCK) {
            if (state != State.INITIALIZED) {
                return;
            }
            state = State.CLOSED;
            for (Closeable closer : closers) {
                try {
                    closer.close();
                } catch (IOException e) {
                    fallback.println("Failed to close log " + closer + ": " + e);
                }
            }
        }
    }

}
