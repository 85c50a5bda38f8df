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
package io.multilog.sink;

import io.multilog.log.Level;
import io.multilog.output.Console;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Forwards lines to an SLF4J category, at the SLF4J level matching the log level.
 * <p>
 * Configure the category in your logback.xml:
 * <pre>
 * &lt;logger name="app.audit" level="INFO"&gt;
 *     &lt;appender-ref ref="FILE" /&gt;
 * &lt;/logger&gt;
 * </pre>
 * Bytes are buffered until {@link #flush()}, which forwards one line with the
 * trailing newline and any ANSI codes removed.
 */
public class Slf4jSink extends OutputStream {

    private final Logger logger;
    private final Level level;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    public Slf4jSink(String category, Level level) {
        this(LoggerFactory.getLogger(category), level);
    }

    public Slf4jSink(Logger logger, Level level) {
        this.logger = logger;
        this.level = level;
    }

    @Override
    public void write(int b) {
        buffer.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) {
        buffer.write(b, off, len);
    }

    @Override
    public void flush() {
        if (buffer.size() == 0) {
            return;
        }
        String line = Console.stripAnsi(buffer.toString(StandardCharsets.UTF_8)).stripTrailing();
        buffer.reset();
        switch (level) {
            case DEBUG -> logger.debug(line);
            case INFO -> logger.info(line);
            case WARNING -> logger.warn(line);
            case ERROR, PANIC, FATAL -> logger.error(line);
        }
    }

    @Override
    public String toString() {
        return "slf4j:" + logger.getName();
    }

}
