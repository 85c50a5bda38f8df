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
package io.multilog.example;

import io.multilog.log.Fields;
import io.multilog.log.Level;
import io.multilog.log.Logger;
import io.multilog.log.LoggerConfig;
import io.multilog.log.LoggerPanicException;
import io.multilog.log.Loggers;
import io.multilog.output.LogFlags;

import java.util.Map;

/**
 * Walks through every level of a logger built from system properties, e.g.
 * <pre>
 * java -Dmultilog.format=color -Dmultilog.level=debug -jar multilog-example.jar
 * </pre>
 * Ends with a fatal line, so the process exits with status 1.
 */
public class Main {

    record Point(int x, int y) {
    }

    public static void main(String[] args) {
        LoggerConfig config = LoggerConfig.fromSystemProperties();
        if (System.getProperty(LoggerConfig.LEVEL) == null) {
            config.setLevel(Level.DEBUG);
        }
        if (System.getProperty(LoggerConfig.FLAGS) == null) {
            config.setFlags(LogFlags.STD | LogFlags.MICROSECONDS);
        }
        Logger logger = Loggers.newLogger(config)
                .withContextFields(Fields.of("_context", "bound"));

        logger.debug("debug");
        logger.with(Fields.of(Map.of(
                "asd", "bsd",
                "lorem", "ipsum dolor",
                "bang", 10,
                "point", new Point(3, 4)))).info("info");
        logger.warning("warn");
        logger.error("error");
        try {
            logger.with(Fields.of("test", "check")).panic("panic");
        } catch (LoggerPanicException e) {
            // the panic closed the logger, report through a fresh one
            Loggers.newLogger(config).fatalf("recovered from panic: %s", e.getMessage());
        }
    }

}
