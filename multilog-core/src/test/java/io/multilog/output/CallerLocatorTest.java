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
import io.multilog.sink.LevelChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallerLocatorTest {

    @Test
    void testLocatesCaller() {
        CallerLocation location = CallerLocator.locate();
        assertEquals("CallerLocatorTest.java", location.file());
        assertEquals("io/multilog/output/CallerLocatorTest.java", location.path());
        assertTrue(location.line() > 0);
    }

    @Test
    void testSkipsFormatterFrames() {
        String text = new JsonFormatter().output(LogFlags.SHORT_FILE, Level.INFO, Fields.EMPTY, "");
        assertTrue(text.contains("\"file\":\"CallerLocatorTest.java:"), text);
    }

    @Test
    void testInternalClasses() {
        assertTrue(CallerLocator.isInternal(CallerLocator.class));
        assertTrue(CallerLocator.isInternal(LevelChannel.class));
        assertTrue(CallerLocator.isInternal(JsonFormatter.class));
        assertFalse(CallerLocator.isInternal(CallerLocatorTest.class));
        assertFalse(CallerLocator.isInternal(Headers.class));
    }

}
