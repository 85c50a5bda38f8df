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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogFlagsTest {

    @Test
    void testStd() {
        assertEquals(LogFlags.DATE | LogFlags.TIME, LogFlags.STD);
        assertEquals(0, LogFlags.DISABLED);
    }

    @Test
    void testPredicates() {
        assertTrue(LogFlags.hasTimestamp(LogFlags.MICROSECONDS));
        assertTrue(LogFlags.hasTimestamp(LogFlags.DATE));
        assertFalse(LogFlags.hasTimestamp(LogFlags.UTC | LogFlags.SHORT_FILE));
        assertTrue(LogFlags.hasFile(LogFlags.LONG_FILE));
        assertTrue(LogFlags.hasFile(LogFlags.SHORT_FILE));
        assertFalse(LogFlags.hasFile(LogFlags.STD));
    }

    @Test
    void testParse() {
        assertEquals(LogFlags.STD, LogFlags.parse("std"));
        assertEquals(LogFlags.DATE | LogFlags.MICROSECONDS | LogFlags.SHORT_FILE,
                LogFlags.parse("Date, micro ,shortfile"));
        assertEquals(LogFlags.LONG_FILE | LogFlags.UTC | LogFlags.MSG_PREFIX | LogFlags.TIME,
                LogFlags.parse("longfile,utc,msgprefix,time"));
        assertEquals(LogFlags.MICROSECONDS, LogFlags.parse("microseconds"));
        assertEquals(LogFlags.DISABLED, LogFlags.parse("disabled"));
        assertEquals(LogFlags.DISABLED, LogFlags.parse(""));
        assertEquals(LogFlags.DISABLED, LogFlags.parse(null));
    }

    @Test
    void testParseUnknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LogFlags.parse("date,nanos"));
        assertEquals("unknown log flag: nanos", e.getMessage());
    }

}
