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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorizedFormatterTest {

    @Test
    void testColoredPrefixes() {
        ColorizedFormatter formatter = new ColorizedFormatter();
        assertTrue(formatter.overridesPrefixes());
        assertFalse(formatter.overridesFlags());
        assertEquals(Console.RED + "ERROR: " + Console.RESET, formatter.prefix(Level.ERROR));
        assertEquals(Console.RED + "FATAL: " + Console.RESET, formatter.prefix(Level.FATAL));
        assertEquals(Console.MAGENTA + "PANIC: " + Console.RESET, formatter.prefix(Level.PANIC));
        assertEquals(Console.YELLOW + "WARN : " + Console.RESET, formatter.prefix(Level.WARNING));
        assertEquals(Console.CYAN + "INFO : " + Console.RESET, formatter.prefix(Level.INFO));
        assertEquals(Console.WHITE + "DEBUG: " + Console.RESET, formatter.prefix(Level.DEBUG));
    }

    @Test
    void testPrefixesColoredEvenWithoutTerminal() {
        boolean colors = Console.isColorsEnabled();
        try {
            Console.setColorsEnabled(false);
            assertEquals(Console.CYAN + "INFO : " + Console.RESET, new ColorizedFormatter().prefix(Level.INFO));
        } finally {
            Console.setColorsEnabled(colors);
        }
    }

    @Test
    void testDelegatesBody() {
        ColorizedFormatter formatter = new ColorizedFormatter();
        assertEquals("a=1 msg", formatter.output(LogFlags.STD, Level.INFO, Fields.of("a", 1), "msg"));
    }

    @Test
    void testDecoratesJson() {
        ColorizedFormatter formatter = new ColorizedFormatter(new JsonFormatter());
        assertTrue(formatter.overridesFlags());
        assertEquals(LogFlags.DISABLED, formatter.flags());
        assertEquals("{\"level\":\"info\",\"msg\":\"m\"}",
                formatter.output(LogFlags.DISABLED, Level.INFO, Fields.EMPTY, "m"));
        assertEquals(Console.CYAN + "INFO : " + Console.RESET, formatter.prefix(Level.INFO));
    }

    @Test
    void testStripAnsi() {
        assertEquals("WARN : careful", Console.stripAnsi(new ColorizedFormatter().prefix(Level.WARNING) + "careful"));
    }

}
