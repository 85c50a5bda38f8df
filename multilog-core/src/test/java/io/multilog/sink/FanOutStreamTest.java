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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FanOutStreamTest {

    static class FailingStream extends OutputStream {

        int flushes;

        @Override
        public void write(int b) throws IOException {
            throw new IOException("write refused");
        }

        @Override
        public void flush() throws IOException {
            flushes++;
            throw new IOException("flush refused");
        }

        @Override
        public String toString() {
            return "failing";
        }

    }

    @Test
    void testWritesEveryDestinationInOrder() throws IOException {
        StringBuilder order = new StringBuilder();
        OutputStream first = new ByteArrayOutputStream() {
            @Override
            public void write(byte[] b, int off, int len) {
                order.append("1");
                super.write(b, off, len);
            }
        };
        OutputStream second = new ByteArrayOutputStream() {
            @Override
            public void write(byte[] b, int off, int len) {
                order.append("2");
                super.write(b, off, len);
            }
        };
        FanOutStream fanOut = new FanOutStream(List.of(first, second), System.err);
        fanOut.write("line\n".getBytes(StandardCharsets.UTF_8));
        assertEquals("12", order.toString());
        assertEquals("line\n", first.toString());
        assertEquals("line\n", second.toString());
    }

    @Test
    void testFailureIsolated() {
        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        PrintStream fallback = new PrintStream(errors, true);
        FailingStream failing = new FailingStream();
        ByteArrayOutputStream good = new ByteArrayOutputStream();
        FanOutStream fanOut = new FanOutStream(List.of(failing, good), fallback);

        fanOut.write("abc".getBytes(StandardCharsets.UTF_8), 0, 3);
        fanOut.write('d');
        fanOut.flush();

        assertEquals("abcd", good.toString(StandardCharsets.UTF_8));
        assertEquals(1, failing.flushes);
        String reported = errors.toString(StandardCharsets.UTF_8);
        assertTrue(reported.contains("Failed to write log to failing: java.io.IOException: write refused"), reported);
        assertTrue(reported.contains("Failed to flush log to failing: java.io.IOException: flush refused"), reported);
    }

    @Test
    void testCloseLeavesDestinationsOpen() throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        PrintStream console = new PrintStream(sink, true);
        FanOutStream fanOut = new FanOutStream(List.of(console), System.err);
        fanOut.close();
        console.print("after");
        assertFalse(console.checkError());
        assertEquals("after", sink.toString(StandardCharsets.UTF_8));
    }

}
