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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Writes everything to each destination in order.
 * <p>
 * A destination that fails is reported on the fallback stream and skipped for
 * that write only; the remaining destinations are still written. Closing this
 * stream does not close the destinations, their owner does.
 */
public class FanOutStream extends OutputStream {

    private final List<OutputStream> destinations;
    private final PrintStream fallback;

    public FanOutStream(List<OutputStream> destinations, PrintStream fallback) {
        this.destinations = List.copyOf(destinations);
        this.fallback = fallback;
    }

    public List<OutputStream> getDestinations() {
        return destinations;
    }

    @Override
    public void write(int b) {
        for (OutputStream out : destinations) {
            try {
                out.write(b);
            } catch (IOException e) {
                report("write", out, e);
            }
        }
    }

    @Override
    public void write(byte[] b, int off, int len) {
        for (OutputStream out : destinations) {
            try {
                out.write(b, off, len);
            } catch (IOException e) {
                report("write", out, e);
            }
        }
    }

    @Override
    public void flush() {
        for (OutputStream out : destinations) {
            try {
                out.flush();
            } catch (IOException e) {
                report("flush", out, e);
            }
        }
    }

    private void report(String action, OutputStream out, IOException e) {
        fallback.println("Failed to " + action + " log to " + out + ": " + e);
    }

}
