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

import ch.qos.logback.core.net.SyslogConstants;
import io.multilog.log.Level;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SyslogSystemLogTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void testSeverities() {
        assertEquals(SyslogConstants.DEBUG_SEVERITY, SyslogSystemLog.severity(Level.DEBUG));
        assertEquals(SyslogConstants.NOTICE_SEVERITY, SyslogSystemLog.severity(Level.INFO));
        assertEquals(SyslogConstants.WARNING_SEVERITY, SyslogSystemLog.severity(Level.WARNING));
        assertEquals(SyslogConstants.ERROR_SEVERITY, SyslogSystemLog.severity(Level.ERROR));
        assertEquals(SyslogConstants.ERROR_SEVERITY, SyslogSystemLog.severity(Level.FATAL));
        assertEquals(SyslogConstants.CRITICAL_SEVERITY, SyslogSystemLog.severity(Level.PANIC));
    }

    @Test
    void testDatagramFraming() throws IOException {
        InetAddress loopback = InetAddress.getByName("127.0.0.1");
        try (DatagramSocket server = new DatagramSocket(0, loopback)) {
            server.setSoTimeout(5000);
            try (SyslogSystemLog log = SyslogSystemLog.open("myapp", "127.0.0.1", server.getLocalPort(), clock)) {
                OutputStream info = log.channel(Level.INFO);
                info.write("INFO : started\n".getBytes(StandardCharsets.UTF_8));
                info.flush();
                String message = receive(server);
                assertTrue(message.startsWith("<13>May  1 10:15:30 "), message);
                assertTrue(message.contains(" myapp[" + ProcessHandle.current().pid() + "]: "), message);
                assertTrue(message.endsWith("]: INFO : started"), message);

                OutputStream panic = log.channel(Level.PANIC);
                panic.write("PANIC: down".getBytes(StandardCharsets.UTF_8));
                panic.flush();
                assertTrue(receive(server).startsWith("<10>"));
            }
        }
    }

    @Test
    void testEmptySourceUsesDefaultTag() throws IOException {
        try (SyslogSystemLog log = SyslogSystemLog.open("", "127.0.0.1", 514, clock)) {
            SyslogSystemLog.SyslogChannel channel = (SyslogSystemLog.SyslogChannel) log.channel(Level.ERROR);
            String header = channel.header();
            assertTrue(header.startsWith("<11>May  1 10:15:30 "), header);
            assertTrue(header.contains(" multilog["), header);
        }
    }

    private static String receive(DatagramSocket server) throws IOException {
        byte[] buffer = new byte[2048];
        DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
        server.receive(packet);
        return new String(packet.getData(), 0, packet.getLength(), StandardCharsets.UTF_8);
    }

}
