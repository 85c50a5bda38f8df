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

import io.multilog.common.OsUtils;

/**
 * Platform system log selection.
 */
public final class SystemLogs {

    public static final String SYSLOG_HOST = "localhost";
    public static final int SYSLOG_PORT = 514;

    private SystemLogs() {
    }

    /**
     * The Windows event log on Windows, the local syslog daemon elsewhere.
     */
    public static SystemLogFactory platform() {
        if (OsUtils.isWindows()) {
            return EventLogSystemLog::open;
        }
        return syslog(SYSLOG_HOST, SYSLOG_PORT);
    }

    public static SystemLogFactory syslog(String host, int port) {
        return source -> SyslogSystemLog.open(source, host, port);
    }

}
