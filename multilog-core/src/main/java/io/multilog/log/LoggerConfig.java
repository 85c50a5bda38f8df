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

import io.multilog.output.ColorizedFormatter;
import io.multilog.output.Console;
import io.multilog.output.Formatter;
import io.multilog.output.JsonFormatter;
import io.multilog.output.LogFlags;
import io.multilog.output.PlainFormatter;
import io.multilog.sink.SystemLogs;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Logger settings read from properties.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code multilog.level} - debug, info, warning, error, panic, fatal (default info)</li>
 *   <li>{@code multilog.format} - plain, json, color or auto (color when the terminal supports it)</li>
 *   <li>{@code multilog.flags} - comma separated, see {@link LogFlags#parse(String)} (default std)</li>
 *   <li>{@code multilog.syslog} - source name, enables the system log</li>
 *   <li>{@code multilog.syslog.address} - {@code host[:port]} of a syslog daemon listening on UDP,
 *   replaces the platform system log (default port 514)</li>
 *   <li>{@code multilog.slf4j} - SLF4J category to forward lines to</li>
 * </ul>
 * Invalid values fail fast with {@link IllegalArgumentException}.
 */
public class LoggerConfig {

    public static final String LEVEL = "multilog.level";
    public static final String FORMAT = "multilog.format";
    public static final String FLAGS = "multilog.flags";
    public static final String SYSLOG = "multilog.syslog";
    public static final String SYSLOG_ADDRESS = "multilog.syslog.address";
    public static final String SLF4J = "multilog.slf4j";

    private static final List<String> FORMATS = List.of("plain", "json", "color", "auto");

    private Level level = Level.DEFAULT;
    private String format = "plain";
    private int flags = LogFlags.STD;
    private String syslogSource;
    private String syslogHost;
    private int syslogPort = SystemLogs.SYSLOG_PORT;
    private String slf4jCategory;

    public static LoggerConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    public static LoggerConfig from(Properties props) {
        LoggerConfig config = new LoggerConfig();
        String level = props.getProperty(LEVEL);
        if (level != null) {
            config.setLevel(Level.fromString(level));
        }
        String format = props.getProperty(FORMAT);
        if (format != null) {
            config.setFormat(format);
        }
        String flags = props.getProperty(FLAGS);
        if (flags != null) {
            config.setFlags(LogFlags.parse(flags));
        }
        config.setSyslogSource(blankToNull(props.getProperty(SYSLOG)));
        String address = blankToNull(props.getProperty(SYSLOG_ADDRESS));
        if (address != null) {
            config.setSyslogAddress(address);
        }
        config.setSlf4jCategory(blankToNull(props.getProperty(SLF4J)));
        return config;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public Formatter createFormatter() {
        return switch (format) {
            case "json" -> new JsonFormatter();
            case "color" -> new ColorizedFormatter();
            case "auto" -> Console.isColorsEnabled() ? new ColorizedFormatter() : new PlainFormatter();
            default -> new PlainFormatter();
        };
    }

    public List<LogOption> toOptions() {
        List<LogOption> options = new ArrayList<>();
        options.add(LogOptions.withFormatter(createFormatter()));
        options.add(LogOptions.withLevel(level));
        options.add(LogOptions.withFlags(flags));
        if (syslogHost != null) {
            options.add(LogOptions.withSystemLog(SystemLogs.syslog(syslogHost, syslogPort)));
        }
        if (slf4jCategory != null) {
            options.add(LogOptions.withSlf4j(slf4jCategory));
        }
        return options;
    }

    public Level getLevel() {
        return level;
    }

    public void setLevel(Level level) {
        this.level = level;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        String value = format == null ? "" : format.trim().toLowerCase();
        if (!FORMATS.contains(value)) {
            throw new IllegalArgumentException("unknown log format: " + format + ", expected one of " + FORMATS);
        }
        this.format = value;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public String getSyslogSource() {
        return syslogSource;
    }

    public void setSyslogSource(String syslogSource) {
        this.syslogSource = syslogSource;
    }

    /**
     * @param address {@code host} or {@code host:port}
     * @throws IllegalArgumentException for an empty host or a port outside 1-65535
     */
    public void setSyslogAddress(String address) {
        String value = address == null ? "" : address.trim();
        String host = value;
        int port = SystemLogs.SYSLOG_PORT;
        int pos = value.lastIndexOf(':');
        if (pos != -1) {
            host = value.substring(0, pos);
            try {
                port = Integer.parseInt(value.substring(pos + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid syslog port in: " + address);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("invalid syslog port in: " + address);
            }
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("syslog address needs a host: " + address);
        }
        this.syslogHost = host;
        this.syslogPort = port;
    }

    public String getSyslogHost() {
        return syslogHost;
    }

    public int getSyslogPort() {
        return syslogPort;
    }

    public String getSlf4jCategory() {
        return slf4jCategory;
    }

    public void setSlf4jCategory(String slf4jCategory) {
        this.slf4jCategory = slf4jCategory;
    }

}
