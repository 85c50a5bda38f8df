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
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One JSON object per line:
 * <pre>
 * {"time":"2024/05/01 10:15:30","level":"info","msg":"started","file":"Main.java:12","port":8080}
 * </pre>
 * {@code time} and {@code file} are present only when the logger's flags ask for
 * them. The formatter encodes level, time and caller itself, so the channels run
 * without header flags or prefixes.
 */
public class JsonFormatter implements Formatter {

    public static final String TIME = "time";
    public static final String LEVEL = "level";
    public static final String MSG = "msg";
    public static final String FILE = "file";

    // FLAG_PROTECT_4WEB turns off the web escaping, so "/" stays unescaped
    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private final Clock clock;

    public JsonFormatter() {
        this(Clock.systemDefaultZone());
    }

    public JsonFormatter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String output(int flags, Level level, Fields fields, String message) {
        Fields merged = fields
                .merge(Fields.of(MSG, message, LEVEL, level.label()))
                .merge(headers(flags));
        return JSONValue.toJSONString(toOrderedMap(merged), JSON_STYLE);
    }

    private Fields headers(int flags) {
        Fields headers = Fields.EMPTY;
        if (LogFlags.hasFile(flags)) {
            headers = headers.with(FILE, Headers.file(flags, CallerLocator.locate()));
        }
        if (LogFlags.hasTimestamp(flags)) {
            headers = headers.with(TIME, Headers.timestamp(flags, clock.instant(), clock.getZone()));
        }
        return headers;
    }

    /**
     * Reserved keys first ({@code time}, {@code level}, {@code msg}), then the rest.
     */
    static Map<String, Object> toOrderedMap(Fields fields) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : new String[]{TIME, LEVEL, MSG}) {
            if (fields.containsKey(key)) {
                map.put(key, toJsonValue(fields.get(key)));
            }
        }
        for (Map.Entry<String, Object> entry : fields) {
            map.putIfAbsent(entry.getKey(), toJsonValue(entry.getValue()));
        }
        return map;
    }

    private static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), toJsonValue(v)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object item : collection) {
                result.add(toJsonValue(item));
            }
            return result;
        }
        if (value instanceof Object[] array) {
            List<Object> result = new ArrayList<>(array.length);
            for (Object item : array) {
                result.add(toJsonValue(item));
            }
            return result;
        }
        return Fields.stringify(value);
    }

    @Override
    public boolean overridesFlags() {
        return true;
    }

    @Override
    public boolean overridesPrefixes() {
        return true;
    }

    @Override
    public String prefix(Level level) {
        return "";
    }

}
