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

import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code key=value} fields in key order followed by the message.
 * Header and prefix are left to the channel.
 */
public class PlainFormatter implements Formatter {

    private static final Pattern FIELD = Pattern.compile("([^\\s=\"]+)=(\"[^\"]*\"|\\S*) ");

    @Override
    public String output(int flags, Level level, Fields fields, String message) {
        return fields.render() + message;
    }

    @Override
    public boolean overridesFlags() {
        return false;
    }

    @Override
    public boolean overridesPrefixes() {
        return false;
    }

    /**
     * Split the output of this formatter back into fields and message.
     * Leading {@code key=value } tokens are read as fields, the rest is the message,
     * so a message that itself starts with such a token cannot be told apart.
     */
    public static PlainLine parse(String text) {
        TreeMap<String, Object> fields = new TreeMap<>();
        Matcher matcher = FIELD.matcher(text);
        int pos = 0;
        while (pos < text.length()) {
            matcher.region(pos, text.length());
            if (!matcher.lookingAt()) {
                break;
            }
            String value = matcher.group(2);
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            fields.put(matcher.group(1), value);
            pos = matcher.end();
        }
        return new PlainLine(Fields.of(fields), text.substring(pos));
    }

}
