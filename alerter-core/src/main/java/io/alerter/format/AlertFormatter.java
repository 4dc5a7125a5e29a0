/*
 * AlertFormatter.java
 *
 * This source file is part of the alerter open source project
 *
 * Copyright 2023 The alerter Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.alerter.format;

import io.alerter.annotation.API;
import io.alerter.util.KeyValue;
import io.alerter.util.KeysAndValues;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Array;
import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders alerts as single lines of {@code key=value} tokens.
 *
 * <p>
 * An info alert with name {@code store/compactor} and one pair renders as
 * {@code logger="store/compactor" level=1 msg="Compacted" files=3}. Error alerts carry an {@code error} token in
 * place of {@code level}. Values implementing {@link io.alerter.AlertMarshaler} are rendered through their
 * substitute. Strings are quoted and escaped, numbers and booleans are bare, maps render as {@code {"k":v}} and
 * iterables and arrays render as {@code [v,...]}. Keys are written bare, with {@code =}, {@code "} and whitespace
 * removed.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class AlertFormatter {
    /**
     * Rendered in place of containers nested deeper than the formatter's maximum depth.
     */
    public static final String MAX_DEPTH_EXCEEDED = "<max-log-depth-exceeded>";
    public static final int DEFAULT_MAX_LOG_DEPTH = 16;

    private static final Pattern KEY_SANITIZER = Pattern.compile("[=\\s\"]");
    private static final AlertFormatter DEFAULT = new AlertFormatter(DEFAULT_MAX_LOG_DEPTH, false, Clock.systemUTC());

    private final int maxLogDepth;
    private final boolean logTimestamp;
    @Nonnull
    private final Clock clock;

    /**
     * Create a formatter.
     *
     * @param maxLogDepth deepest container nesting that is rendered
     * @param logTimestamp whether lines start with a {@code ts} token
     * @param clock source of the {@code ts} token
     */
    public AlertFormatter(int maxLogDepth, boolean logTimestamp, @Nonnull Clock clock) {
        this.maxLogDepth = maxLogDepth;
        this.logTimestamp = logTimestamp;
        this.clock = clock;
    }

    /**
     * Format a static message followed by key/value pairs. This is the form the bundled sinks use when reporting
     * their own problems through SLF4J.
     *
     * @param staticMessage constant message
     * @param keysAndValues flattened key/value pairs
     * @return the formatted message
     */
    @Nonnull
    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final StringBuilder sb = new StringBuilder(staticMessage);
        DEFAULT.appendPairs(sb, KeysAndValues.of(keysAndValues));
        return sb.toString();
    }

    /**
     * Format an informational alert.
     *
     * @param name joined name of the sink, or {@code null} to leave out the {@code logger} token
     * @param level verbosity level of the alert
     * @param msg constant message
     * @param context pairs accumulated by the sink
     * @param keysAndValues flattened pairs passed with the alert
     * @return the rendered line
     */
    @Nonnull
    public String formatInfo(@Nullable String name, int level, @Nonnull String msg,
                             @Nonnull KeysAndValues context, @Nullable Object... keysAndValues) {
        final StringBuilder sb = new StringBuilder(64);
        appendPrefix(sb, name);
        appendToken(sb, "level").append(level);
        appendToken(sb, "msg");
        appendQuoted(sb, msg);
        appendPairs(sb, context.concat(keysAndValues));
        return sb.toString();
    }

    /**
     * Format an error alert.
     *
     * @param name joined name of the sink, or {@code null} to leave out the {@code logger} token
     * @param err the error, or {@code null}
     * @param msg constant message
     * @param context pairs accumulated by the sink
     * @param keysAndValues flattened pairs passed with the alert
     * @return the rendered line
     */
    @Nonnull
    public String formatError(@Nullable String name, @Nullable Throwable err, @Nonnull String msg,
                              @Nonnull KeysAndValues context, @Nullable Object... keysAndValues) {
        final StringBuilder sb = new StringBuilder(64);
        appendPrefix(sb, name);
        appendToken(sb, "msg");
        appendQuoted(sb, msg);
        appendToken(sb, "error");
        if (err == null) {
            sb.append("null");
        } else {
            appendQuoted(sb, err.toString());
        }
        appendPairs(sb, context.concat(keysAndValues));
        return sb.toString();
    }

    private void appendPrefix(@Nonnull StringBuilder sb, @Nullable String name) {
        if (logTimestamp) {
            appendToken(sb, "ts");
            appendQuoted(sb, clock.instant().toString());
        }
        if (name != null && !name.isEmpty()) {
            appendToken(sb, "logger");
            appendQuoted(sb, name);
        }
    }

    private void appendPairs(@Nonnull StringBuilder sb, @Nonnull KeysAndValues pairs) {
        for (KeyValue pair : pairs) {
            appendToken(sb, sanitizeKey(pair.getKey()));
            appendValue(sb, Marshaling.marshal(pair.getValue()), 0);
        }
    }

    @Nonnull
    private static StringBuilder appendToken(@Nonnull StringBuilder sb, @Nonnull String key) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
        return sb.append(key).append('=');
    }

    private void appendValue(@Nonnull StringBuilder sb, @Nullable Object value, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Map<?, ?>) {
            if (depth >= maxLogDepth) {
                appendQuoted(sb, MAX_DEPTH_EXCEEDED);
                return;
            }
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendQuoted(sb, String.valueOf(entry.getKey()));
                sb.append(':');
                appendValue(sb, entry.getValue(), depth + 1);
            }
            sb.append('}');
        } else if (value instanceof Iterable<?> || value.getClass().isArray()) {
            if (depth >= maxLogDepth) {
                appendQuoted(sb, MAX_DEPTH_EXCEEDED);
                return;
            }
            sb.append('[');
            if (value instanceof Iterable<?>) {
                final Iterator<?> iterator = ((Iterable<?>)value).iterator();
                while (iterator.hasNext()) {
                    appendValue(sb, iterator.next(), depth + 1);
                    if (iterator.hasNext()) {
                        sb.append(',');
                    }
                }
            } else {
                final int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    if (i > 0) {
                        sb.append(',');
                    }
                    appendValue(sb, Array.get(value, i), depth + 1);
                }
            }
            sb.append(']');
        } else {
            appendQuoted(sb, value.toString());
        }
    }

    @Nonnull
    private static String sanitizeKey(@Nonnull String key) {
        return KEY_SANITIZER.matcher(key).replaceAll("");
    }

    private static void appendQuoted(@Nonnull StringBuilder sb, @Nonnull String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        sb.append('"');
    }
}
