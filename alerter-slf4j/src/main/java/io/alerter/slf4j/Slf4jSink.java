/*
 * Slf4jSink.java
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

package io.alerter.slf4j;

import com.google.common.collect.ImmutableList;
import io.alerter.Alerter;
import io.alerter.AlerterSink;
import io.alerter.annotation.API;
import io.alerter.format.AlertFormatter;
import io.alerter.sinks.SinkOptions;
import io.alerter.util.KeysAndValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A sink that writes alerts through SLF4J.
 *
 * <p>
 * Name segments extend the SLF4J logger name with {@code .}, so an alerter created for {@code com.example.Store}
 * and named {@code compactor} writes to the logger {@code com.example.Store.compactor} and follows that logger's
 * configuration. Alerts at level zero are logged at INFO and alerts at higher levels at DEBUG; errors are logged at
 * ERROR with the error attached. The message is rendered by {@link AlertFormatter} without a {@code logger} token. If
 * rendering fails, a WARN describing the failure is logged to the same logger in place of the alert.
 * </p>
 *
 * <p>
 * An info alert is written only if its level is at most {@link SinkOptions#getVerbosity()} and the logger is enabled
 * for the corresponding SLF4J level.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class Slf4jSink implements AlerterSink {
    @Nonnull
    private final String rootName;
    @Nonnull
    private final ImmutableList<String> names;
    @Nonnull
    private final Logger logger;
    @Nonnull
    private final SinkOptions options;
    @Nonnull
    private final AlertFormatter formatter;
    @Nonnull
    private final KeysAndValues values;

    public Slf4jSink(@Nonnull String rootName, @Nonnull SinkOptions options) {
        this(rootName, ImmutableList.of(), options, options.newFormatter(), KeysAndValues.empty());
    }

    private Slf4jSink(@Nonnull String rootName, @Nonnull ImmutableList<String> names, @Nonnull SinkOptions options,
                      @Nonnull AlertFormatter formatter, @Nonnull KeysAndValues values) {
        this.rootName = rootName;
        this.names = names;
        this.logger = LoggerFactory.getLogger(loggerName(rootName, names));
        this.options = options;
        this.formatter = formatter;
        this.values = values;
    }

    @Nonnull
    public static Alerter newAlerter(@Nonnull String rootName, @Nonnull SinkOptions options) {
        return Alerter.of(new Slf4jSink(rootName, options));
    }

    @Nonnull
    public static Alerter newAlerter(@Nonnull Class<?> clazz, @Nonnull SinkOptions options) {
        return newAlerter(clazz.getName(), options);
    }

    /**
     * Create an alerter configured from system properties.
     *
     * @param clazz class whose name is used as the root logger name
     * @return a new alerter
     * @see SinkOptions#fromSystemProperties()
     */
    @Nonnull
    public static Alerter newAlerter(@Nonnull Class<?> clazz) {
        return newAlerter(clazz, SinkOptions.fromSystemProperties());
    }

    @Nonnull
    private static String loggerName(@Nonnull String rootName, @Nonnull List<String> names) {
        if (names.isEmpty()) {
            return rootName;
        }
        final String suffix = String.join(".", names);
        return rootName.isEmpty() ? suffix : rootName + "." + suffix;
    }

    @Override
    public boolean isEnabled(int level) {
        if (level > options.getVerbosity()) {
            return false;
        }
        return level == 0 ? logger.isInfoEnabled() : logger.isDebugEnabled();
    }

    @Override
    public void info(int level, @Nonnull String msg, @Nullable Object... keysAndValues) {
        final String line;
        try {
            line = formatter.formatInfo(null, level, msg, values, keysAndValues);
        } catch (RuntimeException e) {
            reportRenderFailure(msg, e);
            return;
        }
        if (level == 0) {
            logger.info(line);
        } else {
            logger.debug(line);
        }
    }

    @Override
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues) {
        final String line;
        try {
            line = formatter.formatError(null, err, msg, values, keysAndValues);
        } catch (RuntimeException e) {
            reportRenderFailure(msg, e);
            return;
        }
        if (err == null) {
            logger.error(line);
        } else {
            logger.error(line, err);
        }
    }

    private void reportRenderFailure(@Nonnull String msg, @Nonnull RuntimeException e) {
        if (logger.isWarnEnabled()) {
            logger.warn(AlertFormatter.of("alert could not be rendered", "msg", msg), e);
        }
    }

    @Nonnull
    @Override
    public Slf4jSink withValues(@Nullable Object... keysAndValues) {
        return new Slf4jSink(rootName, names, options, formatter, values.concat(keysAndValues));
    }

    @Nonnull
    @Override
    public Slf4jSink withName(@Nonnull String name) {
        return new Slf4jSink(rootName,
                ImmutableList.<String>builderWithExpectedSize(names.size() + 1).addAll(names).add(name).build(),
                options, formatter, values);
    }

    /**
     * The name of the SLF4J logger this sink writes to.
     * @return the logger name
     */
    @Nonnull
    public String getLoggerName() {
        return logger.getName();
    }

    @Nonnull
    public SinkOptions getOptions() {
        return options;
    }

    @Nonnull
    public KeysAndValues getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "Slf4jSink{logger=" + logger.getName() + ", values=" + values + "}";
    }
}
