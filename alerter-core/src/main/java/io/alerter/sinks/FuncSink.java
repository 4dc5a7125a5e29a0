/*
 * FuncSink.java
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

package io.alerter.sinks;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.alerter.Alerter;
import io.alerter.AlerterSink;
import io.alerter.annotation.API;
import io.alerter.format.AlertFormatter;
import io.alerter.util.KeysAndValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A sink that renders each alert as a line of text with {@link AlertFormatter} and hands it to a function.
 *
 * <p>
 * Info alerts are written when their level is at most {@link SinkOptions#getVerbosity()}. Name segments are joined
 * with {@link SinkOptions#getNameDelimiter()}. Calls to the output function are serialized across this sink and
 * every sink derived from it, so the function does not need to be thread safe. If the function (or rendering a
 * value) throws, the failure is logged through SLF4J and the alert is dropped.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class FuncSink implements AlerterSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(FuncSink.class);

    @Nonnull
    private final Consumer<String> output;
    @Nonnull
    private final Object writeLock;
    @Nonnull
    private final SinkOptions options;
    @Nonnull
    private final AlertFormatter formatter;
    @Nonnull
    private final ImmutableList<String> names;
    @Nullable
    private final String name;
    @Nonnull
    private final KeysAndValues values;

    public FuncSink(@Nonnull Consumer<String> output, @Nonnull SinkOptions options) {
        this(Preconditions.checkNotNull(output, "output"), new Object(), options, options.newFormatter(),
                ImmutableList.of(), KeysAndValues.empty());
    }

    private FuncSink(@Nonnull Consumer<String> output, @Nonnull Object writeLock, @Nonnull SinkOptions options,
                     @Nonnull AlertFormatter formatter, @Nonnull ImmutableList<String> names,
                     @Nonnull KeysAndValues values) {
        this.output = output;
        this.writeLock = writeLock;
        this.options = options;
        this.formatter = formatter;
        this.names = names;
        this.name = names.isEmpty() ? null : String.join(options.getNameDelimiter(), names);
        this.values = values;
    }

    /**
     * Create an alerter that writes lines to {@code output} with default options.
     *
     * @param output function receiving each rendered line
     * @return a new alerter
     */
    @Nonnull
    public static Alerter newAlerter(@Nonnull Consumer<String> output) {
        return newAlerter(output, SinkOptions.defaults());
    }

    /**
     * Create an alerter that writes lines to {@code output}.
     *
     * @param output function receiving each rendered line
     * @param options sink configuration
     * @return a new alerter
     */
    @Nonnull
    public static Alerter newAlerter(@Nonnull Consumer<String> output, @Nonnull SinkOptions options) {
        return Alerter.of(new FuncSink(output, options));
    }

    @Override
    public boolean isEnabled(int level) {
        return level <= options.getVerbosity();
    }

    @Override
    public void info(int level, @Nonnull String msg, @Nullable Object... keysAndValues) {
        write(msg, () -> formatter.formatInfo(name, level, msg, values, keysAndValues));
    }

    @Override
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues) {
        write(msg, () -> formatter.formatError(name, err, msg, values, keysAndValues));
    }

    private void write(@Nonnull String msg, @Nonnull Supplier<String> line) {
        try {
            final String rendered = line.get();
            synchronized (writeLock) {
                output.accept(rendered);
            }
        } catch (RuntimeException e) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(AlertFormatter.of("alert could not be written",
                        "logger", name,
                        "msg", msg), e);
            }
        }
    }

    @Nonnull
    @Override
    public FuncSink withValues(@Nullable Object... keysAndValues) {
        return new FuncSink(output, writeLock, options, formatter, names, values.concat(keysAndValues));
    }

    @Nonnull
    @Override
    public FuncSink withName(@Nonnull String name) {
        return new FuncSink(output, writeLock, options, formatter,
                ImmutableList.<String>builderWithExpectedSize(names.size() + 1).addAll(names).add(name).build(),
                values);
    }

    @Nonnull
    public List<String> getNames() {
        return names;
    }

    @Nonnull
    public KeysAndValues getValues() {
        return values;
    }

    @Nonnull
    public SinkOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "FuncSink{name=" + name + ", values=" + values + "}";
    }
}
