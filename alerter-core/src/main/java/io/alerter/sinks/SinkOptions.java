/*
 * SinkOptions.java
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

import io.alerter.annotation.API;
import io.alerter.format.AlertFormatter;
import io.alerter.util.AlerterException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration shared by the bundled sinks. Instances are immutable; use {@link #newBuilder()} or
 * {@link #toBuilder()} to make new ones, or read them from {@link Properties} with {@link #fromProperties(Properties)}.
 *
 * <table>
 *     <caption>Properties read by {@link #fromProperties(Properties)}</caption>
 *     <tr><th>Property</th><th>Default</th><th>Meaning</th></tr>
 *     <tr><td>{@value #VERBOSITY_PROPERTY}</td><td>0</td><td>highest verbosity level written</td></tr>
 *     <tr><td>{@value #NAME_DELIMITER_PROPERTY}</td><td>{@code /}</td><td>string between name segments</td></tr>
 *     <tr><td>{@value #MAX_LOG_DEPTH_PROPERTY}</td><td>16</td><td>deepest container nesting rendered</td></tr>
 *     <tr><td>{@value #LOG_TIMESTAMP_PROPERTY}</td><td>false</td><td>whether lines start with a timestamp</td></tr>
 * </table>
 */
@API(API.Status.UNSTABLE)
public final class SinkOptions {
    public static final String VERBOSITY_PROPERTY = "alerter.verbosity";
    public static final String NAME_DELIMITER_PROPERTY = "alerter.nameDelimiter";
    public static final String MAX_LOG_DEPTH_PROPERTY = "alerter.maxLogDepth";
    public static final String LOG_TIMESTAMP_PROPERTY = "alerter.logTimestamp";

    public static final int DEFAULT_VERBOSITY = 0;
    public static final String DEFAULT_NAME_DELIMITER = "/";
    public static final int DEFAULT_MAX_LOG_DEPTH = AlertFormatter.DEFAULT_MAX_LOG_DEPTH;

    private static final SinkOptions DEFAULTS = newBuilder().build();

    private final int verbosity;
    @Nonnull
    private final String nameDelimiter;
    private final int maxLogDepth;
    private final boolean logTimestamp;
    @Nonnull
    private final Clock clock;

    private SinkOptions(@Nonnull Builder builder) {
        this.verbosity = builder.verbosity;
        this.nameDelimiter = builder.nameDelimiter;
        this.maxLogDepth = builder.maxLogDepth;
        this.logTimestamp = builder.logTimestamp;
        this.clock = builder.clock;
    }

    @Nonnull
    public static SinkOptions defaults() {
        return DEFAULTS;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Read options from properties. Properties that are not set keep their defaults.
     *
     * @param properties the properties to read
     * @return the options
     * @throws AlerterException if a property is set to a value that cannot be parsed or is out of range
     */
    @Nonnull
    public static SinkOptions fromProperties(@Nonnull Properties properties) {
        final Builder builder = newBuilder();
        final String verbosity = properties.getProperty(VERBOSITY_PROPERTY);
        if (verbosity != null) {
            builder.setVerbosity(parseInt(VERBOSITY_PROPERTY, verbosity));
        }
        final String nameDelimiter = properties.getProperty(NAME_DELIMITER_PROPERTY);
        if (nameDelimiter != null) {
            builder.setNameDelimiter(nameDelimiter);
        }
        final String maxLogDepth = properties.getProperty(MAX_LOG_DEPTH_PROPERTY);
        if (maxLogDepth != null) {
            builder.setMaxLogDepth(parseInt(MAX_LOG_DEPTH_PROPERTY, maxLogDepth));
        }
        final String logTimestamp = properties.getProperty(LOG_TIMESTAMP_PROPERTY);
        if (logTimestamp != null) {
            builder.setLogTimestamp(parseBoolean(LOG_TIMESTAMP_PROPERTY, logTimestamp));
        }
        return builder.build();
    }

    @Nonnull
    public static SinkOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int parseInt(@Nonnull String property, @Nonnull String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new AlerterException("invalid integer property", e)
                    .addLogInfo("property", property, "value", value);
        }
    }

    private static boolean parseBoolean(@Nonnull String property, @Nonnull String value) {
        final String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new AlerterException("invalid boolean property", "property", property, "value", value);
    }

    /**
     * The highest verbosity level written by info alerts.
     * @return the verbosity threshold
     */
    public int getVerbosity() {
        return verbosity;
    }

    @Nonnull
    public String getNameDelimiter() {
        return nameDelimiter;
    }

    public int getMaxLogDepth() {
        return maxLogDepth;
    }

    public boolean isLogTimestamp() {
        return logTimestamp;
    }

    @Nonnull
    public Clock getClock() {
        return clock;
    }

    /**
     * Create a formatter that renders with these options' depth limit, timestamp setting and clock.
     *
     * @return a new formatter
     */
    @Nonnull
    public AlertFormatter newFormatter() {
        return new AlertFormatter(maxLogDepth, logTimestamp, clock);
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SinkOptions that = (SinkOptions)o;
        return verbosity == that.verbosity &&
               maxLogDepth == that.maxLogDepth &&
               logTimestamp == that.logTimestamp &&
               nameDelimiter.equals(that.nameDelimiter) &&
               clock.equals(that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verbosity, nameDelimiter, maxLogDepth, logTimestamp, clock);
    }

    @Override
    public String toString() {
        return "SinkOptions{" +
               "verbosity=" + verbosity +
               ", nameDelimiter='" + nameDelimiter + '\'' +
               ", maxLogDepth=" + maxLogDepth +
               ", logTimestamp=" + logTimestamp +
               '}';
    }

    /**
     * A builder for {@link SinkOptions}.
     */
    public static class Builder {
        private int verbosity = DEFAULT_VERBOSITY;
        @Nonnull
        private String nameDelimiter = DEFAULT_NAME_DELIMITER;
        private int maxLogDepth = DEFAULT_MAX_LOG_DEPTH;
        private boolean logTimestamp;
        @Nonnull
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        private Builder(@Nonnull SinkOptions options) {
            this.verbosity = options.verbosity;
            this.nameDelimiter = options.nameDelimiter;
            this.maxLogDepth = options.maxLogDepth;
            this.logTimestamp = options.logTimestamp;
            this.clock = options.clock;
        }

        /**
         * Set the highest verbosity level that info alerts are written at.
         * @param verbosity the threshold, zero or greater
         * @return this builder
         */
        @Nonnull
        public Builder setVerbosity(int verbosity) {
            if (verbosity < 0) {
                throw new AlerterException("verbosity must not be negative", "verbosity", verbosity);
            }
            this.verbosity = verbosity;
            return this;
        }

        @Nonnull
        public Builder setNameDelimiter(@Nullable String nameDelimiter) {
            if (nameDelimiter == null) {
                throw new AlerterException("name delimiter must not be null");
            }
            this.nameDelimiter = nameDelimiter;
            return this;
        }

        @Nonnull
        public Builder setMaxLogDepth(int maxLogDepth) {
            if (maxLogDepth < 1) {
                throw new AlerterException("max log depth must be positive", "maxLogDepth", maxLogDepth);
            }
            this.maxLogDepth = maxLogDepth;
            return this;
        }

        @Nonnull
        public Builder setLogTimestamp(boolean logTimestamp) {
            this.logTimestamp = logTimestamp;
            return this;
        }

        /**
         * Set the clock timestamps are read from when {@link #setLogTimestamp(boolean)} is on.
         * @param clock the clock
         * @return this builder
         */
        @Nonnull
        public Builder setClock(@Nonnull Clock clock) {
            this.clock = clock;
            return this;
        }

        @Nonnull
        public SinkOptions build() {
            return new SinkOptions(this);
        }
    }
}
